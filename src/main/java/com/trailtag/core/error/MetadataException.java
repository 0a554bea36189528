package com.trailtag.core.error;

/** Метаданные файла не прочитаны или в них нет времени съёмки. */
public class MetadataException extends GeotagException {

    public MetadataException(String message) {
        super(message);
    }

    public MetadataException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String errorType() {
        return "MetadataError";
    }
}
