package com.trailtag.core.error;

/** Ни один источник не дал пригодного трека для файла. */
public class GeotaggingException extends GeotagException {

    public GeotaggingException(String message) {
        super(message);
    }

    public GeotaggingException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String errorType() {
        return "GeotaggingError";
    }
}
