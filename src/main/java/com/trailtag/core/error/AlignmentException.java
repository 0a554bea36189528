package com.trailtag.core.error;

/** Вырожденный трек: пустой или без однозначной пары точек вокруг времени. */
public class AlignmentException extends GeotagException {

    public AlignmentException(String message) {
        super(message);
    }

    @Override
    public String errorType() {
        return "AlignmentError";
    }
}
