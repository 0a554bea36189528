package com.trailtag.core.error;

/** Телеметрия в конкретном источнике отсутствует или повреждена. Селектор переходит к следующему. */
public class ParseException extends GeotagException {

    public ParseException(String message) {
        super(message);
    }

    public ParseException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String errorType() {
        return "ParseError";
    }
}
