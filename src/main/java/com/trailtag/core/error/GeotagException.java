package com.trailtag.core.error;

import com.trailtag.core.model.CaptureError;

/**
 * Базовая ошибка обработки одного файла.
 * errorType() попадает в поле error.type выходного описания.
 */
public abstract class GeotagException extends Exception {

    protected GeotagException(String message) {
        super(message);
    }

    protected GeotagException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract String errorType();

    public CaptureError toCaptureError() {
        return new CaptureError(errorType(), getMessage());
    }
}
