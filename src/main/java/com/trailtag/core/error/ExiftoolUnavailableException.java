package com.trailtag.core.error;

/**
 * exiftool не запускается. Фатально для прогона, только если это единственный
 * настроенный источник; иначе селектор просто пропускает источник.
 */
public class ExiftoolUnavailableException extends RuntimeException {

    public ExiftoolUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
