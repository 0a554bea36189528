package com.trailtag.core.model;

import java.util.Objects;

/** Ошибка обработки одного файла: тип (для выходного JSON) и сообщение. */
public record CaptureError(String type, String message) {

    public CaptureError {
        Objects.requireNonNull(type, "type");
        if (message == null) {
            message = "";
        }
    }
}
