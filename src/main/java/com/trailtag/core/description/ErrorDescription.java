package com.trailtag.core.description;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.trailtag.core.model.CaptureError;

/** Запись об ошибке файла: {"error": {"type", "message"}, "filename"}. */
@JsonPropertyOrder({"error", "filename"})
public record ErrorDescription(
        @JsonProperty("error") Body error,
        @JsonProperty("filename") String filename
) {

    @JsonPropertyOrder({"type", "message"})
    public record Body(@JsonProperty("type") String type, @JsonProperty("message") String message) {
    }

    public static ErrorDescription of(String filename, CaptureError e) {
        return new ErrorDescription(new Body(e.type(), e.message()), filename);
    }
}
