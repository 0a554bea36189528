package com.trailtag.core.description;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Iterator;
import java.util.Set;

/**
 * Проверка готового описания по схеме выходного JSON: обязательные ключи, типы,
 * диапазоны координат, полный объект курса, отсутствие лишних ключей.
 */
public final class DescriptionValidator {

    public static final String ERROR_TYPE = "DescriptionValidationError";

    static final Set<String> REQUIRED = Set.of("MAPLatitude", "MAPLongitude", "MAPCaptureTime", "filename");
    static final Set<String> ALLOWED = Set.of("MAPLatitude", "MAPLongitude", "MAPCaptureTime", "filename",
            "MAPAltitude", "MAPCompassHeading", "MAPSequenceUUID", "MAPOrientation", "MAPDeviceMake",
            "MAPDeviceModel", "MAPGPSAccuracyMeters", "MAPMetaTags");

    /** null если описание корректно, иначе текст первой найденной ошибки. */
    public String validate(JsonNode d) {
        if (d == null || !d.isObject()) {
            return "description must be an object";
        }
        for (String k : REQUIRED) {
            if (!d.has(k) || d.get(k).isNull()) {
                return "'" + k + "' is a required property";
            }
        }
        for (Iterator<String> it = d.fieldNames(); it.hasNext(); ) {
            String k = it.next();
            if (!ALLOWED.contains(k)) {
                return "Additional properties are not allowed ('" + k + "' was unexpected)";
            }
        }
        JsonNode lat = d.get("MAPLatitude");
        if (!lat.isNumber() || Double.isNaN(lat.asDouble()) || lat.asDouble() < -90 || lat.asDouble() > 90) {
            return "MAPLatitude out of range [-90, 90]: " + lat;
        }
        JsonNode lon = d.get("MAPLongitude");
        if (!lon.isNumber() || Double.isNaN(lon.asDouble()) || lon.asDouble() < -180 || lon.asDouble() > 180) {
            return "MAPLongitude out of range [-180, 180]: " + lon;
        }
        if (!d.get("MAPCaptureTime").isTextual() || !d.get("filename").isTextual()) {
            return "MAPCaptureTime and filename must be strings";
        }
        if (d.has("MAPAltitude") && !d.get("MAPAltitude").isNumber()) {
            return "MAPAltitude must be a number";
        }
        if (d.has("MAPCompassHeading")) {
            JsonNode h = d.get("MAPCompassHeading");
            if (!h.isObject() || !h.path("TrueHeading").isNumber() || !h.path("MagneticHeading").isNumber()) {
                return "MAPCompassHeading requires TrueHeading and MagneticHeading";
            }
            for (String k : new String[]{"TrueHeading", "MagneticHeading"}) {
                double v = h.get(k).asDouble();
                if (Double.isNaN(v) || v < 0 || v >= 360) {
                    return k + " out of range [0, 360): " + h.get(k);
                }
            }
        }
        if (d.has("MAPOrientation") && !d.get("MAPOrientation").isIntegralNumber()) {
            return "MAPOrientation must be an integer";
        }
        if (d.has("MAPGPSAccuracyMeters") && !d.get("MAPGPSAccuracyMeters").isNumber()) {
            return "MAPGPSAccuracyMeters must be a number";
        }
        if (d.has("MAPMetaTags") && !d.get("MAPMetaTags").isObject()) {
            return "MAPMetaTags must be an object";
        }
        return null;
    }
}
