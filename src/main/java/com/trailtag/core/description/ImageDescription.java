package com.trailtag.core.description;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Map;

/** Описание одного успешно обработанного файла в выходном JSON. */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"filename", "MAPLatitude", "MAPLongitude", "MAPAltitude", "MAPCaptureTime",
        "MAPCompassHeading", "MAPSequenceUUID", "MAPOrientation", "MAPDeviceMake", "MAPDeviceModel",
        "MAPGPSAccuracyMeters", "MAPMetaTags"})
public record ImageDescription(
        @JsonProperty("filename") String filename,
        @JsonProperty("MAPLatitude") double latitude,
        @JsonProperty("MAPLongitude") double longitude,
        @JsonProperty("MAPAltitude") Double altitude,
        @JsonProperty("MAPCaptureTime") String captureTime,
        @JsonProperty("MAPCompassHeading") CompassHeading compassHeading,
        @JsonProperty("MAPSequenceUUID") String sequenceUuid,
        @JsonProperty("MAPOrientation") Integer orientation,
        @JsonProperty("MAPDeviceMake") String deviceMake,
        @JsonProperty("MAPDeviceModel") String deviceModel,
        @JsonProperty("MAPGPSAccuracyMeters") Double gpsAccuracyMeters,
        @JsonProperty("MAPMetaTags") Map<String, Object> metaTags
) {

    /** Курс: истинный и магнитный (магнитный не вычисляется, совпадает с истинным). */
    @JsonPropertyOrder({"TrueHeading", "MagneticHeading"})
    public record CompassHeading(
            @JsonProperty("TrueHeading") double trueHeading,
            @JsonProperty("MagneticHeading") double magneticHeading
    ) {
    }
}
