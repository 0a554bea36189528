package com.trailtag.core.model;

import java.util.Locale;

/** Тип источника телеметрии и шаблон имени файла-компаньона по умолчанию. */
public enum SourceKind {
    VIDEO("video", "%f"),
    CAMM("camm", "%f"),
    GOPRO("gopro", "%f"),
    BLACKVUE("blackvue", "%f"),
    GPX("gpx", "%g.gpx"),
    NMEA("nmea", "%g.nmea"),
    EXIFTOOL_XML("exiftool_xml", "%g.xml"),
    EXIFTOOL_RUNTIME("exiftool_runtime", "%f");

    private final String configName;
    private final String defaultPattern;

    SourceKind(String configName, String defaultPattern) {
        this.configName = configName;
        this.defaultPattern = defaultPattern;
    }

    public String configName() {
        return configName;
    }

    public String defaultPattern() {
        return defaultPattern;
    }

    public static SourceKind fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("source name is empty");
        }
        String n = name.trim().toLowerCase(Locale.ROOT);
        for (SourceKind k : values()) {
            if (k.configName.equals(n)) {
                return k;
            }
        }
        throw new IllegalArgumentException("Unknown source: " + name);
    }
}
