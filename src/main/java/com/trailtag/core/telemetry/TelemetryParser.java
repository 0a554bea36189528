package com.trailtag.core.telemetry;

import com.trailtag.core.error.ParseException;

import java.nio.file.Path;

/**
 * Парсер одного формата телеметрии. Любая внутренняя несогласованность входа
 * превращается в ParseException, чтобы селектор мог попробовать следующий источник.
 */
@FunctionalInterface
public interface TelemetryParser {

    TelemetryData parse(Path file) throws ParseException;
}
