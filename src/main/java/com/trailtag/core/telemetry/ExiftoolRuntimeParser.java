package com.trailtag.core.telemetry;

import com.trailtag.core.error.ParseException;
import com.trailtag.core.exif.ExiftoolRunner;
import com.trailtag.core.exif.ExiftoolXml;

import java.io.ByteArrayInputStream;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/** Трек видео, извлечённый запуском exiftool; вывод разбирается так же, как XML-файл. */
public final class ExiftoolRuntimeParser implements TelemetryParser {

    private final ExiftoolRunner runner;
    private final ExiftoolXmlParser xmlParser;

    public ExiftoolRuntimeParser(ExiftoolRunner runner) {
        this(runner, new ExiftoolXmlParser());
    }

    public ExiftoolRuntimeParser(ExiftoolRunner runner, ExiftoolXmlParser xmlParser) {
        this.runner = Objects.requireNonNull(runner, "runner");
        this.xmlParser = Objects.requireNonNull(xmlParser, "xmlParser");
    }

    @Override
    public TelemetryData parse(Path file) throws ParseException {
        byte[] xml = runner.run(ExiftoolRunner.VIDEO_ARGS, file);
        List<ExiftoolXml.Description> descriptions = ExiftoolXml.parse(new ByteArrayInputStream(xml));
        if (descriptions.isEmpty()) {
            throw new ParseException("exiftool returned no metadata for " + file.getFileName());
        }
        return xmlParser.extract(descriptions.get(0));
    }
}
