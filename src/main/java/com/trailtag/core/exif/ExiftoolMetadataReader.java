package com.trailtag.core.exif;

import com.trailtag.core.error.MetadataException;
import com.trailtag.core.error.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Метаданные изображений через exiftool: запуском на каждый файл
 * или из заранее снятого XML (exiftool -X -r dir > out.xml), проиндексированного по rdf:about.
 */
public final class ExiftoolMetadataReader implements MetadataReader {
    private static final Logger log = LoggerFactory.getLogger(ExiftoolMetadataReader.class);

    private final ExiftoolRunner runner;               // null для XML-режима
    private final Map<Path, Map<String, String>> index; // null для режима запуска

    private ExiftoolMetadataReader(ExiftoolRunner runner, Map<Path, Map<String, String>> index) {
        this.runner = runner;
        this.index = index;
    }

    public static ExiftoolMetadataReader runtime(ExiftoolRunner runner) {
        return new ExiftoolMetadataReader(Objects.requireNonNull(runner, "runner"), null);
    }

    /** Индекс по нормализованному абсолютному пути из rdf:about. */
    public static ExiftoolMetadataReader fromXml(Path xml) throws ParseException {
        List<ExiftoolXml.Description> descriptions = ExiftoolXml.parse(xml);
        Map<Path, Map<String, String>> index = new HashMap<>();
        for (ExiftoolXml.Description d : descriptions) {
            if (d.about() == null) {
                continue;
            }
            Path about = Path.of(d.about());
            if (!about.isAbsolute()) {
                about = xml.toAbsolutePath().getParent().resolve(about);
            }
            index.put(canonical(about), d.toMap());
        }
        log.info("indexed {} exiftool descriptions from {}", index.size(), xml);
        return new ExiftoolMetadataReader(null, index);
    }

    @Override
    public Map<String, String> read(Path file) throws MetadataException {
        if (index != null) {
            Map<String, String> m = index.get(canonical(file));
            if (m == null) {
                throw new MetadataException("No exiftool metadata found for " + file.getFileName());
            }
            return m;
        }
        try {
            byte[] xml = runner.run(ExiftoolRunner.IMAGE_ARGS, file);
            List<ExiftoolXml.Description> d = ExiftoolXml.parse(new ByteArrayInputStream(xml));
            if (d.isEmpty()) {
                throw new MetadataException("exiftool returned no metadata for " + file.getFileName());
            }
            return d.get(0).toMap();
        } catch (ParseException e) {
            throw new MetadataException("Failed to read metadata of " + file.getFileName() + ": " + e.getMessage(), e);
        }
    }

    static Path canonical(Path p) {
        return p.toAbsolutePath().normalize();
    }
}
