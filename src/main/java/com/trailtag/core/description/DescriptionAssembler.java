package com.trailtag.core.description;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.trailtag.core.geo.Geo;
import com.trailtag.core.model.CaptureError;
import com.trailtag.core.model.CaptureRecord;
import com.trailtag.core.model.MediaType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Итоговые описания: по одной записи на файл. Ошибочные файлы дают ErrorDescription,
 * остальные - ImageDescription, прошедший проверку схемы.
 * Порядок: ошибки, затем изображения в порядке входа, затем видео.
 */
public final class DescriptionAssembler {
    private static final Logger log = LoggerFactory.getLogger(DescriptionAssembler.class);

    public static final DateTimeFormatter CAPTURE_TIME =
            DateTimeFormatter.ofPattern("yyyy_MM_dd_HH_mm_ss_SSS", Locale.ROOT).withZone(ZoneOffset.UTC);

    private final ObjectMapper mapper;
    private final DescriptionValidator validator;

    public DescriptionAssembler() {
        this(new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false), new DescriptionValidator());
    }

    public DescriptionAssembler(ObjectMapper mapper, DescriptionValidator validator) {
        this.mapper = mapper;
        this.validator = validator;
    }

    /** Записи должны быть заморожены. */
    public List<Object> assemble(List<CaptureRecord> records) {
        List<Object> errors = new ArrayList<>();
        List<Object> images = new ArrayList<>();
        List<Object> videos = new ArrayList<>();
        for (CaptureRecord r : records) {
            if (!r.isFrozen()) {
                throw new IllegalStateException("CaptureRecord must be frozen before assembly: " + r.file());
            }
            String filename = r.file().toAbsolutePath().toString();
            if (r.hasError()) {
                errors.add(ErrorDescription.of(filename, r.error()));
                continue;
            }
            ImageDescription d = describe(r);
            String problem = validator.validate(mapper.valueToTree(d));
            if (problem != null) {
                log.warn("invalid description for {}: {}", r.file().getFileName(), problem);
                errors.add(ErrorDescription.of(filename, new CaptureError(DescriptionValidator.ERROR_TYPE, problem)));
                continue;
            }
            if (r.mediaType() == MediaType.VIDEO) {
                videos.add(d);
            } else {
                images.add(d);
            }
        }
        List<Object> out = new ArrayList<>(records.size());
        out.addAll(errors);
        out.addAll(images);
        out.addAll(videos);
        log.info("assembled {} descriptions: {} images, {} videos, {} errors",
                out.size(), images.size(), videos.size(), errors.size());
        return out;
    }

    ImageDescription describe(CaptureRecord r) {
        if (!r.hasPosition() || r.time() == null) {
            throw new IllegalStateException("record without position or time: " + r.file());
        }
        ImageDescription.CompassHeading heading = null;
        if (r.heading() != null) {
            // 359.9996 после округления даёт 360.0
            double h = Geo.normalize360(round(r.heading(), 3));
            heading = new ImageDescription.CompassHeading(h, h);
        }
        Map<String, Object> meta = null;
        if (r.isDuplicate()) {
            meta = new LinkedHashMap<>();
            meta.put("duplicate", Boolean.TRUE);
        }
        return new ImageDescription(
                r.file().toAbsolutePath().toString(),
                round(r.lat(), 7),
                round(r.lon(), 7),
                r.alt() == null ? null : round(r.alt(), 3),
                CAPTURE_TIME.format(r.time()),
                heading,
                r.sequenceId(),
                r.orientation(),
                r.make(),
                r.model(),
                r.accuracyMeters(),
                meta);
    }

    public void write(List<Object> descriptions, OutputStream out) throws IOException {
        mapper.writeValue(out, descriptions);
    }

    public void write(List<Object> descriptions, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (OutputStream out = Files.newOutputStream(file)) {
            write(descriptions, out);
        }
        log.info("wrote {} descriptions to {}", descriptions.size(), file);
    }

    /** Дерево JSON для проверок и тестов. */
    public JsonNode toTree(List<Object> descriptions) {
        return mapper.valueToTree(descriptions);
    }

    static double round(double v, int digits) {
        double scale = Math.pow(10, digits);
        return Math.round(v * scale) / scale;
    }
}
