package com.trailtag.core.pipeline;

import com.trailtag.core.error.ExiftoolUnavailableException;
import com.trailtag.core.error.GeotagException;
import com.trailtag.core.error.GeotaggingException;
import com.trailtag.core.error.MetadataException;
import com.trailtag.core.error.ParseException;
import com.trailtag.core.exif.ImageMetadata;
import com.trailtag.core.exif.MetadataReader;
import com.trailtag.core.geo.DirectionDeriver;
import com.trailtag.core.geo.TrackLocator;
import com.trailtag.core.model.CaptureError;
import com.trailtag.core.model.CaptureRecord;
import com.trailtag.core.model.GpsPoint;
import com.trailtag.core.model.MediaType;
import com.trailtag.core.model.Sequence;
import com.trailtag.core.model.SourceKind;
import com.trailtag.core.model.Track;
import com.trailtag.core.sequence.DuplicateDetector;
import com.trailtag.core.sequence.SequenceBuilder;
import com.trailtag.core.sequence.SequenceLimits;
import com.trailtag.core.source.SourceSelector;
import com.trailtag.core.telemetry.TelemetryParsers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Один прогон геопривязки.
 *
 * Фаза A параллельно на пуле: чтение EXIF изображений и выбор источника для видео.
 * Затем барьер, общий трек GPX/NMEA и привязка изображений к нему (тоже параллельно).
 * Последовательности, курсы, дубли и ограничения считаются в одном потоке.
 * Ошибка одного файла остаётся в его записи. Фатальна только недоступность exiftool,
 * когда он единственный источник.
 */
public final class GeotagPipeline {
    private static final Logger log = LoggerFactory.getLogger(GeotagPipeline.class);

    /** Шаг обработки одного файла. */
    @FunctionalInterface
    interface Step {
        void apply() throws GeotagException;
    }

    private final GeotagOptions options;
    private final TelemetryParsers parsers;
    private final MetadataReader metadata;
    private final MediaScanner scanner;
    private final SourceSelector selector;
    private final TrackLocator locator;
    private final SequenceLimits limits;

    public GeotagPipeline(GeotagOptions options, TelemetryParsers parsers, MetadataReader metadata) {
        this(options, parsers, metadata, new MediaScanner());
    }

    public GeotagPipeline(GeotagOptions options, TelemetryParsers parsers, MetadataReader metadata,
                          MediaScanner scanner) {
        this.options = Objects.requireNonNull(options, "options");
        this.parsers = Objects.requireNonNull(parsers, "parsers");
        this.metadata = Objects.requireNonNull(metadata, "metadata");
        this.scanner = Objects.requireNonNull(scanner, "scanner");
        this.selector = new SourceSelector(parsers);
        this.locator = new TrackLocator(options.toleranceSeconds());
        this.limits = new SequenceLimits(options.maxSpeedKmh(), options.stationaryRadius());
    }

    /**
     * Все записи заморожены. Порядок: изображения по последовательностям,
     * изображения с ошибками, затем видео.
     */
    public List<CaptureRecord> run(List<Path> roots) {
        MediaScanner.Media media = scanner.scan(roots);
        SourceSelector.checkCardinality(options.videoSources(), media.videos().size());

        List<CaptureRecord> images = records(media.images(), MediaType.IMAGE);
        List<CaptureRecord> videos = records(media.videos(), MediaType.VIDEO);

        ExecutorService exec = Executors.newFixedThreadPool(options.effectiveWorkers(), workerFactory());
        try {
            List<Future<?>> phaseA = new ArrayList<>(images.size() + videos.size());
            for (CaptureRecord r : images) {
                phaseA.add(exec.submit(() -> isolate(r, () -> readImage(r))));
            }
            for (CaptureRecord r : videos) {
                phaseA.add(exec.submit(() -> isolate(r, () -> geotagVideo(r))));
            }
            await(phaseA);

            if (options.imageSource() != GeotagSource.EXIF) {
                alignToTrack(images, exec);
            }
        } finally {
            exec.shutdownNow();
        }

        Supplier<String> ids = options.incrementalIds()
                ? SequenceBuilder.incrementalIds()
                : SequenceBuilder.uuidIds();
        // ошибки до последовательностей; отбракованные проверкой ограничений остаются на своих местах
        List<CaptureRecord> failed = new ArrayList<>();
        for (CaptureRecord r : images) {
            if (r.hasError()) {
                failed.add(r);
            }
        }
        List<CaptureRecord> out = new ArrayList<>(images.size() + videos.size());
        out.addAll(processSequences(images, ids));
        out.addAll(failed);
        for (CaptureRecord v : videos) {
            if (!v.hasError()) {
                v.setSequenceId(ids.get());
            }
            out.add(v);
        }
        for (CaptureRecord r : out) {
            r.freeze();
        }
        long failedCount = out.stream().filter(CaptureRecord::hasError).count();
        log.info("geotagged {} files: {} failed", out.size(), failedCount);
        return out;
    }

    private static List<CaptureRecord> records(List<Path> files, MediaType type) {
        List<CaptureRecord> out = new ArrayList<>(files.size());
        for (Path p : files) {
            out.add(new CaptureRecord(p, type));
        }
        return out;
    }

    void readImage(CaptureRecord r) throws GeotagException {
        ImageMetadata m = ImageMetadata.from(metadata.read(r.file()));
        if (m.time() == null) {
            throw new MetadataException("Unable to extract timestamp from the image");
        }
        r.setRawTime(m.time());
        r.setCamera(m.make(), m.model());
        r.setOrientation(m.orientation());
        r.setAccuracyMeters(m.accuracyMeters());
        if (options.imageSource() == GeotagSource.EXIF) {
            if (!m.hasPosition()) {
                throw new GeotaggingException("Unable to extract GPS Longitude or GPS Latitude from the image");
            }
            r.setTime(m.time().plus(seconds(options.offsetSeconds())));
            r.setPosition(m.lat(), m.lon(), m.alt());
            r.setHeading(m.heading());
        }
    }

    void geotagVideo(CaptureRecord r) throws GeotagException {
        SourceSelector.Selection sel = selector.select(r.file(), options.videoSources());
        Track track = sel.track();
        limits.checkVideo(track);
        r.setTrack(track);
        r.setCamera(sel.make(), sel.model());

        // первая точка с курсом; без курса берём направление на следующую точку
        GpsPoint first = DirectionDeriver.fillMissing(track.points()).get(0);
        r.setRawTime(first.time());
        r.setTime(first.time());
        r.setPosition(first);
        log.debug("{}: {} points from {}", r.file().getFileName(), track.size(), sel.spec());
    }

    private void alignToTrack(List<CaptureRecord> images, ExecutorService exec) {
        Track track;
        try {
            track = loadImageTrack();
        } catch (ParseException e) {
            log.warn("failed to read geotag source {}: {}", options.imageSourcePath(), e.getMessage());
            for (CaptureRecord r : images) {
                if (!r.hasError()) {
                    r.fail(e.toCaptureError());
                }
            }
            return;
        }

        Duration offset = seconds(options.offsetSeconds());
        if (options.useStartTime()) {
            Instant earliest = null;
            for (CaptureRecord r : images) {
                if (!r.hasError() && (earliest == null || r.rawTime().isBefore(earliest))) {
                    earliest = r.rawTime();
                }
            }
            if (earliest != null) {
                offset = offset.plus(Duration.between(earliest, track.first().time()));
            }
        }
        log.info("aligning images to {} with offset {}", track, offset);

        final Duration shift = offset;
        List<Future<?>> phaseB = new ArrayList<>(images.size());
        for (CaptureRecord r : images) {
            if (r.hasError()) {
                continue;
            }
            phaseB.add(exec.submit(() -> isolate(r, () -> {
                Instant t = r.rawTime().plus(shift);
                GpsPoint p = locator.locate(track, t);
                r.setTime(t);
                r.setPosition(p);
            })));
        }
        await(phaseB);
    }

    private Track loadImageTrack() throws ParseException {
        SourceKind kind = options.imageSource() == GeotagSource.GPX ? SourceKind.GPX : SourceKind.NMEA;
        Track track = parsers.get(kind).parse(options.imageSourcePath()).track();
        if (track.isEmpty()) {
            throw new ParseException("No GPS points found in " + options.imageSourcePath());
        }
        return track;
    }

    private List<CaptureRecord> processSequences(List<CaptureRecord> images, Supplier<String> ids) {
        List<CaptureRecord> located = new ArrayList<>();
        for (CaptureRecord r : images) {
            if (!r.hasError()) {
                located.add(r);
            }
        }
        SequenceBuilder builder = new SequenceBuilder(options.cutoffDistance(), options.cutoffTime(),
                options.maxSequenceLength(), ids);
        DirectionDeriver deriver = new DirectionDeriver(options.offsetAngle(), options.interpolateDirections());
        DuplicateDetector duplicates = new DuplicateDetector(options.duplicateDistance(), options.duplicateAngle());

        List<CaptureRecord> out = new ArrayList<>(located.size());
        int dups = 0;
        for (Sequence s : builder.build(located)) {
            deriver.derive(s.members());
            dups += duplicates.flag(s);
            limits.check(s);
            out.addAll(s.members());
        }
        if (dups > 0) {
            log.info("marked {} duplicate images", dups);
        }
        return out;
    }

    /** Ошибка файла пишется в его запись и дальше не идёт. */
    private static void isolate(CaptureRecord r, Step step) {
        try {
            step.apply();
        } catch (GeotagException e) {
            log.warn("failed to geotag {}: {}", r.file(), e.getMessage());
            r.fail(e.toCaptureError());
        } catch (ExiftoolUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("failed to geotag {}: {}", r.file(), e.toString());
            r.fail(new CaptureError(e.getClass().getSimpleName(), String.valueOf(e.getMessage())));
        }
    }

    private static void await(List<Future<?>> futures) {
        for (Future<?> f : futures) {
            try {
                f.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while waiting for workers", e);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof RuntimeException) {
                    throw (RuntimeException) cause;
                }
                if (cause instanceof Error) {
                    throw (Error) cause;
                }
                throw new IllegalStateException("Worker failed", cause);
            }
        }
    }

    private static ThreadFactory workerFactory() {
        AtomicInteger n = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "tt-geotag-worker-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    static Duration seconds(double s) {
        return Duration.ofNanos(Math.round(s * 1_000_000_000L));
    }
}
