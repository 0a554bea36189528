package com.trailtag.app;

import com.trailtag.core.description.DescriptionAssembler;
import com.trailtag.core.error.ExiftoolUnavailableException;
import com.trailtag.core.error.ParseException;
import com.trailtag.core.exif.ExiftoolMetadataReader;
import com.trailtag.core.exif.MetadataReader;
import com.trailtag.core.exif.ProcessExiftoolRunner;
import com.trailtag.core.model.CaptureRecord;
import com.trailtag.core.pipeline.GeotagPipeline;
import com.trailtag.core.telemetry.TelemetryParsers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

// точка входа: пути к медиа → JSON с описаниями в stdout или в --out
public final class Boot {
    private static final Logger log = LoggerFactory.getLogger(Boot.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FATAL = 1;
    static final int EXIT_USAGE = 2;

    private Boot() {
        // no-op
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        Path configFile = null;
        Path outFile = null;
        List<Path> paths = new ArrayList<>();
        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            if ("--config".equals(a) && i + 1 < args.length) {
                configFile = Path.of(args[++i]);
            } else if ("--out".equals(a) && i + 1 < args.length) {
                outFile = Path.of(args[++i]);
            } else if (a.startsWith("--")) {
                err.println("Unknown option: " + a);
                usage(err);
                return EXIT_USAGE;
            } else {
                paths.add(Path.of(a));
            }
        }
        if (paths.isEmpty()) {
            usage(err);
            return EXIT_USAGE;
        }

        Config cfg;
        try {
            cfg = configFile != null ? Config.load(configFile) : Config.load();
        } catch (RuntimeException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("{}: {}", e.getMessage(), cause.toString());
            err.println(e.getMessage() + ": " + cause.getMessage());
            return EXIT_FATAL;
        }

        try {
            ProcessExiftoolRunner runner = new ProcessExiftoolRunner(
                    ProcessExiftoolRunner.resolveExecutable(cfg.exiftool().path()),
                    Duration.ofSeconds(cfg.exiftool().timeoutSeconds()));
            MetadataReader metadata = cfg.exiftool().xmlPath() != null
                    ? ExiftoolMetadataReader.fromXml(Path.of(cfg.exiftool().xmlPath()))
                    : ExiftoolMetadataReader.runtime(runner);

            GeotagPipeline pipeline = new GeotagPipeline(cfg.toOptions(), TelemetryParsers.defaults(runner), metadata);
            List<CaptureRecord> records = pipeline.run(paths);

            DescriptionAssembler assembler = new DescriptionAssembler();
            List<Object> descriptions = assembler.assemble(records);
            if (outFile != null) {
                assembler.write(descriptions, outFile);
            } else {
                assembler.write(descriptions, out);
                out.println();
                out.flush();
            }
            return EXIT_OK;
        } catch (ExiftoolUnavailableException e) {
            log.error("exiftool is not available: {}", e.getMessage());
            err.println("exiftool is not available: " + e.getMessage());
            return EXIT_FATAL;
        } catch (IllegalArgumentException | ParseException e) {
            log.error("geotagging aborted: {}", e.getMessage());
            err.println(e.getMessage());
            return EXIT_FATAL;
        } catch (UncheckedIOException e) {
            log.error("failed to scan input: {}", e.getMessage());
            err.println(e.getMessage());
            return EXIT_FATAL;
        } catch (IOException e) {
            log.error("failed to write descriptions: {}", e.toString());
            err.println("Failed to write descriptions: " + e.getMessage());
            return EXIT_FATAL;
        }
    }

    private static void usage(PrintStream err) {
        err.println("Usage: trailtag [--config application.yaml] [--out descriptions.json] <path>...");
    }
}
