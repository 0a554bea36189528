package com.trailtag.core.exif;

import com.trailtag.core.error.ExiftoolUnavailableException;
import com.trailtag.core.error.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * exiftool через ProcessBuilder. stdout и stderr пишутся во временные файлы,
 * чтобы большой вывод не блокировал процесс.
 */
public final class ProcessExiftoolRunner implements ExiftoolRunner {
    private static final Logger log = LoggerFactory.getLogger(ProcessExiftoolRunner.class);

    public static final String PATH_PROPERTY = "trailtag.exiftool.path";
    public static final String PATH_ENV = "MAPILLARY_TOOLS_EXIFTOOL_PATH";
    public static final String DEFAULT_EXECUTABLE = "exiftool";

    private static final int MAX_STDERR_CHARS = 500;

    private final String executable;
    private final Duration timeout;

    public ProcessExiftoolRunner(String executable, Duration timeout) {
        if (executable == null || executable.isBlank()) {
            throw new IllegalArgumentException("exiftool executable is empty");
        }
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("exiftool timeout must be positive: " + timeout);
        }
        this.executable = executable;
        this.timeout = timeout;
    }

    /** Путь к exiftool: системное свойство → переменная окружения → конфиг → "exiftool". */
    public static String resolveExecutable(String configured) {
        String p = System.getProperty(PATH_PROPERTY);
        if (p != null && !p.isBlank()) {
            return p.trim();
        }
        p = System.getenv(PATH_ENV);
        if (p != null && !p.isBlank()) {
            return p.trim();
        }
        if (configured != null && !configured.isBlank()) {
            return configured.trim();
        }
        return DEFAULT_EXECUTABLE;
    }

    public String executable() {
        return executable;
    }

    @Override
    public byte[] run(List<String> args, Path file) throws ParseException {
        List<String> cmd = new ArrayList<>(args.size() + 2);
        cmd.add(executable);
        cmd.addAll(args);
        cmd.add(file.toAbsolutePath().toString());

        Path out = null;
        Path err = null;
        Process p = null;
        try {
            out = Files.createTempFile("trailtag-exiftool-", ".xml");
            err = Files.createTempFile("trailtag-exiftool-", ".err");
            ProcessBuilder pb = new ProcessBuilder(cmd)
                    .redirectOutput(out.toFile())
                    .redirectError(err.toFile());
            try {
                p = pb.start();
            } catch (IOException e) {
                throw new ExiftoolUnavailableException("Failed to start " + executable + ": " + e.getMessage(), e);
            }
            if (!p.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                p.destroyForcibly();
                throw new ParseException("exiftool timed out after " + timeout.toSeconds() + "s on " + file.getFileName());
            }
            int code = p.exitValue();
            if (code != 0) {
                throw new ParseException("exiftool exited with code " + code + " on " + file.getFileName()
                        + ": " + head(err));
            }
            byte[] bytes = Files.readAllBytes(out);
            log.debug("exiftool: {} bytes of output for {}", bytes.length, file);
            return bytes;
        } catch (IOException e) {
            throw new ParseException("Failed to run exiftool on " + file + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            p.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new ParseException("Interrupted while running exiftool on " + file, e);
        } finally {
            deleteQuietly(out);
            deleteQuietly(err);
        }
    }

    private static String head(Path err) throws IOException {
        String s = Files.readString(err, StandardCharsets.UTF_8).trim();
        return s.length() > MAX_STDERR_CHARS ? s.substring(0, MAX_STDERR_CHARS) + "..." : s;
    }

    private static void deleteQuietly(Path p) {
        if (p == null) {
            return;
        }
        try {
            Files.deleteIfExists(p);
        } catch (IOException e) {
            log.debug("failed to delete temp file {}: {}", p, e.toString());
        }
    }
}
