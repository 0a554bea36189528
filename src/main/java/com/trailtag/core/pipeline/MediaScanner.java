package com.trailtag.core.pipeline;

import com.trailtag.core.model.MediaType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Обход входных путей: файлы берутся как есть, каталоги - рекурсивно.
 * Тип файла определяется по расширению (без учёта регистра), прочие файлы пропускаются.
 */
public final class MediaScanner {
    private static final Logger log = LoggerFactory.getLogger(MediaScanner.class);

    public static final List<String> IMAGE_EXTENSIONS = List.of("jpg", "jpeg", "tif", "tiff", "png");
    public static final List<String> VIDEO_EXTENSIONS = List.of("mp4", "mov", "360", "lrv");

    /** Найденные файлы, каждый список отсортирован по пути. */
    public record Media(List<Path> images, List<Path> videos) {
        public Media {
            images = List.copyOf(images);
            videos = List.copyOf(videos);
        }
    }

    private final PathMatcher images;
    private final PathMatcher videos;

    public MediaScanner() {
        this(IMAGE_EXTENSIONS, VIDEO_EXTENSIONS);
    }

    public MediaScanner(List<String> imageExtensions, List<String> videoExtensions) {
        this.images = matcher(imageExtensions);
        this.videos = matcher(videoExtensions);
    }

    // glob по имени файла в нижнем регистре
    private static PathMatcher matcher(List<String> extensions) {
        Set<String> exts = new LinkedHashSet<>();
        for (String e : extensions) {
            String x = e.startsWith(".") ? e.substring(1) : e;
            exts.add(x.toLowerCase(Locale.ROOT));
        }
        String glob = "glob:*.{" + String.join(",", exts) + "}";
        return FileSystems.getDefault().getPathMatcher(glob);
    }

    public MediaType classify(Path file) {
        if (file.getFileName() == null) {
            return null;
        }
        Path name = Path.of(file.getFileName().toString().toLowerCase(Locale.ROOT));
        if (images.matches(name)) {
            return MediaType.IMAGE;
        }
        if (videos.matches(name)) {
            return MediaType.VIDEO;
        }
        return null;
    }

    public Media scan(List<Path> roots) {
        Set<Path> seen = new LinkedHashSet<>();
        for (Path root : roots) {
            if (Files.isDirectory(root)) {
                try (Stream<Path> s = Files.walk(root)) {
                    seen.addAll(s.filter(Files::isRegularFile)
                            .map(p -> p.toAbsolutePath().normalize())
                            .collect(Collectors.toList()));
                } catch (IOException e) {
                    throw new UncheckedIOException("Failed to scan " + root, e);
                }
            } else if (Files.isRegularFile(root)) {
                seen.add(root.toAbsolutePath().normalize());
            } else {
                throw new IllegalArgumentException("Import path not found: " + root);
            }
        }
        List<Path> img = new ArrayList<>();
        List<Path> vid = new ArrayList<>();
        for (Path p : seen) {
            MediaType t = classify(p);
            if (t == MediaType.IMAGE) {
                img.add(p);
            } else if (t == MediaType.VIDEO) {
                vid.add(p);
            } else {
                log.debug("skip non-media file: {}", p);
            }
        }
        img.sort(null);
        vid.sort(null);
        log.info("found {} images and {} videos under {}", img.size(), vid.size(), roots);
        return new Media(img, vid);
    }
}
