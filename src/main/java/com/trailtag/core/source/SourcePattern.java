package com.trailtag.core.source;

import java.nio.file.Path;

/**
 * Имя файла-источника по шаблону: %f - полное имя медиафайла, %g - имя без расширения,
 * %e - расширение с точкой. Относительный результат берётся от каталога медиафайла.
 */
public final class SourcePattern {

    private SourcePattern() {
        // no-op
    }

    public static Path resolve(String pattern, Path media) {
        if (pattern == null || pattern.isBlank()) {
            throw new IllegalArgumentException("source pattern is empty");
        }
        String name = media.getFileName().toString();
        int dot = name.lastIndexOf('.');
        // ".hidden" без расширения
        String stem = dot > 0 ? name.substring(0, dot) : name;
        String ext = dot > 0 ? name.substring(dot) : "";

        String replaced = pattern.replace("%f", name).replace("%g", stem).replace("%e", ext);
        Path p = Path.of(replaced);
        if (!p.isAbsolute()) {
            Path dir = media.toAbsolutePath().getParent();
            p = dir.resolve(p);
        }
        return p.normalize();
    }

    /** Шаблон без подстановок даёт один и тот же файл для всех медиафайлов. */
    public static boolean hasPlaceholder(String pattern) {
        return pattern != null && pattern.contains("%");
    }
}
