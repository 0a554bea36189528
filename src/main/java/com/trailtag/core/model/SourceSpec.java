package com.trailtag.core.model;

import java.util.Objects;

/**
 * Кандидат-источник: тип парсера + шаблон имени файла (%f, %g, %e).
 * Пустой шаблон заменяется шаблоном по умолчанию для типа.
 */
public record SourceSpec(SourceKind kind, String pattern) {

    public SourceSpec {
        Objects.requireNonNull(kind, "kind");
        if (pattern == null || pattern.isBlank()) {
            pattern = kind.defaultPattern();
        }
    }

    public static SourceSpec of(SourceKind kind) {
        return new SourceSpec(kind, null);
    }

    @Override
    public String toString() {
        return kind.configName() + "(" + pattern + ")";
    }
}
