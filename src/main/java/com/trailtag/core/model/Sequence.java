package com.trailtag.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Последовательность как представление: id + упорядоченные участники.
 * Записи принадлежат общему набору захватов, здесь только ссылки.
 */
public record Sequence(String id, List<CaptureRecord> members) {

    public Sequence {
        Objects.requireNonNull(id, "id");
        if (members == null || members.isEmpty()) {
            throw new IllegalArgumentException("Sequence must have at least one member");
        }
        members = List.copyOf(members);
    }

    public int size() {
        return members.size();
    }
}
