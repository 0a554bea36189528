package com.trailtag.core.exif;

import com.trailtag.core.error.MetadataException;

import java.nio.file.Path;
import java.util.Map;

/** Плоская запись метаданных файла: "Group:Tag" → значение (числа в виде -n). */
@FunctionalInterface
public interface MetadataReader {

    Map<String, String> read(Path file) throws MetadataException;
}
