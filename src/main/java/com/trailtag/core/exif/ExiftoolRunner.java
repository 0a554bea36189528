package com.trailtag.core.exif;

import com.trailtag.core.error.ParseException;

import java.nio.file.Path;
import java.util.List;

/**
 * Запуск exiftool для одного файла, результат - stdout (RDF/XML при -X).
 *
 * Таймаут и ненулевой код возврата дают ParseException.
 * Если бинарник не запускается вовсе - ExiftoolUnavailableException.
 */
@FunctionalInterface
public interface ExiftoolRunner {

    /** Аргументы для видео: -ee извлекает встроенные треки, LargeFileSupport для файлов больше 2 ГБ. */
    List<String> VIDEO_ARGS = List.of("-q", "-r", "-n", "-ee", "-api", "LargeFileSupport=1", "-X");

    /** Аргументы для изображений. */
    List<String> IMAGE_ARGS = List.of("-q", "-n", "-X");

    byte[] run(List<String> args, Path file) throws ParseException;
}
