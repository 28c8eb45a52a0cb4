package com.imagescanner.app.metadata;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Map;

/**
 * Campos derivados das tags que o catálogo guarda em colunas próprias.
 */
public final class ExifValues {

    public static final String TAG_DATE_TAKEN = "Date/Time Original";
    public static final String TAG_CAMERA_MODEL = "Model";

    private static final DateTimeFormatter EXIF_DATE = DateTimeFormatter.ofPattern("yyyy:MM:dd HH:mm:ss");

    private ExifValues() {}

    /** null quando ausente ou fora do formato "yyyy:MM:dd HH:mm:ss". */
    public static LocalDateTime dateTaken(Map<String, String> tags) {
        String raw = tags.get(TAG_DATE_TAKEN);
        if (raw == null || raw.isBlank()) return null;
        try {
            return LocalDateTime.parse(raw.trim(), EXIF_DATE);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    public static String cameraModel(Map<String, String> tags) {
        String raw = tags.get(TAG_CAMERA_MODEL);
        return raw == null || raw.isBlank() ? null : raw.trim();
    }
}
