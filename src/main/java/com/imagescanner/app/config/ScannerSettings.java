package com.imagescanner.app.config;

import java.util.List;
import java.util.Locale;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Padrões do scan vindos de reference.conf / application.conf / -D.
 * Opções de linha de comando sobrescrevem esses valores.
 */
public record ScannerSettings(
        List<String> extensions,
        int batchSize,
        long minFileSize,
        long maxFileSize, // 0 = sem limite
        boolean recursive,
        int hashWorkers,
        List<String> metadataFields
) {

    public static final int DEFAULT_BATCH_SIZE = 100;

    private static final List<String> DEFAULT_EXTENSIONS = List.of(".png", ".jpg", ".jpeg", ".bmp", ".gif");
    private static final List<String> DEFAULT_FIELDS = List.of(
            "Make", "Model", "Date/Time Original", "Image Width", "Image Height", "Exposure Time", "F-Number");

    public static ScannerSettings load() {
        return from(ConfigFactory.load());
    }

    static ScannerSettings from(Config cfg) {
        var extensions = getList(cfg, "imagescanner.extensions", DEFAULT_EXTENSIONS).stream()
                .map(e -> e.trim().toLowerCase(Locale.ROOT))
                .filter(e -> !e.isEmpty())
                .toList();

        return new ScannerSettings(
                extensions,
                Math.max(1, getInt(cfg, "imagescanner.batchSize", DEFAULT_BATCH_SIZE)),
                Math.max(0L, getLong(cfg, "imagescanner.minFileSize", 0L)),
                Math.max(0L, getLong(cfg, "imagescanner.maxFileSize", 0L)),
                getBool(cfg, "imagescanner.recursive", true),
                Math.max(1, getInt(cfg, "imagescanner.hashWorkers", 1)),
                getList(cfg, "imagescanner.metadataFields", DEFAULT_FIELDS)
        );
    }

    private static List<String> getList(Config cfg, String path, List<String> def) {
        try { return cfg.hasPath(path) ? List.copyOf(cfg.getStringList(path)) : def; }
        catch (com.typesafe.config.ConfigException ignored) { return def; }
    }

    private static int getInt(Config cfg, String path, int def) {
        try { return cfg.hasPath(path) ? cfg.getInt(path) : def; }
        catch (com.typesafe.config.ConfigException ignored) { return def; }
    }

    private static long getLong(Config cfg, String path, long def) {
        try { return cfg.hasPath(path) ? cfg.getLong(path) : def; }
        catch (com.typesafe.config.ConfigException ignored) { return def; }
    }

    private static boolean getBool(Config cfg, String path, boolean def) {
        try { return cfg.hasPath(path) ? cfg.getBoolean(path) : def; }
        catch (com.typesafe.config.ConfigException ignored) { return def; }
    }
}
