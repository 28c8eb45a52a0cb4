package com.imagescanner.app.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

import io.github.cdimascio.dotenv.Dotenv;

/**
 * Configuração central do ImageScanner.
 * Responsável por resolver onde fica o arquivo SQLite do catálogo.
 */
public final class Config {

    private static final String APP_NAME = "ImageScanner";

    private static final String DEFAULT_DB_NAME = "image_scanner.db";

    // Variáveis de ambiente a serem checadas
    private static final String ENV_DB_NAME = "IMAGESCANNER_DB_NAME";
    private static final String ENV_DATA_DIR = "IMAGESCANNER_DATA_DIR";

    // System property overrides (useful for tests/CI)
    private static final String PROP_DB_NAME = "imagescanner.dbName";
    private static final String PROP_DATA_DIR = "imagescanner.dataDir";

    // Logger must be initialized before any static initializer that may use it
    private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(Config.class);
    private static final Dotenv dotenv = Dotenv.configure().ignoreIfMissing().load();

    private static volatile String cachedDbPathKey;
    private static volatile Path cachedDbPath;

    private Config() {}

    /**
     * Retorna a URL de conexão JDBC do catálogo padrão.
     */
    public static String getDbUrl() {
        return "jdbc:sqlite:" + getDbFilePath().toAbsolutePath();
    }

    public static Path getDbFilePath() {
        String dbFileName = resolveDbFileName();
        String overrideDir = getEnvOrDotenv(ENV_DATA_DIR);

        String key = (overrideDir == null ? "" : overrideDir) + "|" + dbFileName;
        Path current = cachedDbPath;
        if (current != null && key.equals(cachedDbPathKey)) {
            return current;
        }

        synchronized (Config.class) {
            current = cachedDbPath;
            if (current != null && key.equals(cachedDbPathKey)) {
                return current;
            }
            Path resolved = resolveDbPath(overrideDir, dbFileName);
            cachedDbPathKey = key;
            cachedDbPath = resolved;
            return resolved;
        }
    }

    // --- Lógica de Resolução ---

    private static String resolveDbFileName() {
        String name = getEnvOrDotenv(ENV_DB_NAME);
        return name == null ? DEFAULT_DB_NAME : name;
    }

    /**
     * System property, depois variável de ambiente, depois arquivo .env (java-dotenv).
     */
    static String getEnvOrDotenv(String key) {
        String propKey = mapToSystemPropertyKey(key);
        if (propKey != null) {
            String propVal = System.getProperty(propKey);
            if (propVal != null && !propVal.isBlank()) {
                return propVal.trim();
            }
        }

        String envVal = System.getenv(key);
        if (envVal != null && !envVal.isBlank()) {
            return envVal.trim();
        }

        String fileVal = dotenv.get(key);
        if (fileVal == null || fileVal.isBlank()) {
            return null;
        }
        return fileVal.trim();
    }

    private static String mapToSystemPropertyKey(String envKey) {
        if (envKey == null) return null;
        return switch (envKey) {
            case ENV_DB_NAME -> PROP_DB_NAME;
            case ENV_DATA_DIR -> PROP_DATA_DIR;
            default -> null;
        };
    }

    private static Path resolveDbPath(String overrideDir, String dbFileName) {
        // Test/CI override: allow forcing a specific data dir.
        if (overrideDir != null) {
            Path p = Paths.get(overrideDir);
            try {
                Files.createDirectories(p);
            } catch (IOException e) {
                throw new IllegalStateException("Não foi possível criar diretório de dados: " + p, e);
            }
            logger.info("Catálogo localizado em (override): {}", p.toAbsolutePath());
            return p.resolve(dbFileName);
        }

        Path appDataDir = defaultAppDataDir();
        try {
            Files.createDirectories(appDataDir);
            logger.info("Catálogo localizado em: {}", appDataDir.toAbsolutePath());
            return appDataDir.resolve(dbFileName);
        } catch (IOException e) {
            // Falha: fallback para o diretório de trabalho
            Path localPath = Paths.get(dbFileName).toAbsolutePath();
            logger.warn("Não foi possível usar {}. Usando diretório local como fallback: {}", appDataDir, localPath);
            return localPath;
        }
    }

    private static Path defaultAppDataDir() {
        String os = System.getProperty("os.name", "generic").toLowerCase(Locale.ROOT);
        String userHome = System.getProperty("user.home");

        if (os.contains("win")) {
            String appDataEnv = System.getenv("APPDATA");
            if (appDataEnv != null && !appDataEnv.isBlank()) {
                return Paths.get(appDataEnv, APP_NAME);
            }
            return Paths.get(userHome, "AppData", "Roaming", APP_NAME);
        }
        if (os.contains("mac")) {
            return Paths.get(userHome, "Library", "Application Support", APP_NAME);
        }
        // Linux/Unix: padrão XDG (~/.local/share/ImageScanner)
        String xdgData = System.getenv("XDG_DATA_HOME");
        if (xdgData != null && !xdgData.isBlank()) {
            return Paths.get(xdgData, APP_NAME);
        }
        return Paths.get(userHome, ".local", "share", APP_NAME);
    }
}
