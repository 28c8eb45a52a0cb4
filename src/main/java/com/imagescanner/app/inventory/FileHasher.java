package com.imagescanner.app.inventory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Fingerprint SHA-256 do conteúdo, lido em streaming (memória limitada ao buffer).
 */
public class FileHasher {

    public static final String ALGORITHM = "SHA-256";
    public static final int HEX_LENGTH = 64;

    private static final int BUFFER_SIZE = 64 * 1024;

    /**
     * @throws IOException arquivo sumiu, sem permissão, falha de leitura ou digest indisponível
     * @throws ScanCancelledException cancelamento observado entre chunks; nenhum hash parcial é devolvido
     */
    public String hash(Path file, CancellationToken cancel) throws IOException {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            throw new IOException("Algoritmo " + ALGORITHM + " indisponível.", e);
        }

        // READ puro: outros leitores do mesmo arquivo não são bloqueados
        try (InputStream in = Files.newInputStream(file, StandardOpenOption.READ)) {
            byte[] buffer = new byte[BUFFER_SIZE];
            int read;
            while ((read = in.read(buffer)) != -1) {
                cancel.throwIfCancellationRequested();
                digest.update(buffer, 0, read);
            }
        }
        cancel.throwIfCancellationRequested();
        return HexFormat.of().formatHex(digest.digest());
    }
}
