package com.imagescanner.app.metadata;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.drew.imaging.ImageMetadataReader;
import com.drew.imaging.ImageProcessingException;
import com.drew.metadata.Directory;
import com.drew.metadata.Metadata;
import com.drew.metadata.Tag;
import com.drew.metadata.bmp.BmpHeaderDirectory;
import com.drew.metadata.exif.ExifDirectoryBase;
import com.drew.metadata.exif.ExifIFD0Directory;
import com.drew.metadata.exif.ExifSubIFDDirectory;
import com.drew.metadata.gif.GifHeaderDirectory;
import com.drew.metadata.jpeg.JpegDirectory;
import com.drew.metadata.png.PngDirectory;
import com.drew.metadata.webp.WebpDirectory;

/**
 * Extrator baseado no metadata-extractor: lê os diretórios de metadados de JPEG, PNG, GIF, BMP,
 * WebP (e o que mais a biblioteca reconhecer) e devolve as tags pelo nome legível.
 * <p>
 * Só devolve {@link Optional#empty()} quando a leitura falha; imagem sem dimensões conhecidas vira 0x0.
 */
public final class ImageFileMetadataExtractor implements MetadataExtractor {

    private static final Logger logger = LoggerFactory.getLogger(ImageFileMetadataExtractor.class);

    public static final String ALL_FIELDS = "*";

    @Override
    public Optional<ImageMetadata> extract(Path file, Collection<String> requestedFields) {
        Metadata metadata;
        try {
            metadata = ImageMetadataReader.readMetadata(file.toFile());
        } catch (IOException e) {
            logger.warn("Não foi possível ler metadados de {}: {}", file, e.toString());
            return Optional.empty();
        } catch (ImageProcessingException e) {
            // formato não reconhecido ou arquivo corrompido
            logger.warn("Erro ao processar metadados de {}: {}", file, e.getMessage());
            return Optional.empty();
        } catch (RuntimeException e) {
            logger.error("Erro inesperado ao extrair metadados de {}", file, e);
            return Optional.empty();
        }

        int[] dims = dimensions(metadata);
        Map<String, String> tags = new LinkedHashMap<>();
        for (Directory directory : metadata.getDirectories()) {
            for (Tag tag : directory.getTags()) {
                String description = tag.getDescription();
                if (description != null && !description.isBlank()) {
                    tags.put(tag.getTagName(), description.trim());
                }
            }
            if (directory.hasErrors()) {
                logger.debug("{} em {}: {}", directory.getName(), file, String.join("; ", directory.getErrors()));
            }
        }
        return Optional.of(new ImageMetadata(dims[0], dims[1], filter(tags, requestedFields)));
    }

    static Map<String, String> filter(Map<String, String> tags, Collection<String> requestedFields) {
        if (requestedFields == null || requestedFields.contains(ALL_FIELDS)) return tags;
        Set<String> wanted = requestedFields.stream()
                .map(f -> f.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
        Map<String, String> out = new LinkedHashMap<>();
        tags.forEach((k, v) -> {
            if (wanted.contains(k.toLowerCase(Locale.ROOT))) out.put(k, v);
        });
        return out;
    }

    /** Primeiro diretório que traz largura e altura, na ordem de confiança do formato. */
    static int[] dimensions(Metadata metadata) {
        int[] dims = firstSize(metadata, JpegDirectory.class, JpegDirectory.TAG_IMAGE_WIDTH, JpegDirectory.TAG_IMAGE_HEIGHT);
        if (dims == null) dims = firstSize(metadata, PngDirectory.class, PngDirectory.TAG_IMAGE_WIDTH, PngDirectory.TAG_IMAGE_HEIGHT);
        if (dims == null) dims = firstSize(metadata, GifHeaderDirectory.class, GifHeaderDirectory.TAG_IMAGE_WIDTH, GifHeaderDirectory.TAG_IMAGE_HEIGHT);
        if (dims == null) dims = firstSize(metadata, BmpHeaderDirectory.class, BmpHeaderDirectory.TAG_IMAGE_WIDTH, BmpHeaderDirectory.TAG_IMAGE_HEIGHT);
        if (dims == null) dims = firstSize(metadata, WebpDirectory.class, WebpDirectory.TAG_IMAGE_WIDTH, WebpDirectory.TAG_IMAGE_HEIGHT);
        if (dims == null) dims = firstSize(metadata, ExifIFD0Directory.class, ExifDirectoryBase.TAG_IMAGE_WIDTH, ExifDirectoryBase.TAG_IMAGE_HEIGHT);
        if (dims == null) dims = firstSize(metadata, ExifSubIFDDirectory.class, ExifDirectoryBase.TAG_EXIF_IMAGE_WIDTH, ExifDirectoryBase.TAG_EXIF_IMAGE_HEIGHT);
        return dims == null ? new int[]{0, 0} : dims;
    }

    private static <T extends Directory> int[] firstSize(Metadata metadata, Class<T> type, int widthTag, int heightTag) {
        for (T dir : metadata.getDirectoriesOfType(type)) {
            Integer w = dir.getInteger(widthTag);
            Integer h = dir.getInteger(heightTag);
            if (w != null && h != null && w > 0 && h > 0) return new int[]{w, h};
        }
        return null;
    }
}
