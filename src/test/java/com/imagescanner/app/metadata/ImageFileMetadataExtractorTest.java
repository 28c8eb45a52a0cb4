package com.imagescanner.app.metadata;

import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.zip.CRC32;

import javax.imageio.ImageIO;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.*;

public class ImageFileMetadataExtractorTest {

    @TempDir
    Path tmp;

    private final ImageFileMetadataExtractor extractor = new ImageFileMetadataExtractor();

    /** TIFF big-endian: Model no IFD0; DateTimeOriginal e ExposureTime 1/125 no sub-IFD Exif. */
    private static byte[] tiff(String model, String dateOriginal) {
        byte[] modelBytes = (model + "\0").getBytes(StandardCharsets.US_ASCII);
        byte[] dateBytes = (dateOriginal + "\0").getBytes(StandardCharsets.US_ASCII);

        int ifd0 = 8;
        int modelAt = ifd0 + 2 + 2 * 12 + 4;
        int exifIfd = modelAt + modelBytes.length;
        int dateAt = exifIfd + 2 + 2 * 12 + 4;
        int rationalAt = dateAt + dateBytes.length;

        ByteBuffer b = ByteBuffer.allocate(rationalAt + 8);
        b.put((byte) 'M').put((byte) 'M').putShort((short) 0x2A).putInt(ifd0);

        b.putShort((short) 2);
        b.putShort((short) 0x0110).putShort((short) 2).putInt(modelBytes.length).putInt(modelAt);
        b.putShort((short) 0x8769).putShort((short) 4).putInt(1).putInt(exifIfd);
        b.putInt(0);
        b.put(modelBytes);

        b.putShort((short) 2);
        b.putShort((short) 0x829A).putShort((short) 5).putInt(1).putInt(rationalAt);
        b.putShort((short) 0x9003).putShort((short) 2).putInt(dateBytes.length).putInt(dateAt);
        b.putInt(0);
        b.put(dateBytes);
        b.putInt(1).putInt(125);
        return b.array();
    }

    private static byte[] encode(int w, int h, String format) throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        assertTrue(ImageIO.write(new BufferedImage(w, h, BufferedImage.TYPE_INT_RGB), format, out), format);
        return out.toByteArray();
    }

    /** Insere um chunk eXIf logo depois do IHDR. */
    private static byte[] pngWithExif(byte[] png, byte[] exif) {
        int afterIhdr = 8 + 8 + 13 + 4;
        byte[] type = "eXIf".getBytes(StandardCharsets.US_ASCII);
        CRC32 crc = new CRC32();
        crc.update(type);
        crc.update(exif);

        ByteBuffer chunk = ByteBuffer.allocate(12 + exif.length);
        chunk.putInt(exif.length).put(type).put(exif).putInt((int) crc.getValue());

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.write(png, 0, afterIhdr);
        out.writeBytes(chunk.array());
        out.write(png, afterIhdr, png.length - afterIhdr);
        return out.toByteArray();
    }

    /** Insere um APP1 "Exif" logo depois do APP0 (JFIF). */
    private static byte[] jpegWithExif(byte[] jpeg, byte[] exif) {
        int app0End = 4 + (((jpeg[4] & 0xFF) << 8) | (jpeg[5] & 0xFF));
        int len = 2 + 6 + exif.length;

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.write(jpeg, 0, app0End);
        out.writeBytes(new byte[]{(byte) 0xFF, (byte) 0xE1, (byte) (len >> 8), (byte) len});
        out.writeBytes("Exif\0\0".getBytes(StandardCharsets.US_ASCII));
        out.writeBytes(exif);
        out.write(jpeg, app0End, jpeg.length - app0End);
        return out.toByteArray();
    }

    @Test
    void pngWithExifChunk_exposesCameraFields() throws Exception {
        Path png = tmp.resolve("camera.png");
        Files.write(png, pngWithExif(encode(4, 3, "png"), tiff("PngCam", "2022:08:09 07:06:05")));

        ImageMetadata md = extractor.extract(png, List.of(ImageFileMetadataExtractor.ALL_FIELDS)).orElseThrow();

        assertEquals(4, md.width());
        assertEquals(3, md.height());
        assertEquals("PngCam", md.tags().get("Model"));
        assertEquals("PngCam", ExifValues.cameraModel(md.tags()));
        assertEquals(LocalDateTime.of(2022, 8, 9, 7, 6, 5), ExifValues.dateTaken(md.tags()));
    }

    @Test
    void jpegWithExif_givesDimensionsAndRequestedTags() throws Exception {
        Path jpg = tmp.resolve("photo.JPG");
        Files.write(jpg, jpegWithExif(encode(16, 8, "jpg"), tiff("Pixel 7", "2023:12:24 18:00:00")));

        ImageMetadata md = extractor.extract(jpg, List.of("model", "Date/Time Original", "exposure time")).orElseThrow();

        assertEquals(16, md.width());
        assertEquals(8, md.height());
        assertEquals(Map.of(
                "Model", "Pixel 7",
                "Date/Time Original", "2023:12:24 18:00:00",
                "Exposure Time", "1/125 sec"), md.tags());
    }

    @Test
    void gifAndBmp_giveDimensions() throws Exception {
        for (String format : List.of("gif", "bmp")) {
            Path f = tmp.resolve("img." + format);
            Files.write(f, encode(7, 5, format));

            ImageMetadata md = extractor.extract(f, List.of("*")).orElseThrow();

            assertEquals(7, md.width(), format);
            assertEquals(5, md.height(), format);
        }
    }

    @Test
    void unrecognizedContent_givesEmpty() throws Exception {
        Path fake = Files.writeString(tmp.resolve("fake.png"), "not an image at all");
        assertTrue(extractor.extract(fake, List.of("*")).isEmpty());
    }

    @Test
    void missingFile_givesEmpty() {
        assertTrue(extractor.extract(tmp.resolve("missing.jpg"), List.of("*")).isEmpty());
    }

    @Test
    void filter_isCaseInsensitive_andStarKeepsAll() {
        Map<String, String> tags = Map.of("Model", "X", "Make", "Y", "F-Number", "f/2.0");

        assertEquals(Map.of("Model", "X", "F-Number", "f/2.0"),
                ImageFileMetadataExtractor.filter(tags, List.of("MODEL", " f-number ")));
        assertEquals(tags, ImageFileMetadataExtractor.filter(tags, List.of("*")));
        assertTrue(ImageFileMetadataExtractor.filter(tags, List.of()).isEmpty());
    }
}
