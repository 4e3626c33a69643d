package com.flowmable.mosaic;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * {@link RasterStore} backed by {@link ImageIO}.
 * <p>
 * The output format is chosen from the file extension: {@code jpg}/{@code jpeg},
 * {@code png}, {@code bmp} and {@code gif}; anything else is written as PNG.
 * Formats without alpha support are written from an opaque RGB copy.
 */
public class ImageIoRasterStore implements RasterStore {

    @Override
    public BufferedImage load(Path path) throws ImageDecodeException {
        if (!Files.isRegularFile(path)) {
            throw new ImageDecodeException(path, "no such file");
        }
        BufferedImage image;
        try {
            image = ImageIO.read(path.toFile());
        } catch (IOException | RuntimeException e) {
            throw new ImageDecodeException(path, e);
        }
        if (image == null) {
            throw new ImageDecodeException(path, "unsupported or corrupt image format");
        }
        return image;
    }

    @Override
    public void save(BufferedImage image, Path path) throws ImageEncodeException {
        String format = formatFor(path);
        BufferedImage out = "png".equals(format) ? image : ImageOps.toRgb(image);
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            if (!ImageIO.write(out, format, path.toFile())) {
                throw new ImageEncodeException(path, "no ImageIO writer for format " + format);
            }
        } catch (ImageEncodeException e) {
            throw e;
        } catch (IOException e) {
            throw new ImageEncodeException(path, e);
        }
    }

    static String formatFor(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        int dot = name.lastIndexOf('.');
        String ext = dot < 0 ? "" : name.substring(dot + 1);
        return switch (ext) {
            case "jpg", "jpeg" -> "jpg";
            case "bmp" -> "bmp";
            case "gif" -> "gif";
            default -> "png";
        };
    }
}
