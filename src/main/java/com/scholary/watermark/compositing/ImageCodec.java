package com.scholary.watermark.compositing;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Locale;
import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;

/**
 * ImageIO based decoding and encoding.
 *
 * <p>JPEG output has no alpha channel, so images are flattened onto a white background before a
 * JPEG write. PNG keeps alpha and is lossless; its quality only selects the deflate effort.
 */
public final class ImageCodec {

  private ImageCodec() {}

  /**
   * Decode an image file.
   *
   * @throws IOException if the file cannot be read or no ImageIO reader recognises it
   */
  public static BufferedImage read(Path path) throws IOException {
    BufferedImage image = ImageIO.read(path.toFile());
    if (image == null) {
      throw new IOException("Unsupported or corrupt image: " + path);
    }
    return image;
  }

  /**
   * Encode and decode an image in memory so later steps see its post-compression look.
   *
   * <p>Opaque images go through lossy JPEG at {@code quality}; images with alpha go through PNG.
   */
  public static BufferedImage reencode(BufferedImage image, int quality) throws IOException {
    String format = hasAlpha(image) ? "png" : "jpeg";
    ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    write(image, format, quality, buffer);

    BufferedImage decoded = ImageIO.read(new ByteArrayInputStream(buffer.toByteArray()));
    if (decoded == null) {
      throw new IOException("Failed to decode re-encoded " + format + " image");
    }
    return decoded;
  }

  /**
   * Write an image to a file, choosing the format from the file extension.
   *
   * @param quality 0-100; used by lossy formats
   * @throws IOException if the format is unsupported or the write fails
   */
  public static void write(BufferedImage image, Path destination, int quality) throws IOException {
    String format = formatFor(destination);
    try (OutputStream out = Files.newOutputStream(destination)) {
      write(image, format, quality, out);
    }
  }

  public static boolean hasAlpha(BufferedImage image) {
    return image.getColorModel().hasAlpha();
  }

  /** Flatten an image onto a white {@code TYPE_INT_RGB} canvas. */
  public static BufferedImage toRgb(BufferedImage source) {
    if (source.getType() == BufferedImage.TYPE_INT_RGB) {
      return source;
    }
    BufferedImage rgb =
        new BufferedImage(source.getWidth(), source.getHeight(), BufferedImage.TYPE_INT_RGB);
    Graphics2D g = rgb.createGraphics();
    try {
      g.setColor(Color.WHITE);
      g.fillRect(0, 0, source.getWidth(), source.getHeight());
      g.drawImage(source, 0, 0, null);
    } finally {
      g.dispose();
    }
    return rgb;
  }

  static String formatFor(Path destination) throws IOException {
    String name = destination.getFileName().toString().toLowerCase(Locale.ROOT);
    int dot = name.lastIndexOf('.');
    String extension = dot < 0 ? "" : name.substring(dot + 1);
    return switch (extension) {
      case "jpg", "jpeg" -> "jpeg";
      case "png" -> "png";
      default -> throw new IOException("Unsupported output format: " + destination);
    };
  }

  private static void write(BufferedImage image, String format, int quality, OutputStream out)
      throws IOException {
    BufferedImage encodable = "jpeg".equals(format) ? toRgb(image) : image;

    Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName(format);
    if (!writers.hasNext()) {
      throw new IOException("No ImageIO writer for format: " + format);
    }

    ImageWriter writer = writers.next();
    try (ImageOutputStream ios = ImageIO.createImageOutputStream(out)) {
      writer.setOutput(ios);

      ImageWriteParam param = writer.getDefaultWriteParam();
      if (param.canWriteCompressed()) {
        param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
        String[] compressionTypes = param.getCompressionTypes();
        if (compressionTypes != null && compressionTypes.length > 0) {
          param.setCompressionType(compressionTypes[0]);
        }
        param.setCompressionQuality(Math.max(0, Math.min(100, quality)) / 100.0f);
      }

      writer.write(null, new IIOImage(encodable, null, null), param);
    } finally {
      writer.dispose();
    }
  }
}
