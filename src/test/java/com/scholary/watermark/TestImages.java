package com.scholary.watermark;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import javax.imageio.ImageIO;

/** Small in-memory images for tests. */
public final class TestImages {

  private TestImages() {}

  public static BufferedImage solid(int width, int height, int argb) {
    BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
    fill(image, argb);
    return image;
  }

  public static BufferedImage solidRgb(int width, int height, int rgb) {
    BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
    fill(image, rgb);
    return image;
  }

  public static Path writePng(Path path, BufferedImage image) throws IOException {
    ImageIO.write(image, "png", path.toFile());
    return path;
  }

  public static Path writeJpeg(Path path, BufferedImage image) throws IOException {
    ImageIO.write(image, "jpeg", path.toFile());
    return path;
  }

  private static void fill(BufferedImage image, int argb) {
    for (int y = 0; y < image.getHeight(); y++) {
      for (int x = 0; x < image.getWidth(); x++) {
        image.setRGB(x, y, argb);
      }
    }
  }
}
