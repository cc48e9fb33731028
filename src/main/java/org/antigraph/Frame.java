package org.antigraph;

import java.awt.image.BufferedImage;

/**
 * One decoded frame of a time-lapse: a width x height grid of RGB triples, each channel 0-255.
 * Frames are never modified once built.
 */
public final class Frame {
  private final int width;
  private final int height;

  // Packed 0x00RRGGBB, row-major.
  private final int[] rgb;

  /**
   * Wraps {@code rgb} (row-major, packed 0xRRGGBB; any alpha byte is dropped).
   */
  public Frame(int width, int height, int[] rgb) {
    if (width < 0 || height < 0) {
      throw new IllegalArgumentException("Negative frame size " + width + "x" + height);
    }
    if (rgb.length != width * height) {
      throw new IllegalArgumentException(
          "Expected " + (width * height) + " pixels, got " + rgb.length);
    }
    this.width = width;
    this.height = height;
    this.rgb = new int[rgb.length];
    for (int i = 0; i < rgb.length; ++i) {
      this.rgb[i] = rgb[i] & 0x00ffffff;
    }
  }

  /**
   * Copies {@code image} onto a black canvas of the given size. Parts of the image outside the
   * canvas are cropped.
   */
  public static Frame fromImage(BufferedImage image, int width, int height) {
    int[] pixels = new int[width * height];
    int copyWidth = Math.min(width, image.getWidth());
    int copyHeight = Math.min(height, image.getHeight());
    for (int y = 0; y < copyHeight; ++y) {
      for (int x = 0; x < copyWidth; ++x) {
        pixels[y * width + x] = image.getRGB(x, y);
      }
    }
    return new Frame(width, height, pixels);
  }

  /**
   * Builds a frame from per-pixel channel triples, indexed {@code [y][x][channel]}.
   */
  public static Frame fromTriples(int[][][] triples) {
    int height = triples.length;
    int width = height == 0 ? 0 : triples[0].length;
    int[] pixels = new int[width * height];
    for (int y = 0; y < height; ++y) {
      for (int x = 0; x < width; ++x) {
        int[] px = triples[y][x];
        pixels[y * width + x] = pack(px[0], px[1], px[2]);
      }
    }
    return new Frame(width, height, pixels);
  }

  public static int pack(int r, int g, int b) {
    return ((r & 0xff) << 16) | ((g & 0xff) << 8) | (b & 0xff);
  }

  public int getWidth() {
    return width;
  }

  public int getHeight() {
    return height;
  }

  public int getRGB(int x, int y) {
    return rgb[y * width + x];
  }

  /**
   * Channel 0 is red, 1 green, 2 blue.
   */
  public int getChannel(int x, int y, int channel) {
    return (rgb[y * width + x] >> (16 - 8 * channel)) & 0xff;
  }

  /**
   * Squared RGB distance between {@code (x, y)} here and {@code (ox, oy)} in {@code other}.
   */
  public int squaredDistance(int x, int y, Frame other, int ox, int oy) {
    int a = rgb[y * width + x];
    int b = other.rgb[oy * other.width + ox];
    int dr = ((a >> 16) & 0xff) - ((b >> 16) & 0xff);
    int dg = ((a >> 8) & 0xff) - ((b >> 8) & 0xff);
    int db = (a & 0xff) - (b & 0xff);
    return dr * dr + dg * dg + db * db;
  }

  public BufferedImage toImage() {
    BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
    image.setRGB(0, 0, width, height, rgb, 0, width);
    return image;
  }
}
