package org.antigraph;

import ij.plugin.DICOM;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.awt.image.BufferedImage;
import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;

/**
 * Reading frames from and writing the antigraph to image files. Anything {@link ImageIO} reads is
 * accepted, plus DICOM through ImageJ.
 */
public class FrameIO {
  private static final Logger logger = LogManager.getLogger(FrameIO.class);

  public static final String DEFAULT_FORMAT = "png";

  public static boolean isDicom(String name) {
    return name.toLowerCase(Locale.ROOT).endsWith(".dcm");
  }

  /**
   * Lower-cased extension of {@code name}, or the empty string if it has none.
   */
  public static String extension(String name) {
    String base = new File(name).getName();
    int dot = base.lastIndexOf('.');
    if (dot < 0 || dot == base.length() - 1) return "";
    return base.substring(dot + 1).toLowerCase(Locale.ROOT);
  }

  /**
   * True for names this class can decode.
   */
  public static boolean isSupportedFrame(String name) {
    if (isDicom(name)) return true;
    String ext = extension(name);
    if (ext.isEmpty()) return false;
    return ImageIO.getImageReadersBySuffix(ext).hasNext();
  }

  /**
   * Decodes the image at {@code path} onto a {@code width} x {@code height} black canvas.
   */
  public static Frame loadFrame(String path, int width, int height) throws DecodeException {
    try (InputStream in = new BufferedInputStream(new FileInputStream(path))) {
      return decode(in, path, width, height);
    } catch (IOException e) {
      throw new DecodeException("Failed to read frame " + path, e);
    }
  }

  /**
   * Decodes {@code in}; {@code name} picks the decoder and is used in error messages.
   */
  public static Frame decode(InputStream in, String name, int width, int height)
      throws DecodeException {
    return Frame.fromImage(decodeImage(in, name), width, height);
  }

  static BufferedImage decodeImage(InputStream in, String name) throws DecodeException {
    BufferedImage image;
    try {
      if (isDicom(name)) {
        image = decodeDicom(in, name);
      } else {
        image = ImageIO.read(in);
      }
    } catch (IOException e) {
      throw new DecodeException("Failed to decode frame " + name, e);
    } catch (RuntimeException e) {
      // ImageJ and some ImageIO plugins fail on corrupt input with unchecked exceptions.
      throw new DecodeException("Failed to decode frame " + name, e);
    }
    if (image == null) {
      throw new DecodeException("Not a recognized image format: " + name);
    }
    return image;
  }

  private static BufferedImage decodeDicom(InputStream in, String name) {
    DICOM dicom = new DICOM(in);
    dicom.run(name);
    if (dicom.getProcessor() == null || dicom.getWidth() == 0) {
      return null;
    }
    BufferedImage baseImage = dicom.getProcessor().getBufferedImage();
    BufferedImage display = new BufferedImage(
        baseImage.getWidth(), baseImage.getHeight(), BufferedImage.TYPE_INT_RGB);
    display.getGraphics().drawImage(baseImage, 0, 0, null);
    return display;
  }

  /**
   * Width and height of one image, from its header where the reader allows it.
   */
  public static int[] dimensions(String path) throws DecodeException {
    if (!isDicom(path)) {
      try (ImageInputStream iis = ImageIO.createImageInputStream(new File(path))) {
        if (iis == null) {
          throw new DecodeException("Failed to read frame " + path);
        }
        Iterator<ImageReader> readers = ImageIO.getImageReaders(iis);
        if (readers.hasNext()) {
          ImageReader reader = readers.next();
          try {
            reader.setInput(iis);
            return new int[] {reader.getWidth(0), reader.getHeight(0)};
          } finally {
            reader.dispose();
          }
        }
      } catch (IOException e) {
        throw new DecodeException("Failed to read header of " + path, e);
      }
    }
    try (InputStream in = new BufferedInputStream(new FileInputStream(path))) {
      BufferedImage image = decodeImage(in, path);
      return new int[] {image.getWidth(), image.getHeight()};
    } catch (IOException e) {
      throw new DecodeException("Failed to read frame " + path, e);
    }
  }

  /**
   * The largest width and the largest height over all of {@code paths}.
   */
  public static int[] maxDimensions(List<String> paths) throws DecodeException {
    int maxWidth = 0;
    int maxHeight = 0;
    for (String path : paths) {
      int[] dims = dimensions(path);
      maxWidth = Math.max(maxWidth, dims[0]);
      maxHeight = Math.max(maxHeight, dims[1]);
    }
    logger.debug("Max dimensions over {} frames: {}x{}", paths.size(), maxWidth, maxHeight);
    return new int[] {maxWidth, maxHeight};
  }

  /**
   * Output format for {@code path}: its extension if ImageIO can write it, png when it has none.
   */
  public static String formatFor(String path) throws EncodeException {
    String ext = extension(path);
    if (ext.isEmpty()) return DEFAULT_FORMAT;
    if (!ImageIO.getImageWritersBySuffix(ext).hasNext()) {
      throw new EncodeException("No image writer for ." + ext + " (" + path + ")");
    }
    return ext;
  }

  public static void saveImage(Frame frame, String path) throws EncodeException {
    String format = formatFor(path);
    try (OutputStream out = new BufferedOutputStream(new FileOutputStream(path))) {
      encode(frame, format, out);
    } catch (IOException e) {
      throw new EncodeException("Failed to write " + path, e);
    }
    logger.info("Wrote {}x{} antigraph to {}", frame.getWidth(), frame.getHeight(), path);
  }

  public static void encode(Frame frame, String format, OutputStream out) throws EncodeException {
    try {
      if (!ImageIO.write(frame.toImage(), format, out)) {
        throw new EncodeException("No image writer for format " + format);
      }
      out.flush();
    } catch (IOException e) {
      throw new EncodeException("Failed to encode " + format + " image", e);
    }
  }
}
