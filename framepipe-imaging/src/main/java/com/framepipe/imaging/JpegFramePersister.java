package com.framepipe.imaging;

import com.framepipe.frame.Frame;
import com.framepipe.frame.FramePersistenceException;
import com.framepipe.frame.FramePersister;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import javax.imageio.stream.MemoryCacheImageOutputStream;
import java.awt.image.BufferedImage;
import java.awt.image.DataBufferByte;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Objects;

/**
 * Encodes frames to JPEG in memory and writes each one to {@code img_<sequence>.jpg}.
 *
 * <p>Safe for concurrent use: every call gets its own {@link ImageWriter}.
 */
public class JpegFramePersister implements FramePersister {
    private static final Logger logger = LoggerFactory.getLogger(JpegFramePersister.class);

    private static final String FORMAT = "jpeg";

    private final Path directory;
    private final float quality;

    /**
     * Creates a persister writing into the given directory.
     *
     * @param directory   the output directory, expected to exist
     * @param jpegQuality quality between 1 and 100
     */
    public JpegFramePersister(Path directory, int jpegQuality) {
        if (jpegQuality < 1 || jpegQuality > 100) {
            throw new IllegalArgumentException("JPEG quality must be between 1 and 100, got " + jpegQuality);
        }
        this.directory = Objects.requireNonNull(directory, "directory");
        this.quality = jpegQuality / 100f;
    }

    /**
     * Returns the file name used for a sequence number.
     */
    public static String fileNameFor(long sequenceNumber) {
        return "img_" + sequenceNumber + ".jpg";
    }

    @Override
    public long persist(Frame frame, long sequenceNumber) {
        Objects.requireNonNull(frame, "frame");
        byte[] encoded = encode(frame, sequenceNumber);
        Path target = directory.resolve(fileNameFor(sequenceNumber));
        try {
            Files.write(target, encoded);
        } catch (IOException e) {
            throw new FramePersistenceException.WriteFailedException(
                    "Failed to write " + target, sequenceNumber, e);
        }
        logger.trace("Wrote {} ({} bytes)", target, encoded.length);
        return encoded.length;
    }

    private byte[] encode(Frame frame, long sequenceNumber) {
        BufferedImage image = toImage(frame);
        ImageWriter writer = newWriter(sequenceNumber);
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (ImageOutputStream out = new MemoryCacheImageOutputStream(buffer)) {
            ImageWriteParam param = writer.getDefaultWriteParam();
            param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            param.setCompressionQuality(quality);
            writer.setOutput(out);
            writer.write(null, new IIOImage(image, null, null), param);
        } catch (IOException | RuntimeException e) {
            throw new FramePersistenceException.EncodingFailedException(
                    "Failed to encode frame as JPEG", sequenceNumber, e);
        } finally {
            writer.dispose();
        }
        return buffer.toByteArray();
    }

    private static BufferedImage toImage(Frame frame) {
        BufferedImage image = new BufferedImage(frame.width(), frame.height(), BufferedImage.TYPE_3BYTE_BGR);
        byte[] raster = ((DataBufferByte) image.getRaster().getDataBuffer()).getData();
        System.arraycopy(frame.pixels(), 0, raster, 0, raster.length);
        return image;
    }

    private static ImageWriter newWriter(long sequenceNumber) {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName(FORMAT);
        if (!writers.hasNext()) {
            throw new FramePersistenceException.EncodingFailedException(
                    "No ImageIO writer available for " + FORMAT, sequenceNumber);
        }
        return writers.next();
    }
}
