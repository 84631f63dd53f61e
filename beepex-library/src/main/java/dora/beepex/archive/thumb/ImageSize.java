package dora.beepex.archive.thumb;

import lombok.Value;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Optional;

@Value
public class ImageSize {
    int width;
    int height;

    public boolean fitsWithin(int maxDimension) {
        return width <= maxDimension && height <= maxDimension;
    }

    /** Longer side scaled down to {@code maxDimension}, aspect ratio kept, never below 1 px. */
    public ImageSize scaledToFit(int maxDimension) {
        if (fitsWithin(maxDimension)) {
            return this;
        }
        double scale = (double) maxDimension / Math.max(width, height);
        return new ImageSize(
                Math.max(1, (int) Math.round(width * scale)),
                Math.max(1, (int) Math.round(height * scale)));
    }

    /** Reads the dimensions from the image header without decoding the pixels. */
    public static Optional<ImageSize> read(Path image) {
        try (ImageInputStream in = ImageIO.createImageInputStream(image.toFile())) {
            if (in == null) {
                return Optional.empty();
            }
            Iterator<ImageReader> readers = ImageIO.getImageReaders(in);
            if (!readers.hasNext()) {
                return Optional.empty();
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(in, true, true);
                return Optional.of(new ImageSize(reader.getWidth(0), reader.getHeight(0)));
            } finally {
                reader.dispose();
            }
        } catch (IOException e) {
            return Optional.empty();
        }
    }
}
