package dora.beepex.archive.thumb;

import dora.beepex.archive.media.AtomicFiles;
import dora.beepex.archive.media.FileNames;
import dora.beepex.archive.model.ExportSettings;
import lombok.extern.slf4j.Slf4j;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Downsamples large JPEG and PNG images into JPEG thumbnails on a small pool of
 * background workers.
 * <p>
 * Producers only enqueue (they block solely when the bounded queue is full); the
 * export waits once, in {@link #awaitCompletion()}, after all chats are written.
 * When a job fails, the remaining and any later jobs are marked done without
 * running, and the first failure is re-raised from {@link #awaitCompletion()}.
 */
@Slf4j
public class ThumbnailGenerator implements AutoCloseable {

    public static final String THUMBNAIL_EXTENSION = ".jpg";

    private final int jpegMaxDimension;
    private final int pngMaxDimension;
    private final float quality;

    private final BlockingQueue<ThumbnailJob> queue;
    private final ExecutorService workers;
    private final AtomicReference<Throwable> failure = new AtomicReference<>();
    private final AtomicInteger submitted = new AtomicInteger();
    private final Object lock = new Object();
    private int pending;

    public ThumbnailGenerator(ExportSettings settings) {
        this.jpegMaxDimension = settings.getJpegMaxDimension();
        this.pngMaxDimension = settings.getPngMaxDimension();
        this.quality = settings.getThumbnailQuality();
        this.queue = new LinkedBlockingQueue<>(settings.getThumbnailQueueCapacity());

        int workerCount = Math.max(1, settings.getThumbnailWorkers());
        this.workers = Executors.newFixedThreadPool(workerCount, workerThreads());
        for (int i = 0; i < workerCount; i++) {
            workers.execute(this::workLoop);
        }
    }

    /**
     * Largest thumbnail side for an image file name, or empty when the format
     * does not get thumbnails.
     */
    public Optional<Integer> maxDimensionFor(String fileName) {
        String extension = FileNames.extension(fileName).toLowerCase(Locale.ROOT);
        switch (extension) {
            case ".jpg":
            case ".jpeg":
                return Optional.of(jpegMaxDimension);
            case ".png":
                return Optional.of(pngMaxDimension);
            default:
                return Optional.empty();
        }
    }

    public static Path thumbnailPath(Path image, Path thumbnailDir) {
        return thumbnailDir.resolve(FileNames.stem(image.getFileName().toString()) + THUMBNAIL_EXTENSION);
    }

    /**
     * Decides whether {@code image} gets a thumbnail and queues the job if one is
     * still missing. Returns the thumbnail location when the image has or will
     * have a thumbnail.
     *
     * @param knownSize dimensions reported by the service, used when the image
     *                  header cannot be read
     */
    public Optional<Path> planThumbnail(Path image, Path thumbnailDir, ImageSize knownSize) {
        Optional<Integer> maxDimension = maxDimensionFor(image.getFileName().toString());
        if (maxDimension.isEmpty()) {
            return Optional.empty();
        }
        Path target = thumbnailPath(image, thumbnailDir);
        if (Files.exists(target)) {
            return Optional.of(target);
        }
        Optional<ImageSize> size = ImageSize.read(image).or(() -> Optional.ofNullable(knownSize));
        if (size.isEmpty()) {
            log.debug("Cannot read the size of {}, no thumbnail", image);
            return Optional.empty();
        }
        if (size.get().fitsWithin(maxDimension.get())) {
            return Optional.empty();
        }
        submit(new ThumbnailJob(image, target, maxDimension.get()));
        return Optional.of(target);
    }

    public void submit(ThumbnailJob job) {
        if (failure.get() != null) {
            return;
        }
        synchronized (lock) {
            pending++;
        }
        try {
            queue.put(job);
            submitted.incrementAndGet();
        } catch (InterruptedException e) {
            jobDone();
            Thread.currentThread().interrupt();
            throw new ThumbnailException("Interrupted while queueing thumbnail of " + job.getSource(), e);
        }
    }

    public int getSubmittedCount() {
        return submitted.get();
    }

    /**
     * Blocks until every queued job is done.
     *
     * @throws ThumbnailException carrying the first worker failure
     */
    public void awaitCompletion() throws InterruptedException {
        synchronized (lock) {
            while (pending > 0) {
                lock.wait();
            }
        }
        Throwable error = failure.get();
        if (error != null) {
            throw new ThumbnailException("Thumbnail generation failed: " + error.getMessage(), error);
        }
    }

    @Override
    public void close() {
        workers.shutdownNow();
        try {
            if (!workers.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Thumbnail workers did not stop in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void workLoop() {
        while (!Thread.currentThread().isInterrupted()) {
            ThumbnailJob job;
            try {
                job = queue.take();
            } catch (InterruptedException e) {
                return;
            }
            try {
                if (failure.get() == null) {
                    writeThumbnail(job);
                }
            } catch (Throwable e) {
                if (failure.compareAndSet(null, e)) {
                    log.error("Thumbnail of {} failed, dropping queued jobs", job.getSource(), e);
                    drainQueue();
                }
            } finally {
                jobDone();
            }
        }
    }

    private void drainQueue() {
        List<ThumbnailJob> dropped = new ArrayList<>();
        queue.drainTo(dropped);
        for (int i = 0; i < dropped.size(); i++) {
            jobDone();
        }
    }

    private void jobDone() {
        synchronized (lock) {
            pending--;
            if (pending == 0) {
                lock.notifyAll();
            }
        }
    }

    void writeThumbnail(ThumbnailJob job) throws IOException {
        BufferedImage source = ImageIO.read(job.getSource().toFile());
        if (source == null) {
            throw new IOException("Unsupported image format: " + job.getSource());
        }
        ImageSize size = new ImageSize(source.getWidth(), source.getHeight()).scaledToFit(job.getMaxDimension());
        BufferedImage thumbnail = toRgb(downscale(source, size), size);

        Path temp = AtomicFiles.createTempSibling(job.getTarget());
        try {
            writeJpeg(thumbnail, temp);
            AtomicFiles.commit(temp, job.getTarget());
        } finally {
            Files.deleteIfExists(temp);
        }
        log.debug("Wrote thumbnail {} ({}x{})", job.getTarget(), size.getWidth(), size.getHeight());
    }

    /** Halves the image while that stays above the target size, then scales the rest in one step. */
    private static BufferedImage downscale(BufferedImage source, ImageSize target) {
        BufferedImage current = source;
        int width = source.getWidth();
        int height = source.getHeight();
        while (width / 2 >= target.getWidth() && height / 2 >= target.getHeight()) {
            width /= 2;
            height /= 2;
            current = resize(current, width, height, BufferedImage.TYPE_INT_ARGB);
        }
        if (width != target.getWidth() || height != target.getHeight()) {
            current = resize(current, target.getWidth(), target.getHeight(), BufferedImage.TYPE_INT_ARGB);
        }
        return current;
    }

    private static BufferedImage resize(BufferedImage source, int width, int height, int type) {
        BufferedImage resized = new BufferedImage(width, height, type);
        Graphics2D g = resized.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g.drawImage(source, 0, 0, width, height, null);
        } finally {
            g.dispose();
        }
        return resized;
    }

    /** JPEG has no alpha channel: transparent areas end up white. */
    private static BufferedImage toRgb(BufferedImage image, ImageSize size) {
        BufferedImage rgb = new BufferedImage(size.getWidth(), size.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = rgb.createGraphics();
        try {
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, size.getWidth(), size.getHeight());
            g.drawImage(image, 0, 0, null);
        } finally {
            g.dispose();
        }
        return rgb;
    }

    private void writeJpeg(BufferedImage image, Path target) throws IOException {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpeg");
        if (!writers.hasNext()) {
            throw new IOException("No JPEG encoder available");
        }
        ImageWriter writer = writers.next();
        try (ImageOutputStream out = ImageIO.createImageOutputStream(target.toFile())) {
            ImageWriteParam param = writer.getDefaultWriteParam();
            param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            param.setCompressionQuality(quality);
            writer.setOutput(out);
            writer.write(null, new IIOImage(image, null, null), param);
        } finally {
            writer.dispose();
        }
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "thumbnail-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
