package com.largomodo.platelayout.service;

import com.largomodo.platelayout.core.domain.FailureKind;
import com.largomodo.platelayout.core.domain.ImageBatch;
import com.largomodo.platelayout.core.domain.ImageFailure;
import com.largomodo.platelayout.core.domain.ImageItem;
import com.largomodo.platelayout.core.domain.Size;
import com.largomodo.platelayout.util.FileNameUtil;
import com.largomodo.platelayout.util.ImageFileMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.FutureTask;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

/**
 * Reads the dimensions of a folder of photographs in parallel.
 * <p>
 * Strategy: pool sized to CPU cores. The queue is bounded by the number of files in the
 * request, so every decode runs on a worker and can be timed out; the caller thread only
 * waits. Each decode gets its own deadline, counted from the moment a worker starts it. A
 * decode that misses it is cancelled and recorded as a load failure, and the pool grows by one
 * worker since a decoder blocked in native or uninterruptible I/O keeps its thread. The call
 * returns once every file has either decoded or failed, which is the barrier sorting and
 * placement need.
 * <p>
 * Workers are daemon threads so a decoder that ignores interruption cannot keep the JVM alive.
 */
public class ImageLoader {

    private static final Logger log = LoggerFactory.getLogger(ImageLoader.class);

    public static final long DEFAULT_TIMEOUT_MS = 30_000;

    private final ImageDecoder decoder;
    private final long timeoutMs;
    private final int threads;

    public ImageLoader(ImageDecoder decoder) {
        this(decoder, DEFAULT_TIMEOUT_MS, Runtime.getRuntime().availableProcessors());
    }

    public ImageLoader(ImageDecoder decoder, long timeoutMs, int threads) {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("Timeout must be positive: " + timeoutMs);
        }
        if (threads < 1) {
            throw new IllegalArgumentException("Thread count must be at least 1: " + threads);
        }
        this.decoder = decoder;
        this.timeoutMs = timeoutMs;
        this.threads = threads;
    }

    /**
     * Loads every image file directly inside {@code folder}, in file name order.
     *
     * @param metadata file name to metadata fields, may be empty
     * @throws IOException if the folder cannot be listed
     */
    public ImageBatch loadFolder(Path folder, Map<String, Map<String, String>> metadata) throws IOException {
        if (!Files.isDirectory(folder)) {
            throw new IOException("Input folder does not exist: " + folder);
        }
        List<Path> files;
        try (Stream<Path> stream = Files.list(folder)) {
            files = stream.filter(ImageFileMatcher::isImage)
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .toList();
        }
        log.info("Found {} images in {}", files.size(), folder);
        return load(files, metadata);
    }

    public ImageBatch load(List<Path> files, Map<String, Map<String, String>> metadata) throws IOException {
        if (files.isEmpty()) {
            return new ImageBatch(List.of(), List.of());
        }

        int poolSize = Math.min(threads, files.size());
        ThreadPoolExecutor executor = new ThreadPoolExecutor(
                poolSize,
                poolSize,
                0L,
                TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(files.size()),
                daemonThreads("image-loader-")
        );
        ScheduledExecutorService watchdog = Executors.newSingleThreadScheduledExecutor(daemonThreads("image-watchdog-"));

        List<ImageItem> images = new ArrayList<>(files.size());
        List<ImageFailure> failures = new ArrayList<>();
        try {
            List<Decode> decodes = new ArrayList<>(files.size());
            for (Path file : files) {
                Decode decode = new Decode(file, executor, watchdog);
                decodes.add(decode);
                executor.execute(decode.task);
            }

            for (Decode decode : decodes) {
                String name = decode.file.getFileName().toString();
                try {
                    Size size = decode.task.get();
                    images.add(new ImageItem(name, name, decode.file, size.width(), size.height(),
                            metadataFor(name, metadata)));
                    log.debug("Loaded {} ({}x{})", name, size.width(), size.height());
                } catch (CancellationException e) {
                    failures.add(loadFailure(name, "Decoding timed out after " + timeoutMs + " ms"));
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    failures.add(loadFailure(name, cause.getMessage()));
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while loading images", e);
        } finally {
            // Every task is resolved or cancelled here, nothing left worth waiting for
            watchdog.shutdownNow();
            executor.shutdownNow();
        }

        log.info("Loaded {} images, {} failed", images.size(), failures.size());
        return new ImageBatch(images, failures);
    }

    /**
     * One decode. Its deadline starts when a worker picks it up, so time spent queued behind a
     * slow file does not count against it.
     */
    private final class Decode implements Callable<Size> {

        private final Path file;
        private final ThreadPoolExecutor executor;
        private final ScheduledExecutorService watchdog;
        private final FutureTask<Size> task;

        Decode(Path file, ThreadPoolExecutor executor, ScheduledExecutorService watchdog) {
            this.file = file;
            this.executor = executor;
            this.watchdog = watchdog;
            this.task = new FutureTask<>(this);
        }

        @Override
        public Size call() throws Exception {
            ScheduledFuture<?> deadline = watchdog.schedule(this::expire, timeoutMs, TimeUnit.MILLISECONDS);
            MDC.put("image", file.getFileName().toString());
            try {
                log.debug("Probing {}", file);
                return decoder.probe(file);
            } finally {
                MDC.remove("image");
                deadline.cancel(false);
            }
        }

        private void expire() {
            if (task.cancel(true)) {
                // The worker may ignore the interrupt and stay busy, so the queue gets a fresh one
                synchronized (executor) {
                    int size = executor.getCorePoolSize() + 1;
                    executor.setMaximumPoolSize(size);
                    executor.setCorePoolSize(size);
                }
                log.debug("Decode of {} exceeded {} ms, pool grown to {} workers",
                        file.getFileName(), timeoutMs, executor.getCorePoolSize());
            }
        }
    }

    private static Map<String, String> metadataFor(String fileName, Map<String, Map<String, String>> metadata) {
        Map<String, String> fields = metadata.get(fileName);
        if (fields == null) {
            fields = metadata.get(FileNameUtil.stripExtension(fileName));
        }
        return fields == null ? Map.of() : fields;
    }

    private static ImageFailure loadFailure(String name, String reason) {
        log.warn("Skipping {}: {}", name, reason);
        return new ImageFailure(name, FailureKind.IMAGE_LOAD_FAILURE, reason);
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
