package org.texpreview.preview;

import com.typesafe.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.texpreview.compiler.api.CompileResult;
import org.texpreview.compiler.api.ICompiler;
import org.texpreview.project.ProjectSnapshot;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Debounces compile requests of a continuously edited project.
 * <p>
 * A request schedules a pass after the quiet interval; a further request inside the interval
 * cancels the pending pass and restarts the interval. Passes run on one dedicated thread, so at
 * most one is in flight. Each pass takes a fresh snapshot when it starts and publishes its result
 * only after it has completed.
 *
 * <h3>Configuration Structure:</h3>
 * <pre>
 * texpreview.preview {
 *   quiet-interval = 600ms
 * }
 * </pre>
 */
public class PreviewScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PreviewScheduler.class);

    /** Configuration path of the preview section. */
    public static final String CONFIG_PATH = "texpreview.preview";

    /**
     * Supplies the project state at the start of a pass.
     */
    @FunctionalInterface
    public interface SnapshotSource {
        /**
         * @return A snapshot of the project as it is now.
         * @throws IOException if the project cannot be read.
         */
        ProjectSnapshot take() throws IOException;
    }

    private final ICompiler compiler;
    private final SnapshotSource source;
    private final String entryFileName;
    private final Duration quietInterval;
    private final ScheduledExecutorService executor;
    private final List<Consumer<CompileResult>> listeners = new CopyOnWriteArrayList<>();
    private final AtomicReference<CompileResult> latest = new AtomicReference<>();
    private final AtomicLong completedPasses = new AtomicLong();

    private ScheduledFuture<?> pending;
    private volatile boolean closed = false;

    /**
     * Creates a scheduler.
     * @param compiler The compiler used for every pass.
     * @param source Supplies a fresh snapshot per pass.
     * @param entryFileName The requested entry file, or {@code null} for the default.
     * @param quietInterval The time without requests before a pass starts.
     */
    public PreviewScheduler(ICompiler compiler, SnapshotSource source, String entryFileName, Duration quietInterval) {
        this.compiler = compiler;
        this.source = source;
        this.entryFileName = entryFileName;
        this.quietInterval = quietInterval;
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "preview-compiler");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Creates a scheduler with the quiet interval of the {@code texpreview.preview} section.
     * @param config The application configuration.
     * @param compiler The compiler used for every pass.
     * @param source Supplies a fresh snapshot per pass.
     * @param entryFileName The requested entry file, or {@code null} for the default.
     * @return The scheduler.
     */
    public static PreviewScheduler fromConfig(Config config, ICompiler compiler, SnapshotSource source, String entryFileName) {
        Duration interval = config.getConfig(CONFIG_PATH).getDuration("quiet-interval");
        return new PreviewScheduler(compiler, source, entryFileName, interval);
    }

    /**
     * Requests a compile pass after the quiet interval, replacing any pass that has not started yet.
     * @throws IllegalStateException if the scheduler is closed.
     */
    public synchronized void requestCompile() {
        if (closed) {
            throw new IllegalStateException("PreviewScheduler is closed");
        }
        if (pending != null && pending.cancel(false)) {
            log.debug("Pending preview pass superseded");
        }
        pending = executor.schedule(this::runPass, quietInterval.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Registers a listener called on the scheduler thread after every completed pass.
     * @param listener The listener.
     */
    public void addListener(Consumer<CompileResult> listener) {
        listeners.add(listener);
    }

    /**
     * @return The result of the most recent completed pass, or empty before the first one.
     */
    public Optional<CompileResult> latestResult() {
        return Optional.ofNullable(latest.get());
    }

    /**
     * @return The number of passes completed so far.
     */
    public long completedPasses() {
        return completedPasses.get();
    }

    private void runPass() {
        ProjectSnapshot snapshot;
        try {
            snapshot = source.take();
        } catch (IOException e) {
            log.warn("Skipping preview pass, project could not be read: {}", e.getMessage());
            return;
        }
        try {
            long start = System.nanoTime();
            CompileResult result = compiler.compile(entryFileName, snapshot.fileResolver(), snapshot.assetResolver());
            latest.set(result);
            long count = completedPasses.incrementAndGet();
            log.debug("Preview pass {} finished in {} ms", count, (System.nanoTime() - start) / 1_000_000);
            for (Consumer<CompileResult> listener : listeners) {
                try {
                    listener.accept(result);
                } catch (RuntimeException e) {
                    log.warn("Preview listener failed: {}", e.getMessage(), e);
                }
            }
        } catch (RuntimeException e) {
            log.error("Preview pass failed", e);
        }
    }

    /**
     * Cancels any pending pass and stops the scheduler thread, waiting briefly for a running pass.
     */
    @Override
    public void close() {
        synchronized (this) {
            if (closed) return;
            closed = true;
            if (pending != null) {
                pending.cancel(false);
            }
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
