package pipeline;

import hw.BatteryMonitor;
import image.PixelBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import session.EditSession;
import session.PreviewTicket;
import stages.Filter;
import util.EditException;
import util.Timing;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Computes previews for one {@link EditSession} on a worker pool so a slider
 * can be dragged without waiting for each filter pass.
 * <p>
 * Requests are numbered by the session when submitted; whichever order the
 * workers finish in, only the newest result that still matches the session's
 * history is displayed.
 */
public class PreviewScheduler implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(PreviewScheduler.class);

    private final EditSession session;
    private final ThreadPoolExecutor exec;
    private final Thread scaler;
    private final int cores = Math.max(1, Runtime.getRuntime().availableProcessors());

    /** Pool sized from the power state and re-sized while running. */
    public PreviewScheduler(EditSession session) {
        this(session, 0);
    }

    /** @param threads fixed pool size, or 0 to follow the power policy */
    public PreviewScheduler(EditSession session, int threads) {
        this.session = session;
        boolean follow = threads <= 0;
        int initial = follow ? threadsFromPolicy(BatteryMonitor.onAC(), BatteryMonitor.levelOrGuess(), cores) : threads;

        AtomicInteger n = new AtomicInteger();
        this.exec = new ThreadPoolExecutor(
                initial, initial, 60, TimeUnit.SECONDS, new ArrayBlockingQueue<>(Math.max(2, cores)),
                r -> {
                    Thread t = new Thread(r, "preview-worker-" + n.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                },
                new ThreadPoolExecutor.CallerRunsPolicy());
        LOG.debug("Preview pool started with {} thread(s)", initial);

        this.scaler = follow ? startScaler() : null;
    }

    // ---- policy ----

    /** On AC or battery >= 80: up to 2x cores; >= 40: cores; else half. */
    static int threadsFromPolicy(boolean onAC, int battery, int cores) {
        if (onAC || battery >= 80)
            return Math.min(cores * 2, cores + 4);
        if (battery >= 40)
            return cores;
        return Math.max(1, cores / 2);
    }

    private Thread startScaler() {
        Thread t = new Thread(() -> {
            try {
                while (!Thread.currentThread().isInterrupted()) {
                    Thread.sleep(5000);
                    int target = threadsFromPolicy(BatteryMonitor.onAC(), BatteryMonitor.levelOrGuess(), cores);
                    resize(target);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "battery-scaler");
        t.setDaemon(true);
        t.start();
        return t;
    }

    private synchronized void resize(int target) {
        if (target == exec.getCorePoolSize())
            return;
        // core may never exceed max, so order the two calls by direction
        if (target > exec.getMaximumPoolSize()) {
            exec.setMaximumPoolSize(target);
            exec.setCorePoolSize(target);
        } else {
            exec.setCorePoolSize(target);
            exec.setMaximumPoolSize(target);
        }
        LOG.info("Scaler: target threads = {}", target);
    }

    // ---- submission ----

    /**
     * Queue a preview. The future completes with {@code true} if the result
     * reached the display, {@code false} if it was superseded.
     *
     * @throws EditException {@code NO_IMAGE} when the session is empty
     */
    public CompletableFuture<Boolean> submit(Filter filter, int intensity) throws EditException {
        PreviewTicket ticket = session.requestPreview(filter, intensity);
        return CompletableFuture.supplyAsync(() -> {
            Timing timing = new Timing(LOG);
            PixelBuffer result = session.computePreview(ticket);
            timing.stop("preview #" + ticket.sequence());
            return session.offerPreview(ticket, result);
        }, exec);
    }

    public int poolSize() {
        return exec.getCorePoolSize();
    }

    @Override
    public void close() {
        if (scaler != null)
            scaler.interrupt();
        exec.shutdown();
        try {
            if (!exec.awaitTermination(30, TimeUnit.SECONDS))
                exec.shutdownNow();
        } catch (InterruptedException e) {
            exec.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
