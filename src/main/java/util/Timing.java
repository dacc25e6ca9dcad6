package util;

import org.slf4j.Logger;

/** Stopwatch that reports lap times at DEBUG. */
public class Timing {
    private final Logger log;
    private long t0 = System.nanoTime();

    public Timing(Logger log) {
        this.log = log;
    }

    public double stop(String label) {
        long dt = System.nanoTime() - t0;
        double ms = dt / 1_000_000.0;
        if (log.isDebugEnabled())
            log.debug(String.format("%s: %.2f ms", label, ms));
        t0 = System.nanoTime();
        return ms;
    }
}
