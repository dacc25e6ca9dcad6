package hw;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import oshi.SystemInfo;
import oshi.hardware.PowerSource;

import java.util.List;

/**
 * Power state used to size the preview worker pool. Answers "on AC, full
 * battery" whenever the power sources cannot be read.
 * <p>
 * {@code -DforceOnAC=true|false} and {@code -DforceBatteryLevel=N} override
 * the probe.
 */
public final class BatteryMonitor {

    private static final Logger LOG = LoggerFactory.getLogger(BatteryMonitor.class);

    private BatteryMonitor() {
    }

    public static boolean onAC() {
        String override = System.getProperty("forceOnAC");
        if (override != null)
            return Boolean.parseBoolean(override);

        List<PowerSource> ps = powerSources();
        if (ps.isEmpty())
            return true; // desktop
        for (PowerSource p : ps) {
            if (p.isPowerOnLine())
                return true;
        }
        return false;
    }

    /** Average remaining capacity in percent, 100 when unknown. */
    public static int levelOrGuess() {
        String lvl = System.getProperty("forceBatteryLevel");
        if (lvl != null) {
            try {
                int v = Integer.parseInt(lvl.trim());
                return Math.max(0, Math.min(100, v));
            } catch (NumberFormatException e) {
                LOG.warn("Ignoring forceBatteryLevel={}: not a number", lvl);
            }
        }

        double sum = 0;
        int n = 0;
        for (PowerSource p : powerSources()) {
            double pct = p.getRemainingCapacityPercent();
            if (!Double.isNaN(pct)) {
                sum += pct;
                n++;
            }
        }
        if (n == 0)
            return 100;
        return (int) Math.round((sum / n) * 100.0);
    }

    private static List<PowerSource> powerSources() {
        try {
            return Holder.SI.getHardware().getPowerSources();
        } catch (Throwable t) {
            LOG.warn("Power sources unavailable, assuming AC: {}", t.toString());
            return List.of();
        }
    }

    // created on first probe so a missing native layer only costs a warning
    private static final class Holder {
        static final SystemInfo SI = new SystemInfo();
    }
}
