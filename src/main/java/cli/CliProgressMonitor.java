package cli;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.MemoryUsage;

/**
 * Progress logger for the per-state table loop.
 */
public final class CliProgressMonitor {

    private CliProgressMonitor() {
    }

    public static void logProgress(String state, int done, int total, int built, int empty, int skipped,
                                   long loopStartNs, String lastTable) {
        long elapsed = (System.nanoTime() - loopStartNs) / 1_000_000L;
        int pct = total == 0 ? 100 : (int) Math.round(100.0 * done / total);

        MemoryMXBean mem = ManagementFactory.getMemoryMXBean();
        MemoryUsage heap = mem.getHeapMemoryUsage();
        long usedMb = heap.getUsed() / (1024 * 1024);
        long maxMb = heap.getMax() / (1024 * 1024);

        System.out.printf("[PROGRESS] %s %d/%d (%d%%) built=%d empty=%d skip=%d elapsed=%dms heap=%d/%dMB last=%s%n",
                state, done, total, pct, built, empty, skipped, elapsed, usedMb, maxMb, lastTable);
    }
}
