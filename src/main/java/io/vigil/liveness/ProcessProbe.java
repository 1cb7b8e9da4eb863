package io.vigil.liveness;

/**
 * Best-effort view of worker OS processes. Implementations must not block beyond their own grace
 * period; the reaper terminates an instance whatever the probe reports.
 */
public interface ProcessProbe {
    boolean isAlive(long pid);

    /**
     * Asks the process to stop, escalating after {@code graceMs}. Returns true if it is gone afterwards.
     */
    boolean terminate(long pid, long graceMs);
}
