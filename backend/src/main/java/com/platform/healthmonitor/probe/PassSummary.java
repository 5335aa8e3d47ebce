package com.platform.healthmonitor.probe;

import java.time.Instant;

/**
 * Counters of one probe pass.
 *
 * @param listed       containers returned by the listing
 * @param probed       containers whose status was recorded
 * @param skipped      containers without health information, or gone mid-probe
 * @param failed       containers whose probe failed
 * @param transitions  recorded status changes
 * @param retriesArmed retries armed by this pass
 * @param disappeared  tracked containers missing from the listing
 * @param pending      probe tasks still running when the pass stopped waiting
 * @param aborted      true when the listing failed and nothing was probed
 */
public record PassSummary(
    String passId,
    Instant startedAt,
    long durationMs,
    int listed,
    int probed,
    int skipped,
    int failed,
    int transitions,
    int retriesArmed,
    int disappeared,
    int pending,
    boolean aborted
) {
    
    public static PassSummary aborted(String passId, Instant startedAt, long durationMs) {
        return new PassSummary(passId, startedAt, durationMs, 0, 0, 0, 0, 0, 0, 0, 0, true);
    }
    
    public String describe() {
        if (aborted) {
            return String.format("pass %s aborted after %dms", passId, durationMs);
        }
        return String.format(
            "pass %s: listed=%d probed=%d skipped=%d failed=%d transitions=%d retries=%d disappeared=%d pending=%d (%dms)",
            passId, listed, probed, skipped, failed, transitions, retriesArmed, disappeared, pending, durationMs);
    }
}
