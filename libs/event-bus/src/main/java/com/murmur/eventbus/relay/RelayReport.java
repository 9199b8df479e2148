package com.murmur.eventbus.relay;

/**
 * Result of one relay pass.
 *
 * @param deferred events held back because an earlier event of the same aggregate stayed pending
 */
public record RelayReport(int scanned, int completed, int stillPending, int deferred, boolean skipped) {

    static RelayReport skippedPass() {
        return new RelayReport(0, 0, 0, 0, true);
    }
}
