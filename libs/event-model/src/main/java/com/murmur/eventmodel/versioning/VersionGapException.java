package com.murmur.eventmodel.versioning;

/**
 * No upgrade or downgrade path exists between the version an event carries and the version a
 * consumer requires. Surfaced to operators; the event is never coerced.
 */
public class VersionGapException extends RuntimeException {

    private final String eventType;
    private final int fromVersion;
    private final int toVersion;
    private final int missingHopFrom;

    public VersionGapException(String eventType, int fromVersion, int toVersion, int missingHopFrom) {
        super("No version path for " + eventType + " from v" + fromVersion + " to v" + toVersion
                + ": missing hop v" + missingHopFrom + " -> v" + nextHop(missingHopFrom, fromVersion, toVersion));
        this.eventType = eventType;
        this.fromVersion = fromVersion;
        this.toVersion = toVersion;
        this.missingHopFrom = missingHopFrom;
    }

    private static int nextHop(int hopFrom, int fromVersion, int toVersion) {
        return toVersion > fromVersion ? hopFrom + 1 : hopFrom - 1;
    }

    public String eventType() {
        return eventType;
    }

    public int fromVersion() {
        return fromVersion;
    }

    public int toVersion() {
        return toVersion;
    }

    /** Source version of the first hop with no registered step. */
    public int missingHopFrom() {
        return missingHopFrom;
    }
}
