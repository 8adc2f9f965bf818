package com.github.trex_paxos.mcatrim;

import java.util.Arrays;
import java.util.stream.Collectors;

/// The named retention criteria. Each trims chunks whose inhabited time is at most a number of
/// game ticks (20 per second).
public enum TrimCriteria implements TrimPredicate {
    INHABITED_15S("inhabited_time<15s", 15 * 20),
    INHABITED_30S("inhabited_time<30s", 30 * 20),
    INHABITED_1M("inhabited_time<1m", 60 * 20),
    INHABITED_2M("inhabited_time<2m", 2 * 60 * 20),
    INHABITED_3M("inhabited_time<3m", 3 * 60 * 20),
    INHABITED_5M("inhabited_time<5m", 5 * 60 * 20),
    INHABITED_10M("inhabited_time<10m", 10 * 60 * 20);

    private final String label;
    private final long ticks;

    TrimCriteria(String label, long ticks) {
        this.label = label;
        this.ticks = ticks;
    }

    public String getLabel() {
        return label;
    }

    public long getTicks() {
        return ticks;
    }

    @Override
    public boolean shouldTrim(ChunkFields chunk) throws RegionFormatException {
        return Long.compareUnsigned(chunk.inhabitedTime(), ticks) <= 0;
    }

    /// Looks a criterion up by its label, e.g. `inhabited_time<5m`.
    public static TrimCriteria fromLabel(String label) {
        for (TrimCriteria c : values()) {
            if (c.label.equals(label)) return c;
        }
        throw new IllegalArgumentException(String.format("unknown criteria '%s', expected one of %s", label,
                Arrays.stream(values()).map(TrimCriteria::getLabel).collect(Collectors.joining(", "))));
    }

    @Override
    public String toString() {
        return label;
    }
}
