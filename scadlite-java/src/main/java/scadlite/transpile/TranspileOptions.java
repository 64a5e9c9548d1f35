package scadlite.transpile;

/**
 * Settings for one transpile call.
 *
 * @param defaultFn   segment count used until the source assigns {@code $fn}
 * @param minSegments lower clamp for every emitted segment count
 * @param maxSegments upper clamp for every emitted segment count
 */
public record TranspileOptions(
        int defaultFn,
        int minSegments,
        int maxSegments
) {
    public static final int DEFAULT_FN = 32;
    public static final int MIN_SEGMENTS = 16;
    public static final int MAX_SEGMENTS = 128;

    public TranspileOptions {
        if (defaultFn <= 0) {
            throw new IllegalArgumentException("defaultFn must be positive: " + defaultFn);
        }
        if (minSegments < 3 || maxSegments < minSegments) {
            throw new IllegalArgumentException("Invalid segment range [" + minSegments + ", " + maxSegments + "]");
        }
    }

    public TranspileOptions() {
        this(DEFAULT_FN, MIN_SEGMENTS, MAX_SEGMENTS);
    }

    public TranspileOptions withDefaultFn(int fn) {
        return new TranspileOptions(fn, minSegments, maxSegments);
    }

    int clamp(double fn) {
        return (int) Math.max(minSegments, Math.min(maxSegments, Math.round(fn)));
    }
}
