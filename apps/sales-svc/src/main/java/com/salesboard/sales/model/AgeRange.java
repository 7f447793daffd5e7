package com.salesboard.sales.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Inclusive age interval written as {@code start-end}.
 */
public record AgeRange(int start, int end) {

    public static final int BUCKET_WIDTH = 10;

    public AgeRange {
        if (start > end) {
            throw new IllegalArgumentException("start must not exceed end");
        }
    }

    /**
     * Parses a {@code start-end} token. Anything else (no separator, non-numeric bounds,
     * reversed bounds) yields empty rather than an error.
     */
    public static Optional<AgeRange> parse(String token) {
        if (token == null) {
            return Optional.empty();
        }
        String trimmed = token.trim();
        int separator = trimmed.indexOf('-');
        if (separator <= 0 || separator == trimmed.length() - 1) {
            return Optional.empty();
        }
        try {
            int start = Integer.parseInt(trimmed.substring(0, separator).trim());
            int end = Integer.parseInt(trimmed.substring(separator + 1).trim());
            if (start > end) {
                return Optional.empty();
            }
            return Optional.of(new AgeRange(start, end));
        } catch (NumberFormatException ex) {
            return Optional.empty();
        }
    }

    /**
     * Consecutive buckets of {@link #BUCKET_WIDTH} years starting at {@code minAge}. A bucket
     * is opened only while its start lies below {@code maxAge}, so the maximum itself may be
     * left uncovered and {@code minAge == maxAge} yields no bucket.
     */
    public static List<AgeRange> buckets(int minAge, int maxAge) {
        List<AgeRange> buckets = new ArrayList<>();
        // long arithmetic keeps the step from wrapping near Integer.MAX_VALUE
        for (long start = minAge; start < maxAge; start += BUCKET_WIDTH) {
            long end = Math.min(start + BUCKET_WIDTH - 1, Integer.MAX_VALUE);
            buckets.add(new AgeRange((int) start, (int) end));
        }
        return buckets;
    }

    public String token() {
        return start + "-" + end;
    }
}
