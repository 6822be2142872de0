package com.arenabox.sandbox;

import com.arenabox.core.error.PortExhaustionException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

/**
 * Draws distinct ports from a fixed range, avoiding a snapshot of ports already bound.
 *
 * <p>Nothing is reserved: a concurrent allocation may pick the same port before the orchestrator binds
 * it, and that collision surfaces as a failed creation call.
 */
public class PortAllocator {

    private final int rangeMin;
    private final int rangeMax;
    private final int maxAttempts;
    private final Random random;

    public PortAllocator(int rangeMin, int rangeMax, int maxAttempts, Random random) {
        if (rangeMin < 1 || rangeMax > 65535 || rangeMin > rangeMax) {
            throw new IllegalArgumentException("Invalid port range " + rangeMin + "-" + rangeMax);
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be positive");
        }
        this.rangeMin = rangeMin;
        this.rangeMax = rangeMax;
        this.maxAttempts = maxAttempts;
        this.random = random;
    }

    /**
     * @param count number of ports needed
     * @param bound ports already in use
     * @return {@code count} distinct ports inside the range and outside {@code bound}
     * @throws PortExhaustionException if any single draw runs out of attempts
     */
    public List<Integer> allocate(int count, Set<Integer> bound) {
        if (count < 0) {
            throw new IllegalArgumentException("count must not be negative");
        }
        int rangeSize = rangeMax - rangeMin + 1;
        if (count > rangeSize) {
            throw new PortExhaustionException("Cannot allocate " + count + " ports from a range of " + rangeSize);
        }

        var chosen = new ArrayList<Integer>(count);
        var taken = new HashSet<Integer>(bound);
        for (int i = 0; i < count; i++) {
            int port = draw(taken);
            chosen.add(port);
            taken.add(port);
        }
        return chosen;
    }

    private int draw(Set<Integer> taken) {
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            int candidate = rangeMin + random.nextInt(rangeMax - rangeMin + 1);
            if (!taken.contains(candidate)) {
                return candidate;
            }
        }
        throw new PortExhaustionException("No free port found in " + rangeMin + "-" + rangeMax
                + " after " + maxAttempts + " attempts");
    }
}
