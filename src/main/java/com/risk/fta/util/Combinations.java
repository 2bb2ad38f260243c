package com.risk.fta.util;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Lazy sequence of all k-element subsets of {@code {0, ..., n-1}} in
 * lexicographic order.
 *
 * Combinations are produced one at a time, so callers working under a budget
 * can stop early without the full {@code C(n, k)} space ever being
 * materialized. The sequence is restartable: every call to
 * {@link #iterator()} starts from the first combination.
 *
 * Each returned array is a fresh copy owned by the caller.
 */
public final class Combinations implements Iterable<int[]> {
    private final int n;
    private final int k;

    /**
     * @param n Size of the index range to choose from.
     * @param k Number of indices per combination, {@code 0 < k <= n}.
     */
    public Combinations(int n, int k) {
        if (k <= 0)
            throw new IllegalArgumentException("The choice must be positive: " + k);
        if (k > n)
            throw new IllegalArgumentException("The choice " + k + " cannot exceed " + n);
        this.n = n;
        this.k = k;
    }

    /** Returns {@code C(n, k)}, saturating at {@link Long#MAX_VALUE}. */
    public long count() {
        long result = 1;
        int r = Math.min(k, n - k);
        for (int i = 1; i <= r; i++) {
            long next = result * (n - r + i);
            if (next / (n - r + i) != result)
                return Long.MAX_VALUE;
            result = next / i;
        }
        return result;
    }

    @Override
    public Iterator<int[]> iterator() {
        return new Iterator<>() {
            private final int[] current = initial();
            private boolean hasNext = true;

            @Override
            public boolean hasNext() {
                return hasNext;
            }

            @Override
            public int[] next() {
                if (!hasNext)
                    throw new NoSuchElementException();
                int[] result = current.clone();
                advance();
                return result;
            }

            // Moves to the next combination in lexicographic order.
            private void advance() {
                int i = k - 1;
                while (i >= 0 && current[i] == n - k + i)
                    i--;
                if (i < 0) {
                    hasNext = false;
                    return;
                }
                current[i]++;
                for (int j = i + 1; j < k; j++)
                    current[j] = current[j - 1] + 1;
            }
        };
    }

    private int[] initial() {
        int[] first = new int[k];
        for (int i = 0; i < k; i++)
            first[i] = i;
        return first;
    }
}
