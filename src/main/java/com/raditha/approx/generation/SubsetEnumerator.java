package com.raditha.approx.generation;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Lazily enumerates subsets of the modifiable lines: by size ascending, then
 * lexicographically within a size. {@code [3, 7]} under {@link GenerationStrategy#ALL}
 * gives {@code [3], [7], [3, 7]}.
 */
public class SubsetEnumerator implements Iterator<List<Integer>> {

    private final List<Integer> elements;
    private final int maxSize;
    private int size;
    private int[] indices;
    private boolean exhausted;

    public SubsetEnumerator(List<Integer> elements, GenerationStrategy strategy) {
        this.elements = List.copyOf(elements);
        this.maxSize = strategy == GenerationStrategy.ONE_HOT ? Math.min(1, elements.size()) : elements.size();
        this.size = 1;
        this.exhausted = this.elements.isEmpty() || maxSize == 0;
        if (!exhausted) {
            indices = firstCombination(size);
        }
    }

    /**
     * Number of subsets this strategy visits for {@code n} modifiable lines,
     * saturating at {@link Long#MAX_VALUE}.
     */
    public static long candidateCount(int n, GenerationStrategy strategy) {
        if (strategy == GenerationStrategy.ONE_HOT) {
            return n;
        }
        if (n >= 63) {
            return Long.MAX_VALUE;
        }
        return (1L << n) - 1;
    }

    public static List<List<Integer>> enumerate(List<Integer> elements, GenerationStrategy strategy) {
        List<List<Integer>> subsets = new ArrayList<>();
        new SubsetEnumerator(elements, strategy).forEachRemaining(subsets::add);
        return subsets;
    }

    @Override
    public boolean hasNext() {
        return !exhausted;
    }

    @Override
    public List<Integer> next() {
        if (exhausted) {
            throw new NoSuchElementException();
        }
        List<Integer> subset = new ArrayList<>(size);
        for (int index : indices) {
            subset.add(elements.get(index));
        }
        advance();
        return List.copyOf(subset);
    }

    private void advance() {
        int n = elements.size();
        int i = size - 1;
        while (i >= 0 && indices[i] == n - size + i) {
            i--;
        }
        if (i >= 0) {
            indices[i]++;
            for (int j = i + 1; j < size; j++) {
                indices[j] = indices[j - 1] + 1;
            }
            return;
        }
        size++;
        if (size > maxSize) {
            exhausted = true;
        } else {
            indices = firstCombination(size);
        }
    }

    private static int[] firstCombination(int size) {
        int[] first = new int[size];
        for (int i = 0; i < size; i++) {
            first[i] = i;
        }
        return first;
    }
}
