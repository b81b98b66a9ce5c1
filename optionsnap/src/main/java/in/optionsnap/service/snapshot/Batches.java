package in.optionsnap.service.snapshot;

import java.util.ArrayList;
import java.util.List;

public final class Batches {

    private Batches() {
    }

    /**
     * Split into contiguous batches of at most {@code size} elements, in order.
     * Only the last batch may be shorter.
     */
    public static <T> List<List<T>> partition(List<T> items, int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("batch size must be positive: " + size);
        }
        if (items == null || items.isEmpty()) {
            return List.of();
        }

        List<List<T>> batches = new ArrayList<>((items.size() + size - 1) / size);
        for (int from = 0; from < items.size(); from += size) {
            int to = Math.min(from + size, items.size());
            batches.add(List.copyOf(items.subList(from, to)));
        }
        return batches;
    }
}
