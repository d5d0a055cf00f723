package com.vigil.normalization;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Function;

/**
 * Puts a sample batch into strictly increasing timestamp order.
 * On duplicate timestamps the sample that came last in the batch is kept.
 */
final class TimeOrdering {
    
    private TimeOrdering() {
    }
    
    static <T> List<T> strictlyIncreasing(List<T> samples, Function<T, Instant> timestamp) {
        List<T> sorted = new ArrayList<>(samples);
        sorted.sort(Comparator.comparing(timestamp));
        
        List<T> result = new ArrayList<>(sorted.size());
        for (T sample : sorted) {
            int last = result.size() - 1;
            if (last >= 0 && timestamp.apply(result.get(last)).equals(timestamp.apply(sample))) {
                result.set(last, sample);
            } else {
                result.add(sample);
            }
        }
        return List.copyOf(result);
    }
}
