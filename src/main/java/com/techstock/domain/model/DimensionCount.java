package com.techstock.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Row of a {@code GROUP BY dimension, COUNT(*)} aggregate.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DimensionCount {

    private String label;
    private long count;

    /**
     * Sums rows that share a label, e.g. a null group relabelled "Unknown"
     * next to a stored "Unknown" value. The result is ordered by count
     * descending; equal counts keep their incoming order.
     */
    public static List<DimensionCount> mergeByLabel(List<DimensionCount> counts) {
        Map<String, Long> merged = new LinkedHashMap<>();
        for (DimensionCount count : counts) {
            merged.merge(count.getLabel(), count.getCount(), Long::sum);
        }
        if (merged.size() == counts.size()) {
            return counts;
        }

        List<DimensionCount> result = new ArrayList<>(merged.size());
        merged.forEach((label, count) -> result.add(new DimensionCount(label, count)));
        result.sort(Comparator.comparingLong(DimensionCount::getCount).reversed());
        return result;
    }
}
