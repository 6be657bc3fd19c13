package com.di.countnova.aggregation;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Orders collected rows for the report: ascending by the primary dimension's value, then
 * ascending by count. The sort is stable, so rows equal on both keep their arrival order.
 */
public final class ReportSorter {

    private ReportSorter() {
    }

    /**
     * @param rows             rows in arrival order; not modified
     * @param primaryDimension dimension every row's key must contain
     * @return a new, sorted list
     */
    public static List<ResultRow> sort(List<ResultRow> rows, String primaryDimension) {
        List<ResultRow> sorted = new ArrayList<>(rows);
        // List.sort is a stable merge sort
        sorted.sort(Comparator
                .comparingLong((ResultRow r) -> r.getKey().valueOf(primaryDimension))
                .thenComparingLong(ResultRow::getCount));
        return sorted;
    }
}
