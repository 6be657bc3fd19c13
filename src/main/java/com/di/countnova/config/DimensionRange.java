package com.di.countnova.config;

import com.di.countnova.aggregation.Dimension;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * YAML binding for an inclusive integer dimension range, e.g.
 * <pre>
 *   year:
 *     name: pickup_year
 *     from: 2009
 *     to: 2016
 * </pre>
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DimensionRange {

    /** Frame (field) name in the index. */
    @NotBlank
    private String name;

    @Min(0)
    private long from;

    @Min(0)
    private long to;

    @AssertTrue(message = "dimension range 'from' must not exceed 'to'")
    public boolean isOrdered() {
        return from <= to;
    }

    @AssertTrue(message = "dimension range is wider than " + Dimension.MAX_VALUES + " values")
    public boolean isWithinLimit() {
        return from > to || to - from < Dimension.MAX_VALUES;
    }

    public Dimension toDimension() {
        return Dimension.range(name, from, to);
    }
}
