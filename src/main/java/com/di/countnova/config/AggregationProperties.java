package com.di.countnova.config;

import com.di.countnova.aggregation.AggregationRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Defaults for the grouped-count pipeline and the dimension ranges of the predefined reports.
 *
 * <pre>
 * countnova:
 *   aggregation:
 *     pool-size: 32
 *     threshold-fraction: 0.95
 *     queue-capacity: 256
 *     warm-baseline-on-startup: false
 *     baseline-dimension: { name: cab_type, from: 0, to: 2 }
 *     sort-dimension: pickup_year
 *     year: { name: pickup_year, from: 2009, to: 2016 }
 *     passenger-count: { name: passenger_count, from: 1, to: 7 }
 *     distance: { name: dist_miles, from: 0, to: 50 }
 * </pre>
 */
@Data
@Validated
@ConfigurationProperties(prefix = "countnova.aggregation")
public class AggregationProperties {

    // ------------------------------------------------------------------ //
    // Pipeline                                                            //
    // ------------------------------------------------------------------ //

    /** Number of concurrent workers, i.e. maximum outstanding queries. */
    @Min(1)
    @Max(AggregationRequest.MAX_POOL_SIZE)
    private int poolSize = 32;

    /** Coverage of the baseline at which collection stops. 1.0 = never stop early. */
    @DecimalMin(value = "0.0", inclusive = false)
    @DecimalMax("1.0")
    private double thresholdFraction = 0.95;

    /** Capacity of the intake and result queues. */
    @Min(1)
    @Max(AggregationRequest.MAX_QUEUE_CAPACITY)
    private int queueCapacity = 256;

    /** Compute the baseline once the application is ready instead of on the first request. */
    private boolean warmBaselineOnStartup = false;

    // ------------------------------------------------------------------ //
    // Dimensions                                                          //
    // ------------------------------------------------------------------ //

    /** Low-cardinality dimension whose counts sum to the dataset size. */
    @Valid
    @NotNull
    private DimensionRange baselineDimension = new DimensionRange("cab_type", 0, 2);

    /** Primary ordering of report rows. */
    @NotBlank
    private String sortDimension = "pickup_year";

    @Valid
    @NotNull
    private DimensionRange year = new DimensionRange("pickup_year", 2009, 2016);

    @Valid
    @NotNull
    private DimensionRange passengerCount = new DimensionRange("passenger_count", 1, 7);

    @Valid
    @NotNull
    private DimensionRange distance = new DimensionRange("dist_miles", 0, 50);
}
