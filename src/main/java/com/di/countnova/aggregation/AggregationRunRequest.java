package com.di.countnova.aggregation;

import com.di.countnova.config.DimensionRange;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request body of {@code POST /api/aggregation/count}. Omitted fields fall back to
 * {@code countnova.aggregation.*}.
 */
@Data
@NoArgsConstructor
public class AggregationRunRequest {

    private String description;

    @Valid
    @NotEmpty
    @Size(max = 8)
    private List<DimensionRange> dimensions;

    @Positive
    @Max(AggregationRequest.MAX_POOL_SIZE)
    private Integer poolSize;

    @DecimalMin(value = "0.0", inclusive = false)
    @DecimalMax("1.0")
    private Double thresholdFraction;

    private String sortDimension;
}
