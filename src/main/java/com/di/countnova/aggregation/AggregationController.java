package com.di.countnova.aggregation;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * REST API for ad-hoc grouped counts and the cached baseline.
 */
@RestController
@RequestMapping("/api/aggregation")
@RequiredArgsConstructor
public class AggregationController {

    private final AggregationService aggregationService;

    /**
     * Runs a grouped count over the given dimension ranges.
     *
     * @param body dimensions (outermost first) and optional overrides of pool size, threshold and sort dimension
     * @return the sorted report
     */
    @PostMapping(value = "/count",
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<AggregationReport> count(@Valid @RequestBody AggregationRunRequest body) {
        AggregationRequest.AggregationRequestBuilder request = aggregationService.defaults()
                .description(body.getDescription() != null ? body.getDescription() : "ad-hoc grouped count");
        body.getDimensions().forEach(range -> request.dimension(range.toDimension()));
        if (body.getPoolSize() != null) {
            request.poolSize(body.getPoolSize());
        }
        if (body.getThresholdFraction() != null) {
            request.thresholdFraction(body.getThresholdFraction());
        }
        if (body.getSortDimension() != null) {
            request.sortDimension(body.getSortDimension());
        } else {
            request.sortDimension(body.getDimensions().get(0).getName());
        }
        return ResponseEntity.ok(aggregationService.aggregate(request.build()));
    }

    @GetMapping(value = "/baseline", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Long>> baseline() {
        return ResponseEntity.ok(Map.of("baseline", aggregationService.currentBaseline()));
    }

    /** Drops the cached baseline; the next run recomputes it. */
    @DeleteMapping("/baseline")
    public ResponseEntity<Void> resetBaseline() {
        aggregationService.resetBaseline();
        return ResponseEntity.noContent().build();
    }
}
