package com.di.countnova.report;

import com.di.countnova.aggregation.AggregationReport;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Predefined taxi-ride reports. See {@link RideReportService} for what each one computes.
 */
@RestController
@RequestMapping("/predefined")
@RequiredArgsConstructor
public class RideReportController {

    private final RideReportService rideReportService;

    @GetMapping(value = "/1", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<CabTypeReport> cabTypeCounts() {
        return ResponseEntity.ok(rideReportService.cabTypeCounts());
    }

    @GetMapping(value = "/2", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<FareReport> averageFarePerPassengerCount() {
        return ResponseEntity.ok(rideReportService.averageFarePerPassengerCount());
    }

    @GetMapping(value = "/3", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<AggregationReport> yearPassengerCounts() {
        return ResponseEntity.ok(rideReportService.yearPassengerCounts());
    }

    @GetMapping(value = "/4", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<AggregationReport> yearPassengerDistanceCounts() {
        return ResponseEntity.ok(rideReportService.yearPassengerDistanceCounts());
    }
}
