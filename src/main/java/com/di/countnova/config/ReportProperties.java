package com.di.countnova.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Settings of the single-query and fan-out reports served under {@code /predefined}.
 *
 * <pre>
 * countnova:
 *   reports:
 *     cab-type-frame: cab_type
 *     cab-type-top-n: 5
 *     passenger-count-frame: passenger_count
 *     max-passenger-count: 8
 *     amount-frame: total_amount_dollars
 *     amount-top-n: 1000
 * </pre>
 */
@Data
@Validated
@ConfigurationProperties(prefix = "countnova.reports")
public class ReportProperties {

    @NotBlank
    private String cabTypeFrame = "cab_type";

    @Min(1)
    private int cabTypeTopN = 5;

    @NotBlank
    private String passengerCountFrame = "passenger_count";

    /** Passenger counts 1..N get an average fare. */
    @Min(1)
    private int maxPassengerCount = 8;

    /** Frame whose row ids are whole-dollar fare amounts. */
    @NotBlank
    private String amountFrame = "total_amount_dollars";

    /** Distinct fare amounts considered per passenger count. */
    @Min(1)
    private int amountTopN = 1000;
}
