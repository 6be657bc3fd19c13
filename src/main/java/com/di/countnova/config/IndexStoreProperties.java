package com.di.countnova.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Connection settings for the remote index store.
 *
 * <pre>
 * countnova:
 *   index-store:
 *     address: localhost:10101
 *     index: taxi
 *     connect-timeout: 5s
 *     query-timeout: 30s
 * </pre>
 */
@Data
@Validated
@ConfigurationProperties(prefix = "countnova.index-store")
public class IndexStoreProperties {

    /** {@code host:port} or {@code scheme://host:port}; see {@link com.di.countnova.store.IndexStoreAddress}. */
    @NotBlank
    private String address = "localhost:10101";

    @NotBlank
    private String index = "taxi";

    @NotNull
    private Duration connectTimeout = Duration.ofSeconds(5);

    /** Deadline for a single query. A query exceeding it is dropped by the worker pool. */
    @NotNull
    private Duration queryTimeout = Duration.ofSeconds(30);
}
