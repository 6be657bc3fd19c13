package com.di.countnova.config;

import com.di.countnova.store.IndexStore;
import com.di.countnova.store.IndexStoreAddress;
import com.di.countnova.store.PilosaIndexStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;

/**
 * Wires the {@link IndexStore} used by the aggregation pipeline.
 * <p>
 * The per-query deadline is applied as the read timeout of every request, so a stuck remote call
 * surfaces as {@link com.di.countnova.store.QueryTimeoutException} rather than blocking a worker.
 */
@Slf4j
@Configuration
public class IndexStoreConfig {

    @Bean
    public IndexStore indexStore(IndexStoreProperties properties,
                                 RestClient.Builder restClientBuilder,
                                 ObjectMapper objectMapper) {
        IndexStoreAddress address = IndexStoreAddress.parse(properties.getAddress());

        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(properties.getConnectTimeout())
                .build();
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(properties.getQueryTimeout());

        RestClient restClient = restClientBuilder
                .requestFactory(requestFactory)
                .build();

        log.info("[INDEX-STORE] Using {} index={} connectTimeout={} queryTimeout={}",
                address.normalize(), properties.getIndex(),
                properties.getConnectTimeout(), properties.getQueryTimeout());
        return new PilosaIndexStore(restClient, objectMapper, address, properties.getIndex());
    }
}
