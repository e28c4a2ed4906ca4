package com.anthem.apigw.debug.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.sts.StsClient;
import software.amazon.awssdk.services.sts.StsClientBuilder;

import java.net.URI;
import java.time.Duration;

/**
 * Builds STS clients. {@link #shared()} is created once per process and reused by every
 * invocation; the SDK client is thread-safe.
 */
public final class StsClients {

    private static final Logger log = LoggerFactory.getLogger(StsClients.class);

    static final String REGION_VARIABLE = "AWS_REGION";
    static final String ENDPOINT_VARIABLE = "STS_ENDPOINT";
    static final String TIMEOUT_VARIABLE = "STS_CALL_TIMEOUT_MS";

    static final String DEFAULT_REGION = "us-east-1";
    static final long DEFAULT_TIMEOUT_MS = 5000;

    private StsClients() {
    }

    public static StsClient shared() {
        return Holder.INSTANCE;
    }

    public static StsClient create(String region, String endpoint, long callTimeoutMs) {
        StsClientBuilder builder = StsClient.builder()
                .region(Region.of(region))
                .overrideConfiguration(ClientOverrideConfiguration.builder()
                        .apiCallTimeout(Duration.ofMillis(callTimeoutMs))
                        .build());
        if (endpoint != null && !endpoint.isBlank()) {
            builder.endpointOverride(URI.create(endpoint));
        }
        return builder.build();
    }

    private static final class Holder {
        private static final StsClient INSTANCE = create(
                System.getenv().getOrDefault(REGION_VARIABLE, DEFAULT_REGION),
                System.getenv(ENDPOINT_VARIABLE),
                callTimeoutMs(System.getenv(TIMEOUT_VARIABLE)));
    }

    /**
     * Parses the STS call timeout, falling back to the default when unset or not a positive number.
     */
    static long callTimeoutMs(String value) {
        if (value == null || value.isBlank()) {
            return DEFAULT_TIMEOUT_MS;
        }
        try {
            long timeoutMs = Long.parseLong(value.trim());
            if (timeoutMs > 0) {
                return timeoutMs;
            }
        } catch (NumberFormatException e) {
            log.debug("Unparseable {}: {}", TIMEOUT_VARIABLE, e.getMessage());
        }
        log.warn("Invalid {}={}, using default {} ms", TIMEOUT_VARIABLE, value, DEFAULT_TIMEOUT_MS);
        return DEFAULT_TIMEOUT_MS;
    }
}
