package com.phillippitts.callpilot.config;

import com.phillippitts.callpilot.config.properties.SinkProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;

/**
 * Outbound HTTP clients and the shared clock.
 *
 * <p>Call placement and the booking sinks each get their own {@link RestTemplate} so their read
 * timeouts can differ: placement waits on the voice platform's telephony handshake, while sink
 * calls are bounded by {@code callpilot.sinks.timeout-ms}.
 */
@Configuration
public class HttpClientConfig {

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(5);
    private static final Duration PLACEMENT_READ_TIMEOUT = Duration.ofSeconds(30);

    @Bean(name = "placementRestTemplate")
    public RestTemplate placementRestTemplate(RestTemplateBuilder builder) {
        return builder
                .setConnectTimeout(CONNECT_TIMEOUT)
                .setReadTimeout(PLACEMENT_READ_TIMEOUT)
                .build();
    }

    @Bean(name = "sinkRestTemplate")
    public RestTemplate sinkRestTemplate(RestTemplateBuilder builder, SinkProperties sinkProperties) {
        return builder
                .setConnectTimeout(CONNECT_TIMEOUT)
                .setReadTimeout(Duration.ofMillis(sinkProperties.getTimeoutMs()))
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
