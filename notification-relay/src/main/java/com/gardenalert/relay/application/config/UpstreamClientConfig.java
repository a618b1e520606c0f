package com.gardenalert.relay.application.config;

import java.net.http.HttpClient;
import java.time.Duration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class UpstreamClientConfig {

    private static final String USER_AGENT = "GardenAlert-Relay/1.0";

    @Bean
    public RestClient gameDataRestClient(RestClient.Builder builder, RelayProperties properties) {
        var upstream = properties.upstream();
        return builder.clone()
                .baseUrl(upstream.baseUrl())
                .requestFactory(requestFactory(upstream.timeoutMs()))
                .defaultHeader("Accept", "application/json")
                .defaultHeader("User-Agent", USER_AGENT)
                .build();
    }

    /**
     * APNs only speaks HTTP/2, which the JDK client negotiates over TLS.
     */
    @Bean
    @ConditionalOnProperty(prefix = "relay.push", name = "enabled", havingValue = "true")
    public RestClient apnsRestClient(RestClient.Builder builder, RelayProperties properties) {
        var push = properties.push();
        return builder.clone()
                .baseUrl(push.baseUrl())
                .requestFactory(requestFactory(push.timeoutMs()))
                .build();
    }

    private static JdkClientHttpRequestFactory requestFactory(int timeoutMs) {
        var timeout = Duration.ofMillis(timeoutMs);
        var httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_2)
                .connectTimeout(timeout)
                .build();
        var factory = new JdkClientHttpRequestFactory(httpClient);
        factory.setReadTimeout(timeout);
        return factory;
    }
}
