package io.github.drompincen.sprintplanner.gateway.config;

import io.github.drompincen.sprintplanner.runtime.tracker.TrackerProperties;
import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;

@Configuration
public class TrackerClientConfig {

    @Bean
    RestClientCustomizer trackerTimeouts(TrackerProperties properties) {
        return builder -> {
            SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
            factory.setConnectTimeout((int) properties.getConnectTimeout().toMillis());
            factory.setReadTimeout((int) properties.getReadTimeout().toMillis());
            builder.requestFactory(factory);
        };
    }
}
