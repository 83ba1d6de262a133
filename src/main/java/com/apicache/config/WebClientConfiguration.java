package com.apicache.config;

import io.netty.channel.ChannelOption;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

/**
 * WebClient configuration for requests to the upstream service.
 */
@Configuration
public class WebClientConfiguration {

    private final ApiCacheProperties properties;

    public WebClientConfiguration(ApiCacheProperties properties) {
        this.properties = properties;
    }

    @Bean
    public WebClient upstreamWebClient() {
        ApiCacheProperties.UpstreamConfig upstream = properties.getUpstream();

        ConnectionProvider connectionProvider = ConnectionProvider.builder("upstream")
                .maxConnections(upstream.getMaxConnections())
                .build();

        HttpClient httpClient = HttpClient.create(connectionProvider)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) upstream.getConnectTimeout().toMillis())
                .responseTimeout(upstream.getTimeout());

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(upstream.getMaxResponseSize()))
                .build();
    }
}
