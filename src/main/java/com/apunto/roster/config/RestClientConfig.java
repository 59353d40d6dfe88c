package com.apunto.roster.config;

import com.apunto.roster.client.BattleNetProfileClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.ClientHttpRequestFactory;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.support.RestClientAdapter;
import org.springframework.web.service.invoker.HttpServiceProxyFactory;

import java.net.http.HttpClient;
import java.time.Duration;

@Configuration
@Slf4j
@EnableConfigurationProperties(BattleNetProperties.class)
public class RestClientConfig {

    @Bean
    public ClientHttpRequestFactory clientHttpRequestFactory(
            @Value("${rest-client.timeout.connect-ms:2000}") int connectMs,
            @Value("${rest-client.timeout.read-ms:5000}") int readMs
    ) {
        log.info("RestClient timeouts connectMs={} readMs={}", connectMs, readMs);

        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(connectMs))
                .build();

        JdkClientHttpRequestFactory factory = new JdkClientHttpRequestFactory(httpClient);
        factory.setReadTimeout(Duration.ofMillis(readMs));
        return factory;
    }

    @Bean
    public RestClient battleNetRestClient(
            RestClient.Builder builder,
            ClientHttpRequestFactory requestFactory,
            BattleNetProperties properties
    ) {
        String baseUrl = properties.resolvedApiBaseUrl();
        log.info("Battle.net profile API baseUrl={} region={} locale={}",
                baseUrl, properties.getRegion(), properties.getLocale());

        return builder
                .requestFactory(requestFactory)
                .baseUrl(baseUrl)
                .build();
    }

    @Bean
    public BattleNetProfileClient battleNetProfileClient(RestClient battleNetRestClient) {
        HttpServiceProxyFactory factory = HttpServiceProxyFactory
                .builderFor(RestClientAdapter.create(battleNetRestClient))
                .build();

        return factory.createClient(BattleNetProfileClient.class);
    }
}
