package com.portfoliotracker.marketdata.config;

import com.portfoliotracker.marketdata.client.AlphaVantageClient;
import com.portfoliotracker.marketdata.client.AlphaVantageResponseParser;
import com.portfoliotracker.marketdata.client.RawResponseArchive;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Configuration
public class WebClientConfig {

    private static final Logger log = LoggerFactory.getLogger(WebClientConfig.class);

    @Value("${alpha-vantage.base-url:https://www.alphavantage.co}")
    private String baseUrl;

    @Value("${alpha-vantage.api-key:}")
    private String apiKey;

    @Value("${alpha-vantage.timeout-seconds:15}")
    private int timeoutSeconds;

    @Bean
    public WebClient alphaVantageWebClient(WebClient.Builder builder) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 10_000)
            .responseTimeout(Duration.ofSeconds(timeoutSeconds))
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS))
            );

        return builder
            .baseUrl(baseUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .filter(loggingFilter())
            .build();
    }

    @Bean
    public AlphaVantageClient alphaVantageClient(WebClient alphaVantageWebClient,
                                                 AlphaVantageResponseParser parser,
                                                 RawResponseArchive archive) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalStateException("alpha-vantage.api-key is not set (ALPHA_VANTAGE_API_KEY)");
        }
        return new AlphaVantageClient(alphaVantageWebClient, parser, archive, apiKey,
            Duration.ofSeconds(timeoutSeconds));
    }

    private ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            String sanitized = maskApiKey(clientRequest.url().toString());
            log.debug("Outbound request: {} {}", clientRequest.method(), sanitized);
            return Mono.just(clientRequest);
        });
    }

    static String maskApiKey(String uri) {
        return uri.replaceAll("apikey=[^&]+", "apikey=***");
    }
}
