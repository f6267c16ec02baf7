package net.unishelf.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

/**
 * Shared WebClient builder for provider adapters. Each adapter clones it and sets its own base URL.
 */
@Configuration
public class WebClientConfig {

    private static final String USER_AGENT = "unishelf/0.1 (+resource-discovery)";
    private static final int CONNECT_TIMEOUT_MILLIS = 3000;
    // Large arXiv Atom pages run to a few MB
    private static final int MAX_IN_MEMORY_BYTES = 4 * 1024 * 1024;

    /**
     * Socket-level timeouts follow the per-provider call timeout so a stalled
     * connection is released no later than the call that owns it.
     */
    @Bean
    public WebClient.Builder webClientBuilder(ResourceSearchProperties searchProperties) {
        Duration providerTimeout = searchProperties.getProviderTimeout();
        long socketTimeoutMillis = providerTimeout.toMillis();

        HttpClient httpClient = HttpClient.create()
            .followRedirect(true)
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MILLIS)
            .responseTimeout(providerTimeout)
            .doOnConnected(conn -> conn
                .addHandlerLast(new ReadTimeoutHandler(socketTimeoutMillis, TimeUnit.MILLISECONDS))
                .addHandlerLast(new WriteTimeoutHandler(socketTimeoutMillis, TimeUnit.MILLISECONDS)));

        ExchangeStrategies strategies = ExchangeStrategies.builder()
            .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_BYTES))
            .build();

        return WebClient.builder()
            .defaultHeader(HttpHeaders.USER_AGENT, USER_AGENT)
            .exchangeStrategies(strategies)
            .clientConnector(new ReactorClientHttpConnector(httpClient));
    }
}
