package uz.greenwhite.servicegateway.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * One reactor-netty connection pool shared by the gateway transport,
 * the maps and workflow clients and the health pings.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class HttpClientConfig {

    private final HttpProperties httpProperties;

    @Bean
    public WebClient webClient() {
        ExchangeStrategies strategies = ExchangeStrategies.builder()
                .codecs(configurer -> configurer
                        .defaultCodecs()
                        .maxInMemorySize(httpProperties.getMaxInMemorySizeMb() * 1024 * 1024))
                .build();

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(nettyClient()))
                .exchangeStrategies(strategies)
                .filter(logOutbound())
                .build();
    }

    private HttpClient nettyClient() {
        return HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, httpProperties.getConnectTimeoutMs())
                .responseTimeout(Duration.ofMillis(httpProperties.getReadTimeoutMs()))
                .doOnConnected(conn -> conn
                        .addHandlerLast(new ReadTimeoutHandler(httpProperties.getReadTimeoutMs(), TimeUnit.MILLISECONDS))
                        .addHandlerLast(new WriteTimeoutHandler(httpProperties.getWriteTimeoutMs(), TimeUnit.MILLISECONDS)));
    }

    /**
     * Query strings are left out of the log line, they may carry API keys.
     */
    private ExchangeFilterFunction logOutbound() {
        return ExchangeFilterFunction.ofRequestProcessor(request -> {
            log.debug("Outbound {} {}://{}{}", request.method(),
                    request.url().getScheme(), request.url().getAuthority(), request.url().getPath());
            return Mono.just(request);
        });
    }
}
