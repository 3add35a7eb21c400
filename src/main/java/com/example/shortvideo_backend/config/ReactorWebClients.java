package com.example.shortvideo_backend.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import io.netty.resolver.DefaultAddressResolverGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.HttpProtocol;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Builds the Reactor Netty backed {@link WebClient.Builder} shared by every external service client:
 * HTTP/1.1, bounded connection pool, explicit connect/response/read/write timeouts.
 */
final class ReactorWebClients {
    private static final Logger LOGGER = LoggerFactory.getLogger(ReactorWebClients.class);
    private static final int CONNECT_TIMEOUT_MILLIS = 10_000;
    private static final int MAX_CONNECTIONS = 10;
    private static final Duration PENDING_ACQUIRE_TIMEOUT = Duration.ofSeconds(30);
    private static final Duration MAX_IDLE_TIME = Duration.ofSeconds(20);
    private static final Duration MAX_LIFE_TIME = Duration.ofMinutes(5);

    private ReactorWebClients() {
    }

    static WebClient.Builder builder(String name, Duration responseTimeout, int maxInMemoryBytes) {
        ConnectionProvider provider = ConnectionProvider.builder(name + "-http")
                .maxConnections(MAX_CONNECTIONS)
                .pendingAcquireTimeout(PENDING_ACQUIRE_TIMEOUT)
                .maxIdleTime(MAX_IDLE_TIME)
                .maxLifeTime(MAX_LIFE_TIME)
                .build();

        long ioSeconds = Math.max(1L, responseTimeout.toSeconds());
        HttpClient httpClient = HttpClient.create(provider)
                .protocol(HttpProtocol.HTTP11)
                .compress(false)
                .followRedirect(true)
                .responseTimeout(responseTimeout)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MILLIS)
                .resolver(DefaultAddressResolverGroup.INSTANCE)
                .doOnConnected(conn -> conn
                        .addHandlerLast(new ReadTimeoutHandler(ioSeconds, TimeUnit.SECONDS))
                        .addHandlerLast(new WriteTimeoutHandler(ioSeconds, TimeUnit.SECONDS))
                );

        LOGGER.info("Configuring {} WebClient connect={}ms response={}s maxConn={} maxInMemory={}KB",
                name, CONNECT_TIMEOUT_MILLIS, responseTimeout.toSeconds(), MAX_CONNECTIONS, maxInMemoryBytes / 1024);

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(c -> c.defaultCodecs().maxInMemorySize(maxInMemoryBytes));
    }

    static String bearer(String apiKey) {
        return "Bearer " + (apiKey == null ? "" : apiKey.trim());
    }
}
