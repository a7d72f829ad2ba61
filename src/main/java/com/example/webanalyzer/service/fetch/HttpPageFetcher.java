package com.example.webanalyzer.service.fetch;

import com.example.webanalyzer.config.AnalyzerProperties;
import io.netty.channel.ChannelOption;
import io.netty.channel.ConnectTimeoutException;
import io.netty.handler.timeout.ReadTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import javax.net.ssl.SSLException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.URI;
import java.net.UnknownHostException;
import java.nio.channels.UnresolvedAddressException;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * Загрузка страниц через {@link WebClient}.
 *
 * Сетевые ошибки переводятся в {@link PageFetchException} с кодом, похожим на HTTP-статус:
 * DNS → 404, отказ в соединении → 503, таймаут → 408, TLS → 495, сеть недоступна → 503.
 * Тело больше {@code analyzer.fetch.max-body-bytes} отклоняется кодом 413.
 */
@Slf4j
@Service
public class HttpPageFetcher implements PageFetcher {

    private static final String ACCEPT = "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8";
    private static final String ACCEPT_LANGUAGE = "en-US,en;q=0.5";

    private final AnalyzerProperties.FetchConfig config;
    private final WebClient webClient;

    public HttpPageFetcher(AnalyzerProperties properties) {
        this.config = properties.getFetch();

        HttpClient httpClient = HttpClient.create()
                .followRedirect(config.isFollowRedirects())
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) config.getTimeout().toMillis());

        this.webClient = WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader(HttpHeaders.USER_AGENT, config.getUserAgent())
                .defaultHeader(HttpHeaders.ACCEPT, ACCEPT)
                .defaultHeader(HttpHeaders.ACCEPT_LANGUAGE, ACCEPT_LANGUAGE)
                .codecs(configurer -> configurer.defaultCodecs()
                        .maxInMemorySize((int) Math.min(Integer.MAX_VALUE, config.getMaxBodyBytes())))
                .build();
    }

    @Override
    public FetchedPage fetch(String url) throws PageFetchException {
        URI uri = validate(url);

        ResponseEntity<byte[]> response;
        try {
            // exchangeToMono отдаёт любой статус как обычный ответ, без WebClientResponseException
            response = webClient.get()
                    .uri(uri)
                    .exchangeToMono(clientResponse -> clientResponse.toEntity(byte[].class))
                    .timeout(config.getTimeout())
                    .block();
        } catch (RuntimeException e) {
            if (hasCause(e, InterruptedException.class)) {
                Thread.currentThread().interrupt();
                throw new PageFetchException(503, "Request interrupted before the server responded.", e);
            }
            throw classify(e, url);
        }
        if (response == null) {
            throw new PageFetchException(503, "Network error: empty response from " + url
                    + ". Please check your internet connection and try again.");
        }

        byte[] body = response.getBody() != null ? response.getBody() : new byte[0];
        String contentType = response.getHeaders().getFirst(HttpHeaders.CONTENT_TYPE);
        int statusCode = response.getStatusCode().value();
        log.debug("Fetched {}: status {}, {} bytes, content type {}", url, statusCode, body.length, contentType);

        return FetchedPage.builder()
                .body(body)
                .statusCode(statusCode)
                .contentType(contentType)
                .build();
    }

    private URI validate(String url) throws PageFetchException {
        if (url == null || url.isBlank()) {
            throw new PageFetchException(400, "Invalid URL format: URL must not be empty.");
        }
        URI uri;
        try {
            uri = URI.create(url.trim());
        } catch (IllegalArgumentException e) {
            throw new PageFetchException(400, "Invalid URL format: malformed URL: " + e.getMessage(), e);
        }
        String scheme = uri.getScheme();
        if (scheme == null
                || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
            throw new PageFetchException(400,
                    "Protocol error: The URL uses an unsupported protocol. Please use http:// or https://.");
        }
        if (uri.getHost() == null) {
            throw new PageFetchException(400, "Invalid URL format: the URL has no host.");
        }
        return uri;
    }

    /**
     * Переводит ошибку загрузки в код и сообщение для пользователя.
     * Причины ищутся по всей цепочке, в том числе внутри {@code WebClientRequestException}
     * и обёрток Reactor.
     */
    PageFetchException classify(Exception error, String url) {
        log.debug("Fetch of {} failed: {}", url, error.toString());

        if (hasCause(error, DataBufferLimitException.class)) {
            return new PageFetchException(413,
                    "Response too large: the page exceeds the maximum size of "
                            + config.getMaxBodyBytes() + " bytes.", error);
        }
        if (hasCause(error, UnknownHostException.class) || hasCause(error, UnresolvedAddressException.class)) {
            return new PageFetchException(404,
                    "DNS resolution failed: The domain could not be found. Please check if the URL is correct.", error);
        }
        if (hasCause(error, TimeoutException.class)
                || hasCause(error, ReadTimeoutException.class)
                || hasCause(error, ConnectTimeoutException.class)) {
            return new PageFetchException(408,
                    "Request timeout: The server took too long to respond. Please try again later.", error);
        }
        if (hasCause(error, SSLException.class)) {
            return new PageFetchException(495,
                    "SSL/TLS error: There was a problem with the security certificate. The connection is not secure.",
                    error);
        }
        if (hasCause(error, NoRouteToHostException.class) || messageContains(error, "network is unreachable")) {
            return new PageFetchException(503,
                    "Network unreachable: Cannot reach the server. Please check your internet connection.", error);
        }
        if (hasCause(error, ConnectException.class)) {
            return new PageFetchException(503,
                    "Connection refused: The server is not accepting connections. "
                            + "The service might be down or the port might be closed.", error);
        }
        if (error instanceof IllegalArgumentException) {
            return new PageFetchException(400,
                    "Protocol error: The URL uses an unsupported protocol. Please use http:// or https://.", error);
        }
        return new PageFetchException(503,
                "Network error: " + rootMessage(error) + ". Please check your internet connection and try again.",
                error);
    }

    private static String rootMessage(Throwable error) {
        Throwable root = error;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
    }

    private static boolean hasCause(Throwable error, Class<? extends Throwable> type) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (type.isInstance(t)) {
                return true;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }

    private static boolean messageContains(Throwable error, String text) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            String message = t.getMessage();
            if (message != null && message.toLowerCase(Locale.ROOT).contains(text)) {
                return true;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }
}
