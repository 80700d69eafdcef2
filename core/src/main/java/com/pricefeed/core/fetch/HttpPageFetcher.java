package com.pricefeed.core.fetch;

import com.pricefeed.core.api.IPageFetcher;
import com.pricefeed.core.model.FeedConfig;
import com.pricefeed.core.util.StructuredLog;
import com.pricefeed.core.util.StructuredLog.Event;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 단일 GET 페이지 수집기.
 * - 브라우저 흉내 헤더 고정(+판매처에 따라 Referer), 타임아웃 고정, 재시도 없음
 * - 네트워크 오류/타임아웃/비 2xx/빈 본문 → Optional.empty()
 */
public final class HttpPageFetcher implements IPageFetcher {

    private static final Logger LOG = LoggerFactory.getLogger(HttpPageFetcher.class);
    private static final StructuredLog SLOG = StructuredLog.get(HttpPageFetcher.class);

    /** 테스트/모킹용 송신 훅 */
    @FunctionalInterface
    public interface HttpSender {
        HttpResponse<String> send(HttpRequest req) throws Exception;
    }

    private final Duration timeout;
    private final Map<String, String> headers;
    private final HttpSender sender;

    public HttpPageFetcher(FeedConfig config, String referer) {
        this(config, referer, defaultSender(config));
    }

    /** 테스트용 생성자(송신 훅 주입) */
    public HttpPageFetcher(FeedConfig config, String referer, HttpSender sender) {
        Objects.requireNonNull(config, "config");
        this.timeout = config.getTimeout();
        this.headers = requestHeaders(config, referer);
        this.sender = Objects.requireNonNull(sender, "sender");
    }

    private static HttpSender defaultSender(FeedConfig config) {
        // 리다이렉트는 전송 계층 기본 동작에 맡김
        HttpClient client = HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(config.getTimeout())
                .build();
        return req -> client.send(req, HttpResponse.BodyHandlers.ofString());
    }

    static Map<String, String> requestHeaders(FeedConfig config, String referer) {
        Map<String, String> h = new LinkedHashMap<>();
        h.put("User-Agent", config.getUserAgent());
        h.put("Accept", config.getAccept());
        h.put("Accept-Language", config.getAcceptLanguage());
        if (referer != null && !referer.isBlank()) h.put("Referer", referer);
        return Map.copyOf(h);
    }

    /** 실제 전송에 쓰이는 헤더(읽기 전용). */
    public Map<String, String> headers() { return headers; }

    @Override
    public Optional<String> fetch(URI url) {
        Objects.requireNonNull(url, "url");
        long start = System.nanoTime();
        try {
            HttpRequest.Builder rb = HttpRequest.newBuilder(url)
                    .timeout(timeout)
                    .GET();
            headers.forEach(rb::header);

            HttpResponse<String> resp = sender.send(rb.build());
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;
            int code = resp.statusCode();

            if (code < 200 || code >= 300) {
                LOG.warn("Error fetching {}: HTTP {}", url, code);
                SLOG.emit(Event.FETCH_FAIL, "url", url, "status", code, "elapsedMs", elapsedMs);
                return Optional.empty();
            }
            String body = resp.body();
            if (body == null || body.isBlank()) {
                LOG.warn("Error fetching {}: empty body", url);
                SLOG.emit(Event.FETCH_EMPTY, "url", url, "status", code, "elapsedMs", elapsedMs);
                return Optional.empty();
            }
            SLOG.emit(Event.FETCH_OK, "url", url, "status", code, "bytes", body.length(), "elapsedMs", elapsedMs);
            return Optional.of(body);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Fetch interrupted: {}", url);
            return Optional.empty();
        } catch (Exception e) {
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;
            LOG.warn("Error fetching {}: {}", url, e.toString());
            SLOG.emit(Event.FETCH_FAIL, e, "url", url, "status", -1, "elapsedMs", elapsedMs);
            return Optional.empty();
        }
    }
}
