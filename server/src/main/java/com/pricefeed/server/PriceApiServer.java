package com.pricefeed.server;

import com.pricefeed.core.api.IPriceQueries;
import com.pricefeed.core.model.Metal;
import com.pricefeed.core.model.Vendor;
import com.pricefeed.core.util.StructuredLog;
import com.pricefeed.core.util.StructuredLog.Event;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Supplier;

/**
 * 읽기 전용 시세 HTTP 서버 (JDK HttpServer).
 * 라우트: /, /prices, /prices/gold, /prices/silver, /vendors
 * 공통 쿼리: ?vendor=phuquy|btmc (없으면 설정의 기본 판매처)
 * 비즈니스 로직 없음: IPriceQueries 결과를 envelope 로 감싸기만 한다.
 */
public final class PriceApiServer implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(PriceApiServer.class);
    private static final StructuredLog SLOG = StructuredLog.get(PriceApiServer.class);

    /** 요청 처리 중 응답 코드를 지정해 빠져나가기 위한 예외 */
    static final class ApiError extends RuntimeException {
        final int status;
        ApiError(int status, String detail) {
            super(detail);
            this.status = status;
        }
    }

    @FunctionalInterface
    interface Route {
        Object handle(HttpExchange ex) throws Exception;
    }

    private final IPriceQueries prices;
    private final Clock clock;
    private final PriceJson json = new PriceJson();
    private final HttpServer server;
    private final ExecutorService executor;

    public PriceApiServer(IPriceQueries prices, String host, int port, Clock clock) throws IOException {
        this.prices = Objects.requireNonNull(prices, "prices");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.server = HttpServer.create(new InetSocketAddress(host, port), 0);
        wireEndpoints();
        this.executor = Executors.newFixedThreadPool(4);
        server.setExecutor(executor);
    }

    private void wireEndpoints() {
        add("/", ex -> PriceJson.health(clock.instant()));
        add("/vendors", ex -> {
            Map<Vendor, Map<Metal, URI>> sources = new EnumMap<>(Vendor.class);
            for (Vendor v : Vendor.values()) {
                Map<Metal, URI> m = new EnumMap<>(Metal.class);
                for (Metal metal : Metal.values()) m.put(metal, prices.source(v, metal));
                sources.put(v, m);
            }
            return PriceJson.vendors(sources);
        });
        add("/prices", ex -> {
            Vendor v = vendorOf(ex);
            return guarded("prices", () -> PriceJson.all(prices.snapshot(v)));
        });
        add("/prices/gold", ex -> single(ex, Metal.GOLD));
        add("/prices/silver", ex -> single(ex, Metal.SILVER));
    }

    private Object single(HttpExchange ex, Metal metal) {
        Vendor v = vendorOf(ex);
        return guarded(metal.key() + " prices", () ->
                PriceJson.single(clock.instant(), v, metal, prices.source(v, metal), prices.prices(v, metal)));
    }

    /** 파이프라인의 예기치 못한 예외 → 500 (catch-all) */
    private Object guarded(String what, Supplier<Object> body) {
        try {
            return body.get();
        } catch (RuntimeException e) {
            LOG.error("Error fetching {}", what, e);
            throw new ApiError(500, "Error fetching " + what + ": " + e.getMessage());
        }
    }

    private Vendor vendorOf(HttpExchange ex) {
        String raw = query(ex.getRequestURI()).get("vendor");
        if (raw == null || raw.isBlank()) return prices.defaultVendor();
        return Vendor.fromKey(raw).orElseThrow(() -> new ApiError(400, "Unknown vendor: " + raw));
    }

    // 컨텍스트는 접두사 매칭이므로 정확한 경로만 받는다
    private void add(String path, Route route) {
        server.createContext(path, ex -> dispatch(ex, path, route));
    }

    private void dispatch(HttpExchange ex, String path, Route route) throws IOException {
        long start = System.nanoTime();
        int status = 200;
        Object body;
        try {
            if (!path.equals(ex.getRequestURI().getPath())) {
                throw new ApiError(404, "Not Found");
            }
            if (!"GET".equalsIgnoreCase(ex.getRequestMethod())) {
                ex.getResponseHeaders().set("Allow", "GET");
                throw new ApiError(405, "Method Not Allowed");
            }
            body = route.handle(ex);
        } catch (ApiError e) {
            status = e.status;
            body = PriceJson.error(e.getMessage());
        } catch (Exception e) {
            LOG.error("Unhandled error on {}", path, e);
            status = 500;
            body = PriceJson.error("Internal Server Error");
        }
        respond(ex, status, json.write(body));
        SLOG.emit(Event.HTTP_REQUEST, "method", ex.getRequestMethod(), "path", ex.getRequestURI().getPath(),
                "status", status, "elapsedMs", (System.nanoTime() - start) / 1_000_000);
    }

    private static void respond(HttpExchange ex, int status, byte[] bytes) throws IOException {
        ex.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        ex.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = ex.getResponseBody()) {
            os.write(bytes);
        }
    }

    static Map<String, String> query(URI uri) {
        Map<String, String> m = new HashMap<>();
        String q = uri.getRawQuery();
        if (q == null || q.isEmpty()) return m;
        for (String p : q.split("&")) {
            int i = p.indexOf('=');
            String k = i >= 0 ? p.substring(0, i) : p;
            String v = i >= 0 ? p.substring(i + 1) : "";
            m.put(URLDecoder.decode(k, StandardCharsets.UTF_8), URLDecoder.decode(v, StandardCharsets.UTF_8));
        }
        return m;
    }

    public void start() {
        server.start();
        InetSocketAddress a = server.getAddress();
        LOG.info("Price API listening on http://{}:{}", a.getHostString(), a.getPort());
    }

    /** 실제 바인딩된 포트(설정 0 이면 임시 포트) */
    public int port() { return server.getAddress().getPort(); }

    @Override
    public void close() {
        server.stop(0);
        executor.shutdownNow();
    }
}
