package com.pricefeed.core.service;

import com.pricefeed.core.api.IPageFetcher;
import com.pricefeed.core.api.IPriceQueries;
import com.pricefeed.core.extract.PriceExtractor;
import com.pricefeed.core.extract.VendorProfile;
import com.pricefeed.core.fetch.HttpPageFetcher;
import com.pricefeed.core.model.FeedConfig;
import com.pricefeed.core.model.Metal;
import com.pricefeed.core.model.PriceRecord;
import com.pricefeed.core.model.PriceSnapshot;
import com.pricefeed.core.model.Vendor;
import com.pricefeed.core.util.StructuredLog;
import com.pricefeed.core.util.StructuredLog.Event;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * 시세 조회 오케스트레이터:
 *  - 판매처 × 금속마다 PriceExtractor 한 개(설정으로부터 조립)
 *  - 호출마다 새로 수집/파싱, 캐시 없음
 *  - snapshot 은 금/은을 고정 스레드풀에서 병렬로 수집
 *  - DI 생성자는 테스트용(fetcher 대체, 시계 고정)
 */
public final class PriceService implements IPriceQueries, AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(PriceService.class);
    private static final StructuredLog SLOG = StructuredLog.get(PriceService.class);

    private final FeedConfig config;
    private final Clock clock;
    private final Map<Vendor, Map<Metal, PriceExtractor<? extends Number>>> extractors = new EnumMap<>(Vendor.class);
    private final ExecutorService pool;

    /** 기본 구현: 판매처별 HttpPageFetcher(Referer 포함) */
    public PriceService(FeedConfig config) {
        this(config, v -> new HttpPageFetcher(config, config.vendor(v).getReferer()), Clock.systemDefaultZone());
    }

    /** DI/테스트용 */
    public PriceService(FeedConfig config, Function<Vendor, IPageFetcher> fetchers, Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        config.validate();

        for (Vendor v : Vendor.values()) {
            IPageFetcher fetcher = Objects.requireNonNull(fetchers.apply(v), "fetcher for " + v);
            VendorProfile profile = VendorProfile.of(v);
            Map<Metal, PriceExtractor<? extends Number>> perMetal = new EnumMap<>(Metal.class);
            for (Metal m : Metal.values()) {
                perMetal.put(m, profile.extractor(m, config.vendor(v), fetcher));
            }
            extractors.put(v, perMetal);
        }

        AtomicInteger seq = new AtomicInteger();
        this.pool = Executors.newFixedThreadPool(config.getConcurrency(), r -> {
            Thread t = new Thread(r, "pf-extract-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public List<PriceRecord<?>> prices(Vendor vendor, Metal metal) {
        PriceExtractor<? extends Number> ex = extractor(vendor, metal);
        long start = System.nanoTime();
        List<PriceRecord<?>> out = List.copyOf(ex.extract());
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;
        if (out.isEmpty()) {
            LOG.info("No {} prices extracted from {}", metal.key(), ex.source());
        }
        SLOG.emit(Event.PRICES_DONE, "vendor", vendor, "metal", metal.key(),
                "records", out.size(), "elapsedMs", elapsedMs);
        return out;
    }

    @Override
    public PriceSnapshot snapshot(Vendor vendor) {
        Objects.requireNonNull(vendor, "vendor");
        Instant now = clock.instant();
        CompletableFuture<List<PriceRecord<?>>> gold =
                CompletableFuture.supplyAsync(() -> prices(vendor, Metal.GOLD), pool);
        CompletableFuture<List<PriceRecord<?>>> silver =
                CompletableFuture.supplyAsync(() -> prices(vendor, Metal.SILVER), pool);
        try {
            return new PriceSnapshot(now, vendor,
                    source(vendor, Metal.GOLD), source(vendor, Metal.SILVER),
                    gold.join(), silver.join());
        } catch (CompletionException e) {
            // 작업 내부 예외를 그대로 올려 표현 계층의 catch-all 로 보낸다
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RuntimeException re) throw re;
            throw e;
        }
    }

    @Override
    public URI source(Vendor vendor, Metal metal) {
        return extractor(vendor, metal).source();
    }

    @Override
    public Vendor defaultVendor() {
        return config.getDefaultVendor();
    }

    public Instant now() { return clock.instant(); }

    private PriceExtractor<? extends Number> extractor(Vendor vendor, Metal metal) {
        Objects.requireNonNull(vendor, "vendor");
        Objects.requireNonNull(metal, "metal");
        return extractors.get(vendor).get(metal);
    }

    @Override
    public void close() {
        pool.shutdownNow();
    }
}
