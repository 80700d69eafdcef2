package com.pricefeed.core.model;

import java.net.URI;
import java.time.Instant;
import java.util.List;

/** 한 판매처의 금/은 시세를 한 번에 모은 결과. */
public record PriceSnapshot(Instant fetchedAt,
                            Vendor vendor,
                            URI goldSource,
                            URI silverSource,
                            List<PriceRecord<?>> gold,
                            List<PriceRecord<?>> silver) {
    public PriceSnapshot {
        gold = List.copyOf(gold);
        silver = List.copyOf(silver);
    }
}
