package com.pricefeed.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.pricefeed.core.model.Metal;
import com.pricefeed.core.model.PriceRecord;
import com.pricefeed.core.model.PriceSnapshot;
import com.pricefeed.core.model.Vendor;

import java.net.URI;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 응답 envelope 조립 + Jackson 직렬화.
 * 가격 부재는 JSON null 로 나가며 0 으로 바뀌지 않는다.
 */
public final class PriceJson {

    private final ObjectMapper om = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS); // ISO-8601

    public byte[] write(Object body) throws JsonProcessingException {
        return om.writerWithDefaultPrettyPrinter().writeValueAsBytes(body);
    }

    public static Map<String, Object> health(Instant now) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("status", "ok");
        m.put("message", "Gold & Silver Price Scraper API is running");
        m.put("timestamp", now);
        return m;
    }

    public static Map<String, Object> all(PriceSnapshot s) {
        Map<String, Object> sources = new LinkedHashMap<>();
        sources.put(Metal.GOLD.key(), s.goldSource().toString());
        sources.put(Metal.SILVER.key(), s.silverSource().toString());

        Map<String, Object> m = new LinkedHashMap<>();
        m.put("timestamp", s.fetchedAt());
        m.put("vendor", s.vendor().key());
        m.put("sources", sources);
        m.put(Metal.GOLD.key(), records(s.gold()));
        m.put(Metal.SILVER.key(), records(s.silver()));
        return m;
    }

    public static Map<String, Object> single(Instant now, Vendor vendor, Metal metal, URI source,
                                             List<PriceRecord<?>> records) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("timestamp", now);
        m.put("vendor", vendor.key());
        m.put("source", source.toString());
        m.put(metal.key(), records(records));
        return m;
    }

    public static List<Map<String, Object>> vendors(Map<Vendor, Map<Metal, URI>> sources) {
        List<Map<String, Object>> out = new ArrayList<>();
        for (var e : sources.entrySet()) {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("key", e.getKey().key());
            m.put("name", e.getKey().displayName());
            for (var s : e.getValue().entrySet()) m.put(s.getKey().key(), s.getValue().toString());
            out.add(m);
        }
        return out;
    }

    public static Map<String, Object> error(String detail) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("detail", detail);
        return m;
    }

    static List<Map<String, Object>> records(List<PriceRecord<?>> records) {
        List<Map<String, Object>> out = new ArrayList<>(records.size());
        for (PriceRecord<?> r : records) out.add(r.toFields());
        return out;
    }
}
