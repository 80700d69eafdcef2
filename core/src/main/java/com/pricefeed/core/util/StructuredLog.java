package com.pricefeed.core.util;

import java.net.URI;
import java.time.Instant;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 파이프라인 이벤트를 JSON 한 줄로 남기는 로거 (java.util.logging 위).
 * 이벤트 이름과 레벨은 {@link Event} 로 고정되고, 나머지는 "key", value 쌍.
 * 핸들러/포맷은 실행 측(LogSetup)이 정한다.
 */
public final class StructuredLog {

    /** 시세 수집 파이프라인이 내는 이벤트 목록 */
    public enum Event {
        FETCH_OK("fetch.ok", Level.FINE),
        FETCH_EMPTY("fetch.empty", Level.WARNING),
        FETCH_FAIL("fetch.fail", Level.WARNING),
        EXTRACT_DONE("extract.done", Level.FINE),
        PRICES_DONE("prices.done", Level.INFO),
        HTTP_REQUEST("http.request", Level.INFO);

        private final String wireName;
        private final Level level;

        Event(String wireName, Level level) {
            this.wireName = wireName;
            this.level = level;
        }

        public String wireName() { return wireName; }
        public Level level() { return level; }
    }

    private final Logger jul;
    private final String comp;

    private StructuredLog(Class<?> cls) {
        this.jul = Logger.getLogger(cls.getName());
        this.comp = cls.getSimpleName();
    }

    public static StructuredLog get(Class<?> cls) {
        return new StructuredLog(cls);
    }

    public void emit(Event event, Object... kvs) {
        emit(event, null, kvs);
    }

    /** 실패 원인이 있으면 error/message 키로 붙인다. 스택은 SEVERE 에서만 핸들러로 넘긴다. */
    public void emit(Event event, Throwable cause, Object... kvs) {
        Level lvl = event.level();
        if (!jul.isLoggable(lvl)) return;
        String line = render(Instant.now(), comp, event, cause, kvs);
        if (cause != null && lvl.intValue() >= Level.SEVERE.intValue()) jul.log(lvl, line, cause);
        else jul.log(lvl, line);
    }

    static String render(Instant ts, String comp, Event event, Throwable cause, Object... kvs) {
        StringBuilder sb = new StringBuilder(160).append('{');
        field(sb, "ts", ts.toString());
        field(sb, "lvl", event.level().getName());
        field(sb, "comp", comp);
        field(sb, "thread", Thread.currentThread().getName());
        field(sb, "event", event.wireName());

        int n = kvs == null ? 0 : kvs.length;
        for (int i = 0; i + 1 < n; i += 2) {
            field(sb, String.valueOf(kvs[i]), kvs[i + 1]);
        }
        if (n % 2 == 1) field(sb, "_kv_mismatch", String.valueOf(kvs[n - 1]));

        if (cause != null) {
            field(sb, "error", cause.getClass().getSimpleName());
            field(sb, "message", cause.getMessage());
        }
        sb.setLength(sb.length() - 1); // 마지막 콤마
        return sb.append('}').toString();
    }

    private static void field(StringBuilder sb, String key, Object value) {
        quote(sb, key).append(':');
        if (value == null) {
            sb.append("null");
        } else if (value instanceof Double d && !Double.isFinite(d)) {
            quote(sb, d.toString());
        } else if (value instanceof Number || value instanceof Boolean) {
            sb.append(value);
        } else if (value instanceof URI u) {
            quote(sb, u.toASCIIString());
        } else {
            quote(sb, String.valueOf(value));
        }
        sb.append(',');
    }

    private static StringBuilder quote(StringBuilder sb, String s) {
        sb.append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 0x20) sb.append(String.format("\\u%04x", (int) c));
                    else sb.append(c);
                }
            }
        }
        return sb.append('"');
    }
}
