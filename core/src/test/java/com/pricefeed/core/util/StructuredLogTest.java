package com.pricefeed.core.util;

import com.pricefeed.core.util.StructuredLog.Event;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.assertThat;

class StructuredLogTest {

    private static final Instant TS = Instant.parse("2024-05-01T03:00:00Z");

    /** 레코드를 모아두는 JUL 핸들러 */
    static final class Capture extends Handler {
        final List<LogRecord> records = new ArrayList<>();
        @Override public void publish(LogRecord r) { records.add(r); }
        @Override public void flush() {}
        @Override public void close() {}
    }

    private final Logger jul = Logger.getLogger(StructuredLogTest.class.getName());
    private final Capture capture = new Capture();

    @AfterEach
    void detach() {
        jul.removeHandler(capture);
        jul.setLevel(null);
    }

    @Test
    void render_eventNameLevelAndTypedValues() {
        String json = StructuredLog.render(TS, "HttpPageFetcher", Event.FETCH_FAIL, null,
                "url", URI.create("http://giabac.phuquygroup.vn/?q=b%E1%BA%A1c"), "status", 503,
                "note", "say \"hi\"",
                "retry", false, "referer", null);

        assertThat(json).startsWith("{\"ts\":\"2024-05-01T03:00:00Z\",\"lvl\":\"WARNING\",\"comp\":\"HttpPageFetcher\"")
                .endsWith("}")
                .contains("\"event\":\"fetch.fail\"")
                .contains("\"url\":\"http://giabac.phuquygroup.vn/?q=b%E1%BA%A1c\"")
                .contains("\"note\":\"say \\\"hi\\\"\"")
                .contains("\"status\":503")
                .contains("\"retry\":false")
                .contains("\"referer\":null")
                .doesNotContain(",}");
    }

    @Test
    void render_oddArgsAndCause() {
        String json = StructuredLog.render(TS, "PriceExtractor", Event.EXTRACT_DONE,
                new IllegalStateException("bad\nrow"), "rows", 5, "records");

        assertThat(json).contains("\"rows\":5")
                .contains("\"_kv_mismatch\":\"records\"")
                .contains("\"error\":\"IllegalStateException\"")
                .contains("\"message\":\"bad\\nrow\"");
    }

    @Test
    void render_nonFiniteNumbersStayValidJson() {
        String json = StructuredLog.render(TS, "PriceService", Event.PRICES_DONE, null, "avg", Double.NaN);
        assertThat(json).contains("\"avg\":\"NaN\"");
    }

    @Test
    void wireNames_areStable() {
        assertThat(Event.values()).extracting(Event::wireName).containsExactly(
                "fetch.ok", "fetch.empty", "fetch.fail", "extract.done", "prices.done", "http.request");
    }

    @Test
    void emit_usesEventLevel_andRespectsLoggerLevel() {
        jul.addHandler(capture);
        jul.setLevel(Level.INFO);
        StructuredLog log = StructuredLog.get(StructuredLogTest.class);

        log.emit(Event.FETCH_OK, "url", "http://x");          // FINE: 걸러짐
        log.emit(Event.PRICES_DONE, "records", 3);
        log.emit(Event.FETCH_FAIL, new IOException("timeout"), "url", "http://x");

        assertThat(capture.records).extracting(LogRecord::getLevel).containsExactly(Level.INFO, Level.WARNING);
        assertThat(capture.records.get(0).getMessage()).contains("\"event\":\"prices.done\"", "\"records\":3");
        // WARNING 에서는 스택을 넘기지 않는다
        assertThat(capture.records.get(1).getThrown()).isNull();
        assertThat(capture.records.get(1).getMessage()).contains("\"error\":\"IOException\"");
    }
}
