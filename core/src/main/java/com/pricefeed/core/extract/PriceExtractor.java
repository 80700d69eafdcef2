package com.pricefeed.core.extract;

import com.pricefeed.core.api.IPageFetcher;
import com.pricefeed.core.api.IRowInterpreter;
import com.pricefeed.core.api.IRowLocator;
import com.pricefeed.core.interpret.RecordFold;
import com.pricefeed.core.model.Metal;
import com.pricefeed.core.model.PriceRecord;
import com.pricefeed.core.model.Vendor;
import com.pricefeed.core.util.StructuredLog;
import com.pricefeed.core.util.StructuredLog.Event;
import org.jsoup.nodes.Element;

import java.net.URI;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 판매처/금속 하나에 대한 추출 파이프라인: fetch → locate → interpret.
 * 실패는 예외가 아니라 "레코드가 적어지는 것"으로만 드러난다.
 */
public final class PriceExtractor<P extends Number> {

    private static final StructuredLog SLOG = StructuredLog.get(PriceExtractor.class);

    private final Vendor vendor;
    private final Metal metal;
    private final URI source;
    private final IPageFetcher fetcher;
    private final IRowLocator locator;
    private final IRowInterpreter<P> interpreter;

    public PriceExtractor(Vendor vendor, Metal metal, URI source,
                          IPageFetcher fetcher, IRowLocator locator, IRowInterpreter<P> interpreter) {
        this.vendor = Objects.requireNonNull(vendor, "vendor");
        this.metal = Objects.requireNonNull(metal, "metal");
        this.source = Objects.requireNonNull(source, "source");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.locator = Objects.requireNonNull(locator, "locator");
        this.interpreter = Objects.requireNonNull(interpreter, "interpreter");
    }

    public Vendor vendor() { return vendor; }
    public Metal metal() { return metal; }
    public URI source() { return source; }

    /** 원격 페이지를 받아 파싱. 네트워크 I/O 가 있는 유일한 경로. */
    public List<PriceRecord<P>> extract() {
        return parse(fetcher.fetch(source));
    }

    /** 순수 경로: HTML(또는 부재) → 레코드. 부재면 빈 목록. */
    public List<PriceRecord<P>> parse(Optional<String> html) {
        List<Element> rows = locator.locate(html);
        RecordFold.Result<P> r = RecordFold.foldWithStats(rows, interpreter);
        SLOG.emit(Event.EXTRACT_DONE, "vendor", vendor, "metal", metal.key(),
                "rows", rows.size(), "records", r.records().size(),
                "headers", r.headers(), "skipped", r.skipped());
        return r.records();
    }
}
