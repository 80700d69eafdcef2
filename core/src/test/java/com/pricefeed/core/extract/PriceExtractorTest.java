package com.pricefeed.core.extract;

import com.pricefeed.core.api.IPageFetcher;
import com.pricefeed.core.model.FeedConfig;
import com.pricefeed.core.model.Metal;
import com.pricefeed.core.model.PriceRecord;
import com.pricefeed.core.model.Vendor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class PriceExtractorTest {

    private static final FeedConfig CFG = FeedConfig.defaults();

    private static PriceExtractor<? extends Number> extractor(Vendor v, Metal m, IPageFetcher fetcher) {
        return VendorProfile.of(v).extractor(m, CFG.vendor(v), fetcher);
    }

    private static PriceExtractor<? extends Number> offline(Vendor v, Metal m) {
        return extractor(v, m, url -> Optional.empty());
    }

    @Test
    void phuQuyGold_fixture() {
        List<? extends PriceRecord<?>> out = offline(Vendor.PHU_QUY, Metal.GOLD)
                .parse(Optional.of(Fixtures.html("phuquy_gold.html")));

        assertThat(out)
                .extracting(PriceRecord::getProduct, PriceRecord::getCategory,
                        r -> r.getBuyPrice().orElse(null), r -> r.getSellPrice().orElse(null))
                .containsExactly(
                        tuple("Vàng miếng SJC", "Vàng miếng", 8_350_000L, 8_550_000L),
                        tuple("Nhẫn tròn Phú Quý 999.9", "Nhẫn tròn", 7_620_000L, 7_760_000L),
                        tuple("Vàng trang sức 24K", "Nhẫn tròn", 7_500_000L, null));
        assertThat(out).allSatisfy(r -> assertThat(r.getUnit()).isEqualTo("VNĐ/Chỉ"));
    }

    @Test
    void phuQuySilver_fixture_unitFromRow() {
        List<? extends PriceRecord<?>> out = offline(Vendor.PHU_QUY, Metal.SILVER)
                .parse(Optional.of(Fixtures.html("phuquy_silver.html")));

        assertThat(out)
                .extracting(PriceRecord::getCategory, PriceRecord::getProduct, PriceRecord::getUnit)
                .containsExactly(
                        tuple("Bạc miếng", "Bạc miếng Phú Quý 999 1 lượng", "VNĐ/Lượng"),
                        tuple("Bạc miếng", "Bạc miếng Phú Quý 999 5 lượng", "VNĐ/5 Lượng"),
                        tuple("Bạc thỏi", "Bạc thỏi Phú Quý 999 1 kilo", "VNĐ/Kg"));
        assertThat(out.get(2).getSellPrice().orElseThrow()).isEqualTo(51_573_000L);
    }

    @Test
    void btmcGold_fixture_mixedCellCounts() {
        List<? extends PriceRecord<?>> out = offline(Vendor.BTMC, Metal.GOLD)
                .parse(Optional.of(Fixtures.html("btmc_gold.html")));

        assertThat(out)
                .extracting(PriceRecord::getProduct, r -> r.getPurity().orElse(null),
                        r -> r.getBuyPrice().orElse(null), r -> r.getSellPrice().orElse(null))
                .containsExactly(
                        tuple("VÀNG MIẾNG VRTL", "999.9", 8320.0, 8520.0),
                        tuple("NHẪN TRÒN TRƠN", "999.9", 7615.0, 7755.0),
                        tuple("VÀNG MIẾNG SJC", "999.9", 8350.0, null));
    }

    @Test
    void btmcSilver_fixture() {
        List<? extends PriceRecord<?>> out = offline(Vendor.BTMC, Metal.SILVER)
                .parse(Optional.of(Fixtures.html("btmc_silver.html")));

        assertThat(out)
                .extracting(PriceRecord::getProduct, r -> r.getBuyPrice().orElse(null), r -> r.getSellPrice().orElse(null))
                .containsExactly(
                        tuple("BẠC MIẾNG 999 1 LƯỢNG", 1262.0, 1301.0),
                        tuple("BẠC THỎI 999 1KG", 33653.2, 51306.539));
        assertThat(out).allSatisfy(r -> {
            assertThat(r.getCategory()).isEmpty();
            assertThat(r.getUnit()).isEqualTo("Nghìn VNĐ/Lượng");
        });
    }

    @Test
    @DisplayName("3 유효 행 + 2 노이즈 행 → 문서 순서대로 정확히 3건")
    void endToEnd_scenario() {
        List<? extends PriceRecord<?>> out = extractor(Vendor.BTMC, Metal.GOLD,
                url -> Optional.of(Fixtures.html("btmc_gold_scenario.html"))).extract();

        assertThat(out).hasSize(3);
        assertThat(out.get(0).toFields()).containsEntry("product", "SJC 1L")
                .containsEntry("purity", "999.9")
                .containsEntry("buy_price", 78500.0)
                .containsEntry("sell_price", 79200.0);
        assertThat(out.get(1).toFields()).containsEntry("product", "NHẪN TRÒN")
                .containsEntry("buy_price", 76100.0)
                .containsEntry("sell_price", 77300.0);
        assertThat(out.get(2).toFields()).containsEntry("product", "NỮ TRANG 99.9")
                .containsEntry("purity", "99.9")
                .containsEntry("buy_price", 75800.5)
                .containsEntry("sell_price", 77000.0);
    }

    @Test
    void failedFetch_yieldsEmpty_forEveryExtractor() {
        for (Vendor v : Vendor.values()) {
            for (Metal m : Metal.values()) {
                assertThat(offline(v, m).extract()).as(v + "/" + m).isEmpty();
                assertThat(offline(v, m).parse(Optional.empty())).isEmpty();
            }
        }
    }

    @Test
    void extract_fetchesConfiguredSourceOnce() {
        List<URI> asked = new ArrayList<>();
        var ex = extractor(Vendor.PHU_QUY, Metal.SILVER, url -> {
            asked.add(url);
            return Optional.empty();
        });
        ex.extract();
        assertThat(asked).containsExactly(URI.create("http://giabac.phuquygroup.vn"));
        assertThat(ex.source()).isEqualTo(asked.get(0));
    }

    @Test
    void parsingTwice_isIdempotent() {
        var ex = offline(Vendor.PHU_QUY, Metal.SILVER);
        Optional<String> html = Optional.of(Fixtures.html("phuquy_silver.html"));
        assertThat(ex.parse(html)).isEqualTo(ex.parse(html));
    }

    @Test
    void numericDomainsDiffer() {
        var pq = offline(Vendor.PHU_QUY, Metal.GOLD).parse(Optional.of(Fixtures.html("phuquy_gold.html")));
        var bt = offline(Vendor.BTMC, Metal.GOLD).parse(Optional.of(Fixtures.html("btmc_gold.html")));
        assertThat(pq.get(0).getBuyPrice().orElseThrow()).isInstanceOf(Long.class);
        assertThat(bt.get(0).getBuyPrice().orElseThrow()).isInstanceOf(Double.class);
    }

    @Test
    void malformedHtml_doesNotThrow() {
        var ex = offline(Vendor.BTMC, Metal.SILVER);
        assertThat(ex.parse(Optional.of("<table><tr><td>BẠC<td>1,262<td>1,301"))).hasSize(1);
        assertThat(ex.parse(Optional.of("<<<not html>>>"))).isEmpty();
    }
}
