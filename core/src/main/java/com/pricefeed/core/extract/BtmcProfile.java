package com.pricefeed.core.extract;

import com.pricefeed.core.api.IPageFetcher;
import com.pricefeed.core.api.IRowInterpreter;
import com.pricefeed.core.interpret.ColumnLayouts;
import com.pricefeed.core.interpret.DecimalCurrencyParser;
import com.pricefeed.core.interpret.PositionalRowInterpreter;
import com.pricefeed.core.locate.CssRowLocator;
import com.pricefeed.core.model.FeedConfig;
import com.pricefeed.core.model.Metal;
import com.pricefeed.core.model.Vendor;

/** BTMC: 모든 표 행, 셀 개수별 위치 배치, 소수 가격. */
public final class BtmcProfile implements VendorProfile {

    @Override public Vendor vendor() { return Vendor.BTMC; }

    @Override
    public PriceExtractor<Double> extractor(Metal metal, FeedConfig.VendorCfg cfg, IPageFetcher fetcher) {
        var layouts = (metal == Metal.GOLD) ? ColumnLayouts.BTMC_GOLD : ColumnLayouts.BTMC_SILVER;
        IRowInterpreter<Double> interpreter = new PositionalRowInterpreter<>(layouts, new DecimalCurrencyParser(), cfg.unitFor(metal));
        return new PriceExtractor<>(Vendor.BTMC, metal, cfg.urlFor(metal),
                fetcher, CssRowLocator.allRows(), interpreter);
    }
}
