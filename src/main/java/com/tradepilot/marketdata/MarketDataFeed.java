package com.tradepilot.marketdata;

import com.tradepilot.domain.model.PriceBar;
import java.util.List;

/**
 * Source of price bars for the execution engine.
 *
 * <p>Bars are delivered at least once and in order within one instrument; different
 * instruments may interleave arbitrarily. The engine polls this feed on a fixed delay
 * and lets the {@link MarketDataCache} drop bars it has already seen.
 *
 * <p>The paper implementation is {@link com.tradepilot.simulator.SyntheticMarketFeed}.
 */
public interface MarketDataFeed {

    /**
     * Fetches the most recent completed bars for an instrument.
     *
     * @param instrumentId the instrument to fetch
     * @param limit        maximum number of bars to return
     * @return bars ordered oldest-first; empty if the feed has nothing yet
     */
    List<PriceBar> recentBars(String instrumentId, int limit);
}
