package com.tradepilot.config;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Instrument list bound from application.yml under {@code tradepilot.instruments}.
 *
 * <p>Each entry carries the instrument's trading constraints and its per-instrument
 * risk limits. Entries are converted once into immutable
 * {@link com.tradepilot.domain.model.Instrument}s by {@link InstrumentRegistry}.
 */
@Data
@ConfigurationProperties(prefix = "tradepilot")
public class InstrumentProperties {

    private List<Entry> instruments = new ArrayList<>();

    @Data
    public static class Entry {

        private String id;
        private BigDecimal tickSize = new BigDecimal("0.01");
        private BigDecimal lotSize = BigDecimal.ONE;
        private BigDecimal minOrderSize;

        /** Max absolute position size. Null = unlimited. */
        private BigDecimal maxPositionSize;

        /** Max position notional at mark price. Null = unlimited. */
        private BigDecimal maxNotional;

        private int orderLots = 1;
    }
}
