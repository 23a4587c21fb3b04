package com.tradepilot.config;

import com.tradepilot.domain.model.Instrument;
import com.tradepilot.exception.ResourceNotFoundException;
import java.math.BigDecimal;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Immutable lookup of the configured instruments, loaded once at startup.
 *
 * <p>Validates each entry (id present, positive lot size) and fails startup on a bad
 * entry rather than trading with a half-loaded universe.
 */
@Component
public class InstrumentRegistry {

    private static final Logger log = LoggerFactory.getLogger(InstrumentRegistry.class);

    private final Map<String, Instrument> instruments;

    public InstrumentRegistry(InstrumentProperties instrumentProperties) {
        Map<String, Instrument> loaded = new LinkedHashMap<>();
        for (InstrumentProperties.Entry entry : instrumentProperties.getInstruments()) {
            Instrument instrument = toInstrument(entry);
            if (loaded.putIfAbsent(instrument.getId(), instrument) != null) {
                throw new IllegalStateException("Duplicate instrument in configuration: " + instrument.getId());
            }
        }
        this.instruments = Collections.unmodifiableMap(loaded);
        log.info("Loaded {} instruments: {}", instruments.size(), instruments.keySet());
    }

    public Collection<Instrument> getAll() {
        return instruments.values();
    }

    public Optional<Instrument> find(String instrumentId) {
        return Optional.ofNullable(instruments.get(instrumentId));
    }

    public Instrument get(String instrumentId) {
        return find(instrumentId).orElseThrow(() -> new ResourceNotFoundException("Instrument", instrumentId));
    }

    private Instrument toInstrument(InstrumentProperties.Entry entry) {
        if (entry.getId() == null || entry.getId().isBlank()) {
            throw new IllegalStateException("Instrument entry without id");
        }
        if (entry.getLotSize() == null || entry.getLotSize().compareTo(BigDecimal.ZERO) <= 0) {
            throw new IllegalStateException("Instrument " + entry.getId() + " must have a positive lot size");
        }
        if (entry.getOrderLots() < 1) {
            throw new IllegalStateException("Instrument " + entry.getId() + " must trade at least one lot");
        }
        return Instrument.builder()
                .id(entry.getId())
                .tickSize(entry.getTickSize())
                .lotSize(entry.getLotSize())
                .minOrderSize(entry.getMinOrderSize() != null ? entry.getMinOrderSize() : entry.getLotSize())
                .maxPositionSize(entry.getMaxPositionSize())
                .maxNotional(entry.getMaxNotional())
                .orderLots(entry.getOrderLots())
                .build();
    }
}
