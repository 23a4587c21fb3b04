package com.tradepilot.simulator;

import java.util.HashMap;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Paper trading settings bound from {@code tradepilot.simulator}.
 *
 * <p>{@code lostAckProbability} makes the paper exchange accept an order but never
 * acknowledge it, which exercises the retry path and fill-before-ack handling.
 */
@Data
@ConfigurationProperties(prefix = "tradepilot.simulator")
public class SimulatorConfig {

    /** Delay before an accepted order is acknowledged. */
    private long ackLatencyMs = 50;

    /** Delay between the ack and the fill. */
    private long fillDelayMs = 20;

    /** Slippage applied to market fills, in basis points. */
    private int slippageBps = 5;

    private double rejectProbability = 0.0;

    private double lostAckProbability = 0.0;

    /** Random seed for the exchange and the synthetic feed. */
    private long seed = 42L;

    private long barIntervalSeconds = 60;

    /** Standard deviation of the per-bar log return. */
    private double volatility = 0.002;

    /** Bars generated behind the current time on first access. */
    private int historyBars = 200;

    private double defaultStartPrice = 100.0;

    /** Per-instrument starting price, e.g. {@code BTC-USDT: 60000}. */
    private Map<String, Double> startPrices = new HashMap<>();
}
