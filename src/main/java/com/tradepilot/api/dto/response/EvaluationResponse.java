package com.tradepilot.api.dto.response;

import com.tradepilot.domain.enums.PositionSide;
import com.tradepilot.domain.enums.SignalType;
import com.tradepilot.domain.model.Signal;
import com.tradepilot.engine.CycleResult;
import com.tradepilot.strategy.EvaluationOutcome;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of an operator-triggered evaluation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EvaluationResponse {

    private String instrumentId;
    private EvaluationOutcome outcome;
    private PositionSide state;
    private SignalType signal;
    private String rule;
    private Long sequence;

    /** Indicator values the rules saw. NaN values are omitted. */
    private Map<String, Double> indicators;

    private OrderResponse order;
    private String error;

    public static EvaluationResponse from(CycleResult result) {
        EvaluationResponseBuilder builder = EvaluationResponse.builder()
                .instrumentId(result.instrumentId())
                .error(result.error());
        if (result.evaluation() != null) {
            builder.outcome(result.evaluation().outcome()).state(result.evaluation().state());
            Signal signal = result.evaluation().signal();
            if (signal != null) {
                builder.signal(signal.type()).rule(signal.ruleName()).sequence(signal.sequence());
                if (signal.snapshot() != null) {
                    builder.indicators(signal.snapshot().getValues().entrySet().stream()
                            .filter(entry -> !Double.isNaN(entry.getValue()))
                            .collect(Collectors.toMap(
                                    Map.Entry::getKey, Map.Entry::getValue, (a, b) -> a, TreeMap::new)));
                }
            }
        }
        if (result.order() != null) {
            builder.order(OrderResponse.from(result.order()));
        }
        return builder.build();
    }
}
