package com.tradepilot.strategy;

import com.tradepilot.domain.enums.PositionSide;
import com.tradepilot.domain.enums.SignalType;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A named rule: when every condition holds, emit {@link #signal}.
 *
 * <p>Rules are evaluated in list order; the first match wins. {@link #appliesTo}
 * restricts a rule to certain mirrored states; an empty set means every state, in
 * which case the evaluator's transition gate may still suppress the signal.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StrategyRule {

    private String name;
    private SignalType signal;

    @Builder.Default
    private Set<PositionSide> appliesTo = EnumSet.noneOf(PositionSide.class);

    @Builder.Default
    private List<RuleCondition> conditions = new ArrayList<>();

    public boolean appliesTo(PositionSide side) {
        return appliesTo == null || appliesTo.isEmpty() || appliesTo.contains(side);
    }

    /** Every indicator key read by this rule's conditions. */
    public Set<String> inputKeys() {
        Set<String> keys = new LinkedHashSet<>();
        conditions.forEach(condition -> keys.addAll(condition.inputKeys()));
        return keys;
    }
}
