package com.match.lp.solver;

import com.match.lp.models.enums.VariableDomain;
import lombok.Builder;
import lombok.Value;

/**
 * Handle to a variable declared on a {@link LinearModel}. Only meaningful for the model that issued it.
 */
@Value
@Builder
public class DecisionVariable {
    int index;
    String name;
    double lowerBound;
    double upperBound;
    VariableDomain domain;

    public boolean isInteger() {
        return domain == VariableDomain.INTEGER;
    }
}
