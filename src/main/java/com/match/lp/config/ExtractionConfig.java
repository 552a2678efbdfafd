package com.match.lp.config;

import com.match.lp.models.enums.FractionalValuePolicy;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class ExtractionConfig {
    public static final double DEFAULT_TOLERANCE = 1e-5;

    @Builder.Default
    private final double tolerance = DEFAULT_TOLERANCE;
    @Builder.Default
    private final FractionalValuePolicy fractionalPolicy = FractionalValuePolicy.REJECT;
}
