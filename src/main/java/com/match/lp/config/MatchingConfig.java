package com.match.lp.config;

import com.match.lp.models.enums.FractionalValuePolicy;
import com.match.lp.processors.SolutionExtractor;
import com.match.lp.solver.LinearSolver;
import com.match.lp.solver.OjAlgoLinearSolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class MatchingConfig {

    @Bean
    public LinearSolver linearSolver(@Value("${matching.solver.time-limit-ms:0}") long timeLimitMillis) {
        log.info("Using ojAlgo solver, timeLimitMillis={}", timeLimitMillis);
        return new OjAlgoLinearSolver(timeLimitMillis);
    }

    @Bean
    public ExtractionConfig extractionConfig(
            @Value("${matching.tolerance:1e-5}") double tolerance,
            @Value("${matching.fractional-policy:REJECT}") FractionalValuePolicy fractionalPolicy) {
        return ExtractionConfig.builder()
                .tolerance(tolerance)
                .fractionalPolicy(fractionalPolicy)
                .build();
    }

    @Bean
    public SolutionExtractor solutionExtractor(ExtractionConfig extractionConfig) {
        return new SolutionExtractor(extractionConfig);
    }
}
