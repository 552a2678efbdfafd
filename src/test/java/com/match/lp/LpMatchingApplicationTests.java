package com.match.lp;

import com.match.lp.models.Graph;
import com.match.lp.models.MatchingResult;
import com.match.lp.models.SimpleUndirectedGraph;
import com.match.lp.models.enums.SolveStatus;
import com.match.lp.service.MatchingService;
import com.match.lp.solver.LinearSolver;
import com.match.lp.solver.OjAlgoLinearSolver;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@SpringBootTest
class LpMatchingApplicationTests {

    @Autowired
    private MatchingService matchingService;

    @Autowired
    private LinearSolver linearSolver;

    @Test
    void wiresOjAlgoBackedService() {
        assertThat(linearSolver).isInstanceOf(OjAlgoLinearSolver.class);

        Graph square = SimpleUndirectedGraph.of(4, new int[]{1, 2}, new int[]{2, 3}, new int[]{3, 4}, new int[]{1, 4});
        MatchingResult result = matchingService.maximumWeightMatching(square);

        assertThat(result.getStatus()).isEqualTo(SolveStatus.OPTIMAL);
        assertThat(result.getCost()).isCloseTo(2.0, within(1e-6));
        assertThat(result.getMate()).doesNotContain(MatchingResult.UNMATCHED);
    }
}
