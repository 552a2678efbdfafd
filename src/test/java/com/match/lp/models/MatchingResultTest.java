package com.match.lp.models;

import com.match.lp.models.enums.SolveStatus;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MatchingResultTest {

    @Test
    void exposesMatesByVertex() {
        MatchingResult result = MatchingResult.of(SolveStatus.OPTIMAL, 5.0, new int[]{-1, 3, 2, -1});

        assertThat(result.mateOf(2)).isEqualTo(3);
        assertThat(result.isMatched(1)).isFalse();
        assertThat(result.matchedEdges()).containsExactly(Edge.of(2, 3));
        assertThat(result.isSolved()).isTrue();
        assertThat(result.vertexCount()).isEqualTo(4);
    }

    @Test
    void mateArrayCannotBeModifiedFromOutside() {
        int[] mate = {2, 1};
        MatchingResult result = MatchingResult.of(SolveStatus.OPTIMAL, 1.0, mate);

        mate[0] = -1;
        result.getMate()[1] = -1;

        assertThat(result.getMate()).containsExactly(2, 1);
    }

    @Test
    void rejectsAsymmetricMates() {
        assertThatThrownBy(() -> MatchingResult.of(SolveStatus.OPTIMAL, 1.0, new int[]{2, -1}))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> MatchingResult.of(SolveStatus.OPTIMAL, 1.0, new int[]{2, 1, 2}))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> MatchingResult.of(SolveStatus.OPTIMAL, 1.0, new int[]{1}))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void unsolvedLeavesEveryVertexUnmatched() {
        MatchingResult result = MatchingResult.unsolved(SolveStatus.INFEASIBLE, 3);

        assertThat(result.getMate()).containsOnly(MatchingResult.UNMATCHED);
        assertThat(result.getCost()).isZero();
        assertThat(result.isSolved()).isFalse();
    }
}
