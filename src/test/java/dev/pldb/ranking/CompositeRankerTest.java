package dev.pldb.ranking;

import static org.assertj.core.api.Assertions.assertThat;

import dev.pldb.signal.Signals;
import java.util.List;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class CompositeRankerTest {

  // Dimension ranks: a = (0, 0, 2, 2), b = (2, 1, 0, 0), c = (1, 2, 1, 0)
  private static final Signals A = new Signals("a", 100, 100, 1, 0);
  private static final Signals B = new Signals("b", 0, 50, 10, 5);
  private static final Signals C = new Signals("c", 50, 10, 5, 5);

  @Nested
  class CompositeRank {

    @Test
    void dropsTheWorstDimension() {
      assertThat(CompositeRanker.compositeRank(50, 1, 2, 3)).isEqualTo(6);
    }

    @Test
    void worstDimensionMayBeAnyOfTheFour() {
      assertThat(CompositeRanker.compositeRank(1, 50, 2, 3)).isEqualTo(6);
      assertThat(CompositeRanker.compositeRank(1, 2, 50, 3)).isEqualTo(6);
      assertThat(CompositeRanker.compositeRank(1, 2, 3, 50)).isEqualTo(6);
    }

    @Test
    void equalWorstRanksDropOnlyOne() {
      assertThat(CompositeRanker.compositeRank(4, 4, 4, 4)).isEqualTo(12);
      assertThat(CompositeRanker.compositeRank(0, 0, 0, 0)).isZero();
    }
  }

  @Nested
  class Order {

    @Test
    void sortsByCompositeAscending() {
      List<RankedEntity> ordering = CompositeRanker.order(List.of(A, B, C));

      assertThat(ordering).extracting(RankedEntity::entityId).containsExactly("b", "a", "c");
      assertThat(ordering).extracting(RankedEntity::index).containsExactly(0, 1, 2);
    }

    @Test
    void equalCompositesKeepEnumerationOrder() {
      List<RankedEntity> ordering = CompositeRanker.order(List.of(C, A, B));

      // a and c both total 2; c is enumerated first
      assertThat(ordering).extracting(RankedEntity::entityId).containsExactly("b", "c", "a");
    }

    @Test
    void explanationCarriesDimensionRanks() {
      List<RankedEntity> ordering = CompositeRanker.order(List.of(A, B, C));

      assertThat(ordering.get(1).explanation()).isEqualTo(new RankExplanation(0, 0, 2, 2, 2));
      assertThat(ordering.get(0).explanation()).isEqualTo(new RankExplanation(2, 1, 0, 0, 1));
      assertThat(ordering.get(2).explanation()).isEqualTo(new RankExplanation(1, 2, 1, 0, 2));
    }

    @Test
    void outlierDimensionDoesNotSinkAStrongEntity() {
      Signals noJobData = new Signals("strong", 0, 1000, 100, 50);
      Signals average = new Signals("average", 10, 500, 50, 25);
      Signals weak = new Signals("weak", 5, 10, 5, 1);

      List<RankedEntity> ordering = CompositeRanker.order(List.of(average, weak, noJobData));

      assertThat(ordering.get(0).entityId()).isEqualTo("strong");
    }

    @Test
    void emptyScopeHasEmptyOrdering() {
      assertThat(CompositeRanker.order(List.of())).isEmpty();
    }
  }

  @Test
  void debugStringListsEveryRank() {
    assertThat(new RankExplanation(50, 1, 2, 3, 6).toDebugString())
        .isEqualTo("TotalRank: 6 Jobs: 50 Users: 1 Facts: 2 Links: 3");
  }
}
