package dev.pldb.ranking;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DimensionRankerTest {

  @Test
  void tiesShareTheBetterRankAndLeaveAGap() {
    Map<String, Integer> ranks =
        DimensionRanker.rank(
            List.of(
                new ScoredEntity("a", 10),
                new ScoredEntity("b", 10),
                new ScoredEntity("c", 8),
                new ScoredEntity("d", 5)));

    assertThat(ranks)
        .containsEntry("a", 0)
        .containsEntry("b", 0)
        .containsEntry("c", 2)
        .containsEntry("d", 3);
  }

  @Test
  void inputOrderDoesNotMatter() {
    Map<String, Integer> ranks =
        DimensionRanker.rank(
            List.of(
                new ScoredEntity("d", 5),
                new ScoredEntity("b", 10),
                new ScoredEntity("c", 8),
                new ScoredEntity("a", 10)));

    assertThat(ranks)
        .containsEntry("a", 0)
        .containsEntry("b", 0)
        .containsEntry("c", 2)
        .containsEntry("d", 3);
  }

  @Test
  void trailingTieGroupTakesPositionOfItsFirstMember() {
    Map<String, Integer> ranks =
        DimensionRanker.rank(
            List.of(
                new ScoredEntity("a", 3),
                new ScoredEntity("b", 1),
                new ScoredEntity("c", 0),
                new ScoredEntity("d", 0),
                new ScoredEntity("e", 0)));

    assertThat(ranks.values()).containsExactly(0, 1, 2, 2, 2);
  }

  @Test
  void allEqualValuesAllRankZero() {
    Map<String, Integer> ranks =
        DimensionRanker.rank(
            List.of(new ScoredEntity("a", 0), new ScoredEntity("b", 0), new ScoredEntity("c", 0)));

    assertThat(ranks.values()).containsOnly(0);
  }

  @Test
  void fractionalValuesRankLikeIntegers() {
    Map<String, Integer> ranks =
        DimensionRanker.rank(List.of(new ScoredEntity("a", 0.5), new ScoredEntity("b", 0.75)));

    assertThat(ranks).containsEntry("b", 0).containsEntry("a", 1);
  }

  @Test
  void emptyInputGivesEmptyRanks() {
    assertThat(DimensionRanker.rank(List.of())).isEmpty();
  }

  @Test
  void singleEntityRanksFirst() {
    assertThat(DimensionRanker.rank(List.of(new ScoredEntity("only", 42))))
        .containsExactly(Map.entry("only", 0));
  }
}
