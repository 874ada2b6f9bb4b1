package dev.pldb.signal;

import static dev.pldb.fixture.EntityRecordBuilder.entity;
import static org.assertj.core.api.Assertions.assertThat;

import dev.pldb.record.EntityRecord;
import dev.pldb.record.RecordStore;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class SignalExtractorTest {

  private final SignalExtractor extractor = new SignalExtractor(SignalWeights.defaults());

  private static RecordStore storeOf(EntityRecord... records) {
    return new RecordStore(List.of(records));
  }

  @Nested
  class EstimateUsers {

    @Test
    void sumsEverySourceOfTheTable() {
      RecordStore store =
          storeOf(
              entity("lang")
                  .series("linkedInSkill", 2019, 1000)
                  .series("linkedInSkill", 2021, 3000)
                  .series("linkedInSkill", 2020, 2000)
                  .series("subreddit memberCount", 2022, 500)
                  .series("projectEuler members", 2020, 40)
                  .field("meetup members", 100)
                  .field("githubRepo", "https://github.com/lang/lang")
                  .field("githubRepo stars", 250)
                  .field("githubRepo forks", 10)
                  .field("wikipedia", "https://en.wikipedia.org/wiki/Lang")
                  .field("wikipedia dailyPageViews", 120)
                  .field("packageRepository", "https://pkgs.example.org")
                  .build());

      // 3000 + 500 + 40 | 100 + 250 | 20 + 1000 + 600 + 1 + 30
      assertThat(extractor.estimateUsers(store, "lang")).isEqualTo(5541);
    }

    @Test
    void entityWithNoFieldsHasNoUsers() {
      RecordStore store = storeOf(entity("bare").build());

      assertThat(extractor.estimateUsers(store, "bare")).isZero();
    }

    @Test
    void homepageAloneCountsOneUser() {
      RecordStore store = storeOf(entity("tiny").field("website", "https://tiny.dev").build());

      assertThat(extractor.estimateUsers(store, "tiny")).isEqualTo(1);
    }

    @Test
    void blankCustomFieldIsNotPresent() {
      RecordStore store = storeOf(entity("tiny").field("website", "").build());

      assertThat(extractor.estimateUsers(store, "tiny")).isZero();
    }

    @Test
    void forksCountWithoutRepoLinkValue() {
      RecordStore store = storeOf(entity("forked").field("githubRepo forks", "2.5").build());

      // 3 * 2.5 = 7.5 rounds half-up
      assertThat(extractor.estimateUsers(store, "forked")).isEqualTo(8);
    }

    @Test
    void customTableIsSwappable() {
      Map<String, FieldTransform> customs = new LinkedHashMap<>();
      customs.put("book", FieldTransform.constant(42));
      SignalExtractor custom =
          new SignalExtractor(
              new SignalWeights(
                  List.of("members"), List.of("stars"), customs, "skill", 0.5, "jobs"));
      RecordStore store =
          storeOf(
              entity("lang")
                  .series("members", 2020, 10)
                  .field("stars", 5)
                  .field("book", "Learning Lang")
                  .field("website", "https://lang.dev")
                  .build());

      assertThat(custom.estimateUsers(store, "lang")).isEqualTo(57);
    }
  }

  @Nested
  class EstimateJobs {

    @Test
    void onePercentOfSkillPlusJobBoardCount() {
      RecordStore store =
          storeOf(
              entity("lang")
                  .series("linkedInSkill", 2021, 3000)
                  .series("indeedJobs", 2021, 70)
                  .series("indeedJobs", 2022, 80)
                  .build());

      assertThat(extractor.estimateJobs(store, "lang")).isEqualTo(110);
    }

    @Test
    void skillShareIsRounded() {
      RecordStore up = storeOf(entity("up").series("linkedInSkill", 2021, 1260).build());
      RecordStore down = storeOf(entity("down").series("linkedInSkill", 2021, 1240).build());

      assertThat(extractor.estimateJobs(up, "up")).isEqualTo(13);
      assertThat(extractor.estimateJobs(down, "down")).isEqualTo(12);
    }

    @Test
    void noJobDataMeansNoJobs() {
      RecordStore store = storeOf(entity("bare").field("website", "https://x.org").build());

      assertThat(extractor.estimateJobs(store, "bare")).isZero();
    }
  }

  @Test
  void extractCombinesAllFourSignals() {
    RecordStore store =
        storeOf(
            entity("gcc")
                .type("compiler")
                .field("website", "https://gcc.gnu.org")
                .field("githubRepo", "https://github.com/gcc-mirror/gcc")
                .field("githubRepo stars", 900)
                .build());

    Signals signals = extractor.extract(store, "gcc", 4);

    assertThat(signals).isEqualTo(new Signals("gcc", 0, 902, 4, 4));
  }

  @Test
  void negativeFieldValuesCannotProduceNegativeSignals() {
    RecordStore store = storeOf(entity("odd").field("githubRepo stars", -500).build());

    assertThat(extractor.estimateUsers(store, "odd")).isZero();
  }
}
