package dev.pldb.signal;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TimeSeriesTest {

  @Test
  void returnsValueOfLargestYear() {
    Map<String, String> series = new LinkedHashMap<>();
    series.put("2019", "5");
    series.put("2021", "12");
    series.put("2020", "9");

    assertThat(TimeSeries.latestValue(series)).isEqualTo(12);
  }

  @Test
  void absentOrEmptySeriesIsZero() {
    assertThat(TimeSeries.latestValue(null)).isZero();
    assertThat(TimeSeries.latestValue(Map.of())).isZero();
  }

  @Test
  void nonNumericKeysAreIgnored() {
    Map<String, String> series = new LinkedHashMap<>();
    series.put("value", "999999");
    series.put("2018", "7");
    series.put("latest", "100");

    assertThat(TimeSeries.latestValue(series)).isEqualTo(7);
  }

  @Test
  void seriesWithOnlyNonNumericKeysIsZero() {
    assertThat(TimeSeries.latestValue(Map.of("value", "12", "n/a", "3"))).isZero();
  }

  @Test
  void keysCompareNumericallyNotLexically() {
    assertThat(TimeSeries.latestValue(Map.of("999", "1", "2001", "2"))).isEqualTo(2);
  }

  @Test
  void valuesAreReadByLeadingInteger() {
    assertThat(TimeSeries.latestValue(Map.of("2022", "1200 members"))).isEqualTo(1200);
    assertThat(TimeSeries.latestValue(Map.of("2022", "unknown"))).isZero();
  }

  @Test
  void overflowingKeysAreIgnored() {
    assertThat(TimeSeries.latestValue(Map.of("99999999999999999999", "5"))).isZero();
    assertThat(TimeSeries.latestValue(Map.of("99999999999999999999", "5", "2020", "3")))
        .isEqualTo(3);
  }
}
