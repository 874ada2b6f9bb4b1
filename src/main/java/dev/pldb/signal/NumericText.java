package dev.pldb.signal;

import java.util.OptionalLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;

/**
 * Lenient parsing of numbers out of record text. Record fields are hand-edited, so values such as
 * {@code "1200 members"} or {@code "35.5"} are read by their leading numeric prefix; text with no
 * numeric prefix reads as zero.
 */
final class NumericText {

  private static final Pattern LEADING_INTEGER = Pattern.compile("^\\s*([+-]?\\d+)");
  private static final Pattern LEADING_NUMBER = Pattern.compile("^\\s*([+-]?(\\d+(\\.\\d*)?|\\.\\d+))");
  private static final Pattern STRICT_INTEGER = Pattern.compile("^\\s*[+-]?\\d+\\s*$");

  private NumericText() {}

  /** Leading integer prefix, 0 if there is none or it overflows. */
  static long leadingLong(@Nullable String text) {
    if (text == null) {
      return 0L;
    }
    Matcher matcher = LEADING_INTEGER.matcher(text);
    if (!matcher.find()) {
      return 0L;
    }
    try {
      return Long.parseLong(matcher.group(1));
    } catch (NumberFormatException e) {
      return 0L;
    }
  }

  /** Leading decimal prefix, 0 if there is none. */
  static double leadingDouble(@Nullable String text) {
    if (text == null) {
      return 0.0;
    }
    Matcher matcher = LEADING_NUMBER.matcher(text);
    return matcher.find() ? Double.parseDouble(matcher.group(1)) : 0.0;
  }

  /**
   * The value of text that is entirely an integer (surrounding whitespace allowed); empty for any
   * other text, including integers that overflow a {@code long}.
   */
  static OptionalLong strictLong(@Nullable String text) {
    if (text == null || !STRICT_INTEGER.matcher(text).matches()) {
      return OptionalLong.empty();
    }
    try {
      return OptionalLong.of(Long.parseLong(text.trim()));
    } catch (NumberFormatException e) {
      return OptionalLong.empty();
    }
  }
}
