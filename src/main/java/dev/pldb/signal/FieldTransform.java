package dev.pldb.signal;

/** Maps the raw text of a present field to its contribution to the user estimate. */
@FunctionalInterface
public interface FieldTransform {

  double apply(String rawValue);

  /** Flat contribution for the mere presence of the field. */
  static FieldTransform constant(double contribution) {
    return rawValue -> contribution;
  }

  /** Contribution proportional to the field's numeric value, fractions included. */
  static FieldTransform linear(double factor) {
    return rawValue -> factor * NumericText.leadingDouble(rawValue);
  }

  /** Contribution proportional to the field's leading whole number; any fraction is dropped. */
  static FieldTransform linearWhole(double factor) {
    return rawValue -> factor * NumericText.leadingLong(rawValue);
  }
}
