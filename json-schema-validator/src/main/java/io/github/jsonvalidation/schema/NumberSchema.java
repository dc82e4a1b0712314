package io.github.jsonvalidation.schema;

import io.github.jsonvalidation.json.JsonNumber;
import io.github.jsonvalidation.json.JsonValue;

import java.math.BigDecimal;

/// Number schema with range and multiple constraints.
///
/// Bounds compare exactly as `BigDecimal`. Draft-04 style boolean
/// `exclusiveMinimum`/`exclusiveMaximum` arrive here already folded into the
/// numeric exclusive bounds.
public record NumberSchema(
    BigDecimal minimum,
    BigDecimal maximum,
    BigDecimal exclusiveMinimum,
    BigDecimal exclusiveMaximum,
    BigDecimal multipleOf
) implements JsonSchema {

  /// Beyond this scale or magnitude the exact remainder gets expensive
  static final int EXACT_SCALE_LIMIT = 64;
  static final double EPSILON = 1e-9;

  @Override
  public void validateAt(JsonPointer at, JsonValue json, ValidationContext context) {
    if (!(json instanceof JsonNumber)) {
      return;
    }
    BigDecimal value = ((JsonNumber) json).toBigDecimal();
    SchemaLogging.LOG.finest(() -> "NumberSchema.validateAt: " + value + " minimum=" + minimum + " maximum=" + maximum);

    if (minimum != null && value.compareTo(minimum) < 0) {
      context.error(at, "minimum", "Below minimum " + display(minimum));
    }
    if (maximum != null && value.compareTo(maximum) > 0) {
      context.error(at, "maximum", "Above maximum " + display(maximum));
    }
    if (exclusiveMinimum != null && value.compareTo(exclusiveMinimum) <= 0) {
      context.error(at, "exclusiveMinimum", "Not above exclusive minimum " + display(exclusiveMinimum));
    }
    if (exclusiveMaximum != null && value.compareTo(exclusiveMaximum) >= 0) {
      context.error(at, "exclusiveMaximum", "Not below exclusive maximum " + display(exclusiveMaximum));
    }
    if (multipleOf != null && !isMultipleOf(value, multipleOf)) {
      context.error(at, "multipleOf", "Not multiple of " + display(multipleOf));
    }
  }

  /// Exact remainder when both operands have moderate scale and magnitude,
  /// otherwise a floating point ratio test with a relative epsilon.
  static boolean isMultipleOf(BigDecimal value, BigDecimal divisor) {
    if (value.signum() == 0) {
      return true;
    }
    if (moderate(value) && moderate(divisor)) {
      return value.remainder(divisor).signum() == 0;
    }
    double ratio = value.doubleValue() / divisor.doubleValue();
    if (!Double.isFinite(ratio)) {
      return false;
    }
    double nearest = Math.rint(ratio);
    return Math.abs(ratio - nearest) <= EPSILON * Math.max(1.0, Math.abs(ratio));
  }

  /// Plain notation unless that would spell out a huge exponent.
  static String display(BigDecimal n) {
    return moderate(n) ? n.toPlainString() : n.toString();
  }

  private static boolean moderate(BigDecimal n) {
    return Math.abs(n.scale()) <= EXACT_SCALE_LIMIT
        && n.precision() - n.scale() <= EXACT_SCALE_LIMIT;
  }
}
