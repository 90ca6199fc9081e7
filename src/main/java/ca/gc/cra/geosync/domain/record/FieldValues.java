package ca.gc.cra.geosync.domain.record;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.OptionalDouble;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Scalar value helpers shared by records, the merger, and the adapters.
 * <p><strong>Why:</strong> Sources report missing data as {@code null}, JSON {@code null}, NaN, or simply by
 * omitting a field. Every one of those collapses to {@link #ABSENT} so two missing values always compare
 * equal and a missing value never masquerades as data.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class FieldValues {
  /** Single sentinel standing in for every flavor of missing value. */
  public static final Object ABSENT = Absent.INSTANCE;

  private static final Pattern INTEGRAL = Pattern.compile("^[+-]?\\d{1,18}$");

  private FieldValues() {
    // Utility
  }

  /**
   * Maps {@code null} and NaN to {@link #ABSENT}; any other value is returned unchanged.
   *
   * @param value raw value
   * @return normalized value, never {@code null}
   */
  public static Object normalize(Object value) {
    if (value == null) {
      return ABSENT;
    }
    if (value instanceof Double d && d.isNaN()) {
      return ABSENT;
    }
    if (value instanceof Float f && f.isNaN()) {
      return ABSENT;
    }
    return value;
  }

  /**
   * Returns whether the value is missing in any of its representations.
   *
   * @param value candidate value
   * @return {@code true} when the value normalizes to {@link #ABSENT}
   */
  public static boolean isAbsent(Object value) {
    return normalize(value) == ABSENT;
  }

  /**
   * Normalizes a primary-key value so equal identifiers compare equal regardless of source typing.
   * Integral numbers and integral strings become {@code Long}; other strings are trimmed.
   *
   * @param value raw key value
   * @return comparable key, or {@link #ABSENT} when the key is missing or blank
   */
  public static Object normalizeKey(Object value) {
    Object normalized = normalize(value);
    if (normalized == ABSENT) {
      return ABSENT;
    }
    if (normalized instanceof Long || normalized instanceof Integer
        || normalized instanceof Short || normalized instanceof Byte) {
      return ((Number) normalized).longValue();
    }
    if (normalized instanceof BigInteger big && big.bitLength() < 64) {
      return big.longValue();
    }
    if (normalized instanceof Double || normalized instanceof Float || normalized instanceof BigDecimal) {
      double d = ((Number) normalized).doubleValue();
      if (!Double.isInfinite(d) && d == Math.rint(d) && Math.abs(d) < 9.0e15) {
        return (long) d;
      }
      return normalized;
    }
    if (normalized instanceof String text) {
      String trimmed = text.trim();
      if (trimmed.isEmpty()) {
        return ABSENT;
      }
      if (INTEGRAL.matcher(trimmed).matches()) {
        return Long.parseLong(trimmed.startsWith("+") ? trimmed.substring(1) : trimmed);
      }
      return trimmed;
    }
    return normalized;
  }

  /**
   * Reads a value as a double when it is numeric or a numeric string.
   *
   * @param value candidate value
   * @return numeric view, empty when the value is absent or not a number
   */
  public static OptionalDouble toDouble(Object value) {
    Object normalized = normalize(value);
    if (normalized instanceof Number number) {
      double d = number.doubleValue();
      return Double.isFinite(d) ? OptionalDouble.of(d) : OptionalDouble.empty();
    }
    if (normalized instanceof String text && !text.isBlank()) {
      try {
        double d = Double.parseDouble(text.trim().replace(',', '.'));
        return Double.isFinite(d) ? OptionalDouble.of(d) : OptionalDouble.empty();
      } catch (NumberFormatException ex) {
        return OptionalDouble.empty();
      }
    }
    return OptionalDouble.empty();
  }

  /**
   * Compares two field values after normalization. Numbers compare by value, so {@code 1} and
   * {@code 1L} are the same.
   *
   * @param left first value
   * @param right second value
   * @return {@code true} when both values denote the same datum
   */
  public static boolean sameValue(Object left, Object right) {
    Object a = normalize(left);
    Object b = normalize(right);
    if (a == ABSENT || b == ABSENT) {
      return a == b;
    }
    if (a instanceof Number na && b instanceof Number nb) {
      if (isIntegral(na) && isIntegral(nb)) {
        return na.longValue() == nb.longValue();
      }
      return Double.compare(na.doubleValue(), nb.doubleValue()) == 0;
    }
    return a.equals(b);
  }

  private static boolean isIntegral(Number n) {
    return n instanceof Long || n instanceof Integer || n instanceof Short || n instanceof Byte;
  }

  private enum Absent {
    INSTANCE;

    @Override
    public String toString() {
      return "<absent>";
    }
  }
}
