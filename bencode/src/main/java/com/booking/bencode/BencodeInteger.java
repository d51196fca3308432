package com.booking.bencode;

import java.math.BigInteger;
import java.util.Objects;

/**
 * A bencode integer.
 * <p>
 * Integers have arbitrary precision; {@link #longValue()} is available when the value fits in 64 bits.
 */
public final class BencodeInteger extends BencodeValue {
  private static final BigInteger LONG_MIN = BigInteger.valueOf(Long.MIN_VALUE);
  private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

  private final BigInteger value;

  private BencodeInteger(BigInteger value) {
    this.value = value;
  }

  public static BencodeInteger of(long value) {
    return new BencodeInteger(BigInteger.valueOf(value));
  }

  public static BencodeInteger of(BigInteger value) {
    return new BencodeInteger(Objects.requireNonNull(value, "value"));
  }

  @Override
  public BencodeType type() {
    return BencodeType.INTEGER;
  }

  @Override
  public BencodeInteger asInteger() {
    return this;
  }

  /** {@code true} if the value is in the range of {@code long}. */
  public boolean isLong() {
    return value.compareTo(LONG_MIN) >= 0 && value.compareTo(LONG_MAX) <= 0;
  }

  /**
   * The value as a {@code long}.
   *
   * @throws ArithmeticException if the value does not fit in 64 bits
   */
  public long longValue() {
    return value.longValueExact();
  }

  public BigInteger bigIntegerValue() {
    return value;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof BencodeInteger)) {
      return false;
    }
    return value.equals(((BencodeInteger) o).value);
  }

  @Override
  public int hashCode() {
    return value.hashCode();
  }

  @Override
  public String toString() {
    return value.toString();
  }
}
