package com.booking.bencode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * A bencode list: an ordered sequence of values.
 */
public final class BencodeList extends BencodeValue implements Iterable<BencodeValue> {
  private static final BencodeList EMPTY = new BencodeList(Collections.<BencodeValue>emptyList());

  private final List<BencodeValue> values;

  private BencodeList(List<BencodeValue> values) {
    this.values = values;
  }

  public static BencodeList of(BencodeValue... values) {
    return of(Arrays.asList(values));
  }

  /** Copies {@code values}; {@code null} elements are rejected. */
  public static BencodeList of(List<? extends BencodeValue> values) {
    Objects.requireNonNull(values, "values");
    if (values.isEmpty()) {
      return EMPTY;
    }
    List<BencodeValue> copy = new ArrayList<>(values.size());
    for (BencodeValue value : values) {
      copy.add(Objects.requireNonNull(value, "list element"));
    }
    return new BencodeList(Collections.unmodifiableList(copy));
  }

  // takes ownership, used by the decoder
  static BencodeList wrap(List<BencodeValue> values) {
    return values.isEmpty() ? EMPTY : new BencodeList(Collections.unmodifiableList(values));
  }

  @Override
  public BencodeType type() {
    return BencodeType.LIST;
  }

  @Override
  public BencodeList asList() {
    return this;
  }

  public int size() {
    return values.size();
  }

  public boolean isEmpty() {
    return values.isEmpty();
  }

  public BencodeValue get(int index) {
    return values.get(index);
  }

  /** Unmodifiable view of the elements. */
  public List<BencodeValue> values() {
    return values;
  }

  @Override
  public Iterator<BencodeValue> iterator() {
    return values.iterator();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof BencodeList)) {
      return false;
    }
    return values.equals(((BencodeList) o).values);
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  @Override
  public String toString() {
    return values.toString();
  }
}
