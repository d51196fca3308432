package com.booking.bencode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A bencode dictionary, mapping {@link BencodeString} keys to values.
 * <p>
 * Keys are unique. Iteration follows insertion order, while equality does not depend on it:
 * {@link Encoder} always writes entries sorted by key, so two equal dictionaries encode to identical bytes.
 */
public final class BencodeDictionary extends BencodeValue {
  private static final BencodeDictionary EMPTY =
      new BencodeDictionary(Collections.<BencodeString, BencodeValue>emptyMap());

  private final Map<BencodeString, BencodeValue> entries;

  private BencodeDictionary(Map<BencodeString, BencodeValue> entries) {
    this.entries = entries;
  }

  public static BencodeDictionary empty() {
    return EMPTY;
  }

  /** Copies {@code entries}; {@code null} keys or values are rejected. */
  public static BencodeDictionary of(Map<BencodeString, ? extends BencodeValue> entries) {
    Objects.requireNonNull(entries, "entries");
    Builder builder = builder();
    for (Map.Entry<BencodeString, ? extends BencodeValue> entry : entries.entrySet()) {
      builder.put(entry.getKey(), entry.getValue());
    }
    return builder.build();
  }

  public static Builder builder() {
    return new Builder();
  }

  // takes ownership, used by the decoder
  static BencodeDictionary wrap(Map<BencodeString, BencodeValue> entries) {
    return entries.isEmpty() ? EMPTY : new BencodeDictionary(Collections.unmodifiableMap(entries));
  }

  @Override
  public BencodeType type() {
    return BencodeType.DICTIONARY;
  }

  @Override
  public BencodeDictionary asDictionary() {
    return this;
  }

  public int size() {
    return entries.size();
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }

  public boolean containsKey(BencodeString key) {
    return entries.containsKey(key);
  }

  /** The value for {@code key}, or {@code null}. */
  public BencodeValue get(BencodeString key) {
    return entries.get(key);
  }

  /** The value for the UTF-8 encoding of {@code key}, or {@code null}. */
  public BencodeValue get(String key) {
    return entries.get(BencodeString.of(key));
  }

  /** Unmodifiable view of the entries, in insertion order. */
  public Map<BencodeString, BencodeValue> entries() {
    return entries;
  }

  /** The entries in canonical (ascending unsigned byte) key order. */
  public List<Map.Entry<BencodeString, BencodeValue>> sortedEntries() {
    List<Map.Entry<BencodeString, BencodeValue>> sorted = new ArrayList<>(entries.entrySet());
    sorted.sort(Map.Entry.comparingByKey());
    return sorted;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof BencodeDictionary)) {
      return false;
    }
    return entries.equals(((BencodeDictionary) o).entries);
  }

  @Override
  public int hashCode() {
    return entries.hashCode();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("{");
    boolean first = true;
    for (Map.Entry<BencodeString, BencodeValue> entry : sortedEntries()) {
      if (!first) {
        sb.append(", ");
      }
      first = false;
      sb.append(entry.getKey()).append('=').append(entry.getValue());
    }
    return sb.append('}').toString();
  }

  /**
   * Accumulates dictionary entries. Adding the same key twice is an error.
   */
  public static final class Builder {
    private Map<BencodeString, BencodeValue> entries = new LinkedHashMap<>();

    private Builder() {
    }

    public Builder put(BencodeString key, BencodeValue value) {
      Objects.requireNonNull(key, "key");
      Objects.requireNonNull(value, "value");
      if (entries == null) {
        throw new IllegalStateException("build() already called");
      }
      if (entries.putIfAbsent(key, value) != null) {
        throw new IllegalArgumentException("Duplicate dictionary key " + key);
      }
      return this;
    }

    public Builder put(String key, BencodeValue value) {
      return put(BencodeString.of(key), value);
    }

    public Builder put(String key, String value) {
      return put(BencodeString.of(key), BencodeString.of(value));
    }

    public Builder put(String key, long value) {
      return put(BencodeString.of(key), BencodeInteger.of(value));
    }

    /** Can be called once; the builder is unusable afterwards. */
    public BencodeDictionary build() {
      if (entries == null) {
        throw new IllegalStateException("build() already called");
      }
      Map<BencodeString, BencodeValue> built = entries;
      entries = null;
      return wrap(built);
    }
  }
}
