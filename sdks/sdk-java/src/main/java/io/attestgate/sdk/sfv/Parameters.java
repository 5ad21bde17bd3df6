package io.attestgate.sdk.sfv;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

public final class Parameters {
  public static final Parameters EMPTY = new Parameters(new LinkedHashMap<>());

  private final Map<String, BareItem> values;

  private Parameters(LinkedHashMap<String, BareItem> values) {
    this.values = Collections.unmodifiableMap(values);
  }

  public static Builder builder() {
    return new Builder();
  }

  public BareItem get(String key) {
    return values.get(key);
  }

  public boolean containsKey(String key) {
    return values.containsKey(key);
  }

  public Set<String> keys() {
    return values.keySet();
  }

  public Map<String, BareItem> asMap() {
    return values;
  }

  public int size() {
    return values.size();
  }

  public boolean isEmpty() {
    return values.isEmpty();
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof Parameters && ((Parameters) other).values.equals(values);
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  @Override
  public String toString() {
    return StructuredFieldSerializer.serializeParameters(this);
  }

  public static final class Builder {
    private final LinkedHashMap<String, BareItem> values = new LinkedHashMap<>();

    private Builder() {}

    // A repeated key keeps its first position and takes the latest value.
    public Builder put(String key, BareItem value) {
      values.put(Grammar.requireKey(key), Objects.requireNonNull(value, "value"));
      return this;
    }

    public Builder putString(String key, String value) {
      return put(key, BareItem.ofString(value));
    }

    public Builder putInteger(String key, long value) {
      return put(key, BareItem.ofInteger(value));
    }

    public Builder putToken(String key, String value) {
      return put(key, BareItem.ofToken(value));
    }

    public Builder putBoolean(String key, boolean value) {
      return put(key, BareItem.ofBoolean(value));
    }

    public Parameters build() {
      if (values.isEmpty()) {
        return EMPTY;
      }
      return new Parameters(new LinkedHashMap<>(values));
    }
  }
}
