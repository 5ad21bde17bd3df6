package io.attestgate.sdk.sfv;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

public final class StructuredDictionary {
  public static final StructuredDictionary EMPTY = new StructuredDictionary(new LinkedHashMap<>());

  private final Map<String, StructuredItem> members;

  private StructuredDictionary(LinkedHashMap<String, StructuredItem> members) {
    this.members = Collections.unmodifiableMap(members);
  }

  public static Builder builder() {
    return new Builder();
  }

  public StructuredItem get(String key) {
    return members.get(key);
  }

  public boolean containsKey(String key) {
    return members.containsKey(key);
  }

  public Set<String> keys() {
    return members.keySet();
  }

  public Map<String, StructuredItem> asMap() {
    return members;
  }

  public int size() {
    return members.size();
  }

  public boolean isEmpty() {
    return members.isEmpty();
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof StructuredDictionary && ((StructuredDictionary) other).members.equals(members);
  }

  @Override
  public int hashCode() {
    return members.hashCode();
  }

  @Override
  public String toString() {
    return StructuredFieldSerializer.serializeDictionary(this);
  }

  public static final class Builder {
    private final LinkedHashMap<String, StructuredItem> members = new LinkedHashMap<>();

    private Builder() {}

    public Builder put(String key, StructuredItem member) {
      members.put(Grammar.requireKey(key), Objects.requireNonNull(member, "member"));
      return this;
    }

    public Builder put(String key, BareItem value) {
      return put(key, StructuredItem.of(value));
    }

    public StructuredDictionary build() {
      if (members.isEmpty()) {
        return EMPTY;
      }
      return new StructuredDictionary(new LinkedHashMap<>(members));
    }
  }
}
