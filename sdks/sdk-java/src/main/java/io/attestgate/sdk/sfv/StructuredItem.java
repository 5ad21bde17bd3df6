package io.attestgate.sdk.sfv;

import java.util.List;
import java.util.Objects;

public final class StructuredItem {
  private final BareItem bareItem;
  private final List<StructuredItem> innerList;
  private final Parameters parameters;

  private StructuredItem(BareItem bareItem, List<StructuredItem> innerList, Parameters parameters) {
    this.bareItem = bareItem;
    this.innerList = innerList;
    this.parameters = parameters;
  }

  public static StructuredItem of(BareItem value) {
    return of(value, Parameters.EMPTY);
  }

  public static StructuredItem of(BareItem value, Parameters parameters) {
    return new StructuredItem(
        Objects.requireNonNull(value, "value"),
        null,
        parameters == null ? Parameters.EMPTY : parameters);
  }

  public static StructuredItem innerList(List<StructuredItem> items, Parameters parameters) {
    Objects.requireNonNull(items, "items");
    for (StructuredItem item : items) {
      if (item.isInnerList()) {
        throw new IllegalArgumentException("Inner lists cannot be nested");
      }
    }
    return new StructuredItem(
        null,
        List.copyOf(items),
        parameters == null ? Parameters.EMPTY : parameters);
  }

  public boolean isInnerList() {
    return innerList != null;
  }

  public BareItem bareItem() {
    if (bareItem == null) {
      throw new IllegalStateException("Structured field value is an inner list");
    }
    return bareItem;
  }

  public List<StructuredItem> innerList() {
    if (innerList == null) {
      throw new IllegalStateException("Structured field value is not an inner list");
    }
    return innerList;
  }

  public Parameters parameters() {
    return parameters;
  }

  @Override
  public boolean equals(Object other) {
    if (!(other instanceof StructuredItem)) {
      return false;
    }
    StructuredItem that = (StructuredItem) other;
    return Objects.equals(bareItem, that.bareItem)
        && Objects.equals(innerList, that.innerList)
        && parameters.equals(that.parameters);
  }

  @Override
  public int hashCode() {
    return Objects.hash(bareItem, innerList, parameters);
  }

  @Override
  public String toString() {
    return StructuredFieldSerializer.serializeItem(this);
  }
}
