package io.attestgate.sdk.sfv;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.Map;

public final class StructuredFieldSerializer {
  private static final char[] HEX = "0123456789abcdef".toCharArray();

  private StructuredFieldSerializer() {}

  public static String serializeItem(StructuredItem item) {
    StringBuilder builder = new StringBuilder();
    appendItemOrInnerList(builder, item);
    return builder.toString();
  }

  public static String serializeList(List<StructuredItem> members) {
    StringBuilder builder = new StringBuilder();
    for (int i = 0; i < members.size(); i++) {
      if (i > 0) {
        builder.append(", ");
      }
      appendItemOrInnerList(builder, members.get(i));
    }
    return builder.toString();
  }

  public static String serializeDictionary(StructuredDictionary dictionary) {
    StringBuilder builder = new StringBuilder();
    boolean first = true;
    for (Map.Entry<String, StructuredItem> entry : dictionary.asMap().entrySet()) {
      if (!first) {
        builder.append(", ");
      }
      first = false;
      builder.append(entry.getKey());
      StructuredItem member = entry.getValue();
      if (!member.isInnerList() && BareItem.TRUE.equals(member.bareItem())) {
        appendParameters(builder, member.parameters());
        continue;
      }
      builder.append('=');
      appendItemOrInnerList(builder, member);
    }
    return builder.toString();
  }

  public static String serializeInnerList(List<StructuredItem> items, Parameters parameters) {
    StringBuilder builder = new StringBuilder();
    appendInnerList(builder, items, parameters);
    return builder.toString();
  }

  public static String serializeParameters(Parameters parameters) {
    StringBuilder builder = new StringBuilder();
    appendParameters(builder, parameters);
    return builder.toString();
  }

  public static String serializeBareItem(BareItem item) {
    StringBuilder builder = new StringBuilder();
    appendBareItem(builder, item);
    return builder.toString();
  }

  private static void appendItemOrInnerList(StringBuilder builder, StructuredItem item) {
    if (item.isInnerList()) {
      appendInnerList(builder, item.innerList(), item.parameters());
      return;
    }
    appendBareItem(builder, item.bareItem());
    appendParameters(builder, item.parameters());
  }

  private static void appendInnerList(StringBuilder builder, List<StructuredItem> items, Parameters parameters) {
    builder.append('(');
    for (int i = 0; i < items.size(); i++) {
      if (i > 0) {
        builder.append(' ');
      }
      StructuredItem item = items.get(i);
      appendBareItem(builder, item.bareItem());
      appendParameters(builder, item.parameters());
    }
    builder.append(')');
    appendParameters(builder, parameters);
  }

  private static void appendParameters(StringBuilder builder, Parameters parameters) {
    if (parameters == null) {
      return;
    }
    for (Map.Entry<String, BareItem> parameter : parameters.asMap().entrySet()) {
      builder.append(';').append(parameter.getKey());
      if (BareItem.TRUE.equals(parameter.getValue())) {
        continue;
      }
      builder.append('=');
      appendBareItem(builder, parameter.getValue());
    }
  }

  private static void appendBareItem(StringBuilder builder, BareItem item) {
    switch (item.type()) {
      case BOOLEAN:
        builder.append(item.booleanValue() ? "?1" : "?0");
        break;
      case INTEGER:
        builder.append(item.longValue());
        break;
      case DECIMAL:
        appendDecimal(builder, item.decimalValue());
        break;
      case STRING:
        appendString(builder, item.stringValue());
        break;
      case TOKEN:
        builder.append(item.stringValue());
        break;
      case BYTE_SEQUENCE:
        builder.append(':').append(Base64.getEncoder().encodeToString(item.bytesValue())).append(':');
        break;
      case DATE:
        builder.append('@').append(item.longValue());
        break;
      case DISPLAY_STRING:
        appendDisplayString(builder, item.stringValue());
        break;
      default:
        throw new IllegalStateException("Unhandled structured field type " + item.type());
    }
  }

  private static void appendDecimal(StringBuilder builder, BigDecimal value) {
    String text = value.stripTrailingZeros().toPlainString();
    builder.append(text);
    if (text.indexOf('.') < 0) {
      builder.append(".0");
    }
  }

  private static void appendString(StringBuilder builder, String value) {
    builder.append('"');
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      if (c == '"' || c == '\\') {
        builder.append('\\');
      }
      builder.append(c);
    }
    builder.append('"');
  }

  private static void appendDisplayString(StringBuilder builder, String value) {
    builder.append("%\"");
    for (byte b : value.getBytes(StandardCharsets.UTF_8)) {
      int unsigned = b & 0xFF;
      if (unsigned == '%' || unsigned == '"' || unsigned < 0x20 || unsigned > 0x7E) {
        builder.append('%').append(HEX[unsigned >> 4]).append(HEX[unsigned & 0x0F]);
      } else {
        builder.append((char) unsigned);
      }
    }
    builder.append('"');
  }
}
