package io.attestgate.sdk.sfv;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * A structured field bare value. Instances are immutable and always serializable: the factory
 * methods reject values that the grammar cannot express.
 */
public abstract class BareItem {
  public enum Type {
    BOOLEAN,
    INTEGER,
    DECIMAL,
    STRING,
    TOKEN,
    BYTE_SEQUENCE,
    DATE,
    DISPLAY_STRING
  }

  public static final BareItem TRUE = new BooleanItem(true);
  public static final BareItem FALSE = new BooleanItem(false);

  private BareItem() {}

  public abstract Type type();

  public static BareItem ofBoolean(boolean value) {
    return value ? TRUE : FALSE;
  }

  public static BareItem ofInteger(long value) {
    if (value > Grammar.MAX_INTEGER || value < -Grammar.MAX_INTEGER) {
      throw new IllegalArgumentException("Integer out of structured field range: " + value);
    }
    return new IntegerItem(Type.INTEGER, value);
  }

  public static BareItem ofDecimal(BigDecimal value) {
    Objects.requireNonNull(value, "value");
    BigDecimal rounded = value.setScale(Grammar.MAX_DECIMAL_FRACTION_DIGITS, RoundingMode.HALF_EVEN);
    BigDecimal integerPart = rounded.abs().setScale(0, RoundingMode.DOWN);
    if (integerPart.precision() > Grammar.MAX_DECIMAL_INTEGER_DIGITS) {
      throw new IllegalArgumentException("Decimal has more than 12 integer digits: " + value);
    }
    return new DecimalItem(rounded);
  }

  public static BareItem ofDecimal(String value) {
    return ofDecimal(new BigDecimal(value));
  }

  public static BareItem ofString(String value) {
    Objects.requireNonNull(value, "value");
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      if (!Grammar.isPrintable(c)) {
        throw new IllegalArgumentException(
            String.format("Invalid character U+%04X in structured field string", (int) c));
      }
    }
    return new TextItem(Type.STRING, value);
  }

  public static BareItem ofToken(String value) {
    if (!Grammar.isValidToken(value)) {
      throw new IllegalArgumentException("Invalid structured field token: " + value);
    }
    return new TextItem(Type.TOKEN, value);
  }

  public static BareItem ofByteSequence(byte[] value) {
    Objects.requireNonNull(value, "value");
    return new BytesItem(value.clone());
  }

  public static BareItem ofDate(long epochSeconds) {
    if (epochSeconds > Grammar.MAX_INTEGER || epochSeconds < -Grammar.MAX_INTEGER) {
      throw new IllegalArgumentException("Date out of structured field range: " + epochSeconds);
    }
    return new IntegerItem(Type.DATE, epochSeconds);
  }

  public static BareItem ofDisplayString(String value) {
    Objects.requireNonNull(value, "value");
    try {
      StandardCharsets.UTF_8.newEncoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .encode(CharBuffer.wrap(value));
    } catch (CharacterCodingException e) {
      throw new IllegalArgumentException("Display string is not well-formed UTF-16: " + e.getMessage(), e);
    }
    return new TextItem(Type.DISPLAY_STRING, value);
  }

  public boolean isBoolean() {
    return type() == Type.BOOLEAN;
  }

  public boolean isInteger() {
    return type() == Type.INTEGER;
  }

  public boolean isString() {
    return type() == Type.STRING;
  }

  public boolean isByteSequence() {
    return type() == Type.BYTE_SEQUENCE;
  }

  public boolean booleanValue() {
    throw wrongType("boolean");
  }

  /**
   * The payload of an integer or a date.
   */
  public long longValue() {
    throw wrongType("integer or date");
  }

  public BigDecimal decimalValue() {
    throw wrongType("decimal");
  }

  /**
   * The payload of a string, token or display string.
   */
  public String stringValue() {
    throw wrongType("string, token or display string");
  }

  public byte[] bytesValue() {
    throw wrongType("byte sequence");
  }

  @Override
  public String toString() {
    return StructuredFieldSerializer.serializeBareItem(this);
  }

  private IllegalStateException wrongType(String expected) {
    return new IllegalStateException("Structured field value is " + type() + ", not " + expected);
  }

  private static final class BooleanItem extends BareItem {
    private final boolean value;

    BooleanItem(boolean value) {
      this.value = value;
    }

    @Override
    public Type type() {
      return Type.BOOLEAN;
    }

    @Override
    public boolean booleanValue() {
      return value;
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof BooleanItem && ((BooleanItem) other).value == value;
    }

    @Override
    public int hashCode() {
      return Boolean.hashCode(value);
    }
  }

  private static final class IntegerItem extends BareItem {
    private final Type type;
    private final long value;

    IntegerItem(Type type, long value) {
      this.type = type;
      this.value = value;
    }

    @Override
    public Type type() {
      return type;
    }

    @Override
    public long longValue() {
      return value;
    }

    @Override
    public boolean equals(Object other) {
      if (!(other instanceof IntegerItem)) {
        return false;
      }
      IntegerItem that = (IntegerItem) other;
      return type == that.type && value == that.value;
    }

    @Override
    public int hashCode() {
      return Objects.hash(type, value);
    }
  }

  private static final class DecimalItem extends BareItem {
    private final BigDecimal value;

    DecimalItem(BigDecimal value) {
      this.value = value;
    }

    @Override
    public Type type() {
      return Type.DECIMAL;
    }

    @Override
    public BigDecimal decimalValue() {
      return value;
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof DecimalItem && ((DecimalItem) other).value.compareTo(value) == 0;
    }

    @Override
    public int hashCode() {
      return value.stripTrailingZeros().hashCode();
    }
  }

  private static final class TextItem extends BareItem {
    private final Type type;
    private final String value;

    TextItem(Type type, String value) {
      this.type = type;
      this.value = value;
    }

    @Override
    public Type type() {
      return type;
    }

    @Override
    public String stringValue() {
      return value;
    }

    @Override
    public boolean equals(Object other) {
      if (!(other instanceof TextItem)) {
        return false;
      }
      TextItem that = (TextItem) other;
      return type == that.type && value.equals(that.value);
    }

    @Override
    public int hashCode() {
      return Objects.hash(type, value);
    }
  }

  private static final class BytesItem extends BareItem {
    private final byte[] value;

    BytesItem(byte[] value) {
      this.value = value;
    }

    @Override
    public Type type() {
      return Type.BYTE_SEQUENCE;
    }

    @Override
    public byte[] bytesValue() {
      return value.clone();
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof BytesItem && Arrays.equals(((BytesItem) other).value, value);
    }

    @Override
    public int hashCode() {
      return Arrays.hashCode(value);
    }
  }
}
