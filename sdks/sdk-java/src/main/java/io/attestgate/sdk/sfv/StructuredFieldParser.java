package io.attestgate.sdk.sfv;

import java.io.ByteArrayOutputStream;
import java.math.BigDecimal;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

public final class StructuredFieldParser {
  private final String input;
  private int position;

  private StructuredFieldParser(String input) {
    this.input = input;
  }

  public static StructuredItem parseItem(String text) throws StructuredFieldException {
    StructuredFieldParser parser = start(text);
    StructuredItem item = parser.readItem();
    parser.finish();
    return item;
  }

  public static List<StructuredItem> parseList(String text) throws StructuredFieldException {
    StructuredFieldParser parser = start(text);
    List<StructuredItem> members = parser.readList();
    parser.finish();
    return members;
  }

  public static StructuredDictionary parseDictionary(String text) throws StructuredFieldException {
    StructuredFieldParser parser = start(text);
    StructuredDictionary dictionary = parser.readDictionary();
    parser.finish();
    return dictionary;
  }

  private static StructuredFieldParser start(String text) throws StructuredFieldException {
    if (text == null) {
      throw new StructuredFieldException("Structured field value is missing", 0);
    }
    StructuredFieldParser parser = new StructuredFieldParser(text);
    parser.skipSpaces();
    return parser;
  }

  private void finish() throws StructuredFieldException {
    skipSpaces();
    if (!atEnd()) {
      throw error("Unexpected character '" + peek() + "'");
    }
  }

  private List<StructuredItem> readList() throws StructuredFieldException {
    List<StructuredItem> members = new ArrayList<>();
    while (!atEnd()) {
      members.add(readItemOrInnerList());
      skipOptionalWhitespace();
      if (atEnd()) {
        return members;
      }
      expect(',', "Expected ',' between list members");
      skipOptionalWhitespace();
      if (atEnd()) {
        throw error("Trailing comma in list");
      }
    }
    return members;
  }

  private StructuredDictionary readDictionary() throws StructuredFieldException {
    StructuredDictionary.Builder dictionary = StructuredDictionary.builder();
    while (!atEnd()) {
      String key = readKey();
      StructuredItem member;
      if (!atEnd() && peek() == '=') {
        position++;
        member = readItemOrInnerList();
      } else {
        member = StructuredItem.of(BareItem.TRUE, readParameters());
      }
      dictionary.put(key, member);
      skipOptionalWhitespace();
      if (atEnd()) {
        break;
      }
      expect(',', "Expected ',' between dictionary members");
      skipOptionalWhitespace();
      if (atEnd()) {
        throw error("Trailing comma in dictionary");
      }
    }
    return dictionary.build();
  }

  private StructuredItem readItemOrInnerList() throws StructuredFieldException {
    if (!atEnd() && peek() == '(') {
      return readInnerList();
    }
    return readItem();
  }

  private StructuredItem readInnerList() throws StructuredFieldException {
    expect('(', "Expected '(' to open inner list");
    List<StructuredItem> items = new ArrayList<>();
    while (!atEnd()) {
      skipSpaces();
      if (!atEnd() && peek() == ')') {
        position++;
        return StructuredItem.innerList(items, readParameters());
      }
      items.add(readItem());
      if (!atEnd() && peek() != ' ' && peek() != ')') {
        throw error("Expected ' ' or ')' in inner list");
      }
    }
    throw error("Unterminated inner list");
  }

  private StructuredItem readItem() throws StructuredFieldException {
    BareItem value = readBareItem();
    return StructuredItem.of(value, readParameters());
  }

  private Parameters readParameters() throws StructuredFieldException {
    if (atEnd() || peek() != ';') {
      return Parameters.EMPTY;
    }
    Parameters.Builder parameters = Parameters.builder();
    while (!atEnd() && peek() == ';') {
      position++;
      skipSpaces();
      String key = readKey();
      BareItem value = BareItem.TRUE;
      if (!atEnd() && peek() == '=') {
        position++;
        value = readBareItem();
      }
      parameters.put(key, value);
    }
    return parameters.build();
  }

  private String readKey() throws StructuredFieldException {
    if (atEnd() || !Grammar.isKeyStart(peek())) {
      throw error("Key must start with a lowercase letter or '*'");
    }
    int begin = position;
    while (!atEnd() && Grammar.isKeyChar(peek())) {
      position++;
    }
    return input.substring(begin, position);
  }

  private BareItem readBareItem() throws StructuredFieldException {
    if (atEnd()) {
      throw error("Expected a value");
    }
    char c = peek();
    if (c == '-' || Grammar.isDigit(c)) {
      return readNumber();
    }
    if (Grammar.isTokenStart(c)) {
      return readToken();
    }
    switch (c) {
      case '"':
        return readString();
      case ':':
        return readByteSequence();
      case '?':
        return readBoolean();
      case '@':
        return readDate();
      case '%':
        return readDisplayString();
      default:
        throw error("Unexpected character '" + c + "' at start of value");
    }
  }

  private BareItem readNumber() throws StructuredFieldException {
    int begin = position;
    boolean negative = false;
    if (peek() == '-') {
      negative = true;
      position++;
    }
    if (atEnd() || !Grammar.isDigit(peek())) {
      throw error("Expected a digit");
    }
    StringBuilder number = new StringBuilder();
    boolean decimal = false;
    while (!atEnd()) {
      char c = peek();
      if (Grammar.isDigit(c)) {
        number.append(c);
        position++;
      } else if (!decimal && c == '.') {
        if (number.length() > Grammar.MAX_DECIMAL_INTEGER_DIGITS) {
          throw error("Decimal has more than 12 integer digits");
        }
        number.append(c);
        decimal = true;
        position++;
      } else {
        break;
      }
      if (!decimal && number.length() > 15) {
        throw error("Integer has more than 15 digits");
      }
      if (decimal && number.length() > 16) {
        throw error("Decimal has too many digits");
      }
    }
    String digits = number.toString();
    if (!decimal) {
      long value = Long.parseLong(digits);
      return BareItem.ofInteger(negative ? -value : value);
    }
    int fractionDigits = digits.length() - digits.indexOf('.') - 1;
    if (fractionDigits == 0) {
      throw new StructuredFieldException("Decimal must not end with '.'", begin);
    }
    if (fractionDigits > Grammar.MAX_DECIMAL_FRACTION_DIGITS) {
      throw new StructuredFieldException("Decimal has more than 3 fractional digits", begin);
    }
    BigDecimal value = new BigDecimal(digits);
    return BareItem.ofDecimal(negative ? value.negate() : value);
  }

  private BareItem readString() throws StructuredFieldException {
    expect('"', "Expected '\"'");
    StringBuilder value = new StringBuilder();
    while (!atEnd()) {
      char c = input.charAt(position++);
      if (c == '\\') {
        if (atEnd()) {
          throw error("Unterminated escape in string");
        }
        char escaped = input.charAt(position++);
        if (escaped != '"' && escaped != '\\') {
          throw error("Invalid escape '\\" + escaped + "' in string");
        }
        value.append(escaped);
      } else if (c == '"') {
        return BareItem.ofString(value.toString());
      } else if (!Grammar.isPrintable(c)) {
        throw error(String.format("Invalid character U+%04X in string", (int) c));
      } else {
        value.append(c);
      }
    }
    throw error("Unterminated string");
  }

  private BareItem readToken() {
    int begin = position;
    position++;
    while (!atEnd() && Grammar.isTokenChar(peek())) {
      position++;
    }
    return BareItem.ofToken(input.substring(begin, position));
  }

  private BareItem readByteSequence() throws StructuredFieldException {
    expect(':', "Expected ':'");
    int begin = position;
    int end = input.indexOf(':', begin);
    if (end < 0) {
      throw error("Unterminated byte sequence");
    }
    String encoded = input.substring(begin, end);
    for (int i = 0; i < encoded.length(); i++) {
      if (!Grammar.isBase64Char(encoded.charAt(i))) {
        throw new StructuredFieldException("Invalid base64 character in byte sequence", begin + i);
      }
    }
    byte[] decoded;
    try {
      decoded = Base64.getDecoder().decode(encoded);
    } catch (IllegalArgumentException e) {
      throw new StructuredFieldException("Invalid base64 in byte sequence: " + e.getMessage(), begin);
    }
    position = end + 1;
    return BareItem.ofByteSequence(decoded);
  }

  private BareItem readBoolean() throws StructuredFieldException {
    expect('?', "Expected '?'");
    if (atEnd()) {
      throw error("Unterminated boolean");
    }
    char c = input.charAt(position++);
    if (c == '1') {
      return BareItem.TRUE;
    }
    if (c == '0') {
      return BareItem.FALSE;
    }
    throw error("Boolean must be ?0 or ?1");
  }

  private BareItem readDate() throws StructuredFieldException {
    expect('@', "Expected '@'");
    int begin = position;
    BareItem number = readNumber();
    if (!number.isInteger()) {
      throw new StructuredFieldException("Date must be an integer", begin);
    }
    return BareItem.ofDate(number.longValue());
  }

  private BareItem readDisplayString() throws StructuredFieldException {
    expect('%', "Expected '%'");
    expect('"', "Expected '\"' after '%'");
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    while (!atEnd()) {
      char c = input.charAt(position++);
      if (!Grammar.isPrintable(c)) {
        throw error(String.format("Invalid character U+%04X in display string", (int) c));
      }
      if (c == '%') {
        if (position + 2 > input.length()) {
          throw error("Truncated percent escape in display string");
        }
        char high = input.charAt(position);
        char low = input.charAt(position + 1);
        if (!Grammar.isLowerHex(high) || !Grammar.isLowerHex(low)) {
          throw error("Percent escape must use two lowercase hex digits");
        }
        bytes.write(Character.digit(high, 16) << 4 | Character.digit(low, 16));
        position += 2;
      } else if (c == '"') {
        return BareItem.ofDisplayString(decodeUtf8(bytes.toByteArray()));
      } else {
        bytes.write(c);
      }
    }
    throw error("Unterminated display string");
  }

  private String decodeUtf8(byte[] bytes) throws StructuredFieldException {
    try {
      return StandardCharsets.UTF_8.newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(ByteBuffer.wrap(bytes))
          .toString();
    } catch (CharacterCodingException e) {
      throw error("Display string is not valid UTF-8");
    }
  }

  private void expect(char expected, String message) throws StructuredFieldException {
    if (atEnd() || peek() != expected) {
      throw error(message);
    }
    position++;
  }

  private void skipSpaces() {
    while (!atEnd() && peek() == ' ') {
      position++;
    }
  }

  private void skipOptionalWhitespace() {
    while (!atEnd() && (peek() == ' ' || peek() == '\t')) {
      position++;
    }
  }

  private boolean atEnd() {
    return position >= input.length();
  }

  private char peek() {
    return input.charAt(position);
  }

  private StructuredFieldException error(String message) {
    return new StructuredFieldException(message, position);
  }
}
