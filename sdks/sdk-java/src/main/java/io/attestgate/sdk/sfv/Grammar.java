package io.attestgate.sdk.sfv;

final class Grammar {
  private Grammar() {}

  static final long MAX_INTEGER = 999_999_999_999_999L;
  static final int MAX_DECIMAL_INTEGER_DIGITS = 12;
  static final int MAX_DECIMAL_FRACTION_DIGITS = 3;

  private static final String TCHAR_SYMBOLS = "!#$%&'*+-.^_`|~";

  static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  static boolean isAlpha(char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
  }

  static boolean isLcAlpha(char c) {
    return c >= 'a' && c <= 'z';
  }

  static boolean isPrintable(char c) {
    return c >= 0x20 && c <= 0x7E;
  }

  static boolean isTchar(char c) {
    return isAlpha(c) || isDigit(c) || TCHAR_SYMBOLS.indexOf(c) >= 0;
  }

  static boolean isTokenStart(char c) {
    return isAlpha(c) || c == '*';
  }

  static boolean isTokenChar(char c) {
    return isTchar(c) || c == ':' || c == '/';
  }

  static boolean isKeyStart(char c) {
    return isLcAlpha(c) || c == '*';
  }

  static boolean isKeyChar(char c) {
    return isLcAlpha(c) || isDigit(c) || c == '_' || c == '-' || c == '.' || c == '*';
  }

  static boolean isBase64Char(char c) {
    return isAlpha(c) || isDigit(c) || c == '+' || c == '/' || c == '=';
  }

  static boolean isLowerHex(char c) {
    return isDigit(c) || (c >= 'a' && c <= 'f');
  }

  static boolean isValidKey(String key) {
    if (key == null || key.isEmpty() || !isKeyStart(key.charAt(0))) {
      return false;
    }
    for (int i = 1; i < key.length(); i++) {
      if (!isKeyChar(key.charAt(i))) {
        return false;
      }
    }
    return true;
  }

  static boolean isValidToken(String token) {
    if (token == null || token.isEmpty() || !isTokenStart(token.charAt(0))) {
      return false;
    }
    for (int i = 1; i < token.length(); i++) {
      if (!isTokenChar(token.charAt(i))) {
        return false;
      }
    }
    return true;
  }

  static String requireKey(String key) {
    if (!isValidKey(key)) {
      throw new IllegalArgumentException("Invalid structured field key: " + key);
    }
    return key;
  }
}
