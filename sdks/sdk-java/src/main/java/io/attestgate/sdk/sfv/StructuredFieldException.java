package io.attestgate.sdk.sfv;

public class StructuredFieldException extends Exception {
  private final int offset;

  public StructuredFieldException(String message, int offset) {
    super(message + " (at offset " + offset + ")");
    this.offset = offset;
  }

  public int getOffset() {
    return offset;
  }
}
