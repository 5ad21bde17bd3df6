package io.attestgate.sdk;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

public enum DeviceIdEncoding {
  BASE64 {
    @Override
    public byte[] decode(String deviceId) {
      try {
        return Base64.getDecoder().decode(deviceId.trim());
      } catch (IllegalArgumentException e) {
        throw new IllegalArgumentException("Device id is not valid base64", e);
      }
    }
  },
  UTF8 {
    @Override
    public byte[] decode(String deviceId) {
      return deviceId.getBytes(StandardCharsets.UTF_8);
    }
  };

  public abstract byte[] decode(String deviceId);
}
