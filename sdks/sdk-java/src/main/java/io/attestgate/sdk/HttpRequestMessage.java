package io.attestgate.sdk;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

public final class HttpRequestMessage {
  private static final byte[] NO_BODY = new byte[0];

  private final String method;
  private final String scheme;
  private final String authority;
  private final String path;
  private final String query;
  private final Map<String, List<String>> headers;
  private final byte[] body;

  private HttpRequestMessage(Builder builder) {
    this.method = builder.method;
    this.scheme = builder.scheme;
    this.authority = builder.authority;
    this.path = builder.path;
    this.query = builder.query;
    Map<String, List<String>> copy = new LinkedHashMap<>();
    for (Map.Entry<String, List<String>> entry : builder.headers.entrySet()) {
      copy.put(entry.getKey(), Collections.unmodifiableList(new ArrayList<>(entry.getValue())));
    }
    this.headers = Collections.unmodifiableMap(copy);
    this.body = builder.body;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Builds a request from an absolute URL. The raw (still percent-encoded) path and query are kept.
   */
  public static Builder fromUrl(String method, String url) {
    URI parsed = URI.create(url);
    if (parsed.getScheme() == null || parsed.getRawAuthority() == null) {
      throw new IllegalArgumentException("Request URL must be absolute: " + url);
    }
    return builder()
        .method(method)
        .scheme(parsed.getScheme())
        .authority(parsed.getRawAuthority())
        .path(parsed.getRawPath())
        .query(parsed.getRawQuery());
  }

  public String method() {
    return method;
  }

  public String scheme() {
    return scheme;
  }

  public String authority() {
    return authority;
  }

  public String path() {
    return path;
  }

  /**
   * The raw query without the leading '?', or null when the request has none.
   */
  public String query() {
    return query;
  }

  public boolean hasHeader(String name) {
    return headers.containsKey(name.toLowerCase(Locale.ROOT));
  }

  public List<String> headerValues(String name) {
    List<String> values = headers.get(name.toLowerCase(Locale.ROOT));
    return values == null ? Collections.emptyList() : values;
  }

  public byte[] body() {
    return body.clone();
  }

  public int bodyLength() {
    return body.length;
  }

  public InputStream openBody() {
    return new ByteArrayInputStream(body);
  }

  public static final class Builder {
    private String method = "GET";
    private String scheme = "https";
    private String authority;
    private String path = "/";
    private String query;
    private final Map<String, List<String>> headers = new LinkedHashMap<>();
    private byte[] body = NO_BODY;

    private Builder() {}

    public Builder method(String method) {
      this.method = Objects.requireNonNull(method, "method");
      return this;
    }

    public Builder scheme(String scheme) {
      this.scheme = Objects.requireNonNull(scheme, "scheme");
      return this;
    }

    public Builder authority(String authority) {
      this.authority = authority;
      return this;
    }

    public Builder path(String path) {
      this.path = path == null || path.isEmpty() ? "/" : path;
      return this;
    }

    public Builder query(String query) {
      if (query != null && query.startsWith("?")) {
        query = query.substring(1);
      }
      this.query = query;
      return this;
    }

    /**
     * Adds one field line. Repeated names accumulate in arrival order.
     */
    public Builder header(String name, String value) {
      headers.computeIfAbsent(name.toLowerCase(Locale.ROOT), key -> new ArrayList<>())
          .add(Objects.requireNonNull(value, "value"));
      return this;
    }

    public Builder headers(Map<String, String> values) {
      if (values != null) {
        for (Map.Entry<String, String> entry : values.entrySet()) {
          header(entry.getKey(), entry.getValue());
        }
      }
      return this;
    }

    public Builder removeHeader(String name) {
      headers.remove(name.toLowerCase(Locale.ROOT));
      return this;
    }

    public Builder body(byte[] body) {
      this.body = body == null ? NO_BODY : body.clone();
      return this;
    }

    /**
     * Buffers the stream into memory. Fails when more than {@code maxBytes} are offered or when
     * the reading thread is interrupted.
     */
    public Builder body(InputStream in, int maxBytes) throws IOException {
      ByteArrayOutputStream buffer = new ByteArrayOutputStream();
      byte[] chunk = new byte[8192];
      int read;
      while ((read = in.read(chunk)) != -1) {
        if (Thread.currentThread().isInterrupted()) {
          throw new InterruptedIOException("Request body read was interrupted");
        }
        if (buffer.size() + read > maxBytes) {
          throw new IOException("Request body exceeds " + maxBytes + " bytes");
        }
        buffer.write(chunk, 0, read);
      }
      this.body = buffer.toByteArray();
      return this;
    }

    public HttpRequestMessage build() {
      if (authority == null || authority.isEmpty()) {
        throw new IllegalArgumentException("Request authority is required");
      }
      return new HttpRequestMessage(this);
    }
  }
}
