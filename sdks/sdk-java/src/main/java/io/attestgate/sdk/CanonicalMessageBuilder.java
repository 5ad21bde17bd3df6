package io.attestgate.sdk;

import io.attestgate.sdk.sfv.BareItem;
import io.attestgate.sdk.sfv.Parameters;
import io.attestgate.sdk.sfv.StructuredDictionary;
import io.attestgate.sdk.sfv.StructuredFieldException;
import io.attestgate.sdk.sfv.StructuredFieldParser;
import io.attestgate.sdk.sfv.StructuredFieldSerializer;
import io.attestgate.sdk.sfv.StructuredItem;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

public final class CanonicalMessageBuilder {
  private static final Set<String> HEADER_PARAMETERS = Set.of("sf", "key", "bs");

  private CanonicalMessageBuilder() {}

  public static BuildResult build(HttpRequestMessage request, List<StructuredItem> components, Parameters signatureParameters) {
    List<String> lines = new ArrayList<>();
    Set<String> seen = new HashSet<>();
    for (StructuredItem component : components) {
      if (component.isInnerList() || !component.bareItem().isString()) {
        return BuildResult.failed(FailureKind.UNRESOLVABLE_COMPONENT,
            "Unsupported component identifier " + component + " in signature input");
      }
      String label = StructuredFieldSerializer.serializeItem(component);
      if (!seen.add(label)) {
        return BuildResult.failed(FailureKind.MALFORMED_HEADER, "Duplicate component " + label + " in signature input");
      }
      Resolution resolution = resolve(request, component.bareItem().stringValue(), component.parameters());
      if (resolution.failure != null) {
        return BuildResult.failed(resolution.failure);
      }
      lines.add(label + ": " + resolution.value);
    }

    String signatureParams = StructuredFieldSerializer.serializeInnerList(components, signatureParameters);
    lines.add("\"@signature-params\": " + signatureParams);
    return BuildResult.built(new CanonicalMessage(String.join("\n", lines), signatureParams));
  }

  private static Resolution resolve(HttpRequestMessage request, String identifier, Parameters parameters) {
    if (parameters.containsKey("req") || parameters.containsKey("tr")) {
      return Resolution.unresolvable("Component parameters 'req' and 'tr' are not supported: " + identifier);
    }
    if (!identifier.startsWith("@")) {
      return resolveHeader(request, identifier, parameters);
    }
    switch (identifier) {
      case "@method":
        return Resolution.of(request.method().toUpperCase(Locale.ROOT));
      case "@target-uri":
        return Resolution.of(scheme(request) + "://" + authority(request) + requestTarget(request));
      case "@authority":
        return Resolution.of(authority(request));
      case "@scheme":
        return Resolution.of(scheme(request));
      case "@path":
        return Resolution.of(request.path());
      case "@query":
        return Resolution.of("?" + (request.query() == null ? "" : request.query()));
      case "@request-target":
        return Resolution.of(requestTarget(request));
      case "@query-param":
        return resolveQueryParam(request, parameters);
      default:
        return Resolution.unresolvable("Unsupported derived component " + identifier);
    }
  }

  private static String scheme(HttpRequestMessage request) {
    return request.scheme().toLowerCase(Locale.ROOT);
  }

  private static String authority(HttpRequestMessage request) {
    return request.authority().toLowerCase(Locale.ROOT);
  }

  private static String requestTarget(HttpRequestMessage request) {
    String query = request.query();
    return query == null ? request.path() : request.path() + "?" + query;
  }

  private static Resolution resolveQueryParam(HttpRequestMessage request, Parameters parameters) {
    BareItem name = parameters.get("name");
    if (name == null || !name.isString()) {
      return Resolution.unresolvable("@query-param requires a 'name' parameter");
    }
    String wanted;
    try {
      wanted = URLDecoder.decode(name.stringValue(), StandardCharsets.UTF_8);
    } catch (IllegalArgumentException e) {
      return Resolution.unresolvable("Invalid @query-param name '" + name.stringValue() + "'");
    }

    List<String> values = new ArrayList<>();
    String query = request.query();
    if (query != null && !query.isEmpty()) {
      for (String pair : query.split("&")) {
        if (pair.isEmpty()) {
          continue;
        }
        int separator = pair.indexOf('=');
        String rawName = separator < 0 ? pair : pair.substring(0, separator);
        String rawValue = separator < 0 ? "" : pair.substring(separator + 1);
        try {
          if (wanted.equals(URLDecoder.decode(rawName, StandardCharsets.UTF_8))) {
            values.add(URLDecoder.decode(rawValue, StandardCharsets.UTF_8));
          }
        } catch (IllegalArgumentException e) {
          return Resolution.unresolvable("Malformed percent-encoding in query string");
        }
      }
    }
    if (values.isEmpty()) {
      return Resolution.unresolvable("Missing query parameter '" + wanted + "' for @query-param component");
    }
    return Resolution.of(String.join(",", values));
  }

  private static Resolution resolveHeader(HttpRequestMessage request, String name, Parameters parameters) {
    List<String> values = request.headerValues(name);
    if (values.isEmpty()) {
      return Resolution.unresolvable("Missing header '" + name + "' referenced in signature");
    }
    for (String parameter : parameters.keys()) {
      if (!HEADER_PARAMETERS.contains(parameter)) {
        return Resolution.unresolvable("Unsupported parameter '" + parameter + "' on component '" + name + "'");
      }
    }

    BareItem key = parameters.get("key");
    BareItem sf = parameters.get("sf");
    BareItem bs = parameters.get("bs");
    boolean byteSequence = bs != null && bs.isBoolean() && bs.booleanValue();
    if (byteSequence && (key != null || sf != null)) {
      return Resolution.unresolvable("Parameter 'bs' cannot be combined with 'sf' or 'key' on '" + name + "'");
    }
    if (byteSequence) {
      List<String> wrapped = new ArrayList<>();
      for (String value : values) {
        wrapped.add(":" + Base64.getEncoder().encodeToString(value.trim().getBytes(StandardCharsets.ISO_8859_1)) + ":");
      }
      return Resolution.of(String.join(", ", wrapped));
    }

    String combined = combine(values);
    if (key != null) {
      if (!key.isString()) {
        return Resolution.unresolvable("Parameter 'key' on '" + name + "' must be a string");
      }
      StructuredDictionary dictionary;
      try {
        dictionary = StructuredFieldParser.parseDictionary(combined);
      } catch (StructuredFieldException e) {
        return Resolution.unresolvable("Failed to parse header '" + name + "' as dictionary: " + e.getMessage());
      }
      StructuredItem member = dictionary.get(key.stringValue());
      if (member == null) {
        return Resolution.unresolvable("Header '" + name + "' dictionary missing key '" + key.stringValue() + "'");
      }
      return Resolution.of(StructuredFieldSerializer.serializeItem(member));
    }
    if (sf != null && sf.isBoolean() && sf.booleanValue()) {
      return reserializeStructuredField(name, combined);
    }
    return Resolution.of(combined);
  }

  // Dictionary first, then list, then item: the first type that parses wins.
  private static Resolution reserializeStructuredField(String name, String raw) {
    StructuredFieldException firstError;
    try {
      return Resolution.of(StructuredFieldSerializer.serializeDictionary(StructuredFieldParser.parseDictionary(raw)));
    } catch (StructuredFieldException e) {
      firstError = e;
    }
    try {
      return Resolution.of(StructuredFieldSerializer.serializeList(StructuredFieldParser.parseList(raw)));
    } catch (StructuredFieldException e) {
      firstError.addSuppressed(e);
    }
    try {
      return Resolution.of(StructuredFieldSerializer.serializeItem(StructuredFieldParser.parseItem(raw)));
    } catch (StructuredFieldException e) {
      firstError.addSuppressed(e);
    }
    return Resolution.unresolvable(
        "Failed to parse header '" + name + "' as structured field value: " + firstError.getMessage());
  }

  static String combine(List<String> values) {
    List<String> trimmed = new ArrayList<>(values.size());
    for (String value : values) {
      trimmed.add(value.trim());
    }
    return String.join(", ", trimmed);
  }

  public static final class BuildResult {
    public final CanonicalMessage message;
    public final Failure failure;

    private BuildResult(CanonicalMessage message, Failure failure) {
      this.message = message;
      this.failure = failure;
    }

    static BuildResult built(CanonicalMessage message) {
      return new BuildResult(message, null);
    }

    static BuildResult failed(Failure failure) {
      return new BuildResult(null, failure);
    }

    static BuildResult failed(FailureKind kind, String reason) {
      return failed(Failure.of(kind, reason));
    }

    public boolean succeeded() {
      return failure == null;
    }
  }

  private static final class Resolution {
    final String value;
    final Failure failure;

    private Resolution(String value, Failure failure) {
      this.value = value;
      this.failure = failure;
    }

    static Resolution of(String value) {
      return new Resolution(value, null);
    }

    static Resolution unresolvable(String reason) {
      return new Resolution(null, Failure.of(FailureKind.UNRESOLVABLE_COMPONENT, reason));
    }
  }
}
