package ca.gc.cra.netstats.domain.net;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Untyped record returned verbatim by a network device (one connection-tracking entry,
 * one lease, one address pool).
 * <p><strong>Why:</strong> Devices expose loosely shaped key/value rows; aggregators must tolerate any field
 * being absent without failing the whole snapshot.</p>
 * <p><strong>Role:</strong> Domain value object produced by transport adapters and consumed by aggregators.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share across request threads.</p>
 *
 * @since 0.1.0
 */
public final class RawRecord {
  private final Map<String, String> fields;

  private RawRecord(Map<String, String> fields) {
    this.fields = fields;
  }

  /**
   * Creates a record from the supplied field map, preserving iteration order.
   *
   * @param fields field name to value; {@code null} keys are rejected, {@code null} values dropped
   * @return immutable record
   */
  public static RawRecord of(Map<String, String> fields) {
    Objects.requireNonNull(fields, "fields");
    Map<String, String> copy = new LinkedHashMap<>();
    for (Map.Entry<String, String> entry : fields.entrySet()) {
      String key = Objects.requireNonNull(entry.getKey(), "field name");
      if (entry.getValue() != null) {
        copy.put(key, entry.getValue());
      }
    }
    return new RawRecord(Collections.unmodifiableMap(copy));
  }

  /**
   * Convenience factory taking alternating name/value pairs.
   *
   * @param namesAndValues {@code name1, value1, name2, value2, ...}
   * @return immutable record
   * @throws IllegalArgumentException if an odd number of arguments is supplied
   */
  public static RawRecord of(String... namesAndValues) {
    if (namesAndValues.length % 2 != 0) {
      throw new IllegalArgumentException("namesAndValues must contain name/value pairs");
    }
    Map<String, String> map = new LinkedHashMap<>();
    for (int i = 0; i < namesAndValues.length; i += 2) {
      map.put(namesAndValues[i], namesAndValues[i + 1]);
    }
    return of(map);
  }

  /**
   * Returns the trimmed value of a field; blank values are reported as absent.
   *
   * @param name field name as spelled by the device (e.g. {@code src-address})
   * @return trimmed value when present and non-blank
   */
  public Optional<String> field(String name) {
    String value = fields.get(name);
    if (value == null) {
      return Optional.empty();
    }
    String trimmed = value.trim();
    return trimmed.isEmpty() ? Optional.empty() : Optional.of(trimmed);
  }

  /**
   * Returns the underlying fields.
   *
   * @return unmodifiable field map in device order
   */
  public Map<String, String> fields() {
    return fields;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof RawRecord other && fields.equals(other.fields);
  }

  @Override
  public int hashCode() {
    return fields.hashCode();
  }

  @Override
  public String toString() {
    return "RawRecord" + fields;
  }
}
