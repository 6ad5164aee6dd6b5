package ca.gc.cra.netstats.application.stats;

import java.util.Locale;

/**
 * How port rankings resolve a service name from the port registry.
 *
 * @since 0.1.0
 */
public enum ServiceLookupMode {
  /**
   * Match on the port number alone, so 53/tcp is named {@code DNS} as on the live dashboard. The protocol shown is
   * still the one observed on the connection.
   */
  PORT,
  /** Require the registered protocol to equal the observed one, so 53/tcp stays unnamed. */
  PORT_AND_PROTOCOL;

  /**
   * Parses a configuration value.
   *
   * @param raw value such as {@code port} or {@code port_and_protocol}; blank yields {@link #PORT}
   * @return parsed mode
   * @throws IllegalArgumentException for unknown values
   */
  public static ServiceLookupMode from(String raw) {
    if (raw == null || raw.isBlank()) {
      return PORT;
    }
    String normalized = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_');
    try {
      return valueOf(normalized);
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("serviceLookup must be PORT or PORT_AND_PROTOCOL (was " + raw + ")", ex);
    }
  }
}
