package ca.gc.cra.netstats.domain.net;

import java.util.OptionalLong;

/**
 * <strong>What:</strong> Pure IPv4 helpers used while classifying connection-tracking entries.
 * <p><strong>Why:</strong> Aggregators need to split traffic into internal and external flows and match lease
 * addresses against pool ranges without ever failing on malformed device output.</p>
 * <p><strong>Role:</strong> Domain utility; no state, no side effects.</p>
 * <p><strong>Thread-safety:</strong> Stateless and thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class IpClassifier {
  private static final int OCTETS = 4;

  private IpClassifier() {
    // Utility
  }

  /**
   * Classifies an IPv4 dotted quad as private (RFC 1918) or public.
   *
   * @param address candidate address; may be {@code null} or malformed
   * @return {@code true} for 10/8, 172.16/12 and 192.168/16; {@code false} otherwise, including any input that
   *         is not exactly four numeric octets
   */
  public static boolean isPrivate(String address) {
    int[] octets = parseOctets(address);
    if (octets == null) {
      return false;
    }
    int first = octets[0];
    int second = octets[1];
    return first == 10
        || (first == 172 && second >= 16 && second <= 31)
        || (first == 192 && second == 168);
  }

  /**
   * Converts an IPv4 dotted quad to its unsigned 32-bit value.
   *
   * @param address candidate address
   * @return numeric address, or empty when malformed
   */
  public static OptionalLong toLong(String address) {
    int[] octets = parseOctets(address);
    if (octets == null) {
      return OptionalLong.empty();
    }
    long value = 0;
    for (int octet : octets) {
      value = (value << 8) | octet;
    }
    return OptionalLong.of(value);
  }

  /**
   * Removes a trailing {@code :port} suffix from a device address field.
   *
   * <p>{@code 10.0.0.1:443} becomes {@code 10.0.0.1} and {@code [2001:db8::1]:443} becomes {@code 2001:db8::1}.
   * Bare IPv6 literals are returned unchanged.</p>
   *
   * @param value address field as reported by the device; may be {@code null}
   * @return address without port, or {@code null} when nothing usable remains
   */
  public static String stripPort(String value) {
    if (value == null) {
      return null;
    }
    String trimmed = value.trim();
    if (trimmed.startsWith("[")) {
      int close = trimmed.indexOf(']');
      return close > 1 ? trimmed.substring(1, close) : null;
    }
    int first = trimmed.indexOf(':');
    if (first >= 0 && first == trimmed.lastIndexOf(':')) {
      trimmed = trimmed.substring(0, first);
    }
    return trimmed.isEmpty() ? null : trimmed;
  }

  private static int[] parseOctets(String address) {
    if (address == null) {
      return null;
    }
    String[] parts = address.trim().split("\\.", -1);
    if (parts.length != OCTETS) {
      return null;
    }
    int[] octets = new int[OCTETS];
    for (int i = 0; i < OCTETS; i++) {
      String part = parts[i];
      if (part.isEmpty() || part.length() > 3) {
        return null;
      }
      for (int c = 0; c < part.length(); c++) {
        char ch = part.charAt(c);
        if (ch < '0' || ch > '9') {
          return null;
        }
      }
      int octet = Integer.parseInt(part);
      if (octet > 255) {
        return null;
      }
      octets[i] = octet;
    }
    return octets;
  }
}
