package ca.gc.cra.netstats.domain.net;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * <strong>What:</strong> Static mapping from well-known port numbers to protocol and service name.
 * <p><strong>Why:</strong> Port rankings are easier to read with a service label attached; unknown ports are
 * simply rendered without one.</p>
 * <p><strong>Thread-safety:</strong> Backed by an immutable map built once at class load.</p>
 *
 * @since 0.1.0
 */
public final class ServiceRegistry {
  private static final Map<Integer, ServicePort> PORTS = Map.ofEntries(
      Map.entry(21, new ServicePort("tcp", "FTP")),
      Map.entry(22, new ServicePort("tcp", "SSH")),
      Map.entry(23, new ServicePort("tcp", "Telnet")),
      Map.entry(25, new ServicePort("tcp", "SMTP")),
      Map.entry(53, new ServicePort("udp", "DNS")),
      Map.entry(80, new ServicePort("tcp", "HTTP")),
      Map.entry(110, new ServicePort("tcp", "POP3")),
      Map.entry(123, new ServicePort("udp", "NTP")),
      Map.entry(143, new ServicePort("tcp", "IMAP")),
      Map.entry(161, new ServicePort("udp", "SNMP")),
      Map.entry(443, new ServicePort("tcp", "HTTPS")),
      Map.entry(465, new ServicePort("tcp", "SMTPS")),
      Map.entry(587, new ServicePort("tcp", "SMTP Submission")),
      Map.entry(993, new ServicePort("tcp", "IMAPS")),
      Map.entry(995, new ServicePort("tcp", "POP3S")),
      Map.entry(1194, new ServicePort("udp", "OpenVPN")),
      Map.entry(1723, new ServicePort("tcp", "PPTP")),
      Map.entry(3389, new ServicePort("tcp", "RDP")),
      Map.entry(5060, new ServicePort("udp", "SIP")),
      Map.entry(8080, new ServicePort("tcp", "HTTP Proxy")),
      Map.entry(8443, new ServicePort("tcp", "HTTPS Alternate")));

  private ServiceRegistry() {
    // Utility
  }

  /**
   * Looks up a service by port number only.
   *
   * @param port destination port
   * @return registered service, or empty when the port is not well known
   */
  public static Optional<ServicePort> lookup(int port) {
    return Optional.ofNullable(PORTS.get(port));
  }

  /**
   * Looks up a service requiring the registered protocol to match as well.
   *
   * @param port destination port
   * @param protocol protocol observed on the connection; compared case-insensitively
   * @return registered service when both port and protocol match
   */
  public static Optional<ServicePort> lookup(int port, String protocol) {
    if (protocol == null) {
      return Optional.empty();
    }
    String normalized = protocol.trim().toLowerCase(Locale.ROOT);
    return lookup(port).filter(service -> service.protocol().equals(normalized));
  }
}
