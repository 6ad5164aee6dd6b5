package ca.gc.cra.netstats.domain.net;

import java.util.Objects;

/**
 * Well-known service bound to a port.
 *
 * @param protocol transport protocol label as used by devices ({@code tcp}, {@code udp})
 * @param name human readable service name (e.g. {@code HTTPS})
 * @since 0.1.0
 */
public record ServicePort(String protocol, String name) {
  public ServicePort {
    Objects.requireNonNull(protocol, "protocol");
    Objects.requireNonNull(name, "name");
  }
}
