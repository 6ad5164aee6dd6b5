package ca.gc.cra.netstats.application.stats;

/**
 * Print commands issued to devices. The strings belong to the device command language and are passed through
 * untouched.
 *
 * @since 0.1.0
 */
public final class DeviceCommands {
  /** Connection-tracking table. */
  public static final String CONNECTIONS = "/ip/firewall/connection/print";
  /** DHCP server lease table. */
  public static final String DHCP_LEASES = "/ip/dhcp-server/lease/print";
  /** Address pools backing the DHCP servers. */
  public static final String IP_POOLS = "/ip/pool/print";

  private DeviceCommands() {}
}
