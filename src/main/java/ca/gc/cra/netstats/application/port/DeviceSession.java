package ca.gc.cra.netstats.application.port;

import ca.gc.cra.netstats.domain.net.RawRecord;
import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * <strong>What:</strong> Open session to a network device able to run read-only print commands.
 * <p><strong>Role:</strong> Outbound port implemented by transport adapters.</p>
 * <p><strong>Thread-safety:</strong> Implementation defined; the stats services issue queries from request
 * threads and never share a session across devices.</p>
 *
 * @since 0.1.0
 */
public interface DeviceSession {
  /**
   * Runs a print command and returns the rows it produced.
   *
   * @param command command identifier in the device's own language (e.g. {@code /ip/firewall/connection/print});
   *     not interpreted by the caller
   * @return rows in device order; empty when the device answered with something other than a record sequence
   * @throws IOException when the device cannot be reached or the session broke mid-query
   */
  Optional<List<RawRecord>> query(String command) throws IOException;
}
