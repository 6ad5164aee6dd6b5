package ca.gc.cra.netstats.application.port;

import java.io.IOException;
import java.util.Optional;

/**
 * <strong>What:</strong> Outbound port acquiring sessions to managed network devices.
 * <p><strong>Why:</strong> Keeps the aggregation core independent of the device wire protocol, credentials and
 * timeouts, all of which belong to the adapter.</p>
 * <p><strong>Role:</strong> Domain port; implementations live under {@code infrastructure.transport}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate concurrent calls for different devices.</p>
 *
 * @since 0.1.0
 */
public interface DeviceTransportPort {
  /**
   * Ensures a session to the device is open.
   *
   * @param deviceId managed device identifier
   * @return {@code true} when a session is available afterwards
   * @throws IOException when the connection attempt fails (refused, authentication, timeout)
   */
  boolean connect(int deviceId) throws IOException;

  /**
   * Returns the open session for a device.
   *
   * @param deviceId managed device identifier
   * @return session, or empty when none is open
   */
  Optional<DeviceSession> getSession(int deviceId);
}
