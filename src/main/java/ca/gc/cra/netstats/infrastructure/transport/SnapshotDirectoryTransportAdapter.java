package ca.gc.cra.netstats.infrastructure.transport;

import ca.gc.cra.netstats.application.port.DeviceSession;
import ca.gc.cra.netstats.application.port.DeviceTransportPort;
import ca.gc.cra.netstats.domain.net.RawRecord;
import ca.gc.cra.netstats.infrastructure.json.JsonRecordReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link DeviceTransportPort} that answers print commands from JSON snapshot files.
 * <p><strong>Why:</strong> Allows the aggregation engine to run against exported device tables for offline analysis
 * and dry runs.</p>
 * <p><strong>Layout:</strong> {@code <root>/<deviceId>/<command>.json}, where the command has its leading slash
 * removed and remaining slashes replaced by underscores, e.g. {@code ip_firewall_connection_print.json}.</p>
 * <p><strong>Thread-safety:</strong> Safe for concurrent use; sessions are stateless readers.</p>
 *
 * @since 0.1.0
 */
public final class SnapshotDirectoryTransportAdapter implements DeviceTransportPort {
  private static final Logger log = LoggerFactory.getLogger(SnapshotDirectoryTransportAdapter.class);

  private final Path root;
  private final JsonRecordReader reader = new JsonRecordReader();
  private final ConcurrentMap<Integer, DeviceSession> sessions = new ConcurrentHashMap<>();

  /**
   * Creates an adapter rooted at the given snapshot directory.
   *
   * @param root directory containing one sub-directory per device
   */
  public SnapshotDirectoryTransportAdapter(Path root) {
    this.root = Objects.requireNonNull(root, "root");
  }

  @Override
  public boolean connect(int deviceId) throws IOException {
    if (sessions.containsKey(deviceId)) {
      return true;
    }
    Path deviceDir = root.resolve(Integer.toString(deviceId));
    if (!Files.isDirectory(deviceDir)) {
      log.debug("No snapshot directory for device {} at {}", deviceId, deviceDir);
      return false;
    }
    if (!Files.isReadable(deviceDir)) {
      throw new IOException("Snapshot directory is not readable: " + deviceDir);
    }
    sessions.putIfAbsent(deviceId, new SnapshotSession(deviceDir));
    return true;
  }

  @Override
  public Optional<DeviceSession> getSession(int deviceId) {
    return Optional.ofNullable(sessions.get(deviceId));
  }

  /**
   * Maps a print command to its snapshot file name.
   *
   * @param command command such as {@code /ip/pool/print}
   * @return file name such as {@code ip_pool_print.json}
   */
  static String fileNameFor(String command) {
    String trimmed = command.trim();
    while (trimmed.startsWith("/")) {
      trimmed = trimmed.substring(1);
    }
    return trimmed.replace('/', '_') + ".json";
  }

  private final class SnapshotSession implements DeviceSession {
    private final Path deviceDir;

    private SnapshotSession(Path deviceDir) {
      this.deviceDir = deviceDir;
    }

    @Override
    public Optional<List<RawRecord>> query(String command) throws IOException {
      Objects.requireNonNull(command, "command");
      Path file = deviceDir.resolve(fileNameFor(command));
      if (!Files.exists(file)) {
        throw new NoSuchFileException(file.toString(), null, "no snapshot for command " + command);
      }
      try (Reader in = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
        return reader.read(in);
      }
    }
  }
}
