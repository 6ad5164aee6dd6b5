package ca.gc.cra.netstats.infrastructure.json;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.netstats.domain.net.RawRecord;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.util.List;
import org.junit.jupiter.api.Test;

class JsonRecordReaderTest {
  private final JsonRecordReader reader = new JsonRecordReader();

  @Test
  void readsArrayOfFlatObjects() throws IOException {
    List<RawRecord> records = reader.read(new StringReader("""
        [
          {".id": "*1", "protocol": "tcp", "dst-port": 443, "assured": true, "note": null},
          {"protocol": "udp", "tags": ["a", "b"], "extra": {"k": "v"}}
        ]
        """)).orElseThrow();

    assertEquals(2, records.size());
    assertEquals(RawRecord.of(".id", "*1", "protocol", "tcp", "dst-port", "443", "assured", "true"),
        records.get(0));
    assertEquals(RawRecord.of("protocol", "udp"), records.get(1));
  }

  @Test
  void emptyArrayIsAnEmptyTable() throws IOException {
    assertEquals(List.of(), reader.read(new StringReader("[]")).orElseThrow());
  }

  @Test
  void nonArrayRootIsMalformed() throws IOException {
    assertTrue(reader.read(new StringReader("{\"error\": \"no such command\"}")).isEmpty());
  }

  @Test
  void nonObjectElementIsMalformed() throws IOException {
    assertTrue(reader.read(new StringReader("[{\"a\": \"b\"}, 42]")).isEmpty());
  }

  @Test
  void invalidJsonIsMalformed() throws IOException {
    assertTrue(reader.read(new StringReader("[{\"a\": ")).isEmpty());
    assertTrue(reader.read(new StringReader("[{\"a\" \"b\"}]")).isEmpty());
  }

  @Test
  void unreadableSourceRaises() {
    Reader broken = new Reader() {
      @Override
      public int read(char[] buffer, int offset, int length) throws IOException {
        throw new IOException("disk gone");
      }

      @Override
      public void close() {
      }
    };

    assertThrows(IOException.class, () -> reader.read(broken));
  }
}
