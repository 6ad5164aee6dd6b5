package ca.gc.cra.netstats.infrastructure.json;

import ca.gc.cra.netstats.domain.net.RawRecord;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Streams a JSON array of flat objects into {@link RawRecord}s.
 *
 * <p>Scalar values are kept as their textual form; nested objects and arrays inside a record are skipped. A
 * document that is not valid JSON, whose root is not an array, or whose array holds anything but objects, is reported
 * as empty so the caller can treat it as a malformed device response.</p>
 *
 * @since 0.1.0
 */
public final class JsonRecordReader {
  private static final Logger log = LoggerFactory.getLogger(JsonRecordReader.class);

  private final JsonFactory factory = new JsonFactory();

  /**
   * Reads records from the supplied reader.
   *
   * @param reader JSON source; not closed by this method
   * @return records in document order, or empty when the document does not have the expected shape
   * @throws IOException when the source cannot be read
   */
  public Optional<List<RawRecord>> read(Reader reader) throws IOException {
    Objects.requireNonNull(reader, "reader");
    try (JsonParser parser = factory.createParser(reader)) {
      if (parser.nextToken() != JsonToken.START_ARRAY) {
        return Optional.empty();
      }
      List<RawRecord> records = new ArrayList<>();
      JsonToken token;
      while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
        if (token != JsonToken.START_OBJECT) {
          return Optional.empty();
        }
        records.add(readRecord(parser));
      }
      return Optional.of(records);
    } catch (JsonProcessingException ex) {
      log.debug("Discarding invalid JSON document: {}", ex.getOriginalMessage());
      return Optional.empty();
    }
  }

  private RawRecord readRecord(JsonParser parser) throws IOException {
    Map<String, String> fields = new LinkedHashMap<>();
    while (parser.nextToken() == JsonToken.FIELD_NAME) {
      String name = parser.currentName();
      JsonToken value = parser.nextToken();
      if (value == JsonToken.START_OBJECT || value == JsonToken.START_ARRAY) {
        parser.skipChildren();
      } else if (value != JsonToken.VALUE_NULL) {
        fields.put(name, parser.getText());
      }
    }
    return RawRecord.of(fields);
  }
}
