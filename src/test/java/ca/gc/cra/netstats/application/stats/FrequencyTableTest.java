package ca.gc.cra.netstats.application.stats;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class FrequencyTableTest {

  @Test
  void topSortsByCountDescending() {
    FrequencyTable<String> table = new FrequencyTable<>();
    table.increment("a");
    table.increment("b");
    table.increment("b");
    table.increment("c");
    table.increment("c");
    table.increment("c");

    List<FrequencyTable.Ranked<String>> top = table.top(10);

    assertEquals(List.of("c", "b", "a"), top.stream().map(FrequencyTable.Ranked::key).toList());
    assertEquals(List.of(3L, 2L, 1L), top.stream().map(FrequencyTable.Ranked::count).toList());
  }

  @Test
  void tiesKeepFirstSeenOrder() {
    FrequencyTable<String> table = new FrequencyTable<>();
    for (String key : List.of("z", "y", "x", "y", "z", "x")) {
      table.increment(key);
    }

    assertEquals(List.of("z", "y", "x"), table.top(3).stream().map(FrequencyTable.Ranked::key).toList());
  }

  @Test
  void topTruncatesToLimit() {
    FrequencyTable<Integer> table = new FrequencyTable<>();
    for (int i = 0; i < 15; i++) {
      table.increment(i);
    }

    assertEquals(10, table.top(10).size());
    assertTrue(table.top(0).isEmpty());
  }
}
