package ca.gc.cra.netstats.application.stats;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Insertion-ordered counter with deterministic top-N ranking.
 *
 * <p>Ranking sorts by descending count; ties keep first-seen order.</p>
 *
 * <p>Not thread-safe; one table lives for the duration of a single aggregation pass.</p>
 *
 * @param <K> counted key type
 * @since 0.1.0
 */
final class FrequencyTable<K> {
  private final Map<K, long[]> counts = new LinkedHashMap<>();

  void increment(K key) {
    Objects.requireNonNull(key, "key");
    counts.computeIfAbsent(key, k -> new long[1])[0]++;
  }

  List<Ranked<K>> top(int limit) {
    List<Ranked<K>> ranked = new ArrayList<>(counts.size());
    for (Map.Entry<K, long[]> entry : counts.entrySet()) {
      ranked.add(new Ranked<>(entry.getKey(), entry.getValue()[0]));
    }
    return Ranking.top(ranked, Ranked::count, limit);
  }

  record Ranked<K>(K key, long count) {}
}
