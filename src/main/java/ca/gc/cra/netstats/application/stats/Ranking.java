package ca.gc.cra.netstats.application.stats;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.function.ToLongFunction;

/**
 * Stable descending top-N selection shared by the aggregators.
 *
 * @since 0.1.0
 */
final class Ranking {
  private Ranking() {}

  /**
   * Returns the highest-scoring items, ties kept in iteration order.
   *
   * @param items candidates in first-seen order
   * @param score ranking score
   * @param limit maximum rows returned
   * @param <T> row type
   * @return immutable list of at most {@code limit} rows
   */
  static <T> List<T> top(Collection<T> items, ToLongFunction<T> score, int limit) {
    if (limit <= 0 || items.isEmpty()) {
      return List.of();
    }
    List<T> sorted = new ArrayList<>(items);
    // List.sort is stable
    sorted.sort(Comparator.comparingLong(score).reversed());
    return List.copyOf(sorted.size() > limit ? sorted.subList(0, limit) : sorted);
  }
}
