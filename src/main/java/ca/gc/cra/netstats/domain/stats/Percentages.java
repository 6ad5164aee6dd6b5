package ca.gc.cra.netstats.domain.stats;

/**
 * Zero-guarded percentage arithmetic shared by all summaries.
 *
 * @since 0.1.0
 */
public final class Percentages {
  private Percentages() {
    // Utility
  }

  /**
   * Computes {@code count / total * 100}, clamped to {@code [0, 100]}.
   *
   * @param count numerator
   * @param total denominator; zero or negative yields {@code 0.0}
   * @return percentage in {@code [0, 100]}
   */
  public static double of(long count, long total) {
    if (total <= 0 || count <= 0) {
      return 0.0;
    }
    double percentage = (double) count / (double) total * 100.0;
    return Math.min(100.0, percentage);
  }
}
