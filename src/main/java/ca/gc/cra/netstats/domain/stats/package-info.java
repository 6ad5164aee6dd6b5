/**
 * Immutable summary shapes served to the presentation layer.
 * <p><strong>Role:</strong> Domain output of the aggregators; cached per device by the stats services.</p>
 * <p><strong>Concurrency:</strong> Records are immutable; safe to hand to concurrent readers.</p>
 * <p><strong>Contract:</strong> counts are non-negative, percentages lie in {@code [0, 100]}.</p>
 */
package ca.gc.cra.netstats.domain.stats;
