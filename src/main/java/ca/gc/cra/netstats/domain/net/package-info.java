/**
 * Domain representations of raw device output and address/port classification helpers.
 * <p><strong>Role:</strong> Domain layer inputs produced by transport adapters and consumed by aggregators.</p>
 * <p><strong>Concurrency:</strong> Types are immutable or stateless; safe across threads.</p>
 * <p><strong>Security:</strong> Records carry internal addressing; treat as sensitive when logging.</p>
 */
package ca.gc.cra.netstats.domain.net;
