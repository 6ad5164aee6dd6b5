/**
 * Configuration loading and composition root wiring for NETSTATS CLIs.
 * <p><strong>Role:</strong> Bootstrap layer layering defaults, YAML and CLI overrides, then selecting adapters.</p>
 * <p><strong>Concurrency:</strong> Configuration objects are immutable; safe to share.</p>
 */
package ca.gc.cra.netstats.config;
