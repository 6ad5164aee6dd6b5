/**
 * Time-bounded caching of computed summaries, keyed by device identifier.
 */
package ca.gc.cra.netstats.application.cache;
