/**
 * Jackson streaming adapters: device snapshot parsing and summary rendering.
 */
package ca.gc.cra.netstats.infrastructure.json;
