/**
 * Generic collection helpers shared by the demo cores.
 * <p><strong>Concurrency:</strong> Not thread-safe; callers confine instances to one thread.</p>
 */
package ca.gc.cra.curio.domain.util;
