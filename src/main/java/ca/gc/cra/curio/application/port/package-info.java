/**
 * <strong>Purpose:</strong> Outbound ports implemented by infrastructure adapters.
 * <p><strong>Concurrency:</strong> Port implementations must be thread-safe unless documented otherwise.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.curio.application.port;
