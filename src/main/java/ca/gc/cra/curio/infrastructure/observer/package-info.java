/**
 * <strong>Purpose:</strong> {@link ca.gc.cra.curio.application.port.AnimalObserver} adapters writing to the
 * console or the SLF4J log.
 * <p><strong>Concurrency:</strong> Adapters are safe for concurrent updates.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.curio.infrastructure.observer;
