/**
 * <strong>Purpose:</strong> Animal variants registered by the zoo demo.
 * <p><strong>Concurrency:</strong> Immutable records; instances are shared by reference between the registry and
 * the notification path.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.curio.domain.registry;
