/**
 * <strong>Purpose:</strong> Library catalog value types (items and members).
 * <p><strong>Concurrency:</strong> Immutable records; thread-safe.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.curio.domain.catalog;
