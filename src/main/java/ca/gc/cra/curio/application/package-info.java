/**
 * <strong>Purpose:</strong> Application services for the library and zoo demos.
 * <p><strong>Role:</strong> Owns the in-memory aggregates and the factories that build domain values from
 * user-supplied type tags.</p>
 * <p><strong>Concurrency:</strong> Aggregates are confined to the CLI control thread unless documented otherwise.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.curio.application;
