/**
 * Core domain model for the Curio library and zoo demos.
 * <p><strong>Role:</strong> Domain layer value types describing catalog items, members, and animals without
 * infrastructure dependencies.</p>
 * <p><strong>Concurrency:</strong> Types are immutable records; safe to share across threads.</p>
 */
package ca.gc.cra.curio.domain;
