/**
 * Zoo registry aggregate, animal factories, and the observer notifier.
 */
package ca.gc.cra.curio.application.registry;
