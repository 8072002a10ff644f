/**
 * CLI entry points for the library and zoo demos.
 * <p><strong>Role:</strong> Driving adapter layer; parses arguments, resolves configuration, configures logging,
 * and runs the numbered menu loops against the application aggregates.</p>
 * <p><strong>Concurrency:</strong> Menu loops run on the calling thread; the zoo demo starts one short-lived
 * display worker per iteration and joins it before continuing.</p>
 */
package ca.gc.cra.curio.api;
