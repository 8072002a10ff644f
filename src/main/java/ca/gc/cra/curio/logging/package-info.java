/**
 * <strong>Purpose:</strong> Logging utilities that tune verbosity at runtime.
 * <p><strong>Observability:</strong> Coordinates with SLF4J/Logback; no custom metrics.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.curio.logging;
