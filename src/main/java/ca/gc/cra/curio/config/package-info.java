/**
 * <strong>Purpose:</strong> Configuration loading for the demo CLIs.
 * <p>Precedence is CLI {@code key=value} &gt; YAML file &gt; embedded defaults.</p>
 * <p><strong>Concurrency:</strong> Stateless loaders and immutable records.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.curio.config;
