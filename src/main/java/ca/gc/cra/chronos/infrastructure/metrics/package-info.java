/**
 * OpenTelemetry-backed implementation of {@link ca.gc.cra.chronos.application.port.MetricsPort}.
 * <p><strong>Concurrency:</strong> Instruments are cached in concurrent maps; safe for concurrent use.</p>
 */
package ca.gc.cra.chronos.infrastructure.metrics;
