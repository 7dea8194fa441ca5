/**
 * CLI entry points for the reconcile, compare and adjust commands.
 * <p><strong>Role:</strong> Adapter layer on the driving side; parses arguments, configures logging and invokes
 * use cases.</p>
 * <p><strong>Metrics:</strong> Bootstraps the OpenTelemetry exporter unless {@code OTEL_METRICS_EXPORTER=none}.</p>
 */
package ca.gc.cra.chronos.api;
