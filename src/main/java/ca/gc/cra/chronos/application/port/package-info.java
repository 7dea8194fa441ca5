/**
 * <strong>Purpose:</strong> Ports the reconciliation use cases depend on for commit history, ticketing,
 * clock and metrics.
 * <p><strong>Pipeline role:</strong> Application layer; infrastructure adapters implement these interfaces.</p>
 * <p><strong>Concurrency:</strong> Calls are made from a single thread; implementations need not be thread-safe.</p>
 * <p><strong>Observability:</strong> Remote failures surface as {@link java.io.IOException} so callers can
 * count them per unit.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.chronos.application.port;
