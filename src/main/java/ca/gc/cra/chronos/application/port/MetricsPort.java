package ca.gc.cra.chronos.application.port;

/**
 * <strong>What:</strong> Port abstracting metrics emission for reconciliation passes.
 * <p><strong>Why:</strong> Lets use cases count failed units, created drafts and applied corrections without
 * binding to a vendor SDK.</p>
 * <p><strong>Role:</strong> Implemented by {@code OpenTelemetryMetricsAdapter}; {@link #NO_OP} for tests and
 * runs without an exporter.</p>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate calls from any thread.</p>
 *
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric name (e.g. {@code reconcile.unit.failed}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram-style metric.
   *
   * @param key dotted metric name; must not be {@code null}
   * @param value observed value, e.g. milliseconds
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}
    @Override public void observe(String key, long value) {}
  };
}
