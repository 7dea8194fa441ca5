/**
 * Configuration aggregates and composition root wiring for chronos CLIs.
 * <p><strong>Role:</strong> Bootstrap layer merging defaults, YAML and CLI overrides and selecting adapters.</p>
 * <p><strong>Concurrency:</strong> Configuration objects are immutable; safe to share.</p>
 * <p><strong>Security:</strong> Paths come from the operator; nothing here reaches the network.</p>
 */
package ca.gc.cra.chronos.config;
