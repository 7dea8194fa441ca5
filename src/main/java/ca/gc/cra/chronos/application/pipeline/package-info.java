/**
 * Use cases that run a reconciliation pass, book drafts and collect remote worklogs.
 *
 * @since 0.1.0
 */
package ca.gc.cra.chronos.application.pipeline;
