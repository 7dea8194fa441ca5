/**
 * Core domain model for chronos reconciliation of attendance, meetings and commits into worklogs.
 * <p><strong>Role:</strong> Domain layer values describing intervals, meetings, commits, worklogs and plans
 * without infrastructure dependencies.</p>
 * <p><strong>Concurrency:</strong> Types are immutable records; safe to share across threads.</p>
 * <p><strong>Security:</strong> Meeting titles and commit messages may carry personal text; log them truncated.</p>
 */
package ca.gc.cra.chronos.domain;
