/** Logging helpers shared by the CLIs and use cases. */
package ca.gc.cra.chronos.logging;
