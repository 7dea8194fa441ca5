/** Half-open local time intervals and the set operations over them. */
package ca.gc.cra.chronos.domain.time;
