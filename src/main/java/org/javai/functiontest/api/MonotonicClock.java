package org.javai.functiontest.api;

/**
 * Time source for elapsed-time measurement.
 *
 * <p>Values are only meaningful relative to each other. The default implementation is backed by
 * {@link System#nanoTime()} and is unaffected by wall-clock adjustments.</p>
 */
@FunctionalInterface
public interface MonotonicClock {

	MonotonicClock SYSTEM = System::nanoTime;

	/**
	 * @return a monotonically increasing tick value in nanoseconds
	 */
	long nowNanos();
}
