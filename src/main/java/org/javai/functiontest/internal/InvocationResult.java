package org.javai.functiontest.internal;

import java.time.Duration;
import java.util.Objects;
import org.javai.functiontest.api.CheckedSupplier;
import org.javai.functiontest.api.MonotonicClock;

/**
 * Outcome of invoking the function under test exactly once: either it returned a value or it
 * raised a {@link Throwable}.
 */
public sealed interface InvocationResult<R> {

	Duration elapsed();

	record Returned<R>(R value, Duration elapsed) implements InvocationResult<R> {
	}

	record Raised<R>(Throwable fault, Duration elapsed) implements InvocationResult<R> {

		public Raised {
			Objects.requireNonNull(fault, "fault must not be null");
		}
	}

	/**
	 * Invoke {@code invocation}, timing only the call itself.
	 */
	static <R> InvocationResult<R> invoke(CheckedSupplier<? extends R> invocation, MonotonicClock clock) {
		long start = clock.nowNanos();
		try {
			R value = invocation.get();
			return new Returned<>(value, Duration.ofNanos(clock.nowNanos() - start));
		}
		catch (InterruptedException ex) {
			Thread.currentThread().interrupt();
			return new Raised<>(ex, Duration.ofNanos(clock.nowNanos() - start));
		}
		catch (Throwable ex) {
			return new Raised<>(ex, Duration.ofNanos(clock.nowNanos() - start));
		}
	}
}
