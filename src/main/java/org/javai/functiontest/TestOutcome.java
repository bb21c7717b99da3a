package org.javai.functiontest;

import java.time.Duration;
import java.util.Objects;

/**
 * Result of one {@code test} call.
 *
 * @param name the test label as given by the caller
 * @param expected the anticipated result
 * @param verdict how the call ended
 * @param actual the value returned by the function, or {@code null} if it faulted before returning
 * @param elapsed time spent inside the function itself
 * @param fault the contained throwable when {@code verdict} is {@link Verdict#FAULTED}, otherwise {@code null}
 */
public record TestOutcome<R>(
		String name,
		R expected,
		Verdict verdict,
		R actual,
		Duration elapsed,
		Throwable fault) {

	public TestOutcome {
		Objects.requireNonNull(verdict, "verdict must not be null");
		if (verdict == Verdict.FAULTED && fault == null) {
			throw new IllegalArgumentException("a FAULTED outcome requires a fault");
		}
		if (verdict != Verdict.FAULTED && fault != null) {
			throw new IllegalArgumentException("a " + verdict + " outcome must not carry a fault");
		}
		elapsed = elapsed != null ? elapsed : Duration.ZERO;
	}

	static <R> TestOutcome<R> passed(String name, R expected, R actual, Duration elapsed) {
		return new TestOutcome<>(name, expected, Verdict.PASSED, actual, elapsed, null);
	}

	static <R> TestOutcome<R> failed(String name, R expected, R actual, Duration elapsed) {
		return new TestOutcome<>(name, expected, Verdict.FAILED, actual, elapsed, null);
	}

	static <R> TestOutcome<R> faulted(String name, R expected, R actual, Duration elapsed, Throwable fault) {
		return new TestOutcome<>(name, expected, Verdict.FAULTED, actual, elapsed, fault);
	}

	public boolean success() {
		return verdict == Verdict.PASSED;
	}

	public long elapsedMillis() {
		return elapsed.toMillis();
	}
}
