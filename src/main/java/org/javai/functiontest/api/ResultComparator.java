package org.javai.functiontest.api;

import java.util.Objects;

/**
 * Decides whether an actual invocation result matches the expected one.
 *
 * @param <R> the result type
 */
@FunctionalInterface
public interface ResultComparator<R> {

	/**
	 * @param actual the value returned by the function under test
	 * @param expected the anticipated value
	 * @return {@code true} when the two results are considered equal
	 */
	boolean matches(R actual, R expected);

	/**
	 * Value equality via {@link Objects#deepEquals(Object, Object)}. Boxed primitives compare by
	 * value and arrays, primitive or not, compare element by element.
	 */
	static <R> ResultComparator<R> equality() {
		return Objects::deepEquals;
	}
}
