package org.javai.functiontest.api;

/**
 * A three-argument function under test. May throw any exception.
 */
@FunctionalInterface
public interface CheckedTriFunction<T, U, V, R> {

	R apply(T t, U u, V v) throws Exception;
}
