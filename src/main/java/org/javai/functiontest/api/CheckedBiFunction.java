package org.javai.functiontest.api;

/**
 * A two-argument function under test. May throw any exception.
 */
@FunctionalInterface
public interface CheckedBiFunction<T, U, R> {

	R apply(T t, U u) throws Exception;
}
