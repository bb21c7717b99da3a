package org.javai.functiontest.api;

/**
 * A single-argument function under test. May throw any exception.
 */
@FunctionalInterface
public interface CheckedFunction<T, R> {

	R apply(T t) throws Exception;
}
