package org.javai.functiontest.api;

/**
 * A nullary function under test. May throw any exception.
 */
@FunctionalInterface
public interface CheckedSupplier<R> {

	R get() throws Exception;
}
