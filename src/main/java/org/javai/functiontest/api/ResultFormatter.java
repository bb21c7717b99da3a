package org.javai.functiontest.api;

import java.util.Arrays;

/**
 * Renders a result as human-readable text for failure diagnostics.
 *
 * @param <R> the result type
 */
@FunctionalInterface
public interface ResultFormatter<R> {

	String UNSPECIFIED = "<result formatter not specified>";

	String format(R result);

	/**
	 * {@link String#valueOf(Object)} for scalars; arrays are rendered element-wise.
	 */
	static <R> ResultFormatter<R> standard() {
		return ResultFormatter::render;
	}

	/**
	 * Placeholder used when a comparator is supplied without a formatter.
	 */
	static <R> ResultFormatter<R> unspecified() {
		return result -> UNSPECIFIED;
	}

	private static String render(Object value) {
		if (value == null || !value.getClass().isArray()) {
			return String.valueOf(value);
		}
		if (value instanceof Object[] objects) {
			return Arrays.deepToString(objects);
		}
		if (value instanceof int[] ints) {
			return Arrays.toString(ints);
		}
		if (value instanceof long[] longs) {
			return Arrays.toString(longs);
		}
		if (value instanceof double[] doubles) {
			return Arrays.toString(doubles);
		}
		if (value instanceof float[] floats) {
			return Arrays.toString(floats);
		}
		if (value instanceof short[] shorts) {
			return Arrays.toString(shorts);
		}
		if (value instanceof byte[] bytes) {
			return Arrays.toString(bytes);
		}
		if (value instanceof char[] chars) {
			return Arrays.toString(chars);
		}
		return Arrays.toString((boolean[]) value);
	}
}
