package org.javai.functiontest;

/**
 * Terminal state of a single {@code test} call.
 */
public enum Verdict {
	/** The comparator judged the actual result equal to the expected one. */
	PASSED,
	/** The comparator judged the results unequal. */
	FAILED,
	/** Something was thrown while invoking, comparing or formatting. */
	FAULTED
}
