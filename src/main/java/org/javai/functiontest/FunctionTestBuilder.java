package org.javai.functiontest;

import java.io.PrintStream;
import java.util.Objects;
import java.util.function.Function;
import org.javai.functiontest.api.MonotonicClock;
import org.javai.functiontest.api.ResultComparator;
import org.javai.functiontest.api.ResultFormatter;

/**
 * Fluent builder shared by all harness arities.
 *
 * <p>Obtained from the static {@code of(...)} factory of each harness:</p>
 * <pre>{@code
 * BiFunctionTest<Integer, Integer, Integer> tester = BiFunctionTest.of((Integer a, Integer b) -> a / b)
 *     .withOutput(System.err)
 *     .withOutputLineLength(72)
 *     .build();
 * }</pre>
 *
 * <p>Any strategy left unset falls back to the defaults of the matching construction mode.</p>
 *
 * @param <R> the result type
 * @param <H> the harness type produced by {@link #build()}
 */
public final class FunctionTestBuilder<R, H extends AbstractFunctionTest<R>> {

	private final Function<FunctionTestBuilder<R, H>, H> factory;

	ResultComparator<R> comparator;
	ResultFormatter<R> formatter;
	PrintStream output;
	MonotonicClock clock = MonotonicClock.SYSTEM;
	Boolean verbose;
	int outputLineLength = AbstractFunctionTest.DEFAULT_OUTPUT_LINE_LENGTH;
	char fillCharacter = AbstractFunctionTest.DEFAULT_FILL_CHARACTER;

	FunctionTestBuilder(Function<FunctionTestBuilder<R, H>, H> factory) {
		this.factory = Objects.requireNonNull(factory, "factory must not be null");
	}

	public FunctionTestBuilder<R, H> withComparator(ResultComparator<R> comparator) {
		this.comparator = comparator;
		return this;
	}

	public FunctionTestBuilder<R, H> withFormatter(ResultFormatter<R> formatter) {
		this.formatter = formatter;
		return this;
	}

	/**
	 * @param output the report sink; {@code null} selects {@code System.out}
	 */
	public FunctionTestBuilder<R, H> withOutput(PrintStream output) {
		this.output = output;
		return this;
	}

	public FunctionTestBuilder<R, H> withClock(MonotonicClock clock) {
		this.clock = Objects.requireNonNull(clock, "clock must not be null");
		return this;
	}

	/**
	 * Override the verbosity the construction mode would otherwise pick.
	 */
	public FunctionTestBuilder<R, H> withVerbose(boolean verbose) {
		this.verbose = verbose;
		return this;
	}

	public FunctionTestBuilder<R, H> withOutputLineLength(int outputLineLength) {
		this.outputLineLength = AbstractFunctionTest.requireLineLength(outputLineLength);
		return this;
	}

	public FunctionTestBuilder<R, H> withFillCharacter(char fillCharacter) {
		this.fillCharacter = fillCharacter;
		return this;
	}

	public H build() {
		return factory.apply(this);
	}
}
