package org.javai.functiontest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

import java.io.IOException;
import org.javai.functiontest.api.CheckedBiFunction;
import org.javai.functiontest.testsupport.ManualMonotonicClock;
import org.javai.functiontest.testsupport.ReportCapture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class BiFunctionTestTest {

	private ReportCapture report;
	private ManualMonotonicClock clock;

	@BeforeEach
	void setUp() {
		report = new ReportCapture();
		clock = new ManualMonotonicClock();
	}

	@AfterEach
	void clearInterrupt() {
		Thread.interrupted();
	}

	private <T, U, R> BiFunctionTest<T, U, R> harness(CheckedBiFunction<? super T, ? super U, ? extends R> function) {
		return BiFunctionTest.<T, U, R>of(function)
				.withOutput(report.stream())
				.withClock(clock)
				.build();
	}

	@Test
	void divisionByZeroIsReportedAsException() {
		BiFunctionTest<Integer, Integer, Integer> divide = harness((Integer a, Integer b) -> a / b);

		TestOutcome<Integer> outcome = divide.test("boom", 0, 1, 0);

		assertThat(outcome.success()).isFalse();
		assertThat(outcome.verdict()).isEqualTo(Verdict.FAULTED);
		assertThat(outcome.actual()).isNull();
		assertThat(outcome.fault()).isInstanceOf(ArithmeticException.class);
		assertThat(report.text()).isEqualTo(
				"TESTING boom: " + ".".repeat(46) + " EXCEPTION\n"
						+ "java.lang.ArithmeticException:\n"
						+ "/ by zero\n");
	}

	@Test
	void checkedExceptionsAreContained() {
		BiFunctionTest<String, Integer, String> reader = harness((String path, Integer limit) -> {
			throw new IOException("cannot read " + path);
		});

		TestOutcome<String> outcome = reader.test("io", "content", "/missing", 10);

		assertThat(outcome.success()).isFalse();
		assertThat(report.text())
				.contains(" EXCEPTION\n")
				.contains("java.io.IOException:\n")
				.endsWith("cannot read /missing\n");
	}

	@Test
	void exceptionWithoutMessagePrintsEmptyLine() {
		BiFunctionTest<Integer, Integer, Integer> failing = harness((Integer a, Integer b) -> {
			throw new IllegalStateException();
		});

		failing.test("silent", 0, 1, 2);

		assertThat(report.text()).endsWith("EXCEPTION\njava.lang.IllegalStateException:\n\n");
	}

	@Test
	void errorsAreReportedWithTypeAndMessage() {
		BiFunctionTest<Integer, Integer, Integer> failing = harness((Integer a, Integer b) -> {
			throw new AssertionError("not a regular exception");
		});

		TestOutcome<Integer> outcome = failing.test("error", 0, 1, 2);

		assertThat(outcome.verdict()).isEqualTo(Verdict.FAULTED);
		assertThat(outcome.fault()).isInstanceOf(AssertionError.class);
		assertThat(report.text()).endsWith(" EXCEPTION\njava.lang.AssertionError:\nnot a regular exception\n");
	}

	@Test
	void faultThatCannotDescribeItselfIsReportedAsUnknown() {
		BiFunctionTest<Integer, Integer, Integer> failing = harness((Integer a, Integer b) -> {
			throw new IllegalStateException() {
				@Override
				public String getMessage() {
					throw new UnsupportedOperationException("no message available");
				}
			};
		});

		TestOutcome<Integer> outcome = failing.test("opaque", 0, 1, 2);

		assertThat(outcome.verdict()).isEqualTo(Verdict.FAULTED);
		assertThat(report.text()).endsWith(" EXCEPTION\nunknown\n");
	}

	@Test
	void faultsNeverEscapeAndTheRunContinues() {
		BiFunctionTest<Integer, Integer, Integer> divide = harness((Integer a, Integer b) -> a / b);

		assertThatCode(() -> divide.test("boom", 0, 1, 0)).doesNotThrowAnyException();
		TestOutcome<Integer> next = divide.test("fine", 3, 6, 2);

		assertThat(next.success()).isTrue();
		assertThat(report.text()).endsWith("TESTING fine: " + ".".repeat(46) + " OK (0 ms)\n");
	}

	@Test
	void interruptIsContainedAndFlagRestored() {
		BiFunctionTest<Integer, Integer, Integer> sleeper = harness((Integer a, Integer b) -> {
			throw new InterruptedException("interrupted while waiting");
		});

		TestOutcome<Integer> outcome = sleeper.test("sleep", 0, 1, 1);

		assertThat(outcome.verdict()).isEqualTo(Verdict.FAULTED);
		assertThat(Thread.currentThread().isInterrupted()).isTrue();
		assertThat(report.text()).contains("java.lang.InterruptedException:\ninterrupted while waiting\n");
	}

	@Test
	void elapsedTimeIsKeptForFaults() {
		BiFunctionTest<Integer, Integer, Integer> divide = harness((Integer a, Integer b) -> {
			clock.advanceMillis(3);
			return a / b;
		});

		TestOutcome<Integer> outcome = divide.test("boom", 0, 1, 0);

		assertThat(outcome.elapsedMillis()).isEqualTo(3);
		assertThat(report.text()).doesNotContain("ms)");
	}

	@Test
	void argumentsArePassedInOrder() {
		BiFunctionTest<String, Integer, String> repeat = harness((String s, Integer n) -> s.repeat(n));

		assertThat(repeat.test("repeat", "ababab", "ab", 3).success()).isTrue();
		assertThat(repeat.test("repeat", "ab", "ab", 3).actual()).isEqualTo("ababab");
	}
}
