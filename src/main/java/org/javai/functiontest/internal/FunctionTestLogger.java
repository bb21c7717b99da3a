package org.javai.functiontest.internal;

import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Diagnostic logging for test invocations. The text report remains the primary output.
 */
public class FunctionTestLogger {

	private final Logger logger;

	public FunctionTestLogger(Class<?> harnessClass) {
		this.logger = LoggerFactory.getLogger(harnessClass);
	}

	public void logPassed(String testName, Duration elapsed) {
		if (!logger.isDebugEnabled()) {
			return;
		}
		logger.debug("test '{}' passed in {} ms", testName, toMillis(elapsed));
	}

	public void logFailed(String testName, Duration elapsed, String actual, String expected) {
		if (!logger.isInfoEnabled()) {
			return;
		}
		if (actual == null) {
			logger.info("test '{}' failed after {} ms", testName, toMillis(elapsed));
			return;
		}
		logger.info("test '{}' failed after {} ms: actual={} expected={}",
				testName,
				toMillis(elapsed),
				summarize(actual),
				summarize(expected)
		);
	}

	public void logFault(String testName, Duration elapsed, Throwable fault) {
		if (!logger.isWarnEnabled()) {
			return;
		}
		logger.warn("test '{}' raised {} after {} ms",
				testName,
				fault.getClass().getName(),
				toMillis(elapsed),
				fault
		);
	}

	private long toMillis(Duration duration) {
		return duration == null ? -1 : duration.toMillis();
	}

	private String summarize(String text) {
		if (text == null) {
			return "null";
		}
		String normalized = text.replaceAll("\\s+", " ").trim();
		int maxLength = 64;
		return normalized.length() <= maxLength ? normalized : normalized.substring(0, maxLength - 3) + "...";
	}
}
