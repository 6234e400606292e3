package org.metricshub.dumblang;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.metricshub.dumblang.ext.AbstractExtension;
import org.metricshub.dumblang.ext.annotations.DslFunction;
import org.metricshub.dumblang.jrt.Values;

/**
 * Test extension used by the unit tests to exercise the annotation-based
 * extension infrastructure.
 */
public class TestExtension extends AbstractExtension {

	private static final String EXTENSION_NAME = "TestExtension";

	@Override
	public String getExtensionName() {
		return EXTENSION_NAME;
	}

	/**
	 * Upper-cases a string and appends an exclamation mark.
	 *
	 * @param text text to shout
	 * @return the shouted text
	 */
	@DslFunction("shout")
	public String shout(String text) {
		return text.toUpperCase(Locale.ROOT) + "!";
	}

	@DslFunction("answer")
	public int answer() {
		return 42;
	}

	/**
	 * @param count number of elements
	 * @return {@code [0, 1, ..., count - 1]}
	 */
	@DslFunction("range")
	public List<Double> range(Double count) {
		List<Double> result = new ArrayList<Double>();
		for (int i = 0; i < count.intValue(); i++) {
			result.add(Double.valueOf(i));
		}
		return result;
	}

	@DslFunction(value = "greet", argumentOptional = true)
	public String greet(String name) {
		return "hello " + (name == null ? "world" : name);
	}

	/**
	 * Writes a value to the output of the run, without the print prefix.
	 *
	 * @param value value to write
	 */
	@DslFunction("emit")
	public void emit(Object value) {
		getSettings().getOutputStream().println("ext: " + Values.toDisplayString(value));
	}
}
