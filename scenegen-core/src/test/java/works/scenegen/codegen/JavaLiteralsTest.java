package works.scenegen.codegen;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class JavaLiteralsTest {

	@Test
	void floats_haveSuffix() {
		assertEquals("1.5f", JavaLiterals.of(1.5f));
		assertEquals("1f", JavaLiterals.of(1f));
		assertEquals("-3f", JavaLiterals.of(-3f));
		assertEquals("0f", JavaLiterals.of(0f));
		assertEquals("-0f", JavaLiterals.of(-0f));
		assertEquals("0.1f", JavaLiterals.of(0.1f));
		assertEquals("1.0E-5f", JavaLiterals.of(1e-5f));
		assertEquals("Float.NaN", JavaLiterals.of(Float.NaN));
		assertEquals("Float.NEGATIVE_INFINITY", JavaLiterals.of(Float.NEGATIVE_INFINITY));
	}

	@Test
	void doublesAndLongs_haveSuffix() {
		assertEquals("1.5d", JavaLiterals.of(1.5d));
		assertEquals("2d", JavaLiterals.of(2d));
		assertEquals("-0d", JavaLiterals.of(-0d));
		assertEquals("Double.POSITIVE_INFINITY", JavaLiterals.of(Double.POSITIVE_INFINITY));
		assertEquals("3L", JavaLiterals.of(3L));
		assertEquals("-2147483648", JavaLiterals.of(Integer.MIN_VALUE));
	}

	@Test
	void strings_areEscaped() {
		assertEquals("\"plain\"", JavaLiterals.of("plain"));
		assertEquals("\"a\\\"b\\\\c\\nd\\re\\tf\"", JavaLiterals.of("a\"b\\c\nd\re\tf"));
		assertEquals("\"\\001\"", JavaLiterals.of("\u0001"));
		assertEquals("\"\"", JavaLiterals.of(""));
	}
}
