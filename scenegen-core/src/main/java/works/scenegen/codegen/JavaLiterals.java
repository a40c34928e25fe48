package works.scenegen.codegen;

/**
 * Java source spellings of primitive and string values.
 * Every numeric literal that isn't an {@code int} carries its type suffix.
 */
public final class JavaLiterals {
	private JavaLiterals() { }

	public static String of(boolean value) {
		return Boolean.toString(value);
	}

	public static String of(int value) {
		return Integer.toString(value);
	}

	public static String of(long value) {
		return value + "L";
	}

	public static String of(float value) {
		if (Float.isNaN(value)) {
			return "Float.NaN";
		} else if (value == Float.POSITIVE_INFINITY) {
			return "Float.POSITIVE_INFINITY";
		} else if (value == Float.NEGATIVE_INFINITY) {
			return "Float.NEGATIVE_INFINITY";
		} else if (isNegativeZero(value)) {
			return "-0f";
		} else if (value == Math.rint(value) && Math.abs(value) < 1e7f) {
			return (long) value + "f";
		} else {
			return Float.toString(value) + "f";
		}
	}

	public static String of(double value) {
		if (Double.isNaN(value)) {
			return "Double.NaN";
		} else if (value == Double.POSITIVE_INFINITY) {
			return "Double.POSITIVE_INFINITY";
		} else if (value == Double.NEGATIVE_INFINITY) {
			return "Double.NEGATIVE_INFINITY";
		} else if (Double.doubleToRawLongBits(value) == Double.doubleToRawLongBits(-0d)) {
			return "-0d";
		} else if (value == Math.rint(value) && Math.abs(value) < 1e15) {
			return (long) value + "d";
		} else {
			return Double.toString(value) + "d";
		}
	}

	/**
	 * A double-quoted literal. Control characters other than the common ones
	 * are written as octal escapes.
	 */
	public static String of(String value) {
		StringBuilder sb = new StringBuilder(value.length() + 2).append('"');
		for (int i = 0; i < value.length(); i++) {
			char c = value.charAt(i);
			switch (c) {
				case '\\' -> sb.append("\\\\");
				case '"' -> sb.append("\\\"");
				case '\n' -> sb.append("\\n");
				case '\r' -> sb.append("\\r");
				case '\t' -> sb.append("\\t");
				default -> {
					if (c < 0x20 || c == 0x7f) {
						sb.append(String.format("\\%03o", (int) c));
					} else {
						sb.append(c);
					}
				}
			}
		}
		return sb.append('"').toString();
	}

	private static boolean isNegativeZero(float value) {
		return Float.floatToRawIntBits(value) == Float.floatToRawIntBits(-0f);
	}
}
