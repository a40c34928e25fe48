package works.scenegen.graph;

import static java.util.Objects.requireNonNull;

/**
 * A field value that can be written as a literal or a constructor call.
 * <p>
 * Floating-point components compare the way {@link Float#compare} does,
 * so {@code NaN} equals itself and {@code -0f} differs from {@code 0f}.
 */
public sealed interface PrimitiveValue extends FieldValue {
	@Override
	default ValueKind kind() {
		return ValueKind.PRIMITIVE;
	}

	record BooleanValue(boolean value) implements PrimitiveValue { }
	record IntValue(int value) implements PrimitiveValue { }
	record LongValue(long value) implements PrimitiveValue { }
	record FloatValue(float value) implements PrimitiveValue { }
	record DoubleValue(double value) implements PrimitiveValue { }

	/**
	 * @param value never null; hosts report a missing string as {@code ""}
	 */
	record StringValue(String value) implements PrimitiveValue {
		public StringValue {
			requireNonNull(value);
		}
	}

	record EnumValue(TypeName enumType, String member) implements PrimitiveValue {
		public EnumValue {
			requireNonNull(enumType);
			requireNonNull(member);
		}
	}

	record Vector2Value(Vec2 value) implements PrimitiveValue {
		public Vector2Value {
			requireNonNull(value);
		}
	}

	record Vector3Value(Vec3 value) implements PrimitiveValue {
		public Vector3Value {
			requireNonNull(value);
		}
	}

	record ColorValue(Rgba value) implements PrimitiveValue {
		public ColorValue {
			requireNonNull(value);
		}
	}
}
