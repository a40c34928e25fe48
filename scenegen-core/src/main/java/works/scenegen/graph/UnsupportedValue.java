package works.scenegen.graph;

/**
 * A field the host can't express as a {@link PrimitiveValue} or {@link ReferenceValue},
 * such as an asset handle or a collection. Generators ignore these.
 *
 * @param reason for diagnostics only
 */
public record UnsupportedValue(String reason) implements FieldValue {
	@Override
	public ValueKind kind() {
		return ValueKind.UNSUPPORTED;
	}
}
