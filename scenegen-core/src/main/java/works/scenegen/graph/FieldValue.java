package works.scenegen.graph;

/**
 * The current value of a {@link ReflectedField}.
 * <p>
 * Implementations are records, so {@link Object#equals equals} is structural,
 * except that references compare their targets by identity.
 */
public sealed interface FieldValue permits PrimitiveValue, ReferenceValue, UnsupportedValue {
	ValueKind kind();
}
