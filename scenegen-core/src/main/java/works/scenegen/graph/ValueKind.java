package works.scenegen.graph;

public enum ValueKind {
	PRIMITIVE,
	REFERENCE,
	UNSUPPORTED,
}
