package works.scenegen.graph;

import static java.util.Objects.requireNonNull;

/**
 * @param name the field's simple name, as assigned in generated code
 * @param path the field's location within the behavior; contains a {@code .}
 *             if the field is nested inside another field
 */
public record ReflectedField(String name, String path, FieldValue value) {
	public ReflectedField {
		requireNonNull(name);
		requireNonNull(path);
		requireNonNull(value);
	}

	public static ReflectedField topLevel(String name, FieldValue value) {
		return new ReflectedField(name, name, value);
	}

	public boolean isNested() {
		return path.indexOf('.') >= 0;
	}
}
