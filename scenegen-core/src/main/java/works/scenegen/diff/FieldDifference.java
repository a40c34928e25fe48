package works.scenegen.diff;

import works.scenegen.graph.FieldValue;

import static java.util.Objects.requireNonNull;

/**
 * A top-level field whose value differs from its type's default.
 */
public record FieldDifference(String name, FieldValue value) {
	public FieldDifference {
		requireNonNull(name);
		requireNonNull(value);
	}
}
