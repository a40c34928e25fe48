package works.scenegen.graph;

import static java.util.Objects.requireNonNull;

/**
 * A field value that points at something else in the scene,
 * or at nothing.
 */
public sealed interface ReferenceValue extends FieldValue {
	@Override
	default ValueKind kind() {
		return ValueKind.REFERENCE;
	}

	record NodeReference(GraphNode node) implements ReferenceValue {
		public NodeReference {
			requireNonNull(node);
		}
	}

	record BehaviorReference(GraphBehavior behavior) implements ReferenceValue {
		public BehaviorReference {
			requireNonNull(behavior);
		}
	}

	/**
	 * Refers to the spatial frame of {@code node} rather than the node itself.
	 */
	record FrameReference(GraphNode node) implements ReferenceValue {
		public FrameReference {
			requireNonNull(node);
		}
	}

	/**
	 * Refers to an object of a type the generator knows nothing about.
	 *
	 * @param description for log messages only
	 */
	record ForeignReference(String description) implements ReferenceValue { }

	record NullReference() implements ReferenceValue { }

	NullReference NULL = new NullReference();
}
