package works.scenegen.refs;

import works.scenegen.graph.GraphBehavior;
import works.scenegen.graph.GraphNode;

import static java.util.Objects.requireNonNull;

/**
 * What generated code must do to reproduce one reference field.
 */
public sealed interface Classification {
	/**
	 * A reference the generator constructs itself, or has already constructed.
	 */
	sealed interface LocalTarget extends Classification {
		/**
		 * @return the node that must exist before the reference can be assigned
		 */
		GraphNode targetNode();
	}

	record NodeRef(GraphNode targetNode) implements LocalTarget {
		public NodeRef {
			requireNonNull(targetNode);
		}
	}

	record BehaviorRef(GraphBehavior target) implements LocalTarget {
		public BehaviorRef {
			requireNonNull(target);
		}

		@Override
		public GraphNode targetNode() {
			return target.node();
		}
	}

	record FrameRef(GraphNode targetNode) implements LocalTarget {
		public FrameRef {
			requireNonNull(targetNode);
		}
	}

	/**
	 * The target lives below an anchor boundary, so generated code looks its node up by
	 * {@code path} and then derives the reference from it the way {@code local} says.
	 */
	record AnchorRef(String path, LocalTarget local) implements Classification {
		public AnchorRef {
			requireNonNull(path);
			requireNonNull(local);
		}
	}

	/**
	 * The field holds null.
	 */
	record Cleared() implements Classification { }

	record Unsupported(String reason) implements Classification {
		public Unsupported {
			requireNonNull(reason);
		}
	}
}
