package works.scenegen.refs;

import works.scenegen.graph.GraphNode;
import works.scenegen.graph.ReferenceValue;
import works.scenegen.graph.ReferenceValue.BehaviorReference;
import works.scenegen.graph.ReferenceValue.ForeignReference;
import works.scenegen.graph.ReferenceValue.FrameReference;
import works.scenegen.graph.ReferenceValue.NodeReference;
import works.scenegen.graph.ReferenceValue.NullReference;
import works.scenegen.refs.Classification.AnchorRef;
import works.scenegen.refs.Classification.BehaviorRef;
import works.scenegen.refs.Classification.Cleared;
import works.scenegen.refs.Classification.FrameRef;
import works.scenegen.refs.Classification.LocalTarget;
import works.scenegen.refs.Classification.NodeRef;
import works.scenegen.refs.Classification.Unsupported;

import static java.util.Objects.requireNonNull;

public final class ReferenceClassifier {
	private final AnchorResolver anchors;

	public ReferenceClassifier(AnchorResolver anchors) {
		this.anchors = requireNonNull(anchors);
	}

	/**
	 * Anchored targets take precedence: a reference to anything below
	 * a boundary is an {@link AnchorRef} regardless of what it points at.
	 */
	public Classification classify(ReferenceValue value) {
		LocalTarget local;
		if (value instanceof NullReference) {
			return new Cleared();
		} else if (value instanceof ForeignReference f) {
			return new Unsupported("unsupported reference to " + f.description());
		} else if (value instanceof NodeReference n) {
			local = new NodeRef(n.node());
		} else if (value instanceof BehaviorReference b) {
			local = new BehaviorRef(b.behavior());
		} else if (value instanceof FrameReference f) {
			local = new FrameRef(f.node());
		} else {
			throw new AssertionError("Unexpected reference: " + value);
		}
		GraphNode target = local.targetNode();
		String path = anchors.pathOf(target);
		if (path == null) {
			return local;
		} else {
			return new AnchorRef(path, local);
		}
	}
}
