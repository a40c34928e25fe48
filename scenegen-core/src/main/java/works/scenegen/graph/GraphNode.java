package works.scenegen.graph;

import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * A vertex of the host's scene graph, as seen by the generator.
 * <p>
 * Nodes are compared by reference identity: {@code equals} must not be overridden,
 * and a host must hand out the same {@code GraphNode} object for the same
 * underlying node throughout a generator run.
 */
public interface GraphNode {
	String name();

	@Nullable GraphNode parent();

	List<? extends GraphNode> children();

	Frame frame();

	/**
	 * @return every behavior attached to this node, in attachment order
	 */
	List<? extends GraphBehavior> behaviors();
}
