package works.scenegen;

import java.util.List;
import works.scenegen.graph.GraphNode;
import works.scenegen.graph.TypeName;

import static java.util.Objects.requireNonNull;

/**
 * The shape of the one factory method a generated class contains.
 */
public sealed interface EntryPoint {
	/**
	 * {@code static <Primary> create(List<Node> createdNodes, AnchorContainer anchors)},
	 * returning the root's primary handle.
	 *
	 * @param includeDescendants if true, every descendant of {@code root} is built,
	 *                           not just the ones its behaviors refer to
	 */
	record SingleRoot(GraphNode root, boolean includeDescendants) implements EntryPoint {
		public SingleRoot {
			requireNonNull(root);
		}
	}

	/**
	 * {@code static List<Element> create(List<Node> createdNodes, AnchorContainer anchors)},
	 * returning each root's handle of type {@code elementType}, in order.
	 */
	record RootList(List<GraphNode> roots, TypeName elementType) implements EntryPoint {
		public RootList {
			roots = List.copyOf(roots);
			requireNonNull(elementType);
			if (roots.isEmpty()) {
				throw new IllegalArgumentException("Root list can't be empty");
			}
		}
	}

	/**
	 * {@code static NodeDirectory create(List<Node> createdNodes)}:
	 * builds {@code boundary} and all its descendants, and registers each descendant
	 * under its path below {@code boundary}.
	 */
	record AnchorDirectory(GraphNode boundary) implements EntryPoint {
		public AnchorDirectory {
			requireNonNull(boundary);
		}
	}
}
