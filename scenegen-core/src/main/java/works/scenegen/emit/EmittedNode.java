package works.scenegen.emit;

import java.util.IdentityHashMap;
import java.util.Map;
import org.jetbrains.annotations.Nullable;
import works.scenegen.graph.GraphBehavior;
import works.scenegen.graph.GraphNode;
import works.scenegen.graph.TypeName;

/**
 * The variables generated code holds for one constructed node.
 */
public final class EmittedNode {
	private final GraphNode node;
	private final String baseName;
	private final String nodeVar;
	private final boolean isRoot;
	private final Map<GraphBehavior, String> behaviorVars = new IdentityHashMap<>();
	private @Nullable GraphBehavior primary;
	private @Nullable String rectVar;
	private boolean parentLinked;

	EmittedNode(GraphNode node, String baseName, String nodeVar, boolean isRoot) {
		this.node = node;
		this.baseName = baseName;
		this.nodeVar = nodeVar;
		this.isRoot = isRoot;
	}

	public GraphNode node() {
		return node;
	}

	String baseName() {
		return baseName;
	}

	public String nodeVar() {
		return nodeVar;
	}

	public boolean isRoot() {
		return isRoot;
	}

	/**
	 * @return the first attached behavior accepted by the supported-behavior filter, if any
	 */
	public @Nullable GraphBehavior primary() {
		return primary;
	}

	/**
	 * @return the variable holding the primary behavior,
	 * or the node variable if there is none
	 */
	public String primaryHandle() {
		return primary == null ? nodeVar : behaviorVars.get(primary);
	}

	public @Nullable String behaviorVar(GraphBehavior behavior) {
		return behaviorVars.get(behavior);
	}

	/**
	 * @return the variable of the first attached behavior whose type is exactly {@code type},
	 * in attachment order of the node, or null if none has been attached
	 */
	public @Nullable String behaviorVarOfType(TypeName type) {
		for (GraphBehavior b : node.behaviors()) {
			if (b.type().equals(type)) {
				String var = behaviorVars.get(b);
				if (var != null) {
					return var;
				}
			}
		}
		return null;
	}

	void recordBehavior(GraphBehavior behavior, String var, boolean isPrimary) {
		behaviorVars.put(behavior, var);
		if (isPrimary) {
			primary = behavior;
		}
	}

	@Nullable String rectVar() {
		return rectVar;
	}

	void rectVar(String rectVar) {
		this.rectVar = rectVar;
	}

	boolean parentLinked() {
		return parentLinked;
	}

	void markParentLinked() {
		parentLinked = true;
	}

	@Override
	public String toString() {
		return "EmittedNode(" + nodeVar + ")";
	}
}
