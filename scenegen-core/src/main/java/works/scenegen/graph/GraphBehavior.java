package works.scenegen.graph;

/**
 * A typed instance attached to exactly one {@link GraphNode}.
 * Identity rules are the same as for {@link GraphNode}.
 */
public interface GraphBehavior {
	GraphNode node();

	TypeName type();
}
