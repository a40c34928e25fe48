package works.scenegen;

import java.util.List;
import java.util.function.Predicate;
import javax.lang.model.SourceVersion;
import works.scenegen.graph.GraphBehavior;
import works.scenegen.graph.GraphNode;

import static java.util.Objects.requireNonNull;

/**
 * One output file to generate.
 *
 * @param className the simple name of the generated class
 * @param sourceName where the graph came from; appears in the header comment
 * @param supported which behaviors to attach and emit; others are attached only if referenced
 * @param anchorBoundaries nodes whose descendants are looked up by path rather than built
 */
public record GenerationRequest(
	String className,
	String sourceName,
	EntryPoint entryPoint,
	Predicate<GraphBehavior> supported,
	List<GraphNode> anchorBoundaries
) {
	public GenerationRequest {
		requireNonNull(sourceName);
		requireNonNull(entryPoint);
		requireNonNull(supported);
		anchorBoundaries = List.copyOf(anchorBoundaries);
		if (!SourceVersion.isIdentifier(className) || SourceVersion.isKeyword(className)) {
			throw new IllegalArgumentException("Invalid class name: \"" + className + "\"");
		}
		if (entryPoint instanceof EntryPoint.AnchorDirectory && !anchorBoundaries.isEmpty()) {
			throw new IllegalArgumentException("A directory factory has no anchor container to look up nodes in");
		}
	}

	public static GenerationRequest of(String className, String sourceName, EntryPoint entryPoint, Predicate<GraphBehavior> supported) {
		return new GenerationRequest(className, sourceName, entryPoint, supported, List.of());
	}

	public GenerationRequest withAnchorBoundaries(List<GraphNode> boundaries) {
		return new GenerationRequest(className, sourceName, entryPoint, supported, boundaries);
	}
}
