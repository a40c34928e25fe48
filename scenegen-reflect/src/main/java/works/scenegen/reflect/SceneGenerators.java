package works.scenegen.reflect;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import works.scenegen.EntryPoint;
import works.scenegen.GeneratedSource;
import works.scenegen.GenerationRequest;
import works.scenegen.GeneratorSettings;
import works.scenegen.SceneCodeGenerator;
import works.scenegen.graph.GraphBehavior;
import works.scenegen.graph.GraphNode;
import works.scenegen.graph.TypeName;
import works.scenegen.scene.Behavior;
import works.scenegen.scene.SceneNode;

import static java.util.Objects.requireNonNull;

/**
 * Generates factory classes for {@link SceneNode} graphs.
 * <p>
 * Each method call is an independent run with its own view of the scene,
 * so the scene may change between calls.
 */
public final class SceneGenerators {
	private final GeneratorSettings settings;

	public SceneGenerators(GeneratorSettings settings) {
		settings.validate();
		this.settings = settings;
	}

	/**
	 * @param supported which behavior classes to emit; see {@link #inPackage}
	 * @param anchorBoundaries containers whose descendants the generated code looks up
	 *                         in its {@code anchors} argument
	 */
	public GeneratedSource singleRoot(
		String className,
		String sourceName,
		SceneNode root,
		boolean includeDescendants,
		Predicate<Class<? extends Behavior>> supported,
		List<SceneNode> anchorBoundaries
	) {
		ReflectiveSceneGraph graph = new ReflectiveSceneGraph();
		EntryPoint entryPoint = new EntryPoint.SingleRoot(graph.node(root), includeDescendants);
		return run(graph, className, sourceName, entryPoint, supported, anchorBoundaries);
	}

	/**
	 * @param elementType the behavior each root contributes to the returned list
	 */
	public GeneratedSource rootList(
		String className,
		String sourceName,
		List<SceneNode> roots,
		Class<? extends Behavior> elementType,
		Predicate<Class<? extends Behavior>> supported,
		List<SceneNode> anchorBoundaries
	) {
		ReflectiveSceneGraph graph = new ReflectiveSceneGraph();
		EntryPoint entryPoint = new EntryPoint.RootList(nodes(graph, roots), TypeName.of(elementType));
		return run(graph, className, sourceName, entryPoint, supported, anchorBoundaries);
	}

	public GeneratedSource directory(
		String className,
		String sourceName,
		SceneNode boundary,
		Predicate<Class<? extends Behavior>> supported
	) {
		ReflectiveSceneGraph graph = new ReflectiveSceneGraph();
		EntryPoint entryPoint = new EntryPoint.AnchorDirectory(graph.node(boundary));
		return run(graph, className, sourceName, entryPoint, supported, List.of());
	}

	/**
	 * Accepts behavior classes in {@code packageName} and its subpackages.
	 */
	public static Predicate<Class<? extends Behavior>> inPackage(String packageName) {
		requireNonNull(packageName);
		return type -> type.getPackageName().equals(packageName)
			|| type.getPackageName().startsWith(packageName + ".");
	}

	private GeneratedSource run(
		ReflectiveSceneGraph graph,
		String className,
		String sourceName,
		EntryPoint entryPoint,
		Predicate<Class<? extends Behavior>> supported,
		List<SceneNode> anchorBoundaries
	) {
		Predicate<GraphBehavior> behaviorFilter = b -> supported.test(graph.instance(b).getClass());
		GenerationRequest request = new GenerationRequest(className, sourceName, entryPoint, behaviorFilter, nodes(graph, anchorBoundaries));
		return new SceneCodeGenerator(graph, SceneTargetDialect.INSTANCE, settings).generate(request);
	}

	private static List<GraphNode> nodes(ReflectiveSceneGraph graph, List<SceneNode> sceneNodes) {
		List<GraphNode> result = new ArrayList<>(sceneNodes.size());
		for (SceneNode n : sceneNodes) {
			result.add(graph.node(n));
		}
		return result;
	}
}
