package works.scenegen.emit;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.scenegen.codegen.ImportSet;
import works.scenegen.codegen.JavaLiterals;
import works.scenegen.codegen.NameAllocator;
import works.scenegen.codegen.SourceBuilder;
import works.scenegen.diff.DefaultValueDiffer;
import works.scenegen.diff.FieldDifference;
import works.scenegen.graph.Frame;
import works.scenegen.graph.Frame.RectFrame;
import works.scenegen.graph.Frame.SpatialFrame;
import works.scenegen.graph.GraphBehavior;
import works.scenegen.graph.GraphNode;
import works.scenegen.graph.PrimitiveValue;
import works.scenegen.graph.PrimitiveValue.BooleanValue;
import works.scenegen.graph.PrimitiveValue.ColorValue;
import works.scenegen.graph.PrimitiveValue.DoubleValue;
import works.scenegen.graph.PrimitiveValue.EnumValue;
import works.scenegen.graph.PrimitiveValue.FloatValue;
import works.scenegen.graph.PrimitiveValue.IntValue;
import works.scenegen.graph.PrimitiveValue.LongValue;
import works.scenegen.graph.PrimitiveValue.StringValue;
import works.scenegen.graph.PrimitiveValue.Vector2Value;
import works.scenegen.graph.PrimitiveValue.Vector3Value;
import works.scenegen.graph.Quat;
import works.scenegen.graph.ReferenceValue;
import works.scenegen.graph.Rgba;
import works.scenegen.graph.TypeName;
import works.scenegen.graph.Vec2;
import works.scenegen.graph.Vec3;
import works.scenegen.refs.Classification;
import works.scenegen.refs.Classification.AnchorRef;
import works.scenegen.refs.Classification.BehaviorRef;
import works.scenegen.refs.Classification.Cleared;
import works.scenegen.refs.Classification.FrameRef;
import works.scenegen.refs.Classification.LocalTarget;
import works.scenegen.refs.Classification.NodeRef;
import works.scenegen.refs.Classification.Unsupported;
import works.scenegen.refs.ReferenceClassifier;

import static java.util.Objects.requireNonNull;

/**
 * Walks a scene graph and writes the statements that rebuild it.
 * <p>
 * Each node is constructed at most once per emitter, no matter how many
 * references lead to it. A node is recorded as visited before anything
 * it refers to is emitted, so cycles end at the second visit.
 * <p>
 * Emitters are single-use: create one per generated method.
 */
public final class GraphEmitter {
	private final TargetDialect dialect;
	private final DefaultValueDiffer differ;
	private final ReferenceClassifier classifier;
	private final Predicate<GraphBehavior> supported;
	private final Predicate<TypeName> followReferencesOf;
	private final NameAllocator names;
	private final ImportSet imports;
	private final SourceBuilder out;
	private final String createdNodes;
	private final @Nullable String anchors;

	private final Map<GraphNode, EmittedNode> visited = new IdentityHashMap<>();
	private final List<EmittedNode> emissionOrder = new ArrayList<>();
	private final Map<GraphNode, String> anchoredNodeVars = new IdentityHashMap<>();

	public GraphEmitter(
		TargetDialect dialect,
		DefaultValueDiffer differ,
		ReferenceClassifier classifier,
		Predicate<GraphBehavior> supported,
		Predicate<TypeName> followReferencesOf,
		MethodScope scope
	) {
		this.dialect = requireNonNull(dialect);
		this.differ = requireNonNull(differ);
		this.classifier = requireNonNull(classifier);
		this.supported = requireNonNull(supported);
		this.followReferencesOf = requireNonNull(followReferencesOf);
		this.names = scope.names();
		this.imports = scope.imports();
		this.out = scope.out();
		this.createdNodes = scope.createdNodes();
		this.anchors = scope.anchors();
	}

	/**
	 * Emits the construction of {@code node}, its frame, its supported behaviors,
	 * and everything they refer to that hasn't been emitted yet.
	 *
	 * @param suggestedName the basis for the node's variable names
	 * @param isRoot if true, the node is never attached to its parent
	 * @return the variable holding the node's primary handle
	 */
	public String emitNode(GraphNode node, String suggestedName, boolean isRoot) {
		EmittedNode existing = visited.get(node);
		if (existing != null) {
			LOGGER.trace("Already emitted {}", existing);
			return existing.primaryHandle();
		}

		String base = names.allocate(suggestedName);
		String nodeVar = names.allocate(base + "Node");
		EmittedNode emitted = new EmittedNode(node, base, nodeVar, isRoot);
		visited.put(node, emitted);
		emissionOrder.add(emitted);
		LOGGER.debug("Emitting node \"{}\" as {}", node.name(), nodeVar);

		if (!out.isEmpty()) {
			out.blankLine();
		}
		String nodeType = type(dialect.nodeType());
		out.declare(nodeType, nodeVar, dialect.newNode(nodeType, JavaLiterals.of(node.name())));
		out.call(createdNodes + ".add(" + nodeVar + ")");
		emitFrame(emitted);

		List<PendingReference> references = new ArrayList<>();
		for (GraphBehavior behavior : node.behaviors()) {
			if (supported.test(behavior)) {
				boolean isPrimary = emitted.primary() == null;
				String var = attach(emitted, behavior, isPrimary);
				references.addAll(emitPrimitiveFields(var, behavior));
			}
		}
		resolveAll(references);
		return emitted.primaryHandle();
	}

	/**
	 * Emits every descendant of {@code root} that hasn't been emitted yet, depth-first.
	 * They are attached to their parents by {@link #linkParents}.
	 */
	public void emitDescendants(GraphNode root) {
		for (GraphNode child : root.children()) {
			if (!visited.containsKey(child)) {
				emitNode(child, child.name(), false);
			}
			emitDescendants(child);
		}
	}

	public @Nullable EmittedNode emitted(GraphNode node) {
		return visited.get(node);
	}

	public int emittedCount() {
		return visited.size();
	}

	/**
	 * Attaches each emitted non-root node to its parent, if the parent was emitted too.
	 * Siblings are attached in their original order, whatever order they were emitted in,
	 * so call this once everything has been emitted.
	 * Nodes that are already attached are skipped.
	 */
	public void linkParents() {
		boolean any = false;
		for (EmittedNode parent : emissionOrder) {
			for (GraphNode child : parent.node().children()) {
				EmittedNode emittedChild = visited.get(child);
				if (emittedChild != null && !emittedChild.isRoot() && !emittedChild.parentLinked()) {
					if (!any) {
						out.blankLine();
						any = true;
					}
					out.call(dialect.setParent(emittedChild.nodeVar(), parent.nodeVar()));
					emittedChild.markParentLinked();
				}
			}
		}
	}

	private void emitFrame(EmittedNode emitted) {
		Frame frame = emitted.node().frame();
		String nodeVar = emitted.nodeVar();
		if (frame instanceof RectFrame rect) {
			RectFrame d = RectFrame.DEFAULT;
			List<FrameSetting> setters = new ArrayList<>();
			if (!rect.anchorMin().equals(d.anchorMin()) || !rect.anchorMax().equals(d.anchorMax())) {
				setters.add(new FrameSetting(FrameProperty.ANCHOR_MIN, vector(rect.anchorMin())));
				setters.add(new FrameSetting(FrameProperty.ANCHOR_MAX, vector(rect.anchorMax())));
			}
			if (!rect.pivot().equals(d.pivot())) {
				setters.add(new FrameSetting(FrameProperty.PIVOT, vector(rect.pivot())));
			}
			if (!rect.anchoredPosition().equals(d.anchoredPosition())) {
				setters.add(new FrameSetting(FrameProperty.ANCHORED_POSITION, vector(rect.anchoredPosition())));
			}
			if (!rect.sizeDelta().equals(d.sizeDelta())) {
				setters.add(new FrameSetting(FrameProperty.SIZE_DELTA, vector(rect.sizeDelta())));
			}
			if (!rect.position().equals(d.position())) {
				setters.add(new FrameSetting(FrameProperty.POSITION, vector(rect.position())));
			}
			addCommonSetters(rect, setters);
			if (setters.isEmpty()) {
				out.call(dialect.useRectFrame(nodeVar));
			} else {
				String rectVar = names.allocate(emitted.baseName() + "Rect");
				emitted.rectVar(rectVar);
				out.declare(type(dialect.rectFrameType()), rectVar, dialect.useRectFrame(nodeVar));
				for (FrameSetting setting : setters) {
					out.call(dialect.setFrameProperty(rectVar, setting.property(), setting.value()));
				}
			}
		} else if (frame instanceof SpatialFrame spatial) {
			List<FrameSetting> setters = new ArrayList<>();
			if (!spatial.position().equals(SpatialFrame.DEFAULT.position())) {
				setters.add(new FrameSetting(FrameProperty.POSITION, vector(spatial.position())));
			}
			addCommonSetters(spatial, setters);
			if (!setters.isEmpty()) {
				String frameExpr = dialect.frameOf(nodeVar);
				for (FrameSetting setting : setters) {
					out.call(dialect.setFrameProperty(frameExpr, setting.property(), setting.value()));
				}
			}
		}
	}

	private void addCommonSetters(Frame frame, List<FrameSetting> setters) {
		if (!frame.rotation().equals(Quat.IDENTITY)) {
			setters.add(new FrameSetting(FrameProperty.ROTATION, rotation(frame.rotation())));
		}
		if (!frame.scale().equals(Vec3.ONE)) {
			setters.add(new FrameSetting(FrameProperty.SCALE, vector(frame.scale())));
		}
	}

	private String attach(EmittedNode emitted, GraphBehavior behavior, boolean isPrimary) {
		String var = isPrimary
			? emitted.baseName()
			: names.allocate(emitted.baseName() + behavior.type().simpleName());
		String behaviorType = type(behavior.type());
		out.declare(behaviorType, var, dialect.addBehavior(emitted.nodeVar(), behaviorType));
		emitted.recordBehavior(behavior, var, isPrimary);
		return var;
	}

	/**
	 * Assigns every differing primitive field of {@code behavior}.
	 *
	 * @return the differing reference fields, to be resolved once the caller is ready
	 */
	private List<PendingReference> emitPrimitiveFields(String behaviorVar, GraphBehavior behavior) {
		List<PendingReference> references = new ArrayList<>();
		for (FieldDifference difference : differ.diff(behavior)) {
			if (difference.value() instanceof PrimitiveValue p) {
				out.assign(dialect.field(behaviorVar, difference.name()), literal(p));
			} else if (difference.value() instanceof ReferenceValue r) {
				references.add(new PendingReference(behaviorVar, behavior, difference.name(), r));
			}
		}
		return references;
	}

	private void resolveAll(List<PendingReference> references) {
		for (PendingReference reference : references) {
			resolve(reference);
		}
	}

	private void resolve(PendingReference reference) {
		String target = dialect.field(reference.ownerVar(), reference.fieldName());
		Classification classification = classifier.classify(reference.value());
		if (classification instanceof Cleared) {
			out.assign(target, "null");
		} else if (classification instanceof Unsupported u) {
			LOGGER.warn("Skipping {}.{}: {}", reference.owner().type().simpleName(), reference.fieldName(), u.reason());
		} else if (classification instanceof AnchorRef a) {
			String anchoredVar = anchoredNodeVar(a, reference.fieldName());
			out.line("if (" + anchoredVar + " != null) " + target + " = " + anchoredExpression(anchoredVar, a.local()) + ";");
		} else if (classification instanceof LocalTarget local) {
			out.assign(target, localExpression(local, reference.fieldName()));
		}
	}

	/**
	 * Anchored nodes are looked up once each; later references reuse the variable.
	 */
	private String anchoredNodeVar(AnchorRef anchorRef, String fieldName) {
		if (anchors == null) {
			throw new IllegalStateException("No anchor container available for \"" + anchorRef.path() + "\"");
		}
		GraphNode targetNode = anchorRef.local().targetNode();
		String existing = anchoredNodeVars.get(targetNode);
		if (existing != null) {
			return existing;
		}
		String var = names.allocate(fieldName + "Node");
		anchoredNodeVars.put(targetNode, var);
		out.declare(type(dialect.nodeType()), var,
			anchors + " == null ? null : " + dialect.findAnchored(anchors, JavaLiterals.of(anchorRef.path())));
		return var;
	}

	private String anchoredExpression(String nodeVar, LocalTarget local) {
		if (local instanceof BehaviorRef b) {
			return dialect.behaviorOf(nodeVar, type(b.target().type()), indexAmongSameType(b.target()));
		} else if (local instanceof FrameRef f) {
			return frameExpression(nodeVar, f.targetNode());
		} else {
			return nodeVar;
		}
	}

	/**
	 * Anchored behaviors are found by position among the node's behaviors of the same type,
	 * which the factory that builds the anchored nodes attaches in their original order.
	 */
	private static int indexAmongSameType(GraphBehavior behavior) {
		int index = 0;
		for (GraphBehavior other : behavior.node().behaviors()) {
			if (other == behavior) {
				return index;
			} else if (other.type().equals(behavior.type())) {
				index++;
			}
		}
		throw new IllegalStateException(behavior + " is not among the behaviors of its own node");
	}

	private String localExpression(LocalTarget local, String fieldName) {
		EmittedNode target = visited.get(local.targetNode());
		if (target == null) {
			emitNode(local.targetNode(), fieldName, false);
			target = visited.get(local.targetNode());
		}
		if (local instanceof BehaviorRef b) {
			return behaviorVar(target, b.target());
		} else if (local instanceof FrameRef) {
			String rectVar = target.rectVar();
			return rectVar != null ? rectVar : frameExpression(target.nodeVar(), target.node());
		} else if (local instanceof NodeRef) {
			return target.nodeVar();
		} else {
			throw new AssertionError("Unexpected target: " + local);
		}
	}

	private String frameExpression(String nodeVar, GraphNode node) {
		return node.frame() instanceof RectFrame
			? dialect.rectFrameOf(nodeVar)
			: dialect.frameOf(nodeVar);
	}

	/**
	 * Behaviors that the supported filter rejected are attached when something refers to them.
	 * Their fields are emitted only if their type is one whose references are followed.
	 */
	private String behaviorVar(EmittedNode target, GraphBehavior behavior) {
		String existing = target.behaviorVar(behavior);
		if (existing != null) {
			return existing;
		}
		LOGGER.debug("Attaching {} to {} on demand", behavior.type().simpleName(), target);
		String var = attach(target, behavior, false);
		if (followReferencesOf.test(behavior.type())) {
			resolveAll(emitPrimitiveFields(var, behavior));
		}
		return var;
	}

	private String literal(PrimitiveValue value) {
		if (value instanceof BooleanValue v) {
			return JavaLiterals.of(v.value());
		} else if (value instanceof IntValue v) {
			return JavaLiterals.of(v.value());
		} else if (value instanceof LongValue v) {
			return JavaLiterals.of(v.value());
		} else if (value instanceof FloatValue v) {
			return JavaLiterals.of(v.value());
		} else if (value instanceof DoubleValue v) {
			return JavaLiterals.of(v.value());
		} else if (value instanceof StringValue v) {
			return JavaLiterals.of(v.value());
		} else if (value instanceof EnumValue v) {
			return type(v.enumType()) + "." + v.member();
		} else if (value instanceof Vector2Value v) {
			return vector(v.value());
		} else if (value instanceof Vector3Value v) {
			return vector(v.value());
		} else if (value instanceof ColorValue v) {
			return color(v.value());
		} else {
			throw new AssertionError("Unexpected value: " + value);
		}
	}

	private String vector(Vec2 v) {
		return construct(dialect.vector2Type(), v.x(), v.y());
	}

	private String vector(Vec3 v) {
		return construct(dialect.vector3Type(), v.x(), v.y(), v.z());
	}

	private String rotation(Quat q) {
		return construct(dialect.rotationType(), q.x(), q.y(), q.z(), q.w());
	}

	private String color(Rgba c) {
		return construct(dialect.colorType(), c.r(), c.g(), c.b(), c.a());
	}

	private String construct(TypeName type, float... components) {
		StringBuilder sb = new StringBuilder("new ").append(type(type)).append('(');
		for (int i = 0; i < components.length; i++) {
			if (i > 0) {
				sb.append(", ");
			}
			sb.append(JavaLiterals.of(components[i]));
		}
		return sb.append(')').toString();
	}

	private String type(TypeName typeName) {
		return imports.use(typeName);
	}

	private record FrameSetting(FrameProperty property, String value) { }

	private record PendingReference(String ownerVar, GraphBehavior owner, String fieldName, ReferenceValue value) { }

	private static final Logger LOGGER = LoggerFactory.getLogger(GraphEmitter.class);
}
