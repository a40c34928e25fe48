package works.scenegen.reflect;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.scenegen.exceptions.TemplateInstantiationException;
import works.scenegen.graph.DefaultTemplate;
import works.scenegen.graph.FieldValue;
import works.scenegen.graph.Frame;
import works.scenegen.graph.Frame.RectFrame;
import works.scenegen.graph.Frame.SpatialFrame;
import works.scenegen.graph.GraphBehavior;
import works.scenegen.graph.GraphNode;
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
import works.scenegen.graph.ReferenceValue.BehaviorReference;
import works.scenegen.graph.ReferenceValue.ForeignReference;
import works.scenegen.graph.ReferenceValue.FrameReference;
import works.scenegen.graph.ReferenceValue.NodeReference;
import works.scenegen.graph.ReflectedField;
import works.scenegen.graph.Rgba;
import works.scenegen.graph.SceneReflector;
import works.scenegen.graph.TypeName;
import works.scenegen.graph.UnsupportedValue;
import works.scenegen.graph.Vec2;
import works.scenegen.graph.Vec3;
import works.scenegen.scene.Behavior;
import works.scenegen.scene.Color;
import works.scenegen.scene.Quaternion;
import works.scenegen.scene.RectTransform;
import works.scenegen.scene.SceneNode;
import works.scenegen.scene.Transform;
import works.scenegen.scene.Vector2;
import works.scenegen.scene.Vector3;

import static java.util.Collections.unmodifiableList;
import static java.util.Objects.requireNonNull;

/**
 * Presents {@link SceneNode}s and their {@link Behavior}s to the generator.
 * <p>
 * A behavior's fields are its public instance fields, including inherited ones,
 * superclass fields first, each class's fields in source order.
 * Static and transient fields are left out.
 * <p>
 * Views are cached by identity, so each {@link SceneNode} has exactly one {@link GraphNode}
 * per {@code ReflectiveSceneGraph}. Use a new instance for each generator run.
 */
public final class ReflectiveSceneGraph implements SceneReflector {
	static final String TEMPLATE_NODE_NAME = "__default_template";

	private final Map<SceneNode, NodeView> nodes = new IdentityHashMap<>();
	private final Map<Behavior, BehaviorView> behaviors = new IdentityHashMap<>();
	private final Map<Class<?>, List<Field>> fieldsByClass = new HashMap<>();

	public GraphNode node(SceneNode node) {
		return nodes.computeIfAbsent(requireNonNull(node), NodeView::new);
	}

	public GraphBehavior behavior(Behavior behavior) {
		return behaviors.computeIfAbsent(requireNonNull(behavior), BehaviorView::new);
	}

	/**
	 * @throws IllegalArgumentException if {@code behavior} didn't come from this graph
	 */
	public Behavior instance(GraphBehavior behavior) {
		return view(behavior).instance;
	}

	public SceneNode sceneNode(GraphNode node) {
		if (node instanceof NodeView v && nodes.get(v.node) == v) {
			return v.node;
		}
		throw new IllegalArgumentException("Not a node of this graph: " + node);
	}

	@Override
	public List<ReflectedField> fields(GraphBehavior behavior) {
		return fieldsOf(view(behavior).instance);
	}

	@Override
	public DefaultTemplate defaultTemplate(GraphBehavior exemplar) throws TemplateInstantiationException {
		Class<? extends Behavior> type = view(exemplar).instance.getClass();
		SceneNode scratch = new SceneNode(TEMPLATE_NODE_NAME);
		List<ReflectedField> fields;
		try {
			Behavior template = scratch.addBehavior(type);
			// A separate graph keeps the scratch node out of this one's caches
			fields = new ReflectiveSceneGraph().fieldsOf(template);
		} catch (RuntimeException e) {
			scratch.destroy();
			Throwable cause = e.getCause() == null ? e : e.getCause();
			throw new TemplateInstantiationException(TypeName.of(type), String.valueOf(e.getMessage()), cause);
		}
		LOGGER.trace("Created default template for {}", type.getSimpleName());
		return new DefaultTemplate() {
			@Override
			public List<ReflectedField> fields() {
				return fields;
			}

			@Override
			public void close() {
				scratch.destroy();
			}
		};
	}

	private BehaviorView view(GraphBehavior behavior) {
		if (behavior instanceof BehaviorView v && behaviors.get(v.instance) == v) {
			return v;
		}
		throw new IllegalArgumentException("Not a behavior of this graph: " + behavior);
	}

	private List<ReflectedField> fieldsOf(Behavior instance) {
		List<ReflectedField> result = new ArrayList<>();
		for (Field field : instanceFields(instance.getClass())) {
			Object value;
			try {
				value = field.get(instance);
			} catch (IllegalAccessException | RuntimeException e) {
				LOGGER.warn("Unable to read {}.{}", instance.getClass().getSimpleName(), field.getName(), e);
				result.add(ReflectedField.topLevel(field.getName(), new UnsupportedValue("unreadable " + field.getType().getSimpleName())));
				continue;
			}
			addField(result, field.getName(), field.getName(), field.getType(), value);
		}
		return result;
	}

	/**
	 * Records with no value mapping of their own contribute one nested entry per component,
	 * after the unsupported entry for the record itself.
	 */
	private void addField(List<ReflectedField> result, String name, String path, Class<?> declaredType, @Nullable Object value) {
		FieldValue fieldValue = valueOf(declaredType, value);
		result.add(new ReflectedField(name, path, fieldValue));
		if (fieldValue instanceof UnsupportedValue && declaredType.isRecord() && value != null) {
			for (RecordComponent component : declaredType.getRecordComponents()) {
				Object componentValue;
				try {
					componentValue = component.getAccessor().invoke(value);
				} catch (ReflectiveOperationException | RuntimeException e) {
					LOGGER.debug("Unable to read {}.{}", path, component.getName(), e);
					continue;
				}
				addField(result, component.getName(), path + "." + component.getName(), component.getType(), componentValue);
			}
		}
	}

	private FieldValue valueOf(Class<?> declaredType, @Nullable Object value) {
		if (isReferenceSlot(declaredType)) {
			return referenceTo(value);
		} else if (value == null) {
			return declaredType == String.class
				? new StringValue("")
				: new UnsupportedValue("null " + declaredType.getSimpleName());
		} else if (value instanceof Boolean b) {
			return new BooleanValue(b);
		} else if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
			return new IntValue(((Number) value).intValue());
		} else if (value instanceof Long l) {
			return new LongValue(l);
		} else if (value instanceof Float f) {
			return new FloatValue(f);
		} else if (value instanceof Double d) {
			return new DoubleValue(d);
		} else if (value instanceof String s) {
			return new StringValue(s);
		} else if (value instanceof Enum<?> e) {
			return new EnumValue(TypeName.of(e.getDeclaringClass()), e.name());
		} else if (value instanceof Vector2 v) {
			return new Vector2Value(new Vec2(v.x(), v.y()));
		} else if (value instanceof Vector3 v) {
			return new Vector3Value(new Vec3(v.x(), v.y(), v.z()));
		} else if (value instanceof Color c) {
			return new ColorValue(new Rgba(c.r(), c.g(), c.b(), c.a()));
		} else {
			return new UnsupportedValue(declaredType.getSimpleName());
		}
	}

	/**
	 * Fields declared as a node, a behavior, a transform,
	 * or an interface outside the JDK that a behavior could implement.
	 */
	private static boolean isReferenceSlot(Class<?> declaredType) {
		return declaredType == SceneNode.class
			|| Behavior.class.isAssignableFrom(declaredType)
			|| Transform.class.isAssignableFrom(declaredType)
			|| (declaredType.isInterface() && !declaredType.getName().startsWith("java."));
	}

	private ReferenceValue referenceTo(@Nullable Object value) {
		if (value == null) {
			return ReferenceValue.NULL;
		} else if (value instanceof SceneNode n) {
			return new NodeReference(node(n));
		} else if (value instanceof Transform t) {
			return new FrameReference(node(t.node()));
		} else if (value instanceof Behavior b) {
			try {
				b.node();
			} catch (IllegalStateException e) {
				return new ForeignReference("detached " + b.getClass().getSimpleName());
			}
			return new BehaviorReference(behavior(b));
		} else {
			return new ForeignReference(value.getClass().getName());
		}
	}

	List<Field> instanceFields(Class<?> type) {
		return fieldsByClass.computeIfAbsent(type, t -> {
			Deque<Class<?>> hierarchy = new ArrayDeque<>();
			for (Class<?> c = t; c != null && c != Behavior.class && c != Object.class; c = c.getSuperclass()) {
				hierarchy.addFirst(c);
			}
			List<Field> result = new ArrayList<>();
			for (Class<?> c : hierarchy) {
				for (Field field : ReflectionHelpers.getDeclaredFieldsInOrder(c)) {
					int modifiers = field.getModifiers();
					if (Modifier.isPublic(modifiers) && !Modifier.isStatic(modifiers) && !Modifier.isTransient(modifiers)) {
						field.setAccessible(true);
						result.add(field);
					}
				}
			}
			return unmodifiableList(result);
		});
	}

	private final class NodeView implements GraphNode {
		final SceneNode node;

		NodeView(SceneNode node) {
			this.node = node;
		}

		@Override
		public String name() {
			return node.name();
		}

		@Override
		public @Nullable GraphNode parent() {
			SceneNode parent = node.parent();
			return parent == null ? null : node(parent);
		}

		@Override
		public List<? extends GraphNode> children() {
			List<GraphNode> result = new ArrayList<>(node.children().size());
			for (SceneNode child : node.children()) {
				result.add(node(child));
			}
			return result;
		}

		@Override
		public Frame frame() {
			Transform t = node.transform();
			Quat rotation = quat(t.localRotation());
			Vec3 scale = vec3(t.localScale());
			if (t instanceof RectTransform rt) {
				return new RectFrame(
					vec2(rt.anchorMin()),
					vec2(rt.anchorMax()),
					vec2(rt.pivot()),
					vec2(rt.anchoredPosition()),
					vec2(rt.sizeDelta()),
					vec3(rt.localPosition()),
					rotation,
					scale);
			} else {
				return new SpatialFrame(vec3(t.localPosition()), rotation, scale);
			}
		}

		@Override
		public List<? extends GraphBehavior> behaviors() {
			List<GraphBehavior> result = new ArrayList<>(node.behaviors().size());
			for (Behavior b : node.behaviors()) {
				result.add(behavior(b));
			}
			return result;
		}

		@Override
		public String toString() {
			return "NodeView(" + node.name() + ")";
		}
	}

	private final class BehaviorView implements GraphBehavior {
		final Behavior instance;
		final TypeName type;

		BehaviorView(Behavior instance) {
			this.instance = instance;
			this.type = TypeName.of(instance.getClass());
		}

		@Override
		public GraphNode node() {
			return ReflectiveSceneGraph.this.node(instance.node());
		}

		@Override
		public TypeName type() {
			return type;
		}

		@Override
		public String toString() {
			return "BehaviorView(" + instance + ")";
		}
	}

	private static Vec2 vec2(Vector2 v) {
		return new Vec2(v.x(), v.y());
	}

	private static Vec3 vec3(Vector3 v) {
		return new Vec3(v.x(), v.y(), v.z());
	}

	private static Quat quat(Quaternion q) {
		return new Quat(q.x(), q.y(), q.z(), q.w());
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(ReflectiveSceneGraph.class);
}
