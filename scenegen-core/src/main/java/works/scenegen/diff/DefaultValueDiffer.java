package works.scenegen.diff;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.scenegen.exceptions.TemplateInstantiationException;
import works.scenegen.graph.DefaultTemplate;
import works.scenegen.graph.FieldValue;
import works.scenegen.graph.GraphBehavior;
import works.scenegen.graph.PrimitiveValue;
import works.scenegen.graph.PrimitiveValue.BooleanValue;
import works.scenegen.graph.PrimitiveValue.ColorValue;
import works.scenegen.graph.PrimitiveValue.DoubleValue;
import works.scenegen.graph.PrimitiveValue.FloatValue;
import works.scenegen.graph.PrimitiveValue.IntValue;
import works.scenegen.graph.PrimitiveValue.LongValue;
import works.scenegen.graph.PrimitiveValue.StringValue;
import works.scenegen.graph.PrimitiveValue.Vector2Value;
import works.scenegen.graph.PrimitiveValue.Vector3Value;
import works.scenegen.graph.ReferenceValue;
import works.scenegen.graph.ReflectedField;
import works.scenegen.graph.Rgba;
import works.scenegen.graph.SceneReflector;
import works.scenegen.graph.ValueKind;
import works.scenegen.graph.Vec2;
import works.scenegen.graph.Vec3;

import static java.util.Objects.requireNonNull;

/**
 * Finds the fields of a behavior that need to be set explicitly
 * to reproduce it, by comparing it with a default-initialized instance of its type.
 * <p>
 * Only top-level fields are considered. Fields with reserved names or the
 * reserved prefix, and fields whose value is {@link ValueKind#UNSUPPORTED unsupported},
 * are never reported.
 */
public final class DefaultValueDiffer {
	private final SceneReflector reflector;
	private final Set<String> reservedNames;
	private final String reservedPrefix;
	private final EmptyStringPolicy emptyStringPolicy;

	public DefaultValueDiffer(SceneReflector reflector, Set<String> reservedNames, String reservedPrefix, EmptyStringPolicy emptyStringPolicy) {
		this.reflector = requireNonNull(reflector);
		this.reservedNames = Set.copyOf(reservedNames);
		this.reservedPrefix = requireNonNull(reservedPrefix);
		this.emptyStringPolicy = requireNonNull(emptyStringPolicy);
	}

	/**
	 * @return the differing fields, in declaration order
	 */
	public List<FieldDifference> diff(GraphBehavior behavior) {
		List<ReflectedField> fields;
		try {
			fields = reflector.fields(behavior);
		} catch (RuntimeException e) {
			LOGGER.warn("Unable to read the fields of {}; leaving them at their defaults", behavior.type().simpleName(), e);
			return List.of();
		}
		Map<String, FieldValue> defaults = templateValues(behavior);
		List<FieldDifference> result = new ArrayList<>();
		for (ReflectedField field : fields) {
			if (isSkipped(field)) {
				continue;
			}
			FieldValue value = field.value();
			boolean isDefault;
			if (defaults == null) {
				isDefault = isImplicitDefault(value);
			} else {
				FieldValue defaultValue = defaults.get(field.path());
				if (defaultValue == null) {
					LOGGER.debug("Skipping {}.{}: not present in default template", behavior.type().simpleName(), field.name());
					continue;
				}
				isDefault = defaultValue.kind() == value.kind() && reflector.structurallyEqual(value, defaultValue);
			}
			if (!isDefault && !isIgnoredString(value)) {
				result.add(new FieldDifference(field.name(), value));
			}
		}
		return result;
	}

	/**
	 * @return the template's field values by path, or null if no template could be built
	 */
	private @Nullable Map<String, FieldValue> templateValues(GraphBehavior behavior) {
		try (DefaultTemplate template = reflector.defaultTemplate(behavior)) {
			Map<String, FieldValue> result = new HashMap<>();
			for (ReflectedField field : template.fields()) {
				result.put(field.path(), field.value());
			}
			return result;
		} catch (TemplateInstantiationException | RuntimeException e) {
			LOGGER.warn("Unable to build default {}; comparing with implicit defaults instead", behavior.type().simpleName(), e);
			return null;
		}
	}

	private boolean isSkipped(ReflectedField field) {
		if (reservedNames.contains(field.name())) {
			return true;
		} else if (!reservedPrefix.isEmpty() && field.name().startsWith(reservedPrefix)) {
			return true;
		} else if (field.isNested()) {
			return true;
		} else if (field.value().kind() == ValueKind.UNSUPPORTED) {
			LOGGER.debug("Skipping unsupported field {}", field.path());
			return true;
		} else {
			return false;
		}
	}

	private boolean isIgnoredString(FieldValue value) {
		return emptyStringPolicy == EmptyStringPolicy.TREAT_EMPTY_AS_DEFAULT
			&& value instanceof StringValue s
			&& s.value().isEmpty();
	}

	/**
	 * Zero, false, empty, and null count as defaults.
	 * An enum value has no known default, so it always differs.
	 */
	static boolean isImplicitDefault(FieldValue value) {
		if (value instanceof ReferenceValue) {
			return value instanceof ReferenceValue.NullReference;
		} else if (value instanceof PrimitiveValue p) {
			return p.equals(implicitDefault(p));
		} else {
			return true;
		}
	}

	private static @Nullable PrimitiveValue implicitDefault(PrimitiveValue value) {
		if (value instanceof BooleanValue) {
			return new BooleanValue(false);
		} else if (value instanceof IntValue) {
			return new IntValue(0);
		} else if (value instanceof LongValue) {
			return new LongValue(0L);
		} else if (value instanceof FloatValue) {
			return new FloatValue(0f);
		} else if (value instanceof DoubleValue) {
			return new DoubleValue(0d);
		} else if (value instanceof StringValue) {
			return new StringValue("");
		} else if (value instanceof Vector2Value) {
			return new Vector2Value(Vec2.ZERO);
		} else if (value instanceof Vector3Value) {
			return new Vector3Value(Vec3.ZERO);
		} else if (value instanceof ColorValue) {
			return new ColorValue(Rgba.CLEAR);
		} else {
			return null;
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(DefaultValueDiffer.class);
}
