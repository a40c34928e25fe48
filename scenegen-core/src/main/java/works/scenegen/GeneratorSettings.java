package works.scenegen;

import java.time.Clock;
import java.util.Set;
import java.util.function.Predicate;
import javax.lang.model.SourceVersion;
import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;
import works.scenegen.diff.EmptyStringPolicy;
import works.scenegen.graph.TypeName;

import static works.scenegen.diff.EmptyStringPolicy.TREAT_EMPTY_AS_DEFAULT;

@Value
@Builder(toBuilder = true)
public class GeneratorSettings {
	/**
	 * Field names that hold host bookkeeping rather than behavior state.
	 */
	public static final Set<String> DEFAULT_RESERVED_FIELD_NAMES = Set.of(
		"node", "enabled", "hideFlags",
		"m_Script", "m_GameObject", "m_Enabled", "m_ObjectHideFlags"
	);

	/**
	 * The package of generated classes. Empty for the unnamed package.
	 */
	@Default String packageName = "";

	/**
	 * Used only for the timestamp in the header comment.
	 */
	@Default Clock clock = Clock.systemDefaultZone();

	@Default Set<String> reservedFieldNames = DEFAULT_RESERVED_FIELD_NAMES;

	/**
	 * Fields whose names start with this are never emitted.
	 * Empty to disable.
	 */
	@Default String reservedFieldPrefix = "m_";

	@Default EmptyStringPolicy emptyStringPolicy = TREAT_EMPTY_AS_DEFAULT;

	/**
	 * When a reference leads to a behavior the request's filter doesn't support,
	 * that behavior is attached anyway. If its type passes this test,
	 * its fields are emitted too, and its references followed.
	 */
	@Default Predicate<TypeName> followReferencesOf = type -> false;

	public void validate() {
		if (!packageName.isEmpty() && !SourceVersion.isName(packageName)) {
			throw new IllegalArgumentException("Invalid package name: \"" + packageName + "\"");
		}
		if (reservedFieldPrefix.isBlank() && !reservedFieldPrefix.isEmpty()) {
			throw new IllegalArgumentException("Reserved field prefix can't be whitespace");
		}
	}
}
