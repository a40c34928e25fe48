package works.scenegen.graph;

import static java.util.Objects.requireNonNull;

/**
 * The name of a host type, as it would be written in source code.
 *
 * @param packageName empty for the unnamed package
 * @param nestedName the simple name, preceded by the simple names of any enclosing classes,
 *                   separated by dots; for example {@code Outer.Inner}
 */
public record TypeName(String packageName, String nestedName) {
	public TypeName {
		requireNonNull(packageName);
		if (nestedName.isEmpty()) {
			throw new IllegalArgumentException("Type name can't be empty");
		}
	}

	public static TypeName of(Class<?> type) {
		String nested = type.getSimpleName();
		for (Class<?> enclosing = type.getEnclosingClass(); enclosing != null; enclosing = enclosing.getEnclosingClass()) {
			nested = enclosing.getSimpleName() + "." + nested;
		}
		return new TypeName(type.getPackageName(), nested);
	}

	public String simpleName() {
		return nestedName.substring(nestedName.lastIndexOf('.') + 1);
	}

	public String qualifiedName() {
		return packageName.isEmpty() ? nestedName : packageName + "." + nestedName;
	}

	@Override
	public String toString() {
		return qualifiedName();
	}
}
