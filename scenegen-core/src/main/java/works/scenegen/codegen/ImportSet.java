package works.scenegen.codegen;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import works.scenegen.graph.TypeName;

/**
 * Decides how each type is spelled in one generated file,
 * and which import declarations that requires.
 * <p>
 * The first type to claim a simple name gets it;
 * later types with the same simple name are written fully qualified.
 */
public final class ImportSet {
	private final String ownPackage;

	/**
	 * Outermost simple name to the qualified name of the outermost class that claimed it.
	 */
	private final Map<String, String> claims = new HashMap<>();
	private final TreeSet<String> imports = new TreeSet<>();

	public ImportSet(String ownPackage, String ownClassName) {
		this.ownPackage = ownPackage;
		claims.put(ownClassName, qualify(ownPackage, ownClassName));
	}

	/**
	 * @return the spelling to use for {@code type} in the generated source
	 */
	public String use(TypeName type) {
		String nested = type.nestedName();
		int dot = nested.indexOf('.');
		String outerSimple = dot < 0 ? nested : nested.substring(0, dot);
		String outerQualified = qualify(type.packageName(), outerSimple);
		String existing = claims.putIfAbsent(outerSimple, outerQualified);
		if (existing != null && !existing.equals(outerQualified)) {
			return type.qualifiedName();
		}
		if (!type.packageName().isEmpty()
			&& !type.packageName().equals(ownPackage)
			&& !type.packageName().equals("java.lang")) {
			imports.add(outerQualified);
		}
		return nested;
	}

	/**
	 * @return qualified names to import, sorted
	 */
	public List<String> imports() {
		return List.copyOf(imports);
	}

	private static String qualify(String packageName, String simpleName) {
		return packageName.isEmpty() ? simpleName : packageName + "." + simpleName;
	}
}
