package works.scenegen.codegen;

import java.util.HashSet;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hands out local variable names that are valid Java identifiers
 * and unique within one generated method.
 * <p>
 * Each generator run needs a fresh allocator.
 */
public final class NameAllocator {
	static final String PLACEHOLDER = "item";

	private final Set<String> used = new HashSet<>(KEYWORDS);

	/**
	 * @return {@link #sanitize sanitized} {@code suggestedName}, with a numeric suffix
	 * if needed to distinguish it from every name previously allocated or reserved
	 */
	public String allocate(String suggestedName) {
		String base = sanitize(suggestedName);
		String candidate = base;
		for (int suffix = 1; used.contains(candidate); suffix++) {
			candidate = base + suffix;
		}
		used.add(candidate);
		LOGGER.trace("allocate({}) = {}", suggestedName, candidate);
		return candidate;
	}

	/**
	 * Claims names exactly as given, so that {@link #allocate} never returns them.
	 */
	public void reserve(String... names) {
		for (String name : names) {
			used.add(name);
		}
	}

	public boolean isUsed(String name) {
		return used.contains(name);
	}

	/**
	 * Turns arbitrary text into a lower-camel-case identifier.
	 * Letters and digits are kept; any other character, including {@code _},
	 * separates words, and the next kept character is upper-cased.
	 * A leading digit gets an {@code n} prefix.
	 * Text with no letters or digits becomes {@code item}.
	 */
	public static String sanitize(String text) {
		StringBuilder sb = new StringBuilder(text.length());
		boolean wordBoundary = false;
		for (int i = 0; i < text.length(); i++) {
			char c = text.charAt(i);
			if (Character.isLetterOrDigit(c)) {
				if (wordBoundary) {
					sb.append(Character.toUpperCase(c));
					wordBoundary = false;
				} else {
					sb.append(c);
				}
			} else if (sb.length() > 0) {
				wordBoundary = true;
			}
		}
		if (sb.length() == 0) {
			return PLACEHOLDER;
		}
		char first = sb.charAt(0);
		if (Character.isDigit(first)) {
			sb.insert(0, 'n');
		} else {
			sb.setCharAt(0, Character.toLowerCase(first));
		}
		return sb.toString();
	}

	private static final Set<String> KEYWORDS = Set.of(
		"abstract", "assert", "boolean", "break", "byte", "case", "catch", "char",
		"class", "const", "continue", "default", "do", "double", "else", "enum",
		"extends", "final", "finally", "float", "for", "goto", "if", "implements",
		"import", "instanceof", "int", "interface", "long", "native", "new", "package",
		"private", "protected", "public", "return", "short", "static", "strictfp", "super",
		"switch", "synchronized", "this", "throw", "throws", "transient", "try", "void",
		"volatile", "while",
		"true", "false", "null",
		"var", "yield", "record", "sealed", "permits"
	);

	private static final Logger LOGGER = LoggerFactory.getLogger(NameAllocator.class);
}
