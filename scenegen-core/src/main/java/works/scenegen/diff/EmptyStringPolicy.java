package works.scenegen.diff;

/**
 * How {@link DefaultValueDiffer} treats string fields.
 */
public enum EmptyStringPolicy {
	/**
	 * An empty string is never reported as a difference, even if the type's
	 * default is non-empty. Non-empty strings are compared with the default as usual.
	 */
	TREAT_EMPTY_AS_DEFAULT,

	/**
	 * Strings are compared with the default like any other value.
	 */
	COMPARE_WITH_TEMPLATE,
}
