package works.scenegen.logging;

/**
 * Keys the generator puts in the SLF4J {@link org.slf4j.MDC MDC}.
 */
public final class MdcKeys {
	private MdcKeys() { }

	/**
	 * The simple name of the class being generated.
	 */
	public static final String OUTPUT = "scenegen.output";
}
