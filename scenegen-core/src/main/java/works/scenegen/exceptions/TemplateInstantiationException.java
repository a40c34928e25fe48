package works.scenegen.exceptions;

import works.scenegen.graph.TypeName;

/**
 * The host was unable to build a default-initialized instance of a behavior type.
 */
public class TemplateInstantiationException extends Exception {
	private final TypeName behaviorType;

	public TemplateInstantiationException(TypeName behaviorType, String message, Throwable cause) {
		super("Unable to instantiate default " + behaviorType.simpleName() + ": " + message, cause);
		this.behaviorType = behaviorType;
	}

	public TypeName behaviorType() {
		return behaviorType;
	}
}
