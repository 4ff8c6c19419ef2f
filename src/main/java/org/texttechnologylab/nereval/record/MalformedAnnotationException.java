package org.texttechnologylab.nereval.record;

/**
 * Thrown if an annotation source cannot be parsed into rows carrying all {@link AnnotationColumns#REQUIRED required
 * columns}. Always fatal for the evaluation run.
 */
public class MalformedAnnotationException extends Exception {

	public MalformedAnnotationException(String message) {
		super(message);
	}

	public MalformedAnnotationException(String message, Throwable cause) {
		super(message, cause);
	}
}
