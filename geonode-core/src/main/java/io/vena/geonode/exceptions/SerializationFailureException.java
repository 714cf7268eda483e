package io.vena.geonode.exceptions;

/**
 * Indicates that a value could not be rendered in the snapshot format.
 */
@SuppressWarnings("serial")
public class SerializationFailureException extends SnapshotException {
	public SerializationFailureException(String message) { super(message); }
	public SerializationFailureException(String message, Throwable cause) { super(message, cause); }
}
