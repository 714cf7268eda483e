package io.vena.geonode.exceptions;

/**
 * Indicates that serialized data had a recognized shape but its fields were
 * missing, unexpected, mistyped, or inconsistent with one another.
 */
@SuppressWarnings("serial")
public class MalformedFieldsException extends SnapshotException {
	public MalformedFieldsException(String message) { super(message); }
	public MalformedFieldsException(String message, Throwable cause) { super(message, cause); }
}
