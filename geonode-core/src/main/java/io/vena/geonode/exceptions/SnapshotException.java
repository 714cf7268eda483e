package io.vena.geonode.exceptions;

/**
 * Indicates that a whole-collection snapshot operation could not be completed.
 * No partial result is ever produced when one of these is thrown.
 */
public abstract class SnapshotException extends RuntimeException {
	protected SnapshotException(String message) {
		super(message);
	}

	protected SnapshotException(String message, Throwable cause) {
		super(message, cause);
	}
}
