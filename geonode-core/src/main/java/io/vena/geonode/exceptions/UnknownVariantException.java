package io.vena.geonode.exceptions;

import io.vena.geonode.NodeVariantRegistry;
import lombok.Getter;

/**
 * Indicates that serialized data carried a tag that matches no variant
 * in the {@link NodeVariantRegistry} in use.
 */
@Getter
@SuppressWarnings("serial")
public class UnknownVariantException extends SnapshotException {
	private final String tag;

	public UnknownVariantException(String tag) {
		super("No node variant registered for tag \"" + tag + "\"");
		this.tag = tag;
	}

	public UnknownVariantException(String tag, Throwable cause) {
		super("No node variant registered for tag \"" + tag + "\"", cause);
		this.tag = tag;
	}
}
