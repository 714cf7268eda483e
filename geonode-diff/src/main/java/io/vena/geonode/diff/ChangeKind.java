package io.vena.geonode.diff;

public enum ChangeKind {
	ADDED,
	REMOVED,
	UNCHANGED,
	MODIFIED,
}
