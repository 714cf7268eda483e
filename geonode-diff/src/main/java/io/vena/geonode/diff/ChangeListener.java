package io.vena.geonode.diff;

/**
 * Receives {@link ChangeRecord}s from a {@link SnapshotDiffer} in traversal order.
 */
@FunctionalInterface
public interface ChangeListener {
	void onChange(ChangeRecord record);
}
