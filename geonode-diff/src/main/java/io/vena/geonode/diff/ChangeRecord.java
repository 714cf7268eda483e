package io.vena.geonode.diff;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One event reported by a {@link SnapshotDiffer}: what happened at one {@link ChangePath}.
 */
sealed public interface ChangeRecord permits
	ChangeRecord.Added,
	ChangeRecord.Removed,
	ChangeRecord.Unchanged,
	ChangeRecord.Modified
{
	ChangePath path();
	ChangeKind kind();

	/**
	 * @return a one-line description suitable for a log or console
	 */
	String describe();

	/**
	 * The value at {@link #path()} appeared in the "after" snapshot only.
	 */
	record Added(ChangePath path, JsonNode value) implements ChangeRecord {
		@Override public ChangeKind kind() { return ChangeKind.ADDED; }
		@Override public String describe() { return path + ": added " + value; }
	}

	/**
	 * The value at {@link #path()} appeared in the "before" snapshot only.
	 */
	record Removed(ChangePath path, JsonNode value) implements ChangeRecord {
		@Override public ChangeKind kind() { return ChangeKind.REMOVED; }
		@Override public String describe() { return path + ": removed " + value; }
	}

	record Unchanged(ChangePath path, JsonNode value) implements ChangeRecord {
		@Override public ChangeKind kind() { return ChangeKind.UNCHANGED; }
		@Override public String describe() { return path + ": unchanged " + value; }
	}

	/**
	 * A leaf whose value differs, or a location whose value changed kind
	 * (say, from an object to a number), in which case both values are given whole.
	 */
	record Modified(ChangePath path, JsonNode oldValue, JsonNode newValue) implements ChangeRecord {
		@Override public ChangeKind kind() { return ChangeKind.MODIFIED; }
		@Override public String describe() { return path + ": modified " + oldValue + " to " + newValue; }
	}
}
