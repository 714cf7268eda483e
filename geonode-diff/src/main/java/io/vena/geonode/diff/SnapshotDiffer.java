package io.vena.geonode.diff;

import com.fasterxml.jackson.databind.JsonNode;
import io.vena.geonode.diff.ChangeRecord.Added;
import io.vena.geonode.diff.ChangeRecord.Modified;
import io.vena.geonode.diff.ChangeRecord.Removed;
import io.vena.geonode.diff.ChangeRecord.Unchanged;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;
import lombok.Getter;

import static java.util.Objects.requireNonNull;

/**
 * Computes the structural difference between two JSON trees.
 *
 * <p>
 * Objects are matched field by field, visiting the union of both sides' field
 * names in sorted order, so the result doesn't depend on field order.
 * Arrays are matched element by element by position: moving an element
 * shows up as a series of modifications, not as a move.
 * Containers of the same kind on both sides are traversed and never reported
 * themselves; only scalars, and whole subtrees present on one side only, produce records.
 *
 * <p>
 * Knows nothing about what the trees represent. Immutable, so instances can be shared.
 */
public final class SnapshotDiffer {
	@Getter private final DiffSettings settings;

	public SnapshotDiffer(DiffSettings settings) {
		this.settings = settings;
	}

	public SnapshotDiffer() {
		this(DiffSettings.defaults());
	}

	public List<ChangeRecord> diff(JsonNode before, JsonNode after) {
		ChangeRecorder recorder = new ChangeRecorder();
		diff(before, after, recorder);
		return recorder.records();
	}

	public void diff(JsonNode before, JsonNode after, ChangeListener listener) {
		compare(ChangePath.empty(),
			requireNonNull(before, "before"),
			requireNonNull(after, "after"),
			listener);
	}

	private void compare(ChangePath path, JsonNode before, JsonNode after, ChangeListener listener) {
		if (before.isObject() && after.isObject()) {
			SortedSet<String> fieldNames = new TreeSet<>();
			before.fieldNames().forEachRemaining(fieldNames::add);
			after.fieldNames().forEachRemaining(fieldNames::add);
			for (String name: fieldNames) {
				JsonNode beforeValue = before.get(name);
				JsonNode afterValue = after.get(name);
				if (afterValue == null) {
					listener.onChange(new Removed(path.then(name), beforeValue));
				} else if (beforeValue == null) {
					listener.onChange(new Added(path.then(name), afterValue));
				} else {
					compare(path.then(name), beforeValue, afterValue, listener);
				}
			}
		} else if (before.isArray() && after.isArray()) {
			int common = Math.min(before.size(), after.size());
			for (int i = 0; i < common; i++) {
				compare(path.then(i), before.get(i), after.get(i), listener);
			}
			for (int i = common; i < before.size(); i++) {
				listener.onChange(new Removed(path.then(i), before.get(i)));
			}
			for (int i = common; i < after.size(); i++) {
				listener.onChange(new Added(path.then(i), after.get(i)));
			}
		} else if (before.isContainerNode() || after.isContainerNode()) {
			// Different kinds of node; nothing to recurse into
			listener.onChange(new Modified(path, before, after));
		} else if (sameScalar(before, after)) {
			if (settings.isReportUnchanged()) {
				listener.onChange(new Unchanged(path, after));
			}
		} else {
			listener.onChange(new Modified(path, before, after));
		}
	}

	/**
	 * Numbers are compared by numeric value, so <code>10</code> and <code>10.0</code> are the same.
	 */
	static boolean sameScalar(JsonNode a, JsonNode b) {
		if (a.isNumber() && b.isNumber()) {
			if (isNonFinite(a) || isNonFinite(b)) {
				return Double.compare(a.doubleValue(), b.doubleValue()) == 0;
			} else {
				return a.decimalValue().compareTo(b.decimalValue()) == 0;
			}
		} else {
			return a.equals(b);
		}
	}

	private static boolean isNonFinite(JsonNode number) {
		return number.isFloatingPointNumber() && !Double.isFinite(number.doubleValue());
	}

}
