package io.vena.geonode.diff;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static java.util.Collections.unmodifiableList;
import static java.util.stream.Collectors.toList;

/**
 * A {@link ChangeListener} that keeps every {@link ChangeRecord} it receives, in order.
 */
public final class ChangeRecorder implements ChangeListener {
	private final List<ChangeRecord> records = new ArrayList<>();

	@Override
	public void onChange(ChangeRecord record) {
		records.add(record);
	}

	public List<ChangeRecord> records() {
		return unmodifiableList(new ArrayList<>(records));
	}

	/**
	 * @return the records other than {@link ChangeRecord.Unchanged Unchanged} ones
	 */
	public List<ChangeRecord> changes() {
		return records.stream()
			.filter(r -> r.kind() != ChangeKind.UNCHANGED)
			.collect(toList());
	}

	public List<ChangeRecord> recordsUnder(ChangePath prefix) {
		return records.stream()
			.filter(r -> prefix.isPrefixOf(r.path()))
			.collect(toList());
	}

	public long count(ChangeKind kind) {
		return records.stream().filter(r -> r.kind() == kind).count();
	}

	/**
	 * @return true if nothing was added, removed, or modified
	 */
	public boolean isUnchanged() {
		return records.stream().allMatch(r -> r.kind() == ChangeKind.UNCHANGED);
	}

	public Map<ChangeKind, Long> counts() {
		Map<ChangeKind, Long> result = new EnumMap<>(ChangeKind.class);
		for (ChangeKind kind: ChangeKind.values()) {
			result.put(kind, count(kind));
		}
		return result;
	}

	public String summary() {
		return count(ChangeKind.ADDED) + " added, "
			+ count(ChangeKind.REMOVED) + " removed, "
			+ count(ChangeKind.MODIFIED) + " modified, "
			+ count(ChangeKind.UNCHANGED) + " unchanged";
	}

	public void clear() {
		records.clear();
	}

	@Override
	public String toString() {
		return "ChangeRecorder(" + summary() + ")";
	}
}
