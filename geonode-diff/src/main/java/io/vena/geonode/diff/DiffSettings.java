package io.vena.geonode.diff;

import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;

@Value
@Builder
public class DiffSettings {
	/**
	 * When false, leaves that are equal on both sides produce no
	 * {@link ChangeRecord.Unchanged Unchanged} record.
	 */
	@Default boolean reportUnchanged = true;

	public static DiffSettings defaults() {
		return builder().build();
	}
}
