package io.vena.geonode.jackson;

import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;

@Value
@Builder
public class SnapshotSettings {
	/**
	 * JSON has no representation for NaN or the infinities.
	 * When true, a snapshot containing one fails with
	 * {@link io.vena.geonode.exceptions.SerializationFailureException}.
	 * When false, they're left for Jackson to deal with.
	 */
	@Default boolean rejectNonFiniteNumbers = true;

	/**
	 * Pretty-print the JSON text produced by {@link SnapshotCodec#toJson}.
	 */
	@Default boolean indentOutput = false;

	public static SnapshotSettings defaults() {
		return builder().build();
	}
}
