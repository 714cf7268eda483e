package io.vena.geonode.diff;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs each {@link ChangeRecord#describe() description}, then passes the record downstream.
 * Unchanged leaves are logged at DEBUG; everything else at INFO.
 */
public final class LoggingChangeListener implements ChangeListener {
	private final ChangeListener downstream;

	public LoggingChangeListener(ChangeListener downstream) {
		this.downstream = downstream;
	}

	public LoggingChangeListener() {
		this(record -> { });
	}

	@Override
	public void onChange(ChangeRecord record) {
		if (record.kind() == ChangeKind.UNCHANGED) {
			LOGGER.debug("{}", record.describe());
		} else {
			LOGGER.info("{}", record.describe());
		}
		downstream.onChange(record);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(LoggingChangeListener.class);
}
