package io.vena.absence.install;

import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;

/**
 * Names under which {@link Installer} binds things in {@link GlobalBindings}.
 * A null name means "don't bind that one".
 */
@Value
@Builder
public class InstallerSettings {
	@Default String sentinelName = DEFAULT_SENTINEL_NAME;
	@Default String predicateName = DEFAULT_PREDICATE_NAME;

	public static final String DEFAULT_SENTINEL_NAME = "Absent";
	public static final String DEFAULT_PREDICATE_NAME = "isabsent";

	public static InstallerSettings defaults() {
		return builder().build();
	}
}
