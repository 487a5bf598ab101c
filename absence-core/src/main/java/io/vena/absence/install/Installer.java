package io.vena.absence.install;

import io.vena.absence.Absence;
import lombok.NonNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opt-in convenience that publishes the canonical marker ({@link Absence#absent()})
 * and its identity test ({@link Absence#IS_ABSENT}) in {@link GlobalBindings}.
 *
 * <p>
 * After installation, the bound objects are the very same instances the library uses,
 * so they can be compared by identity.
 */
public final class Installer {
	private Installer() { }

	/**
	 * Binds under {@link InstallerSettings#DEFAULT_SENTINEL_NAME} and {@link InstallerSettings#DEFAULT_PREDICATE_NAME}.
	 */
	public static void install() {
		install(InstallerSettings.defaults());
	}

	/**
	 * @param sentinelName if null, the marker is not bound
	 * @param predicateName if null, the predicate is not bound
	 */
	public static void install(@Nullable String sentinelName, @Nullable String predicateName) {
		install(InstallerSettings.builder()
			.sentinelName(sentinelName)
			.predicateName(predicateName)
			.build());
	}

	public static void install(@NonNull InstallerSettings settings) {
		LOGGER.debug("Installing with {}", settings);
		if (settings.getSentinelName() != null) {
			GlobalBindings.bind(settings.getSentinelName(), Absence.absent());
		}
		if (settings.getPredicateName() != null) {
			GlobalBindings.bind(settings.getPredicateName(), Absence.IS_ABSENT);
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(Installer.class);
}
