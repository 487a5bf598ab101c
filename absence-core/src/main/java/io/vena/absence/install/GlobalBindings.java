package io.vena.absence.install;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import lombok.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A process-wide namespace of named objects, so that code can find the
 * absence marker and its predicate by name without depending on this library's classes.
 *
 * <p>
 * Thread-safe. Bindings last until {@link #unbind unbound}.
 */
public final class GlobalBindings {
	private GlobalBindings() { }

	private static final Map<String, Object> BINDINGS = new ConcurrentHashMap<>();

	/**
	 * Binds <code>name</code> to <code>value</code>, replacing any existing binding.
	 */
	public static void bind(@NonNull String name, @NonNull Object value) {
		Object previous = BINDINGS.put(name, value);
		if (previous == null) {
			LOGGER.debug("Bound \"{}\" to {}", name, value);
		} else if (previous != value) {
			LOGGER.warn("Rebound \"{}\" from {} to {}", name, previous, value);
		}
	}

	public static Optional<Object> lookup(@NonNull String name) {
		return Optional.ofNullable(BINDINGS.get(name));
	}

	public static boolean isBound(@NonNull String name) {
		return BINDINGS.containsKey(name);
	}

	/**
	 * @return true if there was a binding to remove
	 */
	public static boolean unbind(@NonNull String name) {
		Object removed = BINDINGS.remove(name);
		if (removed == null) {
			return false;
		} else {
			LOGGER.debug("Unbound \"{}\"", name);
			return true;
		}
	}

	/**
	 * @return a snapshot; later binds and unbinds don't affect it
	 */
	public static Set<String> names() {
		return Set.copyOf(BINDINGS.keySet());
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(GlobalBindings.class);
}
