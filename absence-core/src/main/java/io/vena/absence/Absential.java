package io.vena.absence;

import org.jetbrains.annotations.Nullable;

/**
 * Either a {@link Present} value of type <code>T</code>, or the canonical {@link Absent} marker.
 *
 * <p>
 * Use this as the type of a parameter whose default should mean "the caller didn't say",
 * as opposed to "the caller said null":
 *
 * <pre>
 * void configure(Absential&lt;String&gt; label) {
 *     if (label instanceof Present&lt;String&gt; p) {
 *         setLabel(p.value()); // May legitimately be null
 *     }
 * }
 * </pre>
 *
 * For anything more than a single presence check, wrap it with {@link Cell#from}.
 */
public sealed interface Absential<T> permits Present, Absent {
	boolean isPresent();

	default boolean isAbsent() {
		return !isPresent();
	}

	/**
	 * Passing the canonical marker itself returns {@link #absent()}, so that
	 * an {@link Absential} never holds the marker as though it were a value.
	 */
	static <T> Absential<T> of(@Nullable T value) {
		if (Absence.isAbsent(value)) {
			return absent();
		} else {
			return new Present<>(value);
		}
	}

	static <T> Absential<T> absent() {
		return Absent.instance();
	}
}
