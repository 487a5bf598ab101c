package io.vena.absence;

import org.jetbrains.annotations.Nullable;

/**
 * A supplied value. It can be <code>null</code> if the supplier explicitly chose null.
 *
 * <p>
 * It can't be the canonical marker {@link Absence#absent()}; that is represented by {@link Absent} itself.
 * Use {@link Absential#of} to accept any value, including the marker.
 */
public record Present<T>(@Nullable T value) implements Absential<T> {
	public Present {
		if (Absence.isAbsent(value)) {
			throw new IllegalArgumentException("The canonical absence marker is not a present value");
		}
	}

	@Override
	public boolean isPresent() {
		return true;
	}
}
