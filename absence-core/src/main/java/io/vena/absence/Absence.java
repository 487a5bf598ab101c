package io.vena.absence;

import java.util.function.Function;
import java.util.function.Predicate;
import lombok.NonNull;
import org.jetbrains.annotations.Nullable;

/**
 * Entry points for absence markers.
 *
 * <p>
 * {@link #isAbsent} is the test the rest of the library uses to decide
 * whether a value was supplied: it compares against the canonical marker by identity.
 * {@link #isAbsence} is looser, and accepts any {@link AbsenceMarker}.
 */
public final class Absence {
	private Absence() { }

	/**
	 * @return the one canonical marker
	 */
	public static AbsenceMarker absent() {
		return Absent.instance();
	}

	/**
	 * @return a new marker, distinct from every other marker including {@link #absent()}
	 */
	public static AbsenceMarker marker() {
		return marker(MarkerDisplay.FACTORY_DEFAULT);
	}

	/**
	 * @param reprFunction computes {@link AbsenceMarker#repr()}; if null, the default is used
	 * @param strFunction computes {@link AbsenceMarker#toString()}; if null, the default is used
	 */
	public static AbsenceMarker marker(
		@Nullable Function<? super AbsenceMarker, String> reprFunction,
		@Nullable Function<? super AbsenceMarker, String> strFunction
	) {
		return marker(MarkerDisplay.of(reprFunction, strFunction));
	}

	public static AbsenceMarker marker(@NonNull MarkerDisplay display) {
		return new AbsenceMarker(display);
	}

	public static boolean isAbsence(@Nullable Object value) {
		return value instanceof AbsenceMarker;
	}

	public static boolean isAbsent(@Nullable Object value) {
		return value == Absent.instance();
	}

	public static boolean isPresent(@Nullable Object value) {
		return !isAbsent(value);
	}

	/**
	 * {@link #isAbsent} as a shared object, so it can be handed around
	 * (eg. by {@link io.vena.absence.install.Installer}) and still be recognized by identity.
	 */
	public static final Predicate<Object> IS_ABSENT = Absence::isAbsent;

	public static final Predicate<Object> IS_PRESENT = Absence::isPresent;
}
