package io.vena.absence;

import java.util.function.Function;
import org.jetbrains.annotations.Nullable;

/**
 * How an {@link AbsenceMarker} describes itself.
 * Supplied once, when the marker is created; a marker's display never changes afterward.
 *
 * <p>
 * {@link #repr} is the unambiguous, debugging-oriented form;
 * {@link #str} is the short form returned by {@link AbsenceMarker#toString()}.
 */
public interface MarkerDisplay {
	String repr(AbsenceMarker marker);
	String str(AbsenceMarker marker);

	MarkerDisplay FACTORY_DEFAULT = of(m -> "absence.AbsenceMarker()", m -> "absence");

	/**
	 * @param reprFunction if null, uses the {@link #FACTORY_DEFAULT} form
	 * @param strFunction if null, uses the {@link #FACTORY_DEFAULT} form
	 */
	static MarkerDisplay of(
		@Nullable Function<? super AbsenceMarker, String> reprFunction,
		@Nullable Function<? super AbsenceMarker, String> strFunction
	) {
		return new MarkerDisplay() {
			@Override
			public String repr(AbsenceMarker marker) {
				if (reprFunction == null) {
					return FACTORY_DEFAULT.repr(marker);
				} else {
					return reprFunction.apply(marker);
				}
			}

			@Override
			public String str(AbsenceMarker marker) {
				if (strFunction == null) {
					return FACTORY_DEFAULT.str(marker);
				} else {
					return strFunction.apply(marker);
				}
			}
		};
	}
}
