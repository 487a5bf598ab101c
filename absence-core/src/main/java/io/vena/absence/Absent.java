package io.vena.absence;

/**
 * The canonical {@link AbsenceMarker}, and the "nothing here" case of {@link Absential}.
 *
 * <p>
 * There is exactly one instance, created when this class is initialized.
 * Get it from {@link Absence#absent()} or {@link Absential#absent()}.
 */
public final class Absent<T> extends AbsenceMarker implements Absential<T> {
	private Absent() {
		super(CANONICAL_DISPLAY);
	}

	@SuppressWarnings("unchecked")
	static <TT> Absent<TT> instance() {
		return (Absent<TT>) INSTANCE;
	}

	@Override
	public boolean isPresent() {
		return false;
	}

	private static final MarkerDisplay CANONICAL_DISPLAY = MarkerDisplay.of(m -> "absence.absent", m -> "absent");
	private static final Absent<?> INSTANCE = new Absent<>();
}
