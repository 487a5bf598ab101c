package io.vena.absence;

import io.vena.absence.exceptions.OperationValidityException;
import java.io.ObjectInputStream;
import java.io.ObjectStreamException;
import java.io.Serializable;
import lombok.NonNull;

/**
 * A value meaning "nothing was supplied here", as distinct from <code>null</code>.
 *
 * <p>
 * Markers compare by identity only: two markers are equal if and only if they are the same object.
 * Most code wants the one canonical marker, {@link Absence#absent()};
 * other instances can be made with {@link Absence#marker()} for use as private sentinels,
 * and they are never equal to the canonical one or to each other.
 *
 * <p>
 * Markers can't be serialized. Deserializing one would create an object
 * that looks like the marker it came from but isn't identical to it,
 * which defeats the whole point of an identity-based sentinel.
 * The {@link Serializable} interface is implemented only so that an attempt fails
 * with an {@link OperationValidityException} instead of a generic
 * {@link java.io.NotSerializableException}.
 */
public sealed class AbsenceMarker implements Serializable permits Absent {
	private final transient MarkerDisplay display;

	AbsenceMarker(@NonNull MarkerDisplay display) {
		this.display = display;
	}

	/**
	 * Markers are falsy, in the Groovy sense.
	 *
	 * @return false
	 */
	public final boolean asBoolean() {
		return false;
	}

	public final String repr() {
		return display.repr(this);
	}

	@Override
	public final String toString() {
		return display.str(this);
	}

	@Override
	public final boolean equals(Object obj) {
		return this == obj;
	}

	@Override
	public final int hashCode() {
		return System.identityHashCode(this);
	}

	protected final Object writeReplace() throws ObjectStreamException {
		throw new OperationValidityException("serialize");
	}

	private void readObject(ObjectInputStream in) {
		throw new OperationValidityException("deserialize");
	}
}
