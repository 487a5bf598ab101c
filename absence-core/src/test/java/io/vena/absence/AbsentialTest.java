package io.vena.absence;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;

class AbsentialTest {

	@Test
	void of_isPresent() {
		Absential<String> value = Absential.of("hello");
		assertTrue(value.isPresent());
		assertFalse(value.isAbsent());
		assertEquals(new Present<>("hello"), value);
	}

	@Test
	void absent_isCanonicalMarker() {
		Absential<String> value = Absential.absent();
		assertTrue(value.isAbsent());
		assertFalse(value.isPresent());
		assertSame(Absence.absent(), value);
		assertTrue(Absence.isAbsent(value));
	}

	@Test
	void ofCanonicalMarker_isAbsent() {
		Absential<Object> value = Absential.of(Absence.absent());
		assertSame(Absence.absent(), value);
	}

	@Test
	void presentCanonicalMarker_throws() {
		assertThrows(IllegalArgumentException.class, () -> new Present<>(Absence.absent()));
	}

	@Test
	void ofOtherMarker_isPresent() {
		AbsenceMarker local = Absence.marker();
		Absential<Object> value = Absential.of(local);
		assertTrue(value.isPresent());
		assertSame(local, ((Present<Object>) value).value());
	}

	@Test
	void ofNull_isPresentNull() {
		Absential<String> value = Absential.of(null);
		assertTrue(value.isPresent());
		assertNull(((Present<String>) value).value());
	}

	@Test
	void instanceofNarrowing() {
		assertEquals("HELLO", shout(Absential.of("hello")));
		assertEquals("(unspecified)", shout(Absential.absent()));
	}

	@Test
	void presentValues_compareByValue() {
		assertEquals(Absential.of(3), Absential.of(3));
		assertEquals(Absential.of(3).hashCode(), Absential.of(3).hashCode());
		assertFalse(Absential.of(3).equals(Absential.absent()));
	}

	private static String shout(Absential<String> word) {
		if (word instanceof Present<String> p) {
			return p.value().toUpperCase();
		} else if (word instanceof Absent<String>) {
			return "(unspecified)";
		} else {
			return fail("Unexpected Absential: " + word);
		}
	}
}
