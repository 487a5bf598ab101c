package io.vena.absence.install;

import io.vena.absence.Absence;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Stream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static io.vena.absence.install.InstallerSettings.DEFAULT_PREDICATE_NAME;
import static io.vena.absence.install.InstallerSettings.DEFAULT_SENTINEL_NAME;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasItems;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InstallerTest {

	@AfterEach
	void removeTestBindings() {
		Stream.of(DEFAULT_SENTINEL_NAME, DEFAULT_PREDICATE_NAME, "CustomAbsent", "custom_absent", "other")
			.forEach(GlobalBindings::unbind);
	}

	@Test
	void defaultInstall() {
		Installer.install();
		assertSame(Absence.absent(), GlobalBindings.lookup("Absent").orElseThrow());
		assertSame(Absence.IS_ABSENT, GlobalBindings.lookup("isabsent").orElseThrow());
		assertThat(GlobalBindings.names(), hasItems("Absent", "isabsent"));
	}

	@Test
	void customInstall() {
		Installer.install("CustomAbsent", "custom_absent");
		assertSame(Absence.absent(), GlobalBindings.lookup("CustomAbsent").orElseThrow());
		assertSame(Absence.IS_ABSENT, GlobalBindings.lookup("custom_absent").orElseThrow());
		assertFalse(GlobalBindings.isBound(DEFAULT_SENTINEL_NAME));
		assertFalse(GlobalBindings.isBound(DEFAULT_PREDICATE_NAME));
	}

	@Test
	void partialInstall() {
		Installer.install(null, DEFAULT_PREDICATE_NAME);
		assertFalse(GlobalBindings.isBound(DEFAULT_SENTINEL_NAME));
		assertTrue(GlobalBindings.isBound(DEFAULT_PREDICATE_NAME));
		assertTrue(GlobalBindings.unbind(DEFAULT_PREDICATE_NAME));

		Installer.install(InstallerSettings.builder().predicateName(null).build());
		assertTrue(GlobalBindings.isBound(DEFAULT_SENTINEL_NAME));
		assertFalse(GlobalBindings.isBound(DEFAULT_PREDICATE_NAME));
	}

	@Test
	void installedPredicate_recognizesInstalledSentinel() {
		Installer.install();
		@SuppressWarnings("unchecked")
		Predicate<Object> isAbsent = (Predicate<Object>) GlobalBindings.lookup("isabsent").orElseThrow();
		Object sentinel = GlobalBindings.lookup("Absent").orElseThrow();
		assertTrue(isAbsent.test(sentinel));
		assertFalse(isAbsent.test(Absence.marker()));
	}

	@Test
	void repeatedInstall_isIdempotent() {
		Installer.install();
		Installer.install();
		assertSame(Absence.absent(), GlobalBindings.lookup("Absent").orElseThrow());
	}

	@Test
	void rebind_replacesValue() {
		GlobalBindings.bind("other", "first");
		GlobalBindings.bind("other", "second");
		assertEquals("second", GlobalBindings.lookup("other").orElseThrow());
	}

	@Test
	void names_isSnapshot() {
		GlobalBindings.bind("other", "value");
		Set<String> before = GlobalBindings.names();
		GlobalBindings.unbind("other");
		Installer.install();
		assertTrue(before.contains("other"));
		assertFalse(before.contains(DEFAULT_SENTINEL_NAME));
		assertThrows(UnsupportedOperationException.class, () -> before.add("x"));
	}

	@Test
	void unbind_missingName() {
		assertFalse(GlobalBindings.unbind("other"));
		assertTrue(GlobalBindings.lookup("other").isEmpty());
	}

	@Test
	void defaultSettings() {
		InstallerSettings settings = InstallerSettings.defaults();
		assertEquals("Absent", settings.getSentinelName());
		assertEquals("isabsent", settings.getPredicateName());
	}
}
