package io.vena.absence;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;
import lombok.AccessLevel;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.jetbrains.annotations.Nullable;

/**
 * An immutable container for an {@link Absential} value,
 * with combinators that save you from writing presence checks by hand.
 *
 * <p>
 * A cell is either <em>occupied</em> (it holds a value, possibly null if you asked for that)
 * or <em>empty</em> (it holds {@link Absence#absent()}).
 * Nothing changes a cell once it's built; the combinators return new cells.
 *
 * <pre>
 * int width = columnsMax
 *     .filter(n -&gt; n &gt; 0)
 *     .map(n -&gt; n - 4)
 *     .extractOr(80);
 * </pre>
 *
 * <p>
 * Callbacks passed to the combinators are called at most once, synchronously,
 * and only when the contract says so. Whatever they throw propagates unchanged.
 *
 * @see java.util.Optional
 */
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class Cell<T> {
	private final Absential<T> value;

	/**
	 * @return an occupied cell, unless <code>value</code> is the canonical absence marker itself
	 */
	public static <TT> Cell<TT> of(@Nullable TT value) {
		return from(Absential.of(value));
	}

	@SuppressWarnings("unchecked")
	public static <TT> Cell<TT> empty() {
		return (Cell<TT>) EMPTY;
	}

	/**
	 * Wraps a raw {@link Absential}, such as a parameter value.
	 */
	public static <TT> Cell<TT> from(@NonNull Absential<TT> value) {
		if (value.isPresent()) {
			return new Cell<>(value);
		} else {
			return empty();
		}
	}

	/**
	 * Treats <code>null</code> as absent. This is the inverse of {@link #toNullable()}.
	 */
	public static <TT> Cell<TT> fromNullable(@Nullable TT value) {
		return fromNullable(value, true);
	}

	/**
	 * @param nullIsAbsent if false, a null <code>value</code> is stored as a legitimate value
	 * and the result is occupied
	 */
	public static <TT> Cell<TT> fromNullable(@Nullable TT value, boolean nullIsAbsent) {
		if (value == null && nullIsAbsent) {
			return empty();
		} else {
			return of(value);
		}
	}

	public static <TT> Cell<TT> fromOptional(@NonNull Optional<TT> value) {
		return value.map(Cell::of).orElseGet(Cell::empty);
	}

	public boolean isAbsent() {
		return value.isAbsent();
	}

	public boolean isOccupied() {
		return value.isPresent();
	}

	/**
	 * Groovy truth: same as {@link #isOccupied()}.
	 */
	public boolean asBoolean() {
		return isOccupied();
	}

	/**
	 * The raw contents, for passing along to code that takes {@link Absential} parameters.
	 */
	public Absential<T> value() {
		return value;
	}

	/**
	 * @throws NoSuchElementException if this cell is empty
	 */
	public T extract() {
		if (value instanceof Present<T> p) {
			return p.value();
		}
		throw new NoSuchElementException("Cannot extract from absent cell");
	}

	public T extractOr(T defaultValue) {
		if (value instanceof Present<T> p) {
			return p.value();
		} else {
			return defaultValue;
		}
	}

	/**
	 * @param factory called only if this cell is empty
	 */
	public T extractOrCompute(@NonNull Supplier<? extends T> factory) {
		if (value instanceof Present<T> p) {
			return p.value();
		} else {
			return factory.get();
		}
	}

	/**
	 * @param func called only if this cell is occupied
	 * @return the result of <code>func</code>, or <code>defaultValue</code> if this cell is empty
	 */
	public <U> U evaluateOr(@NonNull Function<? super T, ? extends U> func, U defaultValue) {
		if (value instanceof Present<T> p) {
			return func.apply(p.value());
		} else {
			return defaultValue;
		}
	}

	/**
	 * For constraints where absence means "no constraint":
	 *
	 * <pre>
	 * if (columnsMax.evaluateOrTrue(n -&gt; address.length() &lt;= n)) {
	 *     lines.add(address);
	 * }
	 * </pre>
	 */
	public boolean evaluateOrTrue(@NonNull Predicate<? super T> predicate) {
		return evaluateOr(predicate::test, true);
	}

	public boolean evaluateOrFalse(@NonNull Predicate<? super T> predicate) {
		return evaluateOr(predicate::test, false);
	}

	/**
	 * The result of <code>func</code> is stored as-is; if it returns null, the new cell holds null.
	 */
	public <U> Cell<U> map(@NonNull Function<? super T, ? extends U> func) {
		if (value instanceof Present<T> p) {
			return Cell.of(func.apply(p.value()));
		} else {
			return empty();
		}
	}

	/**
	 * Alias for {@link #map}, for call sites that read better alongside {@link #evaluateOr}.
	 */
	public <U> Cell<U> evaluateOrAbsent(@NonNull Function<? super T, ? extends U> func) {
		return map(func);
	}

	/**
	 * Like {@link #map}, but <code>func</code> returns a cell, which is returned without further wrapping.
	 */
	public <U> Cell<U> flatMap(@NonNull Function<? super T, Cell<U>> func) {
		if (value instanceof Present<T> p) {
			return Objects.requireNonNull(func.apply(p.value()), "flatMap function returned null");
		} else {
			return empty();
		}
	}

	public Cell<T> filter(@NonNull Predicate<? super T> predicate) {
		if (value instanceof Present<T> p && predicate.test(p.value())) {
			return this;
		} else {
			return empty();
		}
	}

	/**
	 * Supports fallback chains, where the first occupied cell wins:
	 *
	 * <pre>
	 * Cell&lt;Theme&gt; effective = userPreference.orElse(systemDefault).orElse(builtIn);
	 * </pre>
	 */
	public Cell<T> orElse(@NonNull Cell<T> alternative) {
		if (isOccupied()) {
			return this;
		} else {
			return alternative;
		}
	}

	/**
	 * @param factory called only if this cell is empty
	 */
	public Cell<T> orCompute(@NonNull Supplier<Cell<T>> factory) {
		if (isOccupied()) {
			return this;
		} else {
			return Objects.requireNonNull(factory.get(), "orCompute factory returned null");
		}
	}

	public @Nullable T toNullable() {
		if (value instanceof Present<T> p) {
			return p.value();
		} else {
			return null;
		}
	}

	/**
	 * Note that {@link Optional} can't hold null, so an occupied cell holding null
	 * becomes {@link Optional#empty()}.
	 */
	public Optional<T> toOptional() {
		return Optional.ofNullable(toNullable());
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		} else if (obj instanceof Cell<?> other) {
			if (this.value instanceof Present<T> mine && other.value instanceof Present<?> theirs) {
				return Objects.equals(mine.value(), theirs.value());
			} else {
				return this.isAbsent() && other.isAbsent();
			}
		} else {
			return false;
		}
	}

	@Override
	public int hashCode() {
		if (value instanceof Present<T> p) {
			return Objects.hashCode(p.value());
		} else {
			return Absence.absent().hashCode();
		}
	}

	@Override
	public String toString() {
		if (value instanceof Present<T> p) {
			return "Cell(" + p.value() + ")";
		} else {
			return "Cell()";
		}
	}

	@SuppressWarnings("rawtypes")
	private static final Cell EMPTY = new Cell<>(Absential.absent());
}
