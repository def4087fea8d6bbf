package oprec;

import java.util.function.Consumer;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/**
 * A best-effort result paired with every error found while producing it, in discovery order.
 *
 * <p>Both public error-handling shapes derive from this: {@link #getOrThrow()} fails on the first
 * error, {@link #report(Consumer)} hands every error to the caller and returns the value anyway.
 */
@AutoValue
public abstract class Outcome<T> {
  public abstract T value();

  public abstract ImmutableList<OperatorPrecedenceException> errors();

  public final boolean hasErrors() {
    return !errors().isEmpty();
  }

  public final T getOrThrow() throws OperatorPrecedenceException {
    if (hasErrors()) throw errors().get(0);
    return value();
  }

  public final T report(Consumer<? super OperatorPrecedenceException> onError) {
    errors().forEach(onError);
    return value();
  }

  public static <T> Outcome<T> of(
      T value, Iterable<? extends OperatorPrecedenceException> errors) {
    return new AutoValue_Outcome<>(value, ImmutableList.copyOf(errors));
  }

  public static <T> Outcome<T> success(T value) {
    return of(value, ImmutableList.of());
  }
}
