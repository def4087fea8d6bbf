package oprec;

import java.util.ArrayList;
import java.util.List;

import com.google.common.collect.ImmutableList;

// Accumulates errors for a single load or fold call. Never shared between calls.
final class ErrorCollector {
  private final List<OperatorPrecedenceException> errors = new ArrayList<>();

  void logError(OperatorPrecedenceException ex) {
    errors.add(ex);
  }

  <T> T takeErrors(Outcome<T> outcome) {
    errors.addAll(outcome.errors());
    return outcome.value();
  }

  ImmutableList<OperatorPrecedenceException> errors() {
    return ImmutableList.copyOf(errors);
  }

  <T> Outcome<T> finish(T value) {
    return Outcome.of(value, errors);
  }
}
