package oprec;

import java.util.Arrays;
import java.util.Optional;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

public enum Fixity {
  INFIX("infix"),
  PREFIX("prefix"),
  POSTFIX("postfix");

  private final String repr;

  Fixity(String repr) {
    this.repr = repr;
  }

  public String repr() {
    return repr;
  }

  private static final ImmutableMap<String, Fixity> REPR_MAP =
      Maps.uniqueIndex(Arrays.asList(values()), Fixity::repr);

  public static Optional<Fixity> parse(String atom) {
    return Optional.ofNullable(REPR_MAP.get(atom));
  }
}
