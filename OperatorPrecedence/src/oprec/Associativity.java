package oprec;

import java.util.Arrays;
import java.util.Optional;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

public enum Associativity {
  // a op b op c == (a op b) op c
  LEFT("left"),
  // a op b op c == a op (b op c)
  RIGHT("right"),
  // a op b op c is an error
  NONE("none");

  private final String repr;

  Associativity(String repr) {
    this.repr = repr;
  }

  public String repr() {
    return repr;
  }

  private static final ImmutableMap<String, Associativity> REPR_MAP =
      Maps.uniqueIndex(Arrays.asList(values()), Associativity::repr);

  public static Optional<Associativity> parse(String atom) {
    return Optional.ofNullable(REPR_MAP.get(atom));
  }
}
