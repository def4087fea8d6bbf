package oprec;

// How the first of two groups relates to the second.
public enum Precedence {
  // The first group binds more tightly.
  HIGHER,
  LOWER,
  // Same group.
  EQUAL,
  // No declared relation orders the two groups.
  UNORDERED;
}
