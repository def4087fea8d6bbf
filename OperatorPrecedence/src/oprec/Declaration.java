package oprec;

import java.util.Optional;

// A top-level declaration from the parser: a precedence group or an operator.
public final class Declaration {
  private final Optional<PrecedenceGroup> group;
  private final Optional<OperatorDefinition> operator;

  private Declaration(Optional<PrecedenceGroup> group, Optional<OperatorDefinition> operator) {
    this.group = group;
    this.operator = operator;
  }

  public static Declaration group(PrecedenceGroup group) {
    return new Declaration(Optional.of(group), Optional.empty());
  }

  public static Declaration operator(OperatorDefinition operator) {
    return new Declaration(Optional.empty(), Optional.of(operator));
  }

  public boolean isGroup() {
    return group.isPresent();
  }

  public PrecedenceGroup group() {
    return group.get();
  }

  public OperatorDefinition operator() {
    return operator.get();
  }

  public Pos pos() {
    return isGroup() ? group().pos() : operator().pos();
  }

  @Override
  public String toString() {
    if (isGroup()) {
      return "[precedencegroup: " + group().name() + "]";
    } else {
      return "[" + operator().describe() + "]";
    }
  }
}
