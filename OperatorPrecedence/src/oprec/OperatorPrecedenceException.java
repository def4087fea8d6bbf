package oprec;

// kind() identifies the nested subclass.
public abstract class OperatorPrecedenceException extends Exception {
  private static final long serialVersionUID = 1L;

  public enum Kind {
    OPERATOR_ALREADY_EXISTS,
    GROUP_ALREADY_EXISTS,
    MISSING_GROUP,
    MISSING_OPERATOR,
    INCOMPARABLE_OPERATORS;
  }

  private final Kind kind;
  private final Pos pos;
  private final String errorMsg;

  private OperatorPrecedenceException(Kind kind, Pos pos, String errorMsg) {
    super(errorMsg);
    this.kind = kind;
    this.pos = pos;
    this.errorMsg = errorMsg;
  }

  public Kind kind() {
    return kind;
  }

  public Pos pos() {
    return pos;
  }

  public String message() {
    return errorMsg;
  }

  public String format() {
    return String.format("ERROR: %s %s", pos, errorMsg);
  }

  @SuppressWarnings("unchecked")
  public <T extends OperatorPrecedenceException> T cast() {
    return (T) this;
  }

  public static final class OperatorAlreadyExists extends OperatorPrecedenceException {
    private static final long serialVersionUID = 1L;

    private final OperatorDefinition existing;
    private final OperatorDefinition newDefinition;

    public OperatorAlreadyExists(OperatorDefinition existing, OperatorDefinition newDefinition) {
      super(
          Kind.OPERATOR_ALREADY_EXISTS,
          newDefinition.pos(),
          "redefinition of " + newDefinition.describe());
      this.existing = existing;
      this.newDefinition = newDefinition;
    }

    public OperatorDefinition existing() {
      return existing;
    }

    public OperatorDefinition newDefinition() {
      return newDefinition;
    }
  }

  public static final class GroupAlreadyExists extends OperatorPrecedenceException {
    private static final long serialVersionUID = 1L;

    private final PrecedenceGroup existing;
    private final PrecedenceGroup newGroup;

    public GroupAlreadyExists(PrecedenceGroup existing, PrecedenceGroup newGroup) {
      super(
          Kind.GROUP_ALREADY_EXISTS,
          newGroup.pos(),
          String.format("redefinition of precedence group '%s'", newGroup.name()));
      this.existing = existing;
      this.newGroup = newGroup;
    }

    public PrecedenceGroup existing() {
      return existing;
    }

    public PrecedenceGroup newGroup() {
      return newGroup;
    }
  }

  public static final class MissingGroup extends OperatorPrecedenceException {
    private static final long serialVersionUID = 1L;

    private final String groupName;

    public MissingGroup(String groupName, Pos pos) {
      super(Kind.MISSING_GROUP, pos, String.format("unknown precedence group '%s'", groupName));
      this.groupName = groupName;
    }

    public String groupName() {
      return groupName;
    }
  }

  public static final class MissingOperator extends OperatorPrecedenceException {
    private static final long serialVersionUID = 1L;

    private final String operatorName;

    public MissingOperator(String operatorName, Pos pos) {
      super(
          Kind.MISSING_OPERATOR, pos, String.format("unknown infix operator '%s'", operatorName));
      this.operatorName = operatorName;
    }

    public String operatorName() {
      return operatorName;
    }
  }

  public static final class IncomparableOperators extends OperatorPrecedenceException {
    private static final long serialVersionUID = 1L;

    private final Expression.Operator leftOperator;
    private final String leftGroup;
    private final Expression.Operator rightOperator;
    private final String rightGroup;

    public IncomparableOperators(
        Expression.Operator leftOperator,
        String leftGroup,
        Expression.Operator rightOperator,
        String rightGroup) {
      super(
          Kind.INCOMPARABLE_OPERATORS,
          rightOperator.pos(),
          leftGroup.equals(rightGroup)
              ? String.format(
                  "adjacent operators are in non-associative precedence group '%s'", leftGroup)
              : String.format(
                  "adjacent operators are in unordered precedence groups '%s' and '%s'",
                  leftGroup,
                  rightGroup));
      this.leftOperator = leftOperator;
      this.leftGroup = leftGroup;
      this.rightOperator = rightOperator;
      this.rightGroup = rightGroup;
    }

    public Expression.Operator leftOperator() {
      return leftOperator;
    }

    public String leftGroup() {
      return leftGroup;
    }

    public Expression.Operator rightOperator() {
      return rightOperator;
    }

    public String rightGroup() {
      return rightGroup;
    }
  }
}
