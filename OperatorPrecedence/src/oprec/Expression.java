package oprec;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

// Immutable expression nodes. Equality is structural and ignores positions.
public abstract class Expression {

  public enum Type {
    // Unfolded; doesn't exist in the final tree.
    SEQUENCE,
    OPERATOR,

    INFIX_OPERATION,
    OPERAND;
  }

  private final Type type;
  private final Pos pos;

  private Expression(Type type, Pos pos) {
    this.type = type;
    this.pos = pos;
  }

  public Type type() {
    return type;
  }

  public Pos pos() {
    return pos;
  }

  public abstract ImmutableList<Expression> children();

  // Returns this node with its children replaced, or this node itself if they are all identical.
  abstract Expression withChildren(ImmutableList<Expression> children);

  public abstract String raw();

  @Override
  public String toString() {
    return raw();
  }

  @SuppressWarnings("unchecked")
  public <T extends Expression> T cast() {
    return (T) this;
  }

  public <T extends Expression> T cast(Class<T> clazz) {
    return clazz.cast(this);
  }

  public final boolean containsSequence() {
    Deque<Expression> pending = new ArrayDeque<>();
    pending.push(this);
    while (!pending.isEmpty()) {
      Expression next = pending.pop();
      if (next.type() == Type.SEQUENCE) return true;
      next.children().forEach(pending::push);
    }
    return false;
  }

  private static boolean sameChildren(List<Expression> current, List<Expression> replacement) {
    if (current.size() != replacement.size()) return false;
    for (int i = 0; i < current.size(); i++) {
      if (current.get(i) != replacement.get(i)) return false;
    }
    return true;
  }

  public static Operand operand(String label, Pos pos) {
    return new Operand(label, ImmutableList.of(), pos);
  }

  public static Operand operand(String label, List<? extends Expression> children, Pos pos) {
    return new Operand(label, ImmutableList.copyOf(children), pos);
  }

  public static Operand parenthesized(Expression inner, Pos pos) {
    return new Operand("", ImmutableList.of(inner), pos);
  }

  public static Operator operator(String name, Pos pos) {
    return new Operator(name, pos);
  }

  public static Sequence sequence(List<? extends Expression> elements) {
    return new Sequence(ImmutableList.copyOf(elements));
  }

  public static InfixOperation infix(Expression lhs, Operator op, Expression rhs) {
    return new InfixOperation(lhs, op, rhs);
  }

  // operand (operator operand)*, not yet folded.
  public static final class Sequence extends Expression {
    private final ImmutableList<Expression> elements;

    private Sequence(ImmutableList<Expression> elements) {
      super(Type.SEQUENCE, elements.isEmpty() ? Pos.internal() : elements.get(0).pos());
      Preconditions.checkArgument(
          elements.size() % 2 == 1, "sequence must alternate operands and operators: %s", elements);
      for (int i = 0; i < elements.size(); i++) {
        boolean isOperator = elements.get(i).type() == Type.OPERATOR;
        Preconditions.checkArgument(
            isOperator == (i % 2 == 1),
            "expected %s at index %s of sequence: %s",
            isOperator ? "an operand" : "an operator",
            i,
            elements);
      }
      this.elements = elements;
    }

    public ImmutableList<Expression> elements() {
      return elements;
    }

    public int numOperators() {
      return elements.size() / 2;
    }

    public Expression operand(int i) {
      return elements.get(2 * i);
    }

    public Operator operator(int i) {
      return elements.get(2 * i + 1).cast();
    }

    @Override
    public ImmutableList<Expression> children() {
      return elements;
    }

    @Override
    Expression withChildren(ImmutableList<Expression> children) {
      return sameChildren(elements, children) ? this : new Sequence(children);
    }

    @Override
    public String raw() {
      return elements.stream().map(Expression::raw).collect(Collectors.joining(" "));
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Sequence && elements.equals(((Sequence) obj).elements);
    }

    @Override
    public int hashCode() {
      return Objects.hash(Type.SEQUENCE, elements);
    }
  }

  public static final class Operator extends Expression {
    private final String name;

    private Operator(String name, Pos pos) {
      super(Type.OPERATOR, pos);
      Preconditions.checkArgument(!name.isEmpty(), "operator name is empty");
      this.name = name;
    }

    public String name() {
      return name;
    }

    @Override
    public ImmutableList<Expression> children() {
      return ImmutableList.of();
    }

    @Override
    Expression withChildren(ImmutableList<Expression> children) {
      Preconditions.checkArgument(children.isEmpty());
      return this;
    }

    @Override
    public String raw() {
      return name;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Operator && name.equals(((Operator) obj).name);
    }

    @Override
    public int hashCode() {
      return Objects.hash(Type.OPERATOR, name);
    }
  }

  public static final class InfixOperation extends Expression {
    private final Expression lhs;
    private final Operator op;
    private final Expression rhs;

    private InfixOperation(Expression lhs, Operator op, Expression rhs) {
      super(Type.INFIX_OPERATION, op.pos());
      Preconditions.checkArgument(lhs.type() != Type.OPERATOR, "operator as lhs: %s", lhs);
      Preconditions.checkArgument(rhs.type() != Type.OPERATOR, "operator as rhs: %s", rhs);
      this.lhs = lhs;
      this.op = op;
      this.rhs = rhs;
    }

    public Expression lhs() {
      return lhs;
    }

    public Operator op() {
      return op;
    }

    public Expression rhs() {
      return rhs;
    }

    @Override
    public ImmutableList<Expression> children() {
      return ImmutableList.of(lhs, op, rhs);
    }

    @Override
    Expression withChildren(ImmutableList<Expression> children) {
      if (sameChildren(children(), children)) return this;
      Preconditions.checkArgument(children.size() == 3, "infix operation needs 3 children");
      return new InfixOperation(
          children.get(0), children.get(1).cast(Operator.class), children.get(2));
    }

    @Override
    public String raw() {
      return lhs.raw() + " " + op.raw() + " " + rhs.raw();
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof InfixOperation)) return false;
      InfixOperation that = (InfixOperation) obj;
      return lhs.equals(that.lhs) && op.equals(that.op) && rhs.equals(that.rhs);
    }

    @Override
    public int hashCode() {
      return Objects.hash(Type.INFIX_OPERATION, lhs, op, rhs);
    }
  }

  /**
   * Anything else the parser produces: identifiers, literals, parenthesized groups, calls. The
   * folder only looks inside for nested sequences.
   *
   * <p>An operand is just a label and a list of children, so a call with no arguments such as
   * {@code g()} is the same node as the bare identifier {@code g}: it renders as {@code g} and the
   * two compare equal. An empty label with one child is a parenthesized expression.
   */
  public static final class Operand extends Expression {
    private final String label;
    private final ImmutableList<Expression> children;

    private Operand(String label, ImmutableList<Expression> children, Pos pos) {
      super(Type.OPERAND, pos);
      Preconditions.checkArgument(
          children.stream().noneMatch(c -> c.type() == Type.OPERATOR),
          "operator outside of a sequence: %s",
          children);
      this.label = label;
      this.children = children;
    }

    public String label() {
      return label;
    }

    @Override
    public ImmutableList<Expression> children() {
      return children;
    }

    @Override
    Expression withChildren(ImmutableList<Expression> children) {
      return sameChildren(this.children, children) ? this : new Operand(label, children, pos());
    }

    @Override
    public String raw() {
      if (children.isEmpty()) return label;
      return label
          + children.stream().map(Expression::raw).collect(Collectors.joining(", ", "(", ")"));
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof Operand)) return false;
      Operand that = (Operand) obj;
      return label.equals(that.label) && children.equals(that.children);
    }

    @Override
    public int hashCode() {
      return Objects.hash(Type.OPERAND, label, children);
    }
  }
}
