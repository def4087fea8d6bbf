package oprec;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Verify;
import com.google.common.collect.ImmutableList;

/**
 * Folds flat sequences into {@link Expression.InfixOperation} trees.
 *
 * <p>Folding never stops at an error. Undefined operators, and operators whose group is undefined,
 * fold as members of the default group; adjacent operators that can't be ordered fold left to
 * right. Either way a complete tree comes back alongside the errors.
 *
 * <p>Everything is read from one {@link PrecedenceGraph} snapshot, so a folder is unaffected by
 * later declarations and may be shared between threads.
 */
public final class SequenceFolder {
  private static final Logger LOGGER = LoggerFactory.getLogger(SequenceFolder.class);

  private static final class ResolvedOperator {
    private final Expression.Operator op;
    private final PrecedenceGroup group;
    // False if resolving the operator already reported an error.
    private final boolean resolved;

    private ResolvedOperator(Expression.Operator op, PrecedenceGroup group, boolean resolved) {
      this.op = op;
      this.group = group;
      this.resolved = resolved;
    }
  }

  private final PrecedenceGraph graph;

  public SequenceFolder(PrecedenceGraph graph) {
    this.graph = graph;
  }

  // Operands must already be folded.
  public Outcome<Expression> foldSingle(Expression.Sequence sequence) {
    ErrorCollector errors = new ErrorCollector();
    Deque<Expression> operands = new ArrayDeque<>();
    Deque<ResolvedOperator> operators = new ArrayDeque<>();

    operands.push(sequence.operand(0));
    for (int i = 0; i < sequence.numOperators(); i++) {
      ResolvedOperator next = resolve(sequence.operator(i), errors);
      while (!operators.isEmpty() && shouldReduce(operators.peek(), next, errors)) {
        reduce(operands, operators);
      }
      operators.push(next);
      operands.push(sequence.operand(i + 1));
    }
    while (!operators.isEmpty()) {
      reduce(operands, operators);
    }

    Verify.verify(operands.size() == 1, "unbalanced fold of %s", sequence);
    Expression folded = operands.pop();
    LOGGER.trace("Folded '{}' into {}", sequence, folded);
    return errors.finish(folded);
  }

  // Innermost first. Subtrees without sequences come back as the same instances.
  public Outcome<Expression> foldAll(Expression root) {
    ErrorCollector errors = new ErrorCollector();

    // Post-order walk with an explicit stack, so deep nesting can't overflow the call stack.
    Deque<Frame> frames = new ArrayDeque<>();
    frames.push(new Frame(root));
    while (true) {
      Frame frame = frames.peek();
      if (frame.hasNextChild()) {
        frames.push(new Frame(frame.nextChild()));
        continue;
      }

      frames.pop();
      Expression rebuilt = frame.rebuild();
      if (rebuilt.type() == Expression.Type.SEQUENCE) {
        rebuilt = errors.takeErrors(foldSingle(rebuilt.cast()));
      }

      if (frames.isEmpty()) return errors.finish(rebuilt);
      frames.peek().addFoldedChild(rebuilt);
    }
  }

  private static final class Frame {
    private final Expression node;
    private final ImmutableList.Builder<Expression> foldedChildren = ImmutableList.builder();
    private int nextChild = 0;

    private Frame(Expression node) {
      this.node = node;
    }

    private boolean hasNextChild() {
      return nextChild < node.children().size();
    }

    private Expression nextChild() {
      return node.children().get(nextChild++);
    }

    private void addFoldedChild(Expression child) {
      foldedChildren.add(child);
    }

    private Expression rebuild() {
      return node.withChildren(foldedChildren.build());
    }
  }

  private ResolvedOperator resolve(Expression.Operator op, ErrorCollector errors) {
    Optional<OperatorDefinition> definition = graph.lookupOperator(op.name());
    if (!definition.isPresent()) {
      errors.logError(new OperatorPrecedenceException.MissingOperator(op.name(), op.pos()));
      return new ResolvedOperator(op, PrecedenceGroup.defaultGroup(), false);
    }

    Optional<PrecedenceGroup.Relation> groupRef = definition.get().precedenceGroup();
    if (!groupRef.isPresent()) {
      return new ResolvedOperator(op, PrecedenceGroup.defaultGroup(), true);
    }

    Optional<PrecedenceGroup> group = graph.lookupGroup(groupRef.get().groupName());
    if (!group.isPresent()) {
      errors.logError(
          new OperatorPrecedenceException.MissingGroup(
              groupRef.get().groupName(), groupRef.get().pos()));
      return new ResolvedOperator(op, PrecedenceGroup.defaultGroup(), false);
    }
    return new ResolvedOperator(op, group.get(), true);
  }

  // Whether `top` takes the operand between it and `next`, i.e. should be combined first.
  private boolean shouldReduce(
      ResolvedOperator top, ResolvedOperator next, ErrorCollector errors) {
    Precedence precedence = errors.takeErrors(graph.compare(top.group, next.group));
    switch (precedence) {
      case HIGHER:
        return true;
      case LOWER:
        return false;
      case EQUAL:
        if (top.group.associativity() == Associativity.LEFT) return true;
        if (top.group.associativity() == Associativity.RIGHT) return false;
        break;
      case UNORDERED:
        break;
    }

    // Non-associative or unordered: report unless resolution already failed, then fold left to
    // right.
    if (top.resolved && next.resolved) {
      errors.logError(
          new OperatorPrecedenceException.IncomparableOperators(
              top.op, top.group.name(), next.op, next.group.name()));
    }
    return true;
  }

  private static void reduce(Deque<Expression> operands, Deque<ResolvedOperator> operators) {
    Expression rhs = operands.pop();
    Expression lhs = operands.pop();
    operands.push(Expression.infix(lhs, operators.pop().op, rhs));
  }
}
