package oprec;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;

import org.junit.jupiter.api.Test;

public class ExpressionTest {

  private static final Pos POS = Pos.internal();

  @Test
  public void sequenceMustAlternate() {
    Expression a = Expression.operand("a", POS);
    Expression.Operator plus = Expression.operator("+", POS);

    assertThrows(IllegalArgumentException.class, () -> Expression.sequence(List.of()));
    assertThrows(IllegalArgumentException.class, () -> Expression.sequence(List.of(a, plus)));
    assertThrows(IllegalArgumentException.class, () -> Expression.sequence(List.of(plus, a, plus)));
    assertThrows(IllegalArgumentException.class, () -> Expression.sequence(List.of(a, a, a)));
    assertThrows(IllegalArgumentException.class, () -> Expression.operand("f", List.of(plus), POS));
  }

  @Test
  public void sequenceAccessors() {
    Expression.Sequence sequence = TestSources.parseSequence("a + b * c");

    assertThat(sequence.numOperators()).isEqualTo(2);
    assertThat(sequence.operand(2).raw()).isEqualTo("c");
    assertThat(sequence.operator(1).name()).isEqualTo("*");
    assertThat(sequence.pos().column()).isEqualTo(0);
  }

  @Test
  public void rendering() {
    Expression expr = TestSources.parseExpression("f(a, (b + c), g()) - x");

    assertThat(expr.raw()).isEqualTo("f(a, (b + c), g) - x");
    assertThat(expr.toString()).isEqualTo(expr.raw());

    // A call without arguments is indistinguishable from a bare identifier.
    assertThat(TestSources.parseExpression("g()")).isEqualTo(TestSources.parseExpression("g"));
  }

  @Test
  public void equalityIgnoresPositions() {
    Expression first = TestSources.parseExpression("a + (b * c)");
    Expression second = TestSources.parseExpression("a   +   ( b*c )");

    assertThat(first).isEqualTo(second);
    assertThat(first.hashCode()).isEqualTo(second.hashCode());
    assertThat(first).isNotEqualTo(TestSources.parseExpression("a + b * c"));
  }

  @Test
  public void containsSequence() {
    Expression.Operand leaf = Expression.operand("a", POS);
    Expression.Sequence sequence =
        Expression.sequence(List.of(leaf, Expression.operator("+", POS), leaf));

    assertThat(leaf.containsSequence()).isFalse();
    assertThat(sequence.containsSequence()).isTrue();
    Expression call =
        Expression.operand("f", List.of(leaf, Expression.parenthesized(sequence, POS)), POS);
    assertThat(call.containsSequence()).isTrue();
    assertThat(Expression.infix(leaf, Expression.operator("+", POS), leaf).containsSequence())
        .isFalse();
  }

  @Test
  public void infixPositionIsOperatorPosition() {
    Expression.Operator op = Expression.operator("+", new Pos("f", 3, 7));
    Expression.InfixOperation infix =
        Expression.infix(Expression.operand("a", POS), op, Expression.operand("b", POS));

    assertThat(infix.pos()).isEqualTo(new Pos("f", 3, 7));
    assertThat(infix.pos().toString()).isEqualTo("f@4:8");
    assertThat(infix.pos()).isLessThan(new Pos("f", 4, 0));
    assertThat(infix.children()).containsExactly(infix.lhs(), op, infix.rhs()).inOrder();
  }
}
