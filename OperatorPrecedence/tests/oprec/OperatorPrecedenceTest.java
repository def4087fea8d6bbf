package oprec;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

public class OperatorPrecedenceTest {

  private static final String FOLD_ERROR_DECLARATIONS =
      String.join(
          "\n",
          "precedencegroup A {",
          "  associativity: none",
          "}",
          "",
          "precedencegroup C {",
          "  associativity: none",
          "  lowerThan: B",
          "}",
          "",
          "precedencegroup D {",
          "  associativity: none",
          "}",
          "",
          "infix operator +: A",
          "infix operator -: A",
          "",
          "infix operator *: C",
          "",
          "infix operator ++: D");

  // Folds `source` and checks it has the same structure as the fully parenthesized version.
  private static void assertExpectedFold(
      OperatorPrecedence precedence, String source, String fullyParenthesized)
      throws OperatorPrecedenceException {
    Expression folded = precedence.foldAll(TestSources.parseExpression(source));
    assertThat(folded.containsSequence()).isFalse();

    Expression expected =
        TestSources.foldParenthesized(TestSources.parseExpression(fullyParenthesized));
    assertThat(expected.containsSequence()).isFalse();

    assertThat(folded).isEqualTo(expected);
  }

  private static List<OperatorPrecedenceException> foldErrors(
      OperatorPrecedence precedence, String source) {
    List<OperatorPrecedenceException> errors = new ArrayList<>();
    precedence.foldSingle(TestSources.parseSequence(source), errors::add);
    return errors;
  }

  private static OperatorPrecedence foldErrorPrecedence() throws OperatorPrecedenceException {
    OperatorPrecedence precedence = new OperatorPrecedence();
    precedence.addSourceFile(TestSources.parseDeclarations(FOLD_ERROR_DECLARATIONS));
    return precedence;
  }

  @Test
  public void logicalExprsSingle() throws OperatorPrecedenceException {
    OperatorPrecedence precedence = OperatorPrecedence.logicalOperators();
    Expression.Sequence sequence = TestSources.parseSequence("x && y || w && v || z");

    Expression folded = precedence.foldSingle(sequence);

    assertThat(folded.toString()).isEqualTo("x && y || w && v || z");
    assertThat(folded.type()).isEqualTo(Expression.Type.INFIX_OPERATION);
    assertThat(folded.containsSequence()).isFalse();
  }

  @Test
  public void logicalExprs() throws OperatorPrecedenceException {
    OperatorPrecedence precedence = OperatorPrecedence.logicalOperators();
    assertExpectedFold(precedence, "x && y || w", "((x && y) || w)");
    assertExpectedFold(precedence, "x || y && w", "(x || (y && w))");
    assertExpectedFold(precedence, "x && y || w && v || z", "(((x && y) || (w && v)) || z)");
  }

  @Test
  public void swiftExprs() throws OperatorPrecedenceException {
    OperatorPrecedence precedence = OperatorPrecedence.standardOperators();
    Expression.Sequence sequence =
        TestSources.parseSequence("(x + y > 17) && x && y || w && v || z");

    Expression folded = precedence.foldSingle(sequence);

    assertThat(folded.toString()).isEqualTo("(x + y > 17) && x && y || w && v || z");
    assertThat(folded.type()).isEqualTo(Expression.Type.INFIX_OPERATION);
    // The parenthesized operand is left alone.
    assertThat(folded.containsSequence()).isTrue();
    assertThat(sequence.operand(0).children().get(0).type())
        .isEqualTo(Expression.Type.SEQUENCE);
  }

  @Test
  public void nestedSwiftExprs() throws OperatorPrecedenceException {
    OperatorPrecedence precedence = OperatorPrecedence.standardOperators();
    Expression parsed = TestSources.parseExpression("(x + y > 17) && x && y || w && v || z");

    Expression foldedAll = precedence.foldAll(parsed);

    assertThat(foldedAll.toString()).isEqualTo("(x + y > 17) && x && y || w && v || z");
    assertThat(foldedAll.containsSequence()).isFalse();
    assertThat(foldedAll)
        .isEqualTo(
            TestSources.foldParenthesized(
                TestSources.parseExpression(
                    "(((((((x + y) > 17)) && x) && y) || (w && v)) || z)")));
  }

  @Test
  public void standardExprs() throws OperatorPrecedenceException {
    OperatorPrecedence precedence = OperatorPrecedence.standardOperators();
    assertExpectedFold(precedence, "a + b * c - d / e", "((a + (b * c)) - (d / e))");
    assertExpectedFold(precedence, "a = b = c", "(a = (b = c))");
    assertExpectedFold(precedence, "a ?? b ?? c", "(a ?? (b ?? c))");
    assertExpectedFold(precedence, "a << 2 * b", "((a << 2) * b)");
    assertExpectedFold(precedence, "a ..< b + 1", "(a ..< (b + 1))");
    assertExpectedFold(precedence, "x = a < b || c && d", "(x = ((a < b) || (c && d)))");
    assertExpectedFold(precedence, "f(a + b * c, d) - 1", "(f((a + (b * c)), d) - 1)");
  }

  @Test
  public void foldAllIsIdempotent() throws OperatorPrecedenceException {
    OperatorPrecedence precedence = OperatorPrecedence.standardOperators();
    Expression once =
        precedence.foldAll(TestSources.parseExpression("f((a + b) * c, g(d - e)) == x"));

    Expression twice = precedence.foldAll(once);

    assertThat(twice).isSameInstanceAs(once);
  }

  @Test
  public void foldAllWithoutSequences() throws OperatorPrecedenceException {
    OperatorPrecedence precedence = OperatorPrecedence.standardOperators();
    Expression call = TestSources.parseExpression("f(a, (b), g())");

    assertThat(precedence.foldAll(call)).isSameInstanceAs(call);
  }

  @Test
  public void foldAllDeeplyNested() throws OperatorPrecedenceException {
    OperatorPrecedence precedence = OperatorPrecedence.standardOperators();
    Pos pos = Pos.internal();
    Expression expr = Expression.operand("a", pos);
    for (int i = 0; i < 20_000; i++) {
      expr =
          Expression.parenthesized(
              Expression.sequence(
                  List.of(expr, Expression.operator("+", pos), Expression.operand("b", pos))),
              pos);
    }

    Expression folded = precedence.foldAll(expr);

    assertThat(folded.containsSequence()).isFalse();
    assertThat(folded.children().get(0).type()).isEqualTo(Expression.Type.INFIX_OPERATION);
  }

  @Test
  public void parsedLogicalExprs() throws OperatorPrecedenceException {
    String logicalOperatorSources =
        String.join(
            "\n",
            "precedencegroup LogicalDisjunctionPrecedence {",
            "  associativity: left",
            "}",
            "",
            "precedencegroup LogicalConjunctionPrecedence {",
            "  associativity: left",
            "  higherThan: LogicalDisjunctionPrecedence",
            "}",
            "",
            "// \"Conjunctive\"",
            "",
            "infix operator &&: LogicalConjunctionPrecedence",
            "",
            "// \"Disjunctive\"",
            "",
            "infix operator ||: LogicalDisjunctionPrecedence");

    OperatorPrecedence precedence = new OperatorPrecedence();
    precedence.addSourceFile(TestSources.parseDeclarations(logicalOperatorSources));

    Expression folded =
        precedence.foldSingle(TestSources.parseSequence("x && y || w && v || z"));
    assertThat(folded.toString()).isEqualTo("x && y || w && v || z");
    assertThat(folded.type()).isEqualTo(Expression.Type.INFIX_OPERATION);
    assertThat(folded)
        .isEqualTo(
            OperatorPrecedence.logicalOperators()
                .foldSingle(TestSources.parseSequence("x && y || w && v || z")));
  }

  @Test
  public void parseErrors() {
    String sources =
        String.join(
            "\n",
            "infix operator +",
            "infix operator +",
            "",
            "precedencegroup A {",
            "  associativity: none",
            "  higherThan: B",
            "}",
            "",
            "precedencegroup A {",
            "  associativity: none",
            "  higherThan: B",
            "}");

    OperatorPrecedence precedence = new OperatorPrecedence();
    List<OperatorPrecedenceException> errors = new ArrayList<>();
    precedence.addSourceFile(TestSources.parseDeclarations(sources), errors::add);

    assertThat(errors).hasSize(2);
    assertThat(errors.get(0).kind())
        .isEqualTo(OperatorPrecedenceException.Kind.OPERATOR_ALREADY_EXISTS);
    assertThat(errors.get(0).message()).isEqualTo("redefinition of infix operator '+'");
    OperatorPrecedenceException.OperatorAlreadyExists operatorError = errors.get(0).cast();
    assertThat(operatorError.existing().pos().lineNumber()).isEqualTo(0);
    assertThat(operatorError.newDefinition().pos().lineNumber()).isEqualTo(1);

    assertThat(errors.get(1).kind())
        .isEqualTo(OperatorPrecedenceException.Kind.GROUP_ALREADY_EXISTS);
    assertThat(errors.get(1).message()).isEqualTo("redefinition of precedence group 'A'");
    OperatorPrecedenceException.GroupAlreadyExists groupError = errors.get(1).cast();
    assertThat(groupError.existing().pos().lineNumber()).isEqualTo(3);
    assertThat(groupError.newGroup().pos().lineNumber()).isEqualTo(8);

    // First definitions win.
    assertThat(precedence.registry().lookupOperator("+").get())
        .isSameInstanceAs(operatorError.existing());
    assertThat(precedence.registry().lookupGroup("A").get())
        .isSameInstanceAs(groupError.existing());
    assertThat(precedence.graph().lookupGroup("A").get()).isSameInstanceAs(groupError.existing());
  }

  @Test
  public void parseErrorsFailFast() {
    OperatorPrecedence precedence = new OperatorPrecedence();

    OperatorPrecedenceException ex =
        assertThrows(
            OperatorPrecedenceException.class,
            () ->
                precedence.addSourceFile(
                    TestSources.parseDeclarations(
                        "infix operator <>\ninfix operator <>\ninfix operator ><")));

    assertThat(ex).hasMessageThat().isEqualTo("redefinition of infix operator '<>'");
    // The rest of the batch is still recorded.
    assertThat(precedence.registry().lookupOperator("><").isPresent()).isTrue();
  }

  @Test
  public void foldErrorMissingGroup() throws OperatorPrecedenceException {
    List<OperatorPrecedenceException> errors = foldErrors(foldErrorPrecedence(), "a + b * c");

    assertThat(errors).hasSize(2);
    assertThat(errors.get(0).kind()).isEqualTo(OperatorPrecedenceException.Kind.MISSING_GROUP);
    OperatorPrecedenceException.MissingGroup missingGroup = errors.get(0).cast();
    assertThat(missingGroup.groupName()).isEqualTo("B");
    assertThat(missingGroup.message()).isEqualTo("unknown precedence group 'B'");
    assertThat(missingGroup.pos().lineNumber()).isEqualTo(6);

    assertThat(errors.get(1).message())
        .isEqualTo("adjacent operators are in unordered precedence groups 'A' and 'C'");
  }

  @Test
  public void foldErrorMissingOperator() throws OperatorPrecedenceException {
    List<OperatorPrecedenceException> errors = foldErrors(foldErrorPrecedence(), "a / c");

    assertThat(errors).hasSize(1);
    assertThat(errors.get(0).kind()).isEqualTo(OperatorPrecedenceException.Kind.MISSING_OPERATOR);
    OperatorPrecedenceException.MissingOperator missingOperator = errors.get(0).cast();
    assertThat(missingOperator.operatorName()).isEqualTo("/");
    assertThat(missingOperator.message()).isEqualTo("unknown infix operator '/'");
    assertThat(missingOperator.pos().column()).isEqualTo(2);
  }

  @Test
  public void foldErrorNonAssociative() throws OperatorPrecedenceException {
    List<OperatorPrecedenceException> errors = foldErrors(foldErrorPrecedence(), "a + b - c");

    assertThat(errors).hasSize(1);
    assertThat(errors.get(0).kind())
        .isEqualTo(OperatorPrecedenceException.Kind.INCOMPARABLE_OPERATORS);
    OperatorPrecedenceException.IncomparableOperators incomparable = errors.get(0).cast();
    assertThat(incomparable.leftGroup()).isEqualTo("A");
    assertThat(incomparable.rightGroup()).isEqualTo("A");
    assertThat(incomparable.leftOperator().name()).isEqualTo("+");
    assertThat(incomparable.rightOperator().name()).isEqualTo("-");
    assertThat(incomparable.message())
        .isEqualTo("adjacent operators are in non-associative precedence group 'A'");
  }

  @Test
  public void foldErrorUnordered() throws OperatorPrecedenceException {
    List<OperatorPrecedenceException> errors = foldErrors(foldErrorPrecedence(), "a ++ b - d");

    assertThat(errors).hasSize(1);
    OperatorPrecedenceException.IncomparableOperators incomparable = errors.get(0).cast();
    assertThat(incomparable.leftGroup()).isEqualTo("D");
    assertThat(incomparable.rightGroup()).isEqualTo("A");
    assertThat(incomparable.message())
        .isEqualTo("adjacent operators are in unordered precedence groups 'D' and 'A'");
  }

  @Test
  public void foldErrorsStillProduceTree() throws OperatorPrecedenceException {
    OperatorPrecedence precedence = foldErrorPrecedence();

    // Degraded folds go left to right.
    Expression folded =
        precedence.foldSingle(TestSources.parseSequence("a + b - c ++ d"), ex -> {});

    assertThat(folded)
        .isEqualTo(
            TestSources.foldParenthesized(TestSources.parseExpression("(((a + b) - c) ++ d)")));
  }

  @Test
  public void foldErrorsFailFast() throws OperatorPrecedenceException {
    OperatorPrecedence precedence = foldErrorPrecedence();

    OperatorPrecedenceException ex =
        assertThrows(
            OperatorPrecedenceException.class,
            () -> precedence.foldSingle(TestSources.parseSequence("a / b + c - d")));

    assertThat(ex.kind()).isEqualTo(OperatorPrecedenceException.Kind.MISSING_OPERATOR);
    assertThat(ex.format()).isEqualTo("ERROR: /test/expression.txt@1:3 unknown infix operator '/'");
  }

  @Test
  public void foldAllReportsNestedErrorsFirst() throws OperatorPrecedenceException {
    OperatorPrecedence precedence = foldErrorPrecedence();
    List<OperatorPrecedenceException> errors = new ArrayList<>();

    Expression folded =
        precedence.foldAll(TestSources.parseExpression("a + b - (c ++ d - e)"), errors::add);

    assertThat(folded.containsSequence()).isFalse();
    assertThat(errors).hasSize(2);
    assertThat(errors.get(0).message())
        .isEqualTo("adjacent operators are in unordered precedence groups 'D' and 'A'");
    assertThat(errors.get(1).message())
        .isEqualTo("adjacent operators are in non-associative precedence group 'A'");
  }
}
