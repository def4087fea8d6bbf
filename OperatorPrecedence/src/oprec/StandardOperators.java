package oprec;

import java.util.Arrays;

import com.google.common.base.Verify;
import com.google.common.collect.ImmutableList;

public final class StandardOperators {

  private static final ImmutableList<Declaration> LOGICAL_OPERATORS =
      ImmutableList.of(
          Declaration.group(
              PrecedenceGroup.builder("LogicalConjunctionPrecedence")
                  .setAssociativity(Associativity.LEFT)
                  .addHigherThan("LogicalDisjunctionPrecedence")
                  .build()),
          Declaration.group(
              PrecedenceGroup.builder("LogicalDisjunctionPrecedence")
                  .setAssociativity(Associativity.LEFT)
                  .build()),
          Declaration.operator(OperatorDefinition.infix("&&", "LogicalConjunctionPrecedence")),
          Declaration.operator(OperatorDefinition.infix("||", "LogicalDisjunctionPrecedence")));

  private static final ImmutableList<Declaration> STANDARD_OPERATORS = buildStandardOperators();

  public static ImmutableList<Declaration> logicalOperators() {
    return LOGICAL_OPERATORS;
  }

  // The Swift standard library table.
  public static ImmutableList<Declaration> standardOperators() {
    return STANDARD_OPERATORS;
  }

  private static ImmutableList<Declaration> buildStandardOperators() {
    ImmutableList.Builder<Declaration> builder = ImmutableList.builder();

    // Groups, loosest first.
    group(builder, "AssignmentPrecedence", Associativity.RIGHT);
    group(builder, "FunctionArrowPrecedence", Associativity.RIGHT, "AssignmentPrecedence");
    group(builder, "TernaryPrecedence", Associativity.RIGHT, "FunctionArrowPrecedence");
    group(builder, "LogicalDisjunctionPrecedence", Associativity.LEFT, "TernaryPrecedence");
    group(
        builder,
        "LogicalConjunctionPrecedence",
        Associativity.LEFT,
        "LogicalDisjunctionPrecedence");
    group(builder, "ComparisonPrecedence", Associativity.NONE, "LogicalConjunctionPrecedence");
    group(builder, "NilCoalescingPrecedence", Associativity.RIGHT, "ComparisonPrecedence");
    group(builder, "CastingPrecedence", Associativity.NONE, "NilCoalescingPrecedence");
    group(builder, "RangeFormationPrecedence", Associativity.NONE, "CastingPrecedence");
    group(builder, "AdditionPrecedence", Associativity.LEFT, "RangeFormationPrecedence");
    group(builder, "MultiplicationPrecedence", Associativity.LEFT, "AdditionPrecedence");
    group(builder, "BitwiseShiftPrecedence", Associativity.NONE, "MultiplicationPrecedence");

    // Prefix and postfix.
    for (String op : Arrays.asList("!", "~", "+", "-", "..<", "...")) {
      builder.add(Declaration.operator(OperatorDefinition.ungrouped(op, Fixity.PREFIX)));
    }
    builder.add(Declaration.operator(OperatorDefinition.ungrouped("...", Fixity.POSTFIX)));

    // Infix.
    infix(builder, "BitwiseShiftPrecedence", "<<", "&<<", ">>", "&>>");
    infix(builder, "MultiplicationPrecedence", "*", "&*", "/", "%", "&");
    infix(builder, "AdditionPrecedence", "+", "&+", "-", "&-", "|", "^");
    infix(builder, "RangeFormationPrecedence", "...", "..<");
    infix(builder, "NilCoalescingPrecedence", "??");
    infix(
        builder,
        "ComparisonPrecedence",
        "<", "<=", ">", ">=", "==", "!=", "===", "!==", "~=",
        ".==", ".!=", ".<", ".<=", ".>", ".>=");
    infix(builder, "LogicalConjunctionPrecedence", "&&", ".&");
    infix(builder, "LogicalDisjunctionPrecedence", "||", ".|", ".^");
    infix(
        builder,
        "AssignmentPrecedence",
        "=", "*=", "&*=", "/=", "%=", "+=", "&+=", "-=", "&-=", "<<=", "&<<=", ">>=", "&>>=",
        "&=", "^=", "|=", ".&=", ".|=", ".^=");

    ImmutableList<Declaration> declarations = builder.build();

    // Every infix operator must name a group from this table.
    Verify.verify(
        declarations.stream()
            .filter(d -> !d.isGroup())
            .flatMap(d -> d.operator().precedenceGroup().stream())
            .allMatch(
                ref ->
                    declarations.stream()
                        .anyMatch(d -> d.isGroup() && d.group().name().equals(ref.groupName()))));
    return declarations;
  }

  private static void group(
      ImmutableList.Builder<Declaration> builder,
      String name,
      Associativity associativity,
      String... higherThan) {
    PrecedenceGroup.Builder group = PrecedenceGroup.builder(name).setAssociativity(associativity);
    for (String looser : higherThan) {
      group.addHigherThan(looser);
    }
    builder.add(Declaration.group(group.build()));
  }

  private static void infix(
      ImmutableList.Builder<Declaration> builder, String groupName, String... operators) {
    for (String op : operators) {
      builder.add(Declaration.operator(OperatorDefinition.infix(op, groupName)));
    }
  }

  private StandardOperators() {}
}
