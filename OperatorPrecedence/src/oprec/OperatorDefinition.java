package oprec;

import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;

// e.g. infix operator &&: LogicalConjunctionPrecedence
@AutoValue
public abstract class OperatorDefinition {
  public abstract String name();

  public abstract Fixity fixity();

  // Absent for operators that belong to the implicit default group.
  public abstract Optional<PrecedenceGroup.Relation> precedenceGroup();

  public abstract Pos pos();

  public final String describe() {
    return String.format("%s operator '%s'", fixity().repr(), name());
  }

  public static OperatorDefinition create(
      String name, Fixity fixity, Optional<PrecedenceGroup.Relation> precedenceGroup, Pos pos) {
    Preconditions.checkArgument(!name.isEmpty(), "operator name is empty");
    Preconditions.checkArgument(
        fixity == Fixity.INFIX || !precedenceGroup.isPresent(),
        "only infix operators belong to a precedence group: %s",
        name);
    return new AutoValue_OperatorDefinition(name, fixity, precedenceGroup, pos);
  }

  public static OperatorDefinition infix(String name, String groupName, Pos pos) {
    return create(
        name, Fixity.INFIX, Optional.of(PrecedenceGroup.Relation.create(groupName, pos)), pos);
  }

  public static OperatorDefinition infix(String name, String groupName) {
    return infix(name, groupName, Pos.internal());
  }

  public static OperatorDefinition ungrouped(String name, Fixity fixity, Pos pos) {
    return create(name, fixity, Optional.empty(), pos);
  }

  public static OperatorDefinition ungrouped(String name, Fixity fixity) {
    return ungrouped(name, fixity, Pos.internal());
  }
}
