package oprec;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Table;
import com.google.common.collect.Tables;

// Only grows, and only through DeclarationLoader. Not thread-safe while loading.
public final class PrecedenceRegistry {
  private final Map<String, PrecedenceGroup> groupsByName = new LinkedHashMap<>();
  private final Table<String, Fixity, OperatorDefinition> operatorsByName =
      Tables.newCustomTable(new LinkedHashMap<>(), () -> new EnumMap<>(Fixity.class));

  public Optional<PrecedenceGroup> lookupGroup(String name) {
    return Optional.ofNullable(groupsByName.get(name));
  }

  public Optional<OperatorDefinition> lookupOperator(String name) {
    return lookupOperator(name, Fixity.INFIX);
  }

  public Optional<OperatorDefinition> lookupOperator(String name, Fixity fixity) {
    return Optional.ofNullable(operatorsByName.get(name, fixity));
  }

  public boolean isGroupDefined(String name) {
    return groupsByName.containsKey(name);
  }

  // In declaration order.
  public ImmutableList<PrecedenceGroup> groups() {
    return ImmutableList.copyOf(groupsByName.values());
  }

  // Grouped by operator name, names in declaration order.
  public ImmutableList<OperatorDefinition> operators() {
    return ImmutableList.copyOf(operatorsByName.values());
  }

  // Returns the existing group if the name is taken, in which case nothing is recorded.
  Optional<PrecedenceGroup> recordGroup(PrecedenceGroup group) {
    return Optional.ofNullable(groupsByName.putIfAbsent(group.name(), group));
  }

  // Returns the existing definition if the name and fixity are taken, in which case nothing is
  // recorded.
  Optional<OperatorDefinition> recordOperator(OperatorDefinition operator) {
    Optional<OperatorDefinition> existing = lookupOperator(operator.name(), operator.fixity());
    if (!existing.isPresent()) {
      operatorsByName.put(operator.name(), operator.fixity(), operator);
    }
    return existing;
  }
}
