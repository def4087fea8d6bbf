package oprec;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.graph.ElementOrder;
import com.google.common.graph.ImmutableValueGraph;
import com.google.common.graph.MutableValueGraph;
import com.google.common.graph.ValueGraphBuilder;

/**
 * An immutable snapshot of a registry: its groups, its infix operators, and the partial order
 * between the groups.
 *
 * <p>An edge {@code X -> Y} means X binds more tightly than Y. Edges come from {@code higherThan}
 * relations and, reversed, from {@code lowerThan} relations; each edge carries the relation that
 * declared it. Undeclared group names are dead ends, reported as missing groups when reached.
 */
public final class PrecedenceGraph {
  private static final Logger LOGGER = LoggerFactory.getLogger(PrecedenceGraph.class);

  private final ImmutableMap<String, PrecedenceGroup> groups;
  private final ImmutableMap<String, OperatorDefinition> infixOperators;
  private final ImmutableValueGraph<String, PrecedenceGroup.Relation> tighterThan;

  private PrecedenceGraph(
      ImmutableMap<String, PrecedenceGroup> groups,
      ImmutableMap<String, OperatorDefinition> infixOperators,
      ImmutableValueGraph<String, PrecedenceGroup.Relation> tighterThan) {
    this.groups = groups;
    this.infixOperators = infixOperators;
    this.tighterThan = tighterThan;
  }

  public static PrecedenceGraph of(PrecedenceRegistry registry) {
    ImmutableList<PrecedenceGroup> declared = registry.groups();
    MutableValueGraph<String, PrecedenceGroup.Relation> graph =
        ValueGraphBuilder.directed()
            .allowsSelfLoops(true)
            .incidentEdgeOrder(ElementOrder.stable())
            .build();

    for (PrecedenceGroup group : declared) {
      graph.addNode(group.name());
    }
    for (PrecedenceGroup group : declared) {
      for (PrecedenceGroup.Relation relation : group.higherThan()) {
        addEdge(graph, group.name(), relation.groupName(), relation);
      }
      for (PrecedenceGroup.Relation relation : group.lowerThan()) {
        addEdge(graph, relation.groupName(), group.name(), relation);
      }
    }

    return new PrecedenceGraph(
        declared.stream()
            .collect(ImmutableMap.toImmutableMap(PrecedenceGroup::name, g -> g)),
        registry.operators().stream()
            .filter(op -> op.fixity() == Fixity.INFIX)
            .collect(ImmutableMap.toImmutableMap(OperatorDefinition::name, op -> op)),
        ImmutableValueGraph.copyOf(graph));
  }

  // The first relation declaring an edge is kept, so errors point at it.
  private static void addEdge(
      MutableValueGraph<String, PrecedenceGroup.Relation> graph,
      String tighter,
      String looser,
      PrecedenceGroup.Relation relation) {
    if (!graph.hasEdgeConnecting(tighter, looser)) {
      graph.putEdgeValue(tighter, looser, relation);
    }
  }

  public Optional<PrecedenceGroup> lookupGroup(String name) {
    return Optional.ofNullable(groups.get(name));
  }

  // Infix only; the folder never consults prefix or postfix definitions.
  public Optional<OperatorDefinition> lookupOperator(String name) {
    return Optional.ofNullable(infixOperators.get(name));
  }

  // The implicit default group is looser than every declared group.
  public Outcome<Precedence> compare(PrecedenceGroup first, PrecedenceGroup second) {
    if (first.isDefault() || second.isDefault()) {
      if (first.isDefault() && second.isDefault()) return Outcome.success(Precedence.EQUAL);
      return Outcome.success(first.isDefault() ? Precedence.LOWER : Precedence.HIGHER);
    }
    return compare(first.name(), second.name());
  }

  // Each direction is searched forward from one end and backward from the other, so relations
  // declared on either group are examined. Missing groups are reported once per name.
  public Outcome<Precedence> compare(String first, String second) {
    if (first.equals(second)) return Outcome.success(Precedence.EQUAL);

    Map<String, PrecedenceGroup.Relation> missing = new LinkedHashMap<>();
    Precedence precedence;
    if (search(first, second, true, missing) || search(second, first, false, missing)) {
      precedence = Precedence.HIGHER;
    } else if (search(second, first, true, missing) || search(first, second, false, missing)) {
      precedence = Precedence.LOWER;
    } else {
      precedence = Precedence.UNORDERED;
    }

    LOGGER.trace("{} vs {}: {}", first, second, precedence);
    return Outcome.of(
        precedence,
        missing.entrySet().stream()
            .map(e -> new OperatorPrecedenceException.MissingGroup(e.getKey(), e.getValue().pos()))
            .collect(ImmutableList.toImmutableList()));
  }

  // Depth-first search for `target`, following successors if `forward`, else predecessors.
  private boolean search(
      String start,
      String target,
      boolean forward,
      Map<String, PrecedenceGroup.Relation> missing) {
    if (!groups.containsKey(start)) return false;

    Deque<String> stack = new ArrayDeque<>();
    Set<String> seen = new HashSet<>();
    stack.push(start);
    seen.add(start);
    while (!stack.isEmpty()) {
      String current = stack.pop();
      Set<String> neighbors =
          forward ? tighterThan.successors(current) : tighterThan.predecessors(current);
      for (String neighbor : neighbors) {
        if (neighbor.equals(target)) return true;

        if (!groups.containsKey(neighbor)) {
          PrecedenceGroup.Relation relation =
              forward
                  ? tighterThan.edgeValue(current, neighbor).get()
                  : tighterThan.edgeValue(neighbor, current).get();
          missing.putIfAbsent(neighbor, relation);
          continue;
        }

        if (seen.add(neighbor)) stack.push(neighbor);
      }
    }
    return false;
  }
}
