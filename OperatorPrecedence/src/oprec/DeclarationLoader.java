package oprec;

import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

// Processes a whole batch; duplicates are reported and skipped, the first definition stays.
public final class DeclarationLoader {
  private static final Logger LOGGER = LoggerFactory.getLogger(DeclarationLoader.class);

  private final PrecedenceRegistry registry;

  public DeclarationLoader(PrecedenceRegistry registry) {
    this.registry = registry;
  }

  public Outcome<PrecedenceRegistry> load(Iterable<Declaration> declarations) {
    ErrorCollector errors = new ErrorCollector();
    int groups = 0;
    int operators = 0;
    for (Declaration declaration : declarations) {
      if (declaration.isGroup()) {
        if (loadGroup(declaration.group(), errors)) groups++;
      } else {
        if (loadOperator(declaration.operator(), errors)) operators++;
      }
    }

    LOGGER.debug(
        "Loaded {} precedence groups and {} operators ({} errors)",
        groups,
        operators,
        errors.errors().size());
    return errors.finish(registry);
  }

  private boolean loadGroup(PrecedenceGroup group, ErrorCollector errors) {
    Optional<PrecedenceGroup> existing = registry.recordGroup(group);
    if (existing.isPresent()) {
      errors.logError(new OperatorPrecedenceException.GroupAlreadyExists(existing.get(), group));
      return false;
    }
    return true;
  }

  private boolean loadOperator(OperatorDefinition operator, ErrorCollector errors) {
    Optional<OperatorDefinition> existing = registry.recordOperator(operator);
    if (existing.isPresent()) {
      errors.logError(
          new OperatorPrecedenceException.OperatorAlreadyExists(existing.get(), operator));
      return false;
    }
    return true;
  }
}
