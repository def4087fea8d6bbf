package oprec;

import java.util.function.Consumer;

/**
 * A table of precedence groups and operators, and the folding operations driven by it.
 *
 * <p>Each operation comes in two shapes. The single-argument forms throw the first {@link
 * OperatorPrecedenceException} found. The forms taking a callback hand it every error, in the order
 * they were found, and always return a usable result.
 *
 * <p>{@link #addSourceFile} must not be called concurrently with anything else. Once loading is
 * done, folding may be called from any number of threads.
 */
public final class OperatorPrecedence {
  private final PrecedenceRegistry registry = new PrecedenceRegistry();
  private PrecedenceGraph graph = PrecedenceGraph.of(registry);

  public static OperatorPrecedence logicalOperators() {
    return builtIn(StandardOperators.logicalOperators());
  }

  public static OperatorPrecedence standardOperators() {
    return builtIn(StandardOperators.standardOperators());
  }

  private static OperatorPrecedence builtIn(Iterable<Declaration> declarations) {
    OperatorPrecedence precedence = new OperatorPrecedence();
    try {
      precedence.addSourceFile(declarations);
    } catch (OperatorPrecedenceException ex) {
      throw new AssertionError(ex);
    }
    return precedence;
  }

  public PrecedenceRegistry registry() {
    return registry;
  }

  public PrecedenceGraph graph() {
    return graph;
  }

  /**
   * Records every declaration, then throws the first error if any were found. Declarations other
   * than the offending ones are recorded either way.
   */
  public void addSourceFile(Iterable<Declaration> declarations)
      throws OperatorPrecedenceException {
    load(declarations).getOrThrow();
  }

  public void addSourceFile(
      Iterable<Declaration> declarations, Consumer<? super OperatorPrecedenceException> onError) {
    load(declarations).report(onError);
  }

  private Outcome<PrecedenceRegistry> load(Iterable<Declaration> declarations) {
    Outcome<PrecedenceRegistry> outcome = new DeclarationLoader(registry).load(declarations);
    graph = PrecedenceGraph.of(registry);
    return outcome;
  }

  public Expression foldSingle(Expression.Sequence sequence) throws OperatorPrecedenceException {
    return folder().foldSingle(sequence).getOrThrow();
  }

  public Expression foldSingle(
      Expression.Sequence sequence, Consumer<? super OperatorPrecedenceException> onError) {
    return folder().foldSingle(sequence).report(onError);
  }

  public Expression foldAll(Expression root) throws OperatorPrecedenceException {
    return folder().foldAll(root).getOrThrow();
  }

  public Expression foldAll(
      Expression root, Consumer<? super OperatorPrecedenceException> onError) {
    return folder().foldAll(root).report(onError);
  }

  private SequenceFolder folder() {
    return new SequenceFolder(graph);
  }
}
