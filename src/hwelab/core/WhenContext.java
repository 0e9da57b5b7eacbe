package hwelab.core;

import hwelab.elab.Builder;
import hwelab.elab.ElaborationException;
import hwelab.elab.ErrorKind;
import hwelab.ir.Command;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Supplier;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * One emitted clause of a when / elsewhen / otherwise chain.
 * <p>
 * A clause at depth k first opens one else-region per earlier sibling predicate, so its contents only apply if all of them are 0.
 * The predicate thunk is evaluated inside those regions, then the guarded block is emitted between WhenBegin and BlockEnd.
 * Finally the k else-regions are closed again.
 */
public final class WhenContext {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /** Predicates of all emitted clauses of the chain, including this one. */
  private final List<Element> predicates;
  private final int depth;

  private WhenContext(List<Element> predicates, int depth) {
    this.predicates = predicates;
    this.depth = depth;
  }

  /**
   * Emits a clause.
   * @param priorPredicates the predicates of the earlier clauses of the chain
   * @param cond the predicate thunk, or null for an otherwise clause
   * @param block the guarded host code
   * @return the context of the emitted clause
   */
  static WhenContext emit(List<Element> priorPredicates, Supplier<Element> cond, Runnable block) {
    Builder builder = Builder.current();
    int depth = priorPredicates.size();
    // the chain may have been started in another elaboration
    for (Element prior : priorPredicates)
      Binding.checkSynthesizable(prior, "'cond'");
    for (Element prior : priorPredicates)
      builder.pushCommand(new Command.ElseBegin(prior, depth));
    List<Element> predicates = new ArrayList<>(priorPredicates);
    if (cond != null) {
      Element pred = cond.get();
      checkPredicate(pred);
      predicates.add(pred);
      logger.trace("when {} at depth {}", pred.getRefName(), depth);
      builder.pushCommand(new Command.WhenBegin(pred, depth));
      block.run();
      builder.pushCommand(new Command.BlockEnd(depth));
    } else {
      logger.trace("otherwise at depth {}", depth);
      block.run();
    }
    for (int i = 0; i < depth; ++i)
      builder.pushCommand(new Command.BlockEnd(depth));
    return new WhenContext(Collections.unmodifiableList(predicates), depth);
  }

  private static void checkPredicate(Element pred) {
    if (pred == null)
      throw new IllegalArgumentException("when condition returned null");
    if (pred.getKind() != ElementKind.BOOL)
      throw new ElaborationException(ErrorKind.TypeMismatch, "when condition must be a Bool, got " + pred.typeString());
    Binding.checkSynthesizable(pred, "'cond'");
  }

  /**
   * Appends a clause that applies if cond is 1 and all earlier predicates of the chain are 0.
   * @return the context of the new clause
   */
  public WhenContext elsewhen(Supplier<Element> cond, Runnable block) { return emit(predicates, cond, block); }

  /** Appends the final clause that applies if all earlier predicates of the chain are 0. */
  public void otherwise(Runnable block) { emit(predicates, null, block); }

  /** Position of this clause within its chain, 0 for the initial when. */
  public int getDepth() { return depth; }

  /** The predicates of this clause and all earlier clauses. */
  public List<Element> getPredicates() { return predicates; }
}
