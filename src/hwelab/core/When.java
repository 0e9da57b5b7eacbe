package hwelab.core;

import java.util.List;
import java.util.function.Supplier;

/**
 * Entry point of conditional regions:
 * <pre>
 * When.when(() -> a, () -> { ... })
 *     .elsewhen(() -> b, () -> { ... })
 *     .otherwise(() -> { ... });
 * </pre>
 * Exactly one clause of a chain is active for each valuation of its predicates.
 */
public class When {

  /**
   * Emits the initial clause of a chain.
   * @param cond thunk producing the Bool predicate; evaluated once, before the block
   * @param block the host code whose connects are guarded
   * @return the context for appending elsewhen / otherwise clauses
   */
  public static WhenContext when(Supplier<Element> cond, Runnable block) { return WhenContext.emit(List.of(), cond, block); }

  /** Convenience overload for an already built predicate. */
  public static WhenContext when(Element cond, Runnable block) { return when(() -> cond, block); }
}
