package hwelab.core;

import hwelab.elab.Builder;
import hwelab.elab.ElaborationException;
import hwelab.elab.ErrorKind;
import hwelab.ir.Port;
import java.util.Optional;

/**
 * Lifecycle state of a node: unbound, or bound to the hardware graph of one elaboration.
 * A node may be bound exactly once.
 */
public final class Binding {
  public enum Kind { UNBOUND, PORT, WIRE, REGISTER, LITERAL, OP }

  public static final Binding UNBOUND = new Binding(Kind.UNBOUND, null, null);
  public static final Binding LITERAL = new Binding(Kind.LITERAL, null, null);

  private final Kind kind;
  /** The elaboration the node belongs to; null for unbound nodes and literals */
  private final Builder owner;
  /** Only set for PORT */
  private final Port.Direction direction;

  private Binding(Kind kind, Builder owner, Port.Direction direction) {
    this.kind = kind;
    this.owner = owner;
    this.direction = direction;
  }

  public static Binding port(Builder owner, Port.Direction direction) { return new Binding(Kind.PORT, owner, direction); }
  public static Binding wire(Builder owner) { return new Binding(Kind.WIRE, owner, null); }
  public static Binding register(Builder owner) { return new Binding(Kind.REGISTER, owner, null); }
  public static Binding op(Builder owner) { return new Binding(Kind.OP, owner, null); }

  public Kind getKind() { return kind; }
  public boolean isBound() { return kind != Kind.UNBOUND; }
  public Optional<Builder> getOwner() { return Optional.ofNullable(owner); }
  public Optional<Port.Direction> getDirection() { return Optional.ofNullable(direction); }

  /**
   * Binds a node (and all leaves of an aggregate) to the target state.
   * Assigns a reference id from the owning builder.
   * @param data the node to bind
   * @param target the new binding, must not be UNBOUND
   * @throws ElaborationException with {@link ErrorKind#AlreadyBound} if the node or any of its leaves is bound already
   */
  public static void bind(Data data, Binding target) {
    if (!target.isBound())
      throw new IllegalArgumentException("Cannot bind to UNBOUND");
    if (data.getBinding().isBound())
      throw new ElaborationException(ErrorKind.AlreadyBound,
                                     String.format("%s is already bound as %s, cannot bind as %s", data, data.getBinding(), target));
    for (Element leaf : data.flatten()) {
      if (leaf.getBinding().isBound())
        throw new ElaborationException(ErrorKind.AlreadyBound,
                                       String.format("%s (in %s) is already bound as %s", leaf, data, leaf.getBinding()));
    }
    data.setBinding(target);
  }

  /**
   * Checks that a node may be used as an operand in the active elaboration.
   * @param data the operand
   * @param what description of the operand for the error message, e.g. "'cond'"
   * @throws ElaborationException with {@link ErrorKind#NotSynthesizable}
   */
  public static void checkSynthesizable(Data data, String what) {
    Builder active = Builder.currentOpt().orElse(null);
    for (Element leaf : data.flatten()) {
      Binding binding = leaf.getBinding();
      if (!binding.isBound())
        throw new ElaborationException(ErrorKind.NotSynthesizable,
                                       String.format("%s (%s) must be hardware: bind it as a port, wire or register first", what, leaf));
      if (binding.owner != null && binding.owner != active) {
        throw new ElaborationException(
            ErrorKind.NotSynthesizable,
            String.format("%s (%s) belongs to %selaboration '%s', not to the active one", what, leaf,
                          binding.owner.isFinished() ? "finalized " : "", binding.owner.getName()));
      }
    }
  }

  @Override
  public String toString() {
    if (kind == Kind.PORT)
      return "PORT(" + direction + ")";
    return kind.toString();
  }
}
