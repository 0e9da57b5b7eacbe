package hwelab.ir;

import hwelab.core.Data;
import hwelab.core.Element;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * One entry of the IR command stream.
 * Conditional regions use WhenBegin/ElseBegin, each closed by exactly one BlockEnd.
 */
public abstract class Command {
  private Command() {}

  /** Short kind name used for serialization. */
  public abstract String getKindName();

  /** Combinational primitive operation defining a new node. */
  public static final class DefPrim extends Command {
    private final Data result;
    private final PrimOp op;
    private final List<Arg> args;

    public DefPrim(Data result, PrimOp op, List<Arg> args) {
      this.result = result;
      this.op = op;
      this.args = List.copyOf(args);
    }

    public Data getResult() { return result; }
    public PrimOp getOp() { return op; }
    public List<Arg> getArgs() { return args; }
    /** Returns the node referenced by argument i; throws if it is an integer constant. */
    public Data getRefArg(int i) { return ((Arg.Ref)args.get(i)).getData(); }
    /** Returns the integer constant at argument i; throws if it is a reference. */
    public int getILitArg(int i) { return ((Arg.ILit)args.get(i)).getValue(); }

    @Override
    public String getKindName() {
      return "prim";
    }
    @Override
    public String toString() {
      return String.format("node %s = %s(%s) : %s", result.getRefName(), op.serialName,
                           args.stream().map(Arg::toString).collect(Collectors.joining(", ")), result.typeString());
    }
  }

  public static final class DefWire extends Command {
    private final Data node;
    public DefWire(Data node) { this.node = node; }
    public Data getNode() { return node; }
    @Override
    public String getKindName() {
      return "wire";
    }
    @Override
    public String toString() {
      return String.format("wire %s : %s", node.getRefName(), node.typeString());
    }
  }

  public static final class DefReg extends Command {
    private final Data node;
    private final Data init;
    public DefReg(Data node, Data init) {
      this.node = node;
      this.init = init;
    }
    public Data getNode() { return node; }
    /** The reset value, if any. */
    public Optional<Data> getInit() { return Optional.ofNullable(init); }
    @Override
    public String getKindName() {
      return "reg";
    }
    @Override
    public String toString() {
      return String.format("reg %s : %s%s", node.getRefName(), node.typeString(),
                           init == null ? "" : " with reset " + init.getRefName());
    }
  }

  /** Assignment of a leaf source to a leaf sink. */
  public static final class Connect extends Command {
    private final Element sink;
    private final Element source;
    public Connect(Element sink, Element source) {
      this.sink = sink;
      this.source = source;
    }
    public Element getSink() { return sink; }
    public Element getSource() { return source; }
    @Override
    public String getKindName() {
      return "connect";
    }
    @Override
    public String toString() {
      return String.format("%s <= %s", sink.getRefName(), source.getRefName());
    }
  }

  /** Base of the two region-opening commands. */
  public abstract static class RegionBegin extends Command {
    private final Element predicate;
    private final int depth;
    RegionBegin(Element predicate, int depth) {
      this.predicate = predicate;
      this.depth = depth;
    }
    /** The Bool node the region is guarded on. */
    public Element getPredicate() { return predicate; }
    /** Position of the emitting clause within its when chain (0 for the first when). */
    public int getDepth() { return depth; }
    /** The predicate value for which the region is active. */
    public abstract boolean activeWhen();
  }

  /** Opens a region that is active iff the predicate is 1. */
  public static final class WhenBegin extends RegionBegin {
    public WhenBegin(Element predicate, int depth) { super(predicate, depth); }
    @Override
    public boolean activeWhen() {
      return true;
    }
    @Override
    public String getKindName() {
      return "when";
    }
    @Override
    public String toString() {
      return String.format("when %s : @[depth %d]", getPredicate().getRefName(), getDepth());
    }
  }

  /** Opens a region that is active iff the predicate (of an earlier sibling clause) is 0. */
  public static final class ElseBegin extends RegionBegin {
    public ElseBegin(Element predicate, int depth) { super(predicate, depth); }
    @Override
    public boolean activeWhen() {
      return false;
    }
    @Override
    public String getKindName() {
      return "else";
    }
    @Override
    public String toString() {
      return String.format("else not %s : @[depth %d]", getPredicate().getRefName(), getDepth());
    }
  }

  /** Closes the innermost open region. */
  public static final class BlockEnd extends Command {
    private final int depth;
    public BlockEnd(int depth) { this.depth = depth; }
    public int getDepth() { return depth; }
    @Override
    public String getKindName() {
      return "end";
    }
    @Override
    public String toString() {
      return "end";
    }
  }
}
