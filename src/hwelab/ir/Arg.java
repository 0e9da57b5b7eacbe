package hwelab.ir;

import hwelab.core.Data;
import java.util.Objects;

/** Operand of a {@link Command.DefPrim}: either a reference to a node or an integer constant. */
public abstract class Arg {
  private Arg() {}

  /** Reference to a hardware node (including literals). */
  public static final class Ref extends Arg {
    private final Data data;
    public Ref(Data data) { this.data = Objects.requireNonNull(data); }
    public Data getData() { return data; }
    @Override
    public int hashCode() {
      return System.identityHashCode(data);
    }
    @Override
    public boolean equals(Object obj) {
      return obj instanceof Ref && ((Ref)obj).data == data;
    }
    @Override
    public String toString() {
      return data.getRefName();
    }
  }

  /** Integer constant parameter, e.g. a shift amount or a bit index. */
  public static final class ILit extends Arg {
    private final int value;
    public ILit(int value) { this.value = value; }
    public int getValue() { return value; }
    @Override
    public int hashCode() {
      return Integer.hashCode(value);
    }
    @Override
    public boolean equals(Object obj) {
      return obj instanceof ILit && ((ILit)obj).value == value;
    }
    @Override
    public String toString() {
      return Integer.toString(value);
    }
  }

  public static Ref ref(Data data) { return new Ref(data); }
  public static ILit ilit(int value) { return new ILit(value); }
}
