package hwelab.passes;

import hwelab.core.Binding;
import hwelab.core.Data;
import hwelab.core.Element;
import hwelab.core.ElementKind;
import hwelab.ir.Arg;
import hwelab.ir.Circuit;
import hwelab.ir.Command;
import hwelab.ir.Port;
import hwelab.ir.PrimOp;
import hwelab.ir.Width;
import hwelab.util.BitMath;
import java.math.BigInteger;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Combinational evaluation of a finished circuit.
 * <p>
 * Each command is settled once, in emission order. Connects apply only if their region is active, with later connects
 * overriding earlier ones. Inputs and the current register values are supplied by the caller; connects to registers
 * only record the next value. Unconnected wires and registers without supplied state read their reset value or zero.
 * <p>
 * UInt and Bool values are non-negative, SInt values are signed; every result is truncated to its known width.
 */
public class Evaluator {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final Circuit circuit;
  private final RegionTree regions;
  private final Map<String, BigInteger> inputs = new HashMap<>();
  private final Map<String, BigInteger> registerState = new HashMap<>();

  private final Map<Element, BigInteger> values = new IdentityHashMap<>();
  private final Map<Element, BigInteger> nextRegisterValues = new IdentityHashMap<>();
  private final Map<String, Element> byName = new HashMap<>();
  private boolean evaluated = false;

  public Evaluator(Circuit circuit) {
    this.circuit = circuit;
    this.regions = RegionTree.build(circuit.getCommands());
  }

  /** Sets an input port leaf by reference name. */
  public Evaluator poke(String name, BigInteger value) {
    inputs.put(name, value);
    evaluated = false;
    return this;
  }
  public Evaluator poke(String name, long value) { return poke(name, BigInteger.valueOf(value)); }

  /** Sets the current value of a register leaf by reference name. */
  public Evaluator setRegister(String name, BigInteger value) {
    registerState.put(name, value);
    evaluated = false;
    return this;
  }
  public Evaluator setRegister(String name, long value) { return setRegister(name, BigInteger.valueOf(value)); }

  /**
   * Settles all commands.
   * @throws IllegalArgumentException if an input leaf has no value
   * @throws IllegalStateException if a value cannot be represented, e.g. a negative value of unknown width
   */
  public Evaluator evaluate() {
    values.clear();
    nextRegisterValues.clear();
    byName.clear();
    for (Port port : circuit.getPorts()) {
      for (Element leaf : port.getData().flatten()) {
        byName.put(leaf.getRefName(), leaf);
        if (port.getDirection() == Port.Direction.INPUT) {
          BigInteger value = inputs.get(leaf.getRefName());
          if (value == null)
            throw new IllegalArgumentException("No value for input " + leaf.getRefName());
          values.put(leaf, normalize(leaf, value));
        } else {
          values.put(leaf, BigInteger.ZERO);
        }
      }
    }
    for (Command command : circuit.getCommands())
      settle(command);
    evaluated = true;
    logger.debug("Evaluated {} with inputs {}", circuit.getName(), inputs);
    return this;
  }

  private void settle(Command command) {
    if (command instanceof Command.DefPrim) {
      Command.DefPrim prim = (Command.DefPrim)command;
      if (prim.getOp() == PrimOp.MUX)
        settleMux(prim);
      else {
        Element result = (Element)prim.getResult();
        values.put(result, normalize(result, compute(prim)));
      }
    } else if (command instanceof Command.DefWire) {
      for (Element leaf : ((Command.DefWire)command).getNode().flatten()) {
        byName.put(leaf.getRefName(), leaf);
        values.put(leaf, BigInteger.ZERO);
      }
    } else if (command instanceof Command.DefReg) {
      Command.DefReg reg = (Command.DefReg)command;
      List<Element> leaves = reg.getNode().flatten();
      List<Element> initLeaves = reg.getInit().map(Data::flatten).orElse(null);
      for (int i = 0; i < leaves.size(); ++i) {
        Element leaf = leaves.get(i);
        byName.put(leaf.getRefName(), leaf);
        BigInteger value = registerState.get(leaf.getRefName());
        if (value == null)
          value = initLeaves != null ? valueOf(initLeaves.get(i)) : BigInteger.ZERO;
        values.put(leaf, normalize(leaf, value));
      }
    } else if (command instanceof Command.Connect) {
      Command.Connect connect = (Command.Connect)command;
      if (!regions.isActive(command, pred -> valueOf(pred).signum() != 0))
        return;
      Element sink = connect.getSink();
      BigInteger value = normalize(sink, valueOf(connect.getSource()));
      if (sink.getBinding().getKind() == Binding.Kind.REGISTER)
        nextRegisterValues.put(sink, value);
      else
        values.put(sink, value);
    }
  }

  private void settleMux(Command.DefPrim prim) {
    boolean sel = valueOf((Element)prim.getRefArg(0)).signum() != 0;
    List<Element> chosen = prim.getRefArg(sel ? 1 : 2).flatten();
    List<Element> results = prim.getResult().flatten();
    for (int i = 0; i < results.size(); ++i)
      values.put(results.get(i), normalize(results.get(i), valueOf(chosen.get(i))));
  }

  private BigInteger compute(Command.DefPrim prim) {
    PrimOp op = prim.getOp();
    List<Arg> args = prim.getArgs();
    Element a = (Element)prim.getRefArg(0);
    BigInteger va = valueOf(a);
    Element b = args.size() > 1 && args.get(1) instanceof Arg.Ref ? (Element)prim.getRefArg(1) : null;
    BigInteger vb = b != null ? valueOf(b) : null;
    switch (op) {
    case ADD:
      return va.add(vb);
    case SUB:
      return va.subtract(vb);
    case MUL:
      return va.multiply(vb);
    case DIV:
      return vb.signum() == 0 ? BigInteger.ZERO : va.divide(vb);
    case REM:
      return vb.signum() == 0 ? BigInteger.ZERO : va.remainder(vb);
    case LT:
      return bool(va.compareTo(vb) < 0);
    case LEQ:
      return bool(va.compareTo(vb) <= 0);
    case GT:
      return bool(va.compareTo(vb) > 0);
    case GEQ:
      return bool(va.compareTo(vb) >= 0);
    case EQ:
      return bool(va.equals(vb));
    case NEQ:
      return bool(!va.equals(vb));
    case PAD:
    case CVT:
      return va;
    case AS_UINT:
    case AS_SINT:
      return bitsOf(a, va);
    case SHL:
      return va.shiftLeft(prim.getILitArg(1));
    case SHR:
      return va.shiftRight(prim.getILitArg(1));
    case DSHL:
      return va.shiftLeft(vb.intValueExact());
    case DSHR:
      return va.shiftRight(vb.intValueExact());
    case NOT:
      return va.not();
    case AND:
      return va.and(vb);
    case OR:
      return va.or(vb);
    case XOR:
      return va.xor(vb);
    case AND_REDUCE:
      return bool(bitsOf(a, va).equals(BitMath.mask(knownWidth(a))));
    case OR_REDUCE:
      return bool(va.signum() != 0);
    case XOR_REDUCE:
      return bool(bitsOf(a, va).bitCount() % 2 == 1);
    case CAT:
      return bitsOf(a, va).shiftLeft(knownWidth(b)).or(bitsOf(b, vb));
    case BITS:
      return BitMath.extract(va, prim.getILitArg(1), prim.getILitArg(2));
    case HEAD:
      return bitsOf(a, va).shiftRight(knownWidth(a) - prim.getILitArg(1));
    case TAIL:
      return va;
    default:
      throw new IllegalStateException("Unhandled primitive " + op);
    }
  }

  private static BigInteger bool(boolean value) { return value ? BigInteger.ONE : BigInteger.ZERO; }

  private static int knownWidth(Element e) {
    if (!e.getWidth().isKnown())
      throw new IllegalStateException("Evaluation requires a known width for " + e);
    return e.getWidth().get();
  }

  /** The raw two's complement bits of a value of e. */
  private static BigInteger bitsOf(Element e, BigInteger value) {
    if (value.signum() >= 0 && e.getKind() != ElementKind.SINT)
      return value;
    return BitMath.toUnsigned(value, knownWidth(e));
  }

  /** Truncates a value to the width and representation of e. */
  private static BigInteger normalize(Element e, BigInteger value) {
    Width w = e.getWidth();
    if (!w.isKnown()) {
      if (e.getKind() != ElementKind.SINT && value.signum() < 0)
        throw new IllegalStateException("Negative value " + value + " for " + e + " of unknown width");
      return value;
    }
    return e.getKind() == ElementKind.SINT ? BitMath.toSigned(value, w.get()) : BitMath.toUnsigned(value, w.get());
  }

  /** The settled value of a leaf; literals evaluate to their payload. */
  public BigInteger valueOf(Element e) {
    if (e.isLit())
      return e.getLitValue();
    BigInteger ret = values.get(e);
    if (ret == null)
      throw new IllegalStateException(e + " is read before its definition");
    return ret;
  }

  /** The settled value of a named leaf (port, wire or register). */
  public BigInteger peek(String name) {
    if (!evaluated)
      evaluate();
    Element e = byName.get(name);
    if (e == null)
      throw new IllegalArgumentException("No signal named " + name);
    return valueOf(e);
  }

  /** The value connected to a register leaf in this evaluation, if any connect to it was active. */
  public Optional<BigInteger> peekNext(String registerName) {
    if (!evaluated)
      evaluate();
    Element e = byName.get(registerName);
    if (e == null)
      throw new IllegalArgumentException("No signal named " + registerName);
    return Optional.ofNullable(nextRegisterValues.get(e));
  }
}
