package hwelab.elab;

import hwelab.core.Binding;
import hwelab.core.Data;
import hwelab.core.Element;
import hwelab.core.Record;
import hwelab.ir.Arg;
import hwelab.ir.Circuit;
import hwelab.ir.Command;
import hwelab.ir.Port;
import hwelab.ir.PrimOp;
import hwelab.ui.ElabConfig;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Context of one elaboration run: the append-only command stream, the declared ports and the collected errors.
 * At most one Builder is active per thread; it is acquired by {@link #begin(String, ElabConfig)} and released by {@link #finish()} or
 * {@link #abort()}.
 */
public class Builder {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private static final ThreadLocal<Builder> active = new ThreadLocal<>();

  private final String name;
  private final ElabConfig cfg;
  private final ArrayList<Command> commands = new ArrayList<>();
  private final ArrayList<Port> ports = new ArrayList<>();
  private final ArrayList<ElabError> errors = new ArrayList<>();
  private int nextId = 0;
  /** Number of region-opening commands without a matching BlockEnd yet */
  private int openBlocks = 0;
  private boolean finished = false;

  private Builder(String name, ElabConfig cfg) {
    this.name = name;
    this.cfg = cfg;
  }

  /** @see #begin(String, ElabConfig) */
  public static Builder begin(String name) { return begin(name, new ElabConfig()); }

  /**
   * Starts an elaboration on the current thread.
   * @param name the circuit name
   * @param cfg the options
   * @return the new active Builder
   * @throws IllegalStateException if another elaboration is active on this thread
   */
  public static Builder begin(String name, ElabConfig cfg) {
    Builder cur = active.get();
    if (cur != null)
      throw new IllegalStateException("Elaboration '" + cur.name + "' is still active on this thread, cannot begin '" + name + "'");
    Builder builder = new Builder(name, cfg);
    active.set(builder);
    logger.debug("Elaboration '{}' started with {}", name, cfg);
    return builder;
  }

  /** @see #elaborate(String, ElabConfig, Consumer) */
  public static Circuit elaborate(String name, Consumer<Builder> body) { return elaborate(name, new ElabConfig(), body); }

  /**
   * Runs body within a new elaboration and returns the finished circuit.
   * The elaboration is released even if body throws.
   * @param name the circuit name
   * @param cfg the options
   * @param body the circuit description
   * @return the finished circuit
   * @throws ElaborationException if the description is malformed
   */
  public static Circuit elaborate(String name, ElabConfig cfg, Consumer<Builder> body) {
    Builder builder = begin(name, cfg);
    try {
      body.accept(builder);
      return builder.finish();
    } catch (ElaborationException e) {
      throw builder.withCollected(e);
    } finally {
      if (!builder.finished)
        builder.abort();
    }
  }

  /**
   * Returns the active Builder of this thread.
   * @throws IllegalStateException if no elaboration is active
   */
  public static Builder current() {
    Builder cur = active.get();
    if (cur == null)
      throw new IllegalStateException("No active elaboration: hardware operations must run within Builder.elaborate");
    return cur;
  }

  public static Optional<Builder> currentOpt() { return Optional.ofNullable(active.get()); }

  /**
   * Reports a user-facing error to the active elaboration, or throws it if there is none.
   * @see #error(ErrorKind, String)
   */
  public static void report(ErrorKind kind, String message) {
    Builder cur = active.get();
    if (cur == null)
      throw new ElaborationException(kind, message);
    cur.error(kind, message);
  }

  /**
   * Finalizes the elaboration and releases it from this thread.
   * @return the immutable circuit
   * @throws ElaborationException listing all collected errors, if any
   */
  public Circuit finish() {
    checkActive();
    release();
    if (openBlocks != 0)
      throw new IllegalStateException(String.format("Elaboration '%s' finished with %d open blocks", name, openBlocks));
    if (!errors.isEmpty()) {
      logger.error("Elaboration '{}' failed with {} error(s)", name, errors.size());
      throw new ElaborationException(errors);
    }
    logger.debug("Elaboration '{}' finished: {} ports, {} commands", name, ports.size(), commands.size());
    return new Circuit(name, commands, ports);
  }

  /** Releases the elaboration without producing a circuit. Does nothing if already finished. */
  public void abort() {
    if (finished)
      return;
    release();
    logger.debug("Elaboration '{}' aborted", name);
  }

  /**
   * Prepends the errors collected so far to an aborting exception.
   * Returns e itself if it already lists all of them.
   */
  ElaborationException withCollected(ElaborationException e) {
    List<ElabError> merged = new ArrayList<>(errors);
    for (ElabError err : e.getErrors()) {
      if (!merged.contains(err))
        merged.add(err);
    }
    if (merged.size() == e.getErrors().size())
      return e;
    ElaborationException ret = new ElaborationException(merged);
    ret.addSuppressed(e);
    return ret;
  }

  private void release() {
    finished = true;
    if (active.get() == this)
      active.remove();
  }

  private void checkActive() {
    if (finished)
      throw new IllegalStateException("Elaboration '" + name + "' is already finished");
  }

  public String getName() { return name; }
  public ElabConfig getConfig() { return cfg; }
  public boolean isFinished() { return finished; }
  /** @return a read-only view of the errors collected so far */
  public List<ElabError> getErrors() { return Collections.unmodifiableList(errors); }
  /** @return a read-only view of the commands emitted so far */
  public List<Command> getCommands() { return Collections.unmodifiableList(commands); }

  /** Allocates a new reference id. */
  public int nextId() { return nextId++; }

  /**
   * Collects a user-facing validation error. Elaboration continues unless the configuration requests fail-fast
   * or max_errors is reached.
   * @param kind the error category
   * @param message a message identifying the offending values
   */
  public void error(ErrorKind kind, String message) {
    checkActive();
    ElabError err = new ElabError(kind, message);
    logger.error("{}: {}", kind, message);
    if (cfg.fail_fast)
      throw new ElaborationException(List.of(err));
    errors.add(err);
    if (errors.size() >= cfg.max_errors) {
      logger.error("Elaboration '{}' reached the error limit of {}", name, cfg.max_errors);
      throw new ElaborationException(errors);
    }
  }

  /**
   * Appends a command to the stream.
   * @param command the command
   * @throws IllegalStateException if the elaboration is finished or a BlockEnd has no open region
   */
  public void pushCommand(Command command) {
    checkActive();
    if (command instanceof Command.RegionBegin)
      ++openBlocks;
    else if (command instanceof Command.BlockEnd) {
      if (openBlocks == 0)
        throw new IllegalStateException("BlockEnd without an open region");
      --openBlocks;
    }
    commands.add(command);
    if (cfg.log_commands)
      logger.trace("{}: {}", name, command);
  }

  /**
   * Binds result as an operator result and emits its DefPrim.
   * Operands must have been checked by the caller.
   * @return result
   */
  public <T extends Data> T pushOp(T result, PrimOp op, Arg... args) {
    checkActive();
    Binding.bind(result, Binding.op(this));
    pushCommand(new Command.DefPrim(result, op, List.of(args)));
    return result;
  }

  /** Number of currently open regions. */
  public int getOpenBlocks() { return openBlocks; }

  public <T extends Data> T input(String name, T proto) { return port(name, Port.Direction.INPUT, proto); }
  public <T extends Data> T output(String name, T proto) { return port(name, Port.Direction.OUTPUT, proto); }

  /**
   * Declares a top-level port, binding proto itself.
   * @return proto, now bound as port
   */
  public <T extends Data> T port(String name, Port.Direction direction, T proto) {
    checkActive();
    Binding.bind(proto, Binding.port(this, direction));
    proto.suggestName(name);
    ports.add(new Port(name, direction, proto));
    return proto;
  }

  /** Declares an unnamed wire. */
  public <T extends Data> T wire(T proto) { return wire(null, proto); }

  /**
   * Declares a wire, binding proto itself.
   * @param name the wire name, or null
   * @return proto, now bound as wire
   */
  public <T extends Data> T wire(String name, T proto) {
    checkActive();
    Binding.bind(proto, Binding.wire(this));
    if (name != null)
      proto.suggestName(name);
    pushCommand(new Command.DefWire(proto));
    return proto;
  }

  /** Declares an unnamed register without reset value. */
  public <T extends Data> T reg(T proto) { return reg(null, proto); }

  /** Declares a register without reset value. */
  public <T extends Data> T reg(String name, T proto) {
    checkActive();
    Binding.bind(proto, Binding.register(this));
    if (name != null)
      proto.suggestName(name);
    pushCommand(new Command.DefReg(proto, null));
    return proto;
  }

  /**
   * Declares a register with reset value init.
   * @param name the register name, or null
   * @param proto the register type
   * @param init the reset value; must match the register's shape
   */
  public <T extends Data> T regInit(String name, T proto, Data init) {
    checkActive();
    Binding.checkSynthesizable(init, "'init'");
    checkShapes(proto, init, "register init");
    Binding.bind(proto, Binding.register(this));
    if (name != null)
      proto.suggestName(name);
    pushCommand(new Command.DefReg(proto, init));
    return proto;
  }

  /**
   * Assigns source to sink, leaf by leaf in construction order.
   * @throws ElaborationException with NotSynthesizable, NotAssignable, TypeMismatch or WidthMismatch
   */
  public void connect(Data sink, Data source) {
    checkActive();
    Binding.checkSynthesizable(sink, "'sink'");
    Binding.checkSynthesizable(source, "'source'");
    checkShapes(sink, source, "connect");
    List<Element> sinkLeaves = sink.flatten();
    List<Element> sourceLeaves = source.flatten();
    for (Element leaf : sinkLeaves) {
      Binding binding = leaf.getBinding();
      boolean assignable = binding.getKind() == Binding.Kind.WIRE || binding.getKind() == Binding.Kind.REGISTER ||
                           (binding.getKind() == Binding.Kind.PORT && binding.getDirection().get() == Port.Direction.OUTPUT);
      if (!assignable)
        throw new ElaborationException(ErrorKind.NotAssignable, String.format("Cannot assign to %s bound as %s", leaf, binding));
    }
    for (int i = 0; i < sinkLeaves.size(); ++i)
      pushCommand(new Command.Connect(sinkLeaves.get(i), sourceLeaves.get(i)));
  }

  /** Leaf-wise shape check shared by connect and register init. */
  private static void checkShapes(Data sink, Data source, String what) {
    if ((sink instanceof Record) != (source instanceof Record))
      throw new ElaborationException(ErrorKind.TypeMismatch,
                                     String.format("Cannot %s between %s and %s", what, sink.typeString(), source.typeString()));
    List<Element> sinkLeaves = sink.flatten();
    List<Element> sourceLeaves = source.flatten();
    if (sinkLeaves.size() != sourceLeaves.size())
      throw new ElaborationException(ErrorKind.WidthMismatch,
                                     String.format("Cannot %s between aggregates with %d and %d fields: %s, %s", what, sinkLeaves.size(),
                                                   sourceLeaves.size(), sink.typeString(), source.typeString()));
    for (int i = 0; i < sinkLeaves.size(); ++i) {
      Element a = sinkLeaves.get(i);
      Element b = sourceLeaves.get(i);
      if (a.getKind() != b.getKind())
        throw new ElaborationException(ErrorKind.TypeMismatch,
                                       String.format("Cannot %s between %s and %s", what, a.typeString(), b.typeString()));
      if (sink instanceof Record && !a.getWidth().equals(b.getWidth()))
        throw new ElaborationException(ErrorKind.WidthMismatch,
                                       String.format("Cannot %s between aggregates of different width: field %d is %s vs %s", what, i,
                                                     a.typeString(), b.typeString()));
    }
  }

  @Override
  public String toString() {
    return String.format("Builder(%s%s)", name, finished ? ", finished" : "");
  }
}
