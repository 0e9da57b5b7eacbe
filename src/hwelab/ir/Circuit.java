package hwelab.ir;

import java.util.List;
import java.util.stream.Stream;

/**
 * The finished result of one elaboration: the ordered command stream plus the declared ports.
 * Immutable.
 */
public class Circuit {
  private final String name;
  private final List<Command> commands;
  private final List<Port> ports;

  public Circuit(String name, List<Command> commands, List<Port> ports) {
    this.name = name;
    this.commands = List.copyOf(commands);
    this.ports = List.copyOf(ports);
  }

  public String getName() { return name; }
  /** @return the commands in emission order */
  public List<Command> getCommands() { return commands; }
  public List<Port> getPorts() { return ports; }

  /** Streams all commands of the given type, in order. */
  public <T extends Command> Stream<T> streamCommands(Class<T> type) {
    return commands.stream().filter(type::isInstance).map(type::cast);
  }

  /** Renders the circuit in a FIRRTL-like textual form, one command per line. */
  public String serialize() {
    StringBuilder ret = new StringBuilder();
    ret.append("circuit ").append(name).append(" :\n");
    for (Port port : ports)
      ret.append("  ").append(port).append("\n");
    int indent = 1;
    for (Command command : commands) {
      if (command instanceof Command.BlockEnd)
        --indent;
      ret.append("  ".repeat(Math.max(indent, 0))).append(command).append("\n");
      if (command instanceof Command.WhenBegin || command instanceof Command.ElseBegin)
        ++indent;
    }
    return ret.toString();
  }

  @Override
  public String toString() {
    return String.format("Circuit %s (%d ports, %d commands)", name, ports.size(), commands.size());
  }
}
