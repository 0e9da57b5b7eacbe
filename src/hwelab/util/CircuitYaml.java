package hwelab.util;

import hwelab.core.Data;
import hwelab.ir.Arg;
import hwelab.ir.Circuit;
import hwelab.ir.Command;
import hwelab.ir.Port;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yaml.snakeyaml.Yaml;

/*
 * Writes a finished circuit as YAML for the netlist backend.
 * Layout: {circuit, ports: [{name, direction, type}], commands: [{kind, ...}]}.
 */
public class CircuitYaml {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /** Converts the circuit into plain maps and lists, in command order. */
  public static Map<String, Object> toMap(Circuit circuit) {
    LinkedHashMap<String, Object> ret = new LinkedHashMap<>();
    ret.put("circuit", circuit.getName());
    List<Object> ports = new ArrayList<>();
    for (Port port : circuit.getPorts()) {
      LinkedHashMap<String, Object> entry = new LinkedHashMap<>();
      entry.put("name", port.getName());
      entry.put("direction", port.getDirection().toString().toLowerCase(Locale.ROOT));
      entry.put("type", port.getData().typeString());
      ports.add(entry);
    }
    ret.put("ports", ports);
    ret.put("commands", circuit.getCommands().stream().map(CircuitYaml::commandToMap).collect(Collectors.toList()));
    return ret;
  }

  private static Map<String, Object> commandToMap(Command command) {
    LinkedHashMap<String, Object> ret = new LinkedHashMap<>();
    ret.put("kind", command.getKindName());
    if (command instanceof Command.DefPrim) {
      Command.DefPrim prim = (Command.DefPrim)command;
      ret.put("result", prim.getResult().getRefName());
      ret.put("type", prim.getResult().typeString());
      ret.put("op", prim.getOp().serialName);
      List<Object> args = new ArrayList<>();
      for (Arg arg : prim.getArgs()) {
        if (arg instanceof Arg.ILit)
          args.add(((Arg.ILit)arg).getValue());
        else
          args.add(((Arg.Ref)arg).getData().getRefName());
      }
      ret.put("args", args);
    } else if (command instanceof Command.DefWire) {
      putNode(ret, ((Command.DefWire)command).getNode());
    } else if (command instanceof Command.DefReg) {
      Command.DefReg reg = (Command.DefReg)command;
      putNode(ret, reg.getNode());
      reg.getInit().ifPresent(init -> ret.put("init", init.getRefName()));
    } else if (command instanceof Command.Connect) {
      Command.Connect connect = (Command.Connect)command;
      ret.put("sink", connect.getSink().getRefName());
      ret.put("source", connect.getSource().getRefName());
    } else if (command instanceof Command.RegionBegin) {
      Command.RegionBegin begin = (Command.RegionBegin)command;
      ret.put("pred", begin.getPredicate().getRefName());
      ret.put("depth", begin.getDepth());
    } else if (command instanceof Command.BlockEnd) {
      ret.put("depth", ((Command.BlockEnd)command).getDepth());
    }
    return ret;
  }

  private static void putNode(Map<String, Object> out, Data node) {
    out.put("name", node.getRefName());
    out.put("type", node.typeString());
  }

  public static String dump(Circuit circuit) { return new Yaml().dump(toMap(circuit)); }

  public static void dump(Circuit circuit, Writer writer) { new Yaml().dump(toMap(circuit), writer); }

  /**
   * Writes the circuit to a file, replacing it if present.
   * @throws IOException if the file cannot be written
   */
  public static void write(Circuit circuit, Path path) throws IOException {
    try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
      dump(circuit, writer);
    }
    logger.info("Wrote {} ({} commands) to {}", circuit.getName(), circuit.getCommands().size(), path);
  }
}
