package hwelab.passes;

import hwelab.core.Element;
import hwelab.ir.Command;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Guarded region tree rebuilt from a flat command stream.
 * The root region is always active; every WhenBegin/ElseBegin opens a child region closed by its BlockEnd.
 */
public class RegionTree {

  public static final class Region {
    private final Command.RegionBegin begin;
    private final Region parent;
    private final List<Region> children = new ArrayList<>();
    /** Non-structural commands directly inside this region */
    private final List<Command> commands = new ArrayList<>();

    private Region(Command.RegionBegin begin, Region parent) {
      this.begin = begin;
      this.parent = parent;
    }

    /** The opening command, null for the root. */
    public Command.RegionBegin getBegin() { return begin; }
    /** The enclosing region, null for the root. */
    public Region getParent() { return parent; }
    public List<Region> getChildren() { return Collections.unmodifiableList(children); }
    public List<Command> getCommands() { return Collections.unmodifiableList(commands); }
    public boolean isRoot() { return parent == null; }

    /** Number of enclosing regions below the root. */
    public int getNesting() {
      int ret = 0;
      for (Region cur = this; !cur.isRoot(); cur = cur.parent)
        ++ret;
      return ret;
    }

    /**
     * Checks whether this region and all enclosing regions are active.
     * @param isHigh returns the value of a predicate node
     */
    public boolean isActive(Predicate<Element> isHigh) {
      for (Region cur = this; !cur.isRoot(); cur = cur.parent) {
        if (isHigh.test(cur.begin.getPredicate()) != cur.begin.activeWhen())
          return false;
      }
      return true;
    }

    @Override
    public String toString() {
      return isRoot() ? "root" : begin.toString();
    }
  }

  private final Region root = new Region(null, null);
  private final Map<Command, Region> regionOf = new IdentityHashMap<>();

  private RegionTree() {}

  /**
   * Rebuilds the tree.
   * @param commands the command stream in emission order
   * @return the region tree
   * @throws IllegalArgumentException if the stream has unbalanced region commands
   */
  public static RegionTree build(List<Command> commands) {
    RegionTree tree = new RegionTree();
    Region cur = tree.root;
    for (int i = 0; i < commands.size(); ++i) {
      Command command = commands.get(i);
      tree.regionOf.put(command, cur);
      if (command instanceof Command.RegionBegin) {
        Region child = new Region((Command.RegionBegin)command, cur);
        cur.children.add(child);
        cur = child;
      } else if (command instanceof Command.BlockEnd) {
        if (cur.isRoot())
          throw new IllegalArgumentException("BlockEnd without an open region at command " + i);
        cur = cur.parent;
      } else {
        cur.commands.add(command);
      }
    }
    if (!cur.isRoot())
      throw new IllegalArgumentException(String.format("%d region(s) left open at the end of the stream", cur.getNesting()));
    return tree;
  }

  public Region getRoot() { return root; }

  /**
   * Returns the region a command was emitted in.
   * Region-opening commands and BlockEnds belong to the region around them.
   * @throws IllegalArgumentException if the command is not part of the stream
   */
  public Region regionOf(Command command) {
    Region ret = regionOf.get(command);
    if (ret == null)
      throw new IllegalArgumentException("Command not part of this stream: " + command);
    return ret;
  }

  /** Checks whether a command applies under the given predicate values. */
  public boolean isActive(Command command, Predicate<Element> isHigh) { return regionOf(command).isActive(isHigh); }

  /** All regions in pre-order, starting with the root. */
  public List<Region> getRegions() {
    List<Region> ret = new ArrayList<>();
    collect(root, ret);
    return ret;
  }

  private static void collect(Region region, List<Region> out) {
    out.add(region);
    for (Region child : region.children)
      collect(child, out);
  }
}
