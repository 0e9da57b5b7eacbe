package hwelab.ir;

import hwelab.core.Data;

/** A top-level port of a circuit. */
public class Port {
  public enum Direction { INPUT, OUTPUT }

  private final String name;
  private final Direction direction;
  private final Data data;

  public Port(String name, Direction direction, Data data) {
    this.name = name;
    this.direction = direction;
    this.data = data;
  }

  public String getName() { return name; }
  public Direction getDirection() { return direction; }
  public Data getData() { return data; }

  @Override
  public String toString() {
    return String.format("%s %s : %s", direction == Direction.INPUT ? "input" : "output", name, data.typeString());
  }
}
