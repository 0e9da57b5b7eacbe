package hwelab.ui;

import hwelab.core.BitsOps;
import hwelab.core.Element;
import hwelab.core.Elements;
import hwelab.elab.Builder;

/** Reports an invalid bit range during elaboration. */
public class BrokenGenerator implements CircuitGenerator {
  @Override
  public String name() {
    return "broken";
  }

  @Override
  public void build(Builder builder) {
    Element a = builder.input("a", Elements.uint(4));
    builder.connect(builder.output("out", Elements.uint(1)), BitsOps.extract(a, 0, 3));
  }
}
