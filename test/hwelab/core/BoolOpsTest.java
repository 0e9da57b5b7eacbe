package hwelab.core;

import hwelab.elab.Builder;
import hwelab.elab.ElaborationException;
import hwelab.elab.ErrorKind;
import hwelab.ir.Circuit;
import hwelab.passes.Evaluator;
import java.math.BigInteger;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class BoolOpsTest {

  @Test
  void testTruthTables() {
    Circuit circuit = Builder.elaborate("logic", builder -> {
      Element a = builder.input("a", Elements.bool());
      Element b = builder.input("b", Elements.bool());
      builder.connect(builder.output("and", Elements.bool()), BoolOps.and(a, b));
      builder.connect(builder.output("or", Elements.bool()), BoolOps.or(a, b));
      builder.connect(builder.output("xor", Elements.bool()), BoolOps.xor(a, b));
      builder.connect(builder.output("nota", Elements.bool()), BoolOps.not(a));
      builder.connect(builder.output("land", Elements.bool()), BoolOps.logicalAnd(a, b));
      builder.connect(builder.output("lor", Elements.bool()), BoolOps.logicalOr(a, b));
    });
    Evaluator eval = new Evaluator(circuit);
    for (int a = 0; a < 2; ++a) {
      for (int b = 0; b < 2; ++b) {
        eval.poke("a", a).poke("b", b).evaluate();
        Assertions.assertEquals(BigInteger.valueOf(a & b), eval.peek("and"));
        Assertions.assertEquals(BigInteger.valueOf(a | b), eval.peek("or"));
        Assertions.assertEquals(BigInteger.valueOf(a ^ b), eval.peek("xor"));
        Assertions.assertEquals(BigInteger.valueOf(1 - a), eval.peek("nota"));
        Assertions.assertEquals(BigInteger.valueOf(a & b), eval.peek("land"));
        Assertions.assertEquals(BigInteger.valueOf(a | b), eval.peek("lor"));
      }
    }
  }

  @Test
  void testRejectsNonBool() {
    Builder.elaborate("nonbool", builder -> {
      Element a = builder.input("a", Elements.bool());
      Element u = builder.input("u", Elements.uint(1));
      Assertions.assertEquals(ErrorKind.TypeMismatch, Assertions.assertThrows(ElaborationException.class, () -> BoolOps.and(a, u)).getKind());
      Assertions.assertEquals(ErrorKind.TypeMismatch, Assertions.assertThrows(ElaborationException.class, () -> BoolOps.not(u)).getKind());
      Assertions.assertEquals(ElementKind.BOOL, BoolOps.or(a, Elements.boolLit(true)).getKind());
    });
  }
}
