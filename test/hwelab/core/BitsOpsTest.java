package hwelab.core;

import hwelab.elab.Builder;
import hwelab.elab.ElaborationException;
import hwelab.elab.ErrorKind;
import hwelab.ir.Circuit;
import hwelab.ir.Command;
import hwelab.ir.PrimOp;
import hwelab.ir.Width;
import hwelab.passes.Evaluator;
import hwelab.ui.ElabConfig;
import hwelab.util.BitMath;
import java.math.BigInteger;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class BitsOpsTest {

  @Test
  void testLiteralExtractScenario() {
    Element sliced = BitsOps.extract(Elements.uintLit(7), 1, 0);
    Assertions.assertTrue(sliced.isLit());
    Assertions.assertEquals(BigInteger.valueOf(3), sliced.getLitValue());
    Assertions.assertEquals(Width.known(2), sliced.getWidth());
    Assertions.assertEquals(ElementKind.UINT, sliced.getKind());
    Element bit = BitsOps.bit(Elements.uintLit(5), 2);
    Assertions.assertEquals(ElementKind.BOOL, bit.getKind());
    Assertions.assertEquals(BigInteger.ONE, bit.getLitValue());
  }

  @RepeatedTest(64)
  void testLiteralExtract_random() {
    long seed = new Random().nextLong();
    try {
      testLiteralExtract(seed);
    } catch (Throwable t) {
      System.err.println("FAILED testLiteralExtract with seed " + seed);
      throw t;
    }
  }

  /** The folded result equals (x >> lo) & mask and the value the emitted command evaluates to. */
  @ParameterizedTest
  @ValueSource(longs = {0, 77, -3012399172231L})
  void testLiteralExtract(long seed) {
    var rand = new Random(seed);
    int w = 1 + rand.nextInt(80);
    BigInteger value = new BigInteger(w, rand);
    int hi = rand.nextInt(w);
    int lo = rand.nextInt(hi + 1);
    BigInteger expected = value.shiftRight(lo).and(BigInteger.ONE.shiftLeft(hi - lo + 1).subtract(BigInteger.ONE));

    Element folded = BitsOps.extract(Elements.uintLit(value, w), hi, lo);
    Assertions.assertEquals(expected, folded.getLitValue());

    ElabConfig cfg = new ElabConfig();
    cfg.literal_fold_extract = false;
    Circuit circuit = Builder.elaborate("extract", cfg, builder -> {
      Element out = builder.output("out", Elements.uint(hi - lo + 1));
      Element emitted = BitsOps.extract(Elements.uintLit(value, w), hi, lo);
      Assertions.assertFalse(emitted.isLit());
      builder.connect(out, emitted);
    });
    Assertions.assertEquals(1, circuit.streamCommands(Command.DefPrim.class).count());
    Assertions.assertEquals(expected, new Evaluator(circuit).peek("out"));
  }

  @Test
  void testInvalidRangeFallback() {
    ElaborationException e = Assertions.assertThrows(ElaborationException.class, () -> Builder.elaborate("ranges", builder -> {
      Element a = builder.input("a", Elements.uint(4));
      Element r = BitsOps.extract(a, 0, 2);
      Assertions.assertEquals(Width.known(1), r.getWidth());
      Assertions.assertEquals(BigInteger.ZERO, r.getLitValue());
      Assertions.assertTrue(BitsOps.extract(a, 2, -1).isLit());
      Assertions.assertTrue(BitsOps.head(a, 5).isLit());
      Assertions.assertTrue(BitsOps.tail(a, 5).isLit());
      Assertions.assertTrue(builder.getCommands().isEmpty());
    }));
    Assertions.assertEquals(4, e.getErrors().size());
    e.getErrors().forEach(err -> Assertions.assertEquals(ErrorKind.InvalidBitRange, err.getKind()));
  }

  @Test
  void testWidths() {
    Builder.elaborate("widths", builder -> {
      Element a = builder.input("a", Elements.uint(4));
      Element b = builder.input("b", Elements.uint(6));
      Element s = builder.input("s", Elements.uint(3));
      Element flag = builder.input("flag", Elements.bool());
      Element signed = builder.input("signed", Elements.sint(5));
      Element unknown = builder.wire(Elements.uint());

      Assertions.assertEquals(Width.known(7), BitsOps.shl(a, 3).getWidth());
      Assertions.assertEquals(Width.known(1), BitsOps.shr(a, 3).getWidth());
      Assertions.assertEquals(Width.known(0), BitsOps.shr(a, 9).getWidth());
      Assertions.assertEquals(Width.known(11), BitsOps.dshl(a, s).getWidth());
      Assertions.assertEquals(Width.known(4), BitsOps.dshr(a, s).getWidth());
      Assertions.assertEquals(Width.known(10), BitsOps.concat(a, b).getWidth());
      Assertions.assertEquals(Width.known(6), BitsOps.and(a, b).getWidth());
      Assertions.assertEquals(Width.known(6), BitsOps.xor(a, b).getWidth());
      Assertions.assertEquals(Width.known(4), BitsOps.not(a).getWidth());
      Assertions.assertEquals(Width.known(8), BitsOps.pad(a, 8).getWidth());
      Assertions.assertEquals(Width.known(4), BitsOps.pad(a, 2).getWidth());
      Assertions.assertEquals(Width.known(3), BitsOps.head(a, 3).getWidth());
      Assertions.assertEquals(Width.known(1), BitsOps.tail(a, 3).getWidth());
      Assertions.assertEquals(Width.unknown(), BitsOps.tail(unknown, 3).getWidth());
      Assertions.assertEquals(Width.unknown(), BitsOps.concat(a, unknown).getWidth());

      Assertions.assertEquals(ElementKind.BOOL, BitsOps.eq(a, b).getKind());
      Assertions.assertEquals(ElementKind.BOOL, BitsOps.andR(a).getKind());
      Assertions.assertEquals(ElementKind.UINT, BitsOps.shl(flag, 2).getKind());
      Assertions.assertEquals(ElementKind.BOOL, BitsOps.and(flag, flag).getKind());
      Assertions.assertEquals(ElementKind.SINT, BitsOps.and(signed, signed).getKind());
      Assertions.assertEquals(ElementKind.SINT, BitsOps.shr(signed, 1).getKind());
      Assertions.assertEquals(ElementKind.UINT, BitsOps.concat(signed, signed).getKind());
    });
  }

  @Test
  void testFailFastErrors() {
    Builder.elaborate("errors", builder -> {
      Element a = builder.input("a", Elements.uint(4));
      Element flag = builder.input("flag", Elements.bool());
      Element signed = builder.input("signed", Elements.sint(4));

      ElaborationException e = Assertions.assertThrows(ElaborationException.class, () -> BitsOps.shl(a, -1));
      Assertions.assertEquals(ErrorKind.NegativeIndex, e.getKind());
      e = Assertions.assertThrows(ElaborationException.class, () -> BitsOps.shr(a, -2));
      Assertions.assertEquals(ErrorKind.NegativeIndex, e.getKind());
      e = Assertions.assertThrows(ElaborationException.class, () -> BitsOps.and(a, flag));
      Assertions.assertEquals(ErrorKind.TypeMismatch, e.getKind());
      Assertions.assertTrue(e.getMessage().contains("UInt<4>") && e.getMessage().contains("Bool"), e.getMessage());
      e = Assertions.assertThrows(ElaborationException.class, () -> BitsOps.eq(a, signed));
      Assertions.assertEquals(ErrorKind.TypeMismatch, e.getKind());
      e = Assertions.assertThrows(ElaborationException.class, () -> BitsOps.dshl(a, signed));
      Assertions.assertEquals(ErrorKind.TypeMismatch, e.getKind());
      Element wideAmount = builder.input("wideAmount", Elements.uint(32));
      e = Assertions.assertThrows(ElaborationException.class, () -> BitsOps.dshl(a, wideAmount));
      Assertions.assertEquals(ErrorKind.WidthMismatch, e.getKind());
      e = Assertions.assertThrows(ElaborationException.class, () -> BitsOps.asBool(a));
      Assertions.assertEquals(ErrorKind.WidthMismatch, e.getKind());
      Assertions.assertTrue(builder.getErrors().isEmpty());
    });
  }

  @Test
  void testCasts() {
    Builder.elaborate("casts", builder -> {
      Element a = builder.input("a", Elements.uint(4));
      Element one = builder.input("one", Elements.uint(1));
      Element flag = builder.input("flag", Elements.bool());
      Assertions.assertSame(a, BitsOps.asUInt(a));
      Assertions.assertSame(flag, BitsOps.asBool(flag));
      Element s = BitsOps.asSInt(a);
      Assertions.assertEquals(ElementKind.SINT, s.getKind());
      Assertions.assertEquals(Width.known(4), s.getWidth());
      Assertions.assertSame(s, BitsOps.asSInt(s));
      Assertions.assertEquals(ElementKind.BOOL, BitsOps.asBool(one).getKind());
      Assertions.assertEquals(Width.known(1), BitsOps.asUInt(flag).getWidth());
    });
  }

  @RepeatedTest(32)
  void testSignedRoundTrip_random() {
    long seed = new Random().nextLong();
    try {
      testSignedRoundTrip(seed);
    } catch (Throwable t) {
      System.err.println("FAILED testSignedRoundTrip with seed " + seed);
      throw t;
    }
  }

  @ParameterizedTest
  @ValueSource(longs = {3, 1009, -88})
  void testSignedRoundTrip(long seed) {
    var rand = new Random(seed);
    int w = 1 + rand.nextInt(40);
    BigInteger value = new BigInteger(w, rand);
    Circuit circuit = Builder.elaborate("roundtrip", builder -> {
      Element a = builder.input("a", Elements.uint(w));
      Element out = builder.output("out", Elements.uint(w));
      Element signedOut = builder.output("signedOut", Elements.sint(w));
      Element s = BitsOps.asSInt(a);
      builder.connect(out, BitsOps.asUInt(s));
      builder.connect(signedOut, s);
    });
    Evaluator eval = new Evaluator(circuit).poke("a", value).evaluate();
    Assertions.assertEquals(value, eval.peek("out"));
    Assertions.assertEquals(BitMath.toSigned(value, w), eval.peek("signedOut"));
  }

  @Test
  void testEvaluatedBitOps() {
    Circuit circuit = Builder.elaborate("bitops", builder -> {
      Element x = builder.input("x", Elements.uint(4));
      Element off = builder.input("off", Elements.uint(2));
      Element dat = builder.input("dat", Elements.bool());
      builder.connect(builder.output("set", Elements.uint(4)), BitsOps.bitSet(x, off, dat));
      builder.connect(builder.output("cat", Elements.uint(6)), BitsOps.concat(x, off));
      builder.connect(builder.output("dyn", Elements.bool()), BitsOps.bit(x, off));
      builder.connect(builder.output("hd", Elements.uint(2)), BitsOps.head(x, 2));
      builder.connect(builder.output("xr", Elements.bool()), BitsOps.xorR(x));
      builder.connect(builder.output("ar", Elements.bool()), BitsOps.andR(x));
      builder.connect(builder.output("inv", Elements.uint(4)), BitsOps.not(x));
    });
    Evaluator eval = new Evaluator(circuit).poke("x", 0b1010).poke("off", 0).poke("dat", 1).evaluate();
    Assertions.assertEquals(BigInteger.valueOf(0b1011), eval.peek("set"));
    Assertions.assertEquals(BigInteger.valueOf(0b101000), eval.peek("cat"));
    Assertions.assertEquals(BigInteger.ZERO, eval.peek("dyn"));
    Assertions.assertEquals(BigInteger.valueOf(0b10), eval.peek("hd"));
    Assertions.assertEquals(BigInteger.ZERO, eval.peek("xr"));
    Assertions.assertEquals(BigInteger.ZERO, eval.peek("ar"));
    Assertions.assertEquals(BigInteger.valueOf(0b0101), eval.peek("inv"));

    eval.poke("off", 1).poke("dat", 0).evaluate();
    Assertions.assertEquals(BigInteger.valueOf(0b1000), eval.peek("set"));
    Assertions.assertEquals(BigInteger.ONE, eval.peek("dyn"));
    eval.poke("x", 0b1110).poke("off", 3).evaluate();
    Assertions.assertEquals(BigInteger.ONE, eval.peek("xr"));
    eval.poke("x", 0b1111).evaluate();
    Assertions.assertEquals(BigInteger.ONE, eval.peek("ar"));
  }

  @Test
  void testToBools() {
    Circuit circuit = Builder.elaborate("bools", builder -> {
      Element x = builder.input("x", Elements.uint(3));
      List<Element> bits = BitsOps.toBools(x);
      Assertions.assertEquals(3, bits.size());
      for (int i = 0; i < bits.size(); ++i) {
        Assertions.assertEquals(ElementKind.BOOL, bits.get(i).getKind());
        builder.connect(builder.output("b" + i, Elements.bool()), bits.get(i));
      }
      Element unknown = builder.wire(Elements.uint());
      Assertions.assertThrows(ElaborationException.class, () -> BitsOps.toBools(unknown));
    });
    Assertions.assertTrue(circuit.streamCommands(Command.DefPrim.class).allMatch(prim -> prim.getOp() == PrimOp.BITS));
    Evaluator eval = new Evaluator(circuit).poke("x", 0b110).evaluate();
    Assertions.assertEquals(BigInteger.ZERO, eval.peek("b0"));
    Assertions.assertEquals(BigInteger.ONE, eval.peek("b1"));
    Assertions.assertEquals(BigInteger.ONE, eval.peek("b2"));
  }
}
