package hwelab.core;

import hwelab.elab.Builder;
import hwelab.elab.ElaborationException;
import hwelab.elab.ErrorKind;
import hwelab.ir.Arg;
import hwelab.ir.PrimOp;
import java.util.List;

/** Two-way multiplexer over leaves and aggregates. */
public class Mux {

  /**
   * Selects con if cond is 1, else alt.
   * Leaves must have the same variant, except that a Bool paired with a UInt is widened to UInt.
   * Aggregates must have the same leaf count and pairwise equal leaf widths and variants.
   * Emits exactly one MUX command (plus the widening cast, if any).
   * @param cond the select signal, must be a Bool
   * @param con the value for cond = 1
   * @param alt the value for cond = 0
   * @return a new node of the common shape
   * @throws ElaborationException with TypeMismatch, WidthMismatch or NotSynthesizable
   */
  @SuppressWarnings("unchecked")
  public static <T extends Data> T mux(Element cond, T con, T alt) {
    if (cond.getKind() != ElementKind.BOOL)
      throw new ElaborationException(ErrorKind.TypeMismatch, "Mux condition must be a Bool, got " + cond.typeString());
    Binding.checkSynthesizable(cond, "'cond'");
    Binding.checkSynthesizable(con, "'con'");
    Binding.checkSynthesizable(alt, "'alt'");
    if ((con instanceof Record) != (alt instanceof Record))
      throw new ElaborationException(ErrorKind.TypeMismatch, String.format("Can't Mux between %s and %s", con.typeString(), alt.typeString()));
    if (con instanceof Record)
      return (T)muxRecord(cond, (Record)con, (Record)alt);
    return (T)muxElement(cond, (Element)con, (Element)alt);
  }

  private static Element muxElement(Element cond, Element con, Element alt) {
    if (con.getKind() == ElementKind.BOOL && alt.getKind() == ElementKind.UINT)
      con = BitsOps.asUInt(con);
    else if (con.getKind() == ElementKind.UINT && alt.getKind() == ElementKind.BOOL)
      alt = BitsOps.asUInt(alt);
    if (con.getKind() != alt.getKind())
      throw new ElaborationException(ErrorKind.TypeMismatch, String.format("Can't Mux between %s and %s", con.typeString(), alt.typeString()));
    Element result = con.cloneTypeWidth(con.getWidth().max(alt.getWidth()));
    return Builder.current().pushOp(result, PrimOp.MUX, Arg.ref(cond), Arg.ref(con), Arg.ref(alt));
  }

  private static Record muxRecord(Element cond, Record con, Record alt) {
    List<Element> conLeaves = con.flatten();
    List<Element> altLeaves = alt.flatten();
    if (conLeaves.size() != altLeaves.size())
      throw new ElaborationException(ErrorKind.WidthMismatch,
                                     String.format("Can't Mux between aggregates with %d and %d fields: %s, %s", conLeaves.size(),
                                                   altLeaves.size(), con.typeString(), alt.typeString()));
    for (int i = 0; i < conLeaves.size(); ++i) {
      Element a = conLeaves.get(i);
      Element b = altLeaves.get(i);
      if (!a.getWidth().equals(b.getWidth()))
        throw new ElaborationException(ErrorKind.WidthMismatch,
                                       String.format("Can't Mux between aggregates of different width: field %d is %s vs %s", i,
                                                     a.typeString(), b.typeString()));
      if (a.getKind() != b.getKind())
        throw new ElaborationException(ErrorKind.TypeMismatch,
                                       String.format("Can't Mux between aggregates of different types: field %d is %s vs %s", i,
                                                     a.typeString(), b.typeString()));
    }
    return Builder.current().pushOp(con.cloneType(), PrimOp.MUX, Arg.ref(cond), Arg.ref(con), Arg.ref(alt));
  }
}
