package exm.ceva.verify.encode;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.junit.BeforeClass;
import org.junit.Test;

import exm.ceva.ast.Function;
import exm.ceva.ast.FunctionBuilder;
import exm.ceva.common.Logging;
import exm.ceva.common.lang.IntegerMode;
import exm.ceva.verify.ContractKind;
import exm.ceva.verify.formula.SideCondition;
import exm.ceva.verify.formula.SideCondition.Reason;
import exm.ceva.verify.formula.Sort;
import exm.ceva.verify.formula.Term;

public class FormulaEncoderTest {

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("FormulaEncoderTest.ceva.log", true);
  }

  private static EncodedContract encodePost(Function f, IntegerMode mode) {
    FormulaEncoder enc = new FormulaEncoder(mode);
    return enc.encodeContract(f, FormulaEncoder.signatureSymbols(f),
        f.postconditions().get(0), ContractKind.POSTCONDITION, 0);
  }

  private static List<Reason> reasons(EncodedContract c) {
    List<Reason> result = new ArrayList<Reason>();
    for (SideCondition sc: c.formula().sideConditions()) {
      result.add(sc.reason());
    }
    return result;
  }

  @Test
  public void testSignatureSymbols() throws Exception {
    Function f = new FunctionBuilder("sum").param("xs", "[i32]")
        .param("k", "u8").returns("i64").build();
    Map<String, Term> syms = FormulaEncoder.signatureSymbols(f);
    assertEquals(Sort.arrayOf(Sort.bitVec(32, true)), syms.get("xs").sort());
    assertEquals(Sort.INDEX, syms.get("xs.length").sort());
    assertEquals(Sort.bitVec(8, false), syms.get("k").sort());
    assertEquals(Sort.bitVec(64, true), syms.get("result").sort());
  }

  @Test
  public void testSimpleComparison() throws Exception {
    Function f = new FunctionBuilder("Abs").param("n", "i32").returns("i32")
        .ensures("(>= result 0)").build();
    EncodedContract c = encodePost(f, IntegerMode.TRAP);
    assertTrue(c.unsupportedReason(), c.isSupported());
    assertTrue(c.formula().formula().sort().isBool());
    assertTrue(c.formula().sideConditions().isEmpty());
    assertFalse(c.formula().isPartial());
  }

  @Test
  public void testDivisionSideConditions() throws Exception {
    Function f = new FunctionBuilder("SafeDivide").param("a", "i32")
        .param("b", "i32").returns("i32")
        .ensures("(== result (/ a b))").build();
    List<Reason> trap = reasons(encodePost(f, IntegerMode.TRAP));
    assertTrue(trap.contains(Reason.DIVISION));
    assertTrue("MIN / -1 traps", trap.contains(Reason.OVERFLOW));

    List<Reason> wrap = reasons(encodePost(f, IntegerMode.WRAP));
    assertEquals(Collections.singletonList(Reason.DIVISION), wrap);
  }

  @Test
  public void testOverflowOnlyInTrapMode() throws Exception {
    Function f = new FunctionBuilder("inc").param("a", "i32").returns("i32")
        .ensures("(> (+ a 1) a)").build();
    assertTrue(reasons(encodePost(f, IntegerMode.TRAP))
                    .contains(Reason.OVERFLOW));
    assertTrue(reasons(encodePost(f, IntegerMode.WRAP)).isEmpty());
  }

  @Test
  public void testIndexBounds() throws Exception {
    Function f = new FunctionBuilder("first").param("xs", "[i32]")
        .returns("i32").ensures("(== result (at xs 0))").build();
    EncodedContract c = encodePost(f, IntegerMode.TRAP);
    assertTrue(c.unsupportedReason(), c.isSupported());
    assertEquals(Collections.singletonList(Reason.BOUNDS), reasons(c));
  }

  @Test
  public void testShortCircuitGuardsSideCondition() throws Exception {
    Function f = new FunctionBuilder("g").param("a", "i32")
        .param("b", "i32").returns("bool")
        .ensures("(|| (== b 0) (> (/ a b) 0))").build();
    EncodedContract c = encodePost(f, IntegerMode.WRAP);
    SideCondition div = c.formula().sideConditions().get(0);
    assertEquals(Reason.DIVISION, div.reason());
    assertFalse("Only needed when b != 0", div.guard().isTrue());
  }

  @Test
  public void testNullComparisonUnsupported() throws Exception {
    Function f = new FunctionBuilder("h").param("s", "str?").returns("bool")
        .ensures("(!= s null)").build();
    EncodedContract c = encodePost(f, IntegerMode.TRAP);
    assertFalse(c.isSupported());
    assertNotNull(c.unsupportedReason());
  }

  @Test
  public void testOpaqueParameterUnsupported() throws Exception {
    Function f = new FunctionBuilder("area").param("p", "Shape")
        .returns("f64").ensures("(>= result 0.0)").requires("(== p p)")
        .build();
    FormulaEncoder enc = new FormulaEncoder(IntegerMode.TRAP);
    Map<String, Term> syms = FormulaEncoder.signatureSymbols(f);
    assertFalse(syms.containsKey("p"));
    EncodedContract pre = enc.encodeContract(f, syms,
        f.preconditions().get(0), ContractKind.PRECONDITION, 0);
    assertFalse(pre.isSupported());
    assertTrue(pre.unsupportedReason(),
               pre.unsupportedReason().contains("'p'"));
    // The postcondition doesn't mention p
    assertTrue(encodePost(f, IntegerMode.TRAP).isSupported());
  }

  @Test
  public void testMixedWidthComparisonWidens() throws Exception {
    Function f = new FunctionBuilder("w").param("a", "i8").param("b", "i64")
        .returns("bool").ensures("(< a b)").build();
    EncodedContract c = encodePost(f, IntegerMode.TRAP);
    assertTrue(c.unsupportedReason(), c.isSupported());
    Term cmp = c.formula().formula();
    assertEquals(Sort.bitVec(64, true), cmp.args().get(0).sort());
  }

  @Test
  public void testTermSimplification() {
    Term x = Term.var("x", Sort.BOOL);
    assertSame(x, Term.and(Term.TRUE, x));
    assertTrue(Term.and(Term.FALSE, x).isFalse());
    assertTrue(Term.or(x, Term.TRUE).isTrue());
    assertSame(x, Term.not(Term.not(x)));
    assertTrue(Term.implies(Term.FALSE, x).isTrue());
  }

  @Test
  public void testCoerceFoldsConstants() {
    Term c = Term.intConst(-1, Sort.bitVec(8, true));
    Term widened = FormulaEncoder.coerce(c, Sort.bitVec(32, true));
    assertTrue(widened.isConstant());
    assertEquals(-1, widened.value().getIntLit().intValue());
    Term asUnsigned = FormulaEncoder.coerce(c, Sort.bitVec(8, false));
    assertEquals(255, asUnsigned.value().getIntLit().intValue());
  }
}
