package exm.ceva.verify.encode;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.HashSet;
import java.util.Set;

import org.junit.BeforeClass;
import org.junit.Test;

import exm.ceva.ast.Function;
import exm.ceva.ast.FunctionBuilder;
import exm.ceva.common.Logging;
import exm.ceva.common.lang.IntegerMode;
import exm.ceva.verify.formula.Term;
import exm.ceva.verify.formula.Term.TermKind;

public class BodyEncoderTest {

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("BodyEncoderTest.ceva.log", true);
  }

  private static BodyModel model(Function f, int pathLimit) {
    BodyEncoder be = new BodyEncoder(new FormulaEncoder(IntegerMode.TRAP),
                                     null, 16, pathLimit);
    return be.encode(f, FormulaEncoder.signatureSymbols(f));
  }

  private static BodyModel model(Function f) {
    return model(f, 64);
  }

  private static FunctionBuilder intFn(String name) {
    return new FunctionBuilder(name).param("n", "i32").returns("i32");
  }

  @Test
  public void testBranchesAreExact() throws Exception {
    Function f = intFn("Abs")
        .body("(if (< n 0) {(return (- n))} {(return n)})").build();
    BodyModel m = model(f);
    assertFalse(m.describePartial(), m.isPartial());
    assertEquals(2, m.paths());
  }

  @Test
  public void testConstantLoopUnrolled() throws Exception {
    Function f = intFn("triangle")
        .body("(bind s i32 0) (for i i32 1 3 {(assign s (+ s i))}) " +
              "(return s)").build();
    BodyModel m = model(f);
    assertFalse(m.describePartial(), m.isPartial());
    assertEquals(1, m.paths());
  }

  @Test
  public void testWhileLoopWidened() throws Exception {
    Function f = intFn("count")
        .body("(bind i i32 0) (while (< i n) {(assign i (+ i 1))}) " +
              "(return i)").build();
    BodyModel m = model(f);
    assertTrue(m.isPartial());
    assertTrue(m.describePartial(),
               m.describePartial().contains("not unrolled"));
  }

  @Test
  public void testUnknownStatementHavocs() throws Exception {
    Function f = intFn("opaque")
        .body("(bind r i32 n) (unknown \"inline asm\") (return r)").build();
    BodyModel m = model(f);
    assertTrue(m.isPartial());
    assertTrue(m.describePartial(),
               m.describePartial().contains("unknown statement"));
  }

  @Test
  public void testThrowingPathDoesNotReturn() throws Exception {
    Function f = intFn("positive")
        .body("(if (< n 0) {(throw)}) (return n)").build();
    BodyModel m = model(f);
    assertFalse(m.isPartial());
    assertEquals(1, m.paths());
  }

  @Test
  public void testPathLimit() throws Exception {
    Function f = intFn("branchy")
        .body("(bind r i32 0) " +
              "(if (< n 1) {(assign r (+ r 1))}) " +
              "(if (< n 2) {(assign r (+ r 1))}) " +
              "(if (< n 3) {(assign r (+ r 1))}) " +
              "(if (< n 4) {(assign r (+ r 1))}) " +
              "(return r)").build();
    BodyModel m = model(f, 4);
    assertTrue(m.isPartial());
    assertTrue(m.constraint().isTrue());
  }

  @Test
  public void testReturnInsideWidenedLoop() throws Exception {
    Function f = intFn("early")
        .body("(while (> n 0) {(return -1)}) (return 0)").build();
    BodyModel m = model(f);
    assertTrue(m.isPartial());
    assertEquals("Return inside the loop is a path", 2, m.paths());

    Function g = intFn("earlyFor")
        .body("(for i i32 0 n {(return -1)}) (return 0)").build();
    assertEquals(2, model(g).paths());
  }

  @Test
  public void testBreakLeavesWidenedLoop() throws Exception {
    Function f = intFn("search")
        .body("(bind i i32 0) " +
              "(while true {(if (>= i n) {(break)}) (assign i (+ i 1))}) " +
              "(return i)").build();
    BodyModel m = model(f);
    assertTrue(m.isPartial());
    assertEquals("Only the break leaves the loop", 1, m.paths());
  }

  @Test
  public void testUnknownInLoopHavocsEverything() throws Exception {
    Function f = intFn("opaqueLoop")
        .body("(bind x i32 0) (bind i i32 0) " +
              "(while (< i n) {(unknown \"x = 7\") (assign i (+ i 1))}) " +
              "(return x)").build();
    BodyModel m = model(f);
    assertTrue(hasFreshSymbol(m.constraint(), "x"));
  }

  @Test
  public void testEffectfulCallInLoopHavocsArray() throws Exception {
    Function f = new FunctionBuilder("refill").param("arr", "[i32]")
        .param("n", "i32").returns("i32")
        .body("(bind i i32 0) " +
              "(while (< i n) {(do (fill arr)) (assign i (+ i 1))}) " +
              "(return (at arr 0))").build();
    BodyModel m = model(f);
    assertTrue(m.describePartial(),
               m.describePartial().contains("may have effects"));
    assertTrue(hasFreshSymbol(m.constraint(), "arr"));
  }

  @Test
  public void testLoopWithoutUnknownKeepsOtherVariables() throws Exception {
    Function f = intFn("untouched")
        .body("(bind x i32 0) (bind i i32 0) " +
              "(while (< i n) {(assign i (+ i 1))}) (return x)").build();
    BodyModel m = model(f);
    assertFalse(hasFreshSymbol(m.constraint(), "x"));
    assertTrue(hasFreshSymbol(m.constraint(), "i"));
  }

  /**
   * @return true if t mentions a symbol made up for variable name
   */
  private static boolean hasFreshSymbol(Term t, String name) {
    Set<String> names = new HashSet<String>();
    collectVars(t, names);
    for (String n: names) {
      if (n.startsWith(name + "!")) {
        return true;
      }
    }
    return false;
  }

  private static void collectVars(Term t, Set<String> names) {
    if (t.kind() == TermKind.VAR) {
      names.add(t.name());
    }
    for (Term arg: t.args()) {
      collectVars(arg, names);
    }
  }
}
