package exm.ceva.cfg;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.List;

import org.junit.BeforeClass;
import org.junit.Test;

import exm.ceva.ast.Function;
import exm.ceva.ast.FunctionBuilder;
import exm.ceva.ast.Statement.StmtKind;
import exm.ceva.common.Logging;

public class ControlFlowBuilderTest {

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("ControlFlowBuilderTest.ceva.log", true);
  }

  private static List<EdgeKind> edgeKinds(ControlFlowGraph cfg) {
    List<EdgeKind> kinds = new ArrayList<EdgeKind>();
    for (BasicBlock b: cfg.blocks()) {
      for (Edge e: b.successorEdges()) {
        kinds.add(e.kind());
      }
    }
    return kinds;
  }

  @Test
  public void testStraightLine() throws Exception {
    Function f = new FunctionBuilder("f").param("a", "i32").returns("i32")
        .body("(bind x i32 (+ a 1)) (return x)").build();
    ControlFlowGraph cfg = ControlFlowBuilder.build(f);

    assertEquals("Both statements in entry block", 2,
                 cfg.entry().statements().size());
    assertTrue("Exit reachable", cfg.exit().isReachable());
    assertEquals("Entry returns to exit", EdgeKind.RETURN,
                 cfg.entry().successorEdges().get(0).kind());
  }

  @Test
  public void testIfElseJoins() throws Exception {
    Function f = new FunctionBuilder("Abs").param("n", "i32").returns("i32")
        .body("(bind r i32) (if (< n 0) {(assign r (- n))} {(assign r n)})" +
              " (return r)").build();
    ControlFlowGraph cfg = ControlFlowBuilder.build(f);

    BasicBlock entry = cfg.entry();
    assertNotNull("Entry branches", entry.branchCondition());
    assertEquals(2, entry.successorEdges().size());
    assertEquals(EdgeKind.TRUE_BRANCH, entry.successorEdges().get(0).kind());
    assertEquals(EdgeKind.FALSE_BRANCH, entry.successorEdges().get(1).kind());

    BasicBlock thenBlock = entry.successors().get(0);
    BasicBlock elseBlock = entry.successors().get(1);
    BasicBlock join = thenBlock.successors().get(0);
    assertEquals("Arms meet at join", join, elseBlock.successors().get(0));
    assertEquals(2, join.predecessors().size());
    assertEquals(StmtKind.RETURN, join.statements().get(0).kind());
    assertTrue(cfg.unreachableBlocks().size() <= 1);
  }

  @Test
  public void testWhileLoopBackEdge() throws Exception {
    Function f = new FunctionBuilder("Count").param("n", "i32")
        .returns("i32")
        .body("(bind i i32 0) (while (< i n) {(assign i (+ i 1))})" +
              " (return i)").build();
    ControlFlowGraph cfg = ControlFlowBuilder.build(f);

    assertTrue(edgeKinds(cfg).contains(EdgeKind.LOOP_BACK));
    int headers = 0;
    for (BasicBlock b: cfg.reversePostorder()) {
      if (cfg.isLoopHeader(b)) {
        headers++;
        assertNotNull("Header tests loop condition", b.branchCondition());
      }
    }
    assertEquals(1, headers);
  }

  @Test
  public void testDoWhileTestsAfterBody() throws Exception {
    Function f = new FunctionBuilder("f").param("n", "i32").returns("i32")
        .body("(bind i i32 0) (do-while (< i n) {(assign i (+ i 1))})" +
              " (return i)").build();
    ControlFlowGraph cfg = ControlFlowBuilder.build(f);

    BasicBlock body = cfg.entry().successors().get(0);
    assertTrue("Body is loop header", cfg.isLoopHeader(body));
    BasicBlock test = body.successors().get(0);
    assertNotNull(test.branchCondition());
    Edge back = test.successorEdges().get(0);
    assertEquals(EdgeKind.LOOP_BACK, back.kind());
    assertTrue("Loop taken when condition holds", back.isTrueOutcome());
  }

  @Test
  public void testForLoopDesugared() throws Exception {
    Function f = new FunctionBuilder("Sum").param("n", "i32").returns("i32")
        .body("(bind s i32 0) (for i i32 1 n {(assign s (+ s i))})" +
              " (return s)").build();
    ControlFlowGraph cfg = ControlFlowBuilder.build(f);

    assertTrue(cfg.loopVariables().contains("i"));
    assertEquals("Loop variable bound in entry", StmtKind.BIND,
                 cfg.entry().statements().get(1).kind());
    boolean foundLatch = false;
    for (BasicBlock b: cfg.blocks()) {
      if (b.isSynthetic()) {
        foundLatch = true;
        assertEquals(StmtKind.ASSIGN, b.statements().get(0).kind());
        assertEquals(EdgeKind.LOOP_BACK, b.successorEdges().get(0).kind());
      }
    }
    assertTrue("For loop has an increment block", foundLatch);
  }

  @Test
  public void testCodeAfterReturnUnreachable() throws Exception {
    Function f = new FunctionBuilder("f").param("a", "i32").returns("i32")
        .body("(return a)\n(bind y i32 2)").build();
    ControlFlowGraph cfg = ControlFlowBuilder.build(f);

    int deadNonEmpty = 0;
    for (BasicBlock b: cfg.unreachableBlocks()) {
      if (!b.isEmpty()) {
        deadNonEmpty++;
        assertEquals("Dead block line", 3, b.line());
      }
    }
    assertEquals(1, deadNonEmpty);
    assertFalse(cfg.reversePostorder().contains(cfg.unreachableBlocks().get(0)));
  }

  @Test
  public void testBreakContinue() throws Exception {
    Function f = new FunctionBuilder("f").param("n", "i32").returns("i32")
        .body("(bind i i32 0)" +
              "(while true {(if (> i n) {(break)} {(continue)})})" +
              "(return i)").build();
    ControlFlowGraph cfg = ControlFlowBuilder.build(f);

    // Constant condition: no false edge out of the header, so the code
    // after the loop is only reached through break
    BasicBlock header = cfg.entry().successors().get(0);
    assertEquals(1, header.successorEdges().size());
    assertTrue("Return reachable through break", cfg.exit().isReachable());
  }

  @Test
  public void testUnknownStatementIsolated() throws Exception {
    Function f = new FunctionBuilder("f").param("a", "i32").returns("i32")
        .body("(bind x i32 a) (unknown \"inline asm\") (return x)").build();
    ControlFlowGraph cfg = ControlFlowBuilder.build(f);

    int unknown = 0;
    for (BasicBlock b: cfg.blocks()) {
      if (b.isUnknown()) {
        unknown++;
        assertEquals(1, b.statements().size());
        assertTrue(b.isReachable());
      }
    }
    assertEquals(1, unknown);
  }

  @Test
  public void testThrowEdge() throws Exception {
    Function f = new FunctionBuilder("f").param("a", "i32").returns("i32")
        .body("(if (< a 0) {(throw a)}) (return a)").build();
    ControlFlowGraph cfg = ControlFlowBuilder.build(f);
    assertTrue(edgeKinds(cfg).contains(EdgeKind.THROW));
    assertTrue(edgeKinds(cfg).contains(EdgeKind.RETURN));
  }
}
