package exm.ceva.verify;

import java.util.Collection;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import exm.ceva.verify.formula.Term;

/**
 * Solver stand-in that answers every check the same way
 */
public class FixedSolverBackend implements SolverBackend {
  private final boolean available;
  private final SolverResult answer;
  private final AtomicInteger sessionsOpened = new AtomicInteger();
  private final AtomicInteger sessionsClosed = new AtomicInteger();
  private final AtomicInteger checks = new AtomicInteger();

  public FixedSolverBackend(boolean available, SolverResult answer) {
    this.available = available;
    this.answer = answer;
  }

  public static FixedSolverBackend unavailable() {
    return new FixedSolverBackend(false, SolverResult.unsat());
  }

  @Override
  public String name() {
    return "fixed";
  }

  @Override
  public boolean isAvailable() {
    return available;
  }

  @Override
  public String unavailableReason() {
    return available ? null : "not installed";
  }

  @Override
  public SolverSession openSession(long timeoutMs) {
    sessionsOpened.incrementAndGet();
    return new SolverSession() {
      @Override
      public SolverResult check(List<Term> assertions,
                                Collection<Term> modelSymbols) {
        checks.incrementAndGet();
        return answer;
      }

      @Override
      public void close() {
        sessionsClosed.incrementAndGet();
      }
    };
  }

  public int sessionsOpened() {
    return sessionsOpened.get();
  }

  public int sessionsClosed() {
    return sessionsClosed.get();
  }

  public int checks() {
    return checks.get();
  }
}
