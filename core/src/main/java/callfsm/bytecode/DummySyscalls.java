package callfsm.bytecode;

import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Default target of the calls inserted by {@link SyscallInstrumenter}.
 *
 * <p>Instrumented classes need this class on their classpath at runtime.
 */
public final class DummySyscalls {

  private static final Logger logger = Logger.getLogger("callfsm.bytecode");

  private static final AtomicLong calls = new AtomicLong();

  private DummySyscalls() { }

  /**
   * Marks that the library call with the given number is about to happen.
   *
   * @param number index of the library call in the call table
   */
  public static void dummySyscall(int number) {
    calls.incrementAndGet();
    logger.log(Level.FINEST, "dummy_syscall({0})", number);
  }

  /**
   * Number of hook invocations so far.
   */
  public static long calls() {
    return calls.get();
  }
}
