package callfsm.bytecode;

import callfsm.graph.Automaton;
import callfsm.program.AnalysisConfig;
import callfsm.program.AnalysisPass;
import callfsm.program.CallTable;
import callfsm.program.ProgramModel;
import java.util.List;
import java.util.Properties;
import junit.framework.TestCase;

public class SyscallInstrumenterTestCase extends TestCase {

  private static final class ByteClassLoader extends ClassLoader {

    ByteClassLoader(ClassLoader parent) {
      super(parent);
    }

    Class<?> define(String name, byte[] bytes) {
      return defineClass(name, bytes, 0, bytes.length);
    }
  }

  private AnalysisConfig config;
  private CallTable table;
  private SyscallInstrumenter.Result result;

  protected void setUp() throws Exception {
    super.setUp();
    config = AnalysisConfig.of(new Properties());
    table = CallTable.load(config);
    result = new SyscallInstrumenter(table, config).instrument(BytecodeProgramReaderTestCase.sampleProgramBytes());
  }

  public void testEveryLibraryCallIsInstrumented() {
    assertTrue(result.modified());
    assertEquals(2, result.instrumentedCalls());
  }

  public void testHooksShowUpAsDummySyscalls() {
    final ProgramModel program =
      new BytecodeProgramReader().read(result.classBytes(), "SampleProgram.class").toProgram();
    final Automaton automaton = AnalysisPass.SYSCALL.run(program, table, config);

    final String nanoTime = "dummy_syscall(" + table.indexOf("java/lang/System.nanoTime") + ")";
    final String millis = "dummy_syscall(" + table.indexOf("java/lang/System.currentTimeMillis") + ")";
    assertTrue(automaton.emits(0, List.of(nanoTime, "syscall(60)")));
    assertTrue(automaton.emits(0, List.of(nanoTime, millis, millis, "syscall(60)")));
    assertFalse(automaton.emits(0, List.of("syscall(60)")));
  }

  public void testInstrumentedClassRuns() throws Exception {
    final Class<?> instrumented = new ByteClassLoader(getClass().getClassLoader())
      .define(SampleProgram.class.getName(), result.classBytes());
    final java.lang.reflect.Method helper = instrumented.getDeclaredMethod("helper", int.class);
    helper.setAccessible(true);

    final long before = DummySyscalls.calls();
    helper.invoke(null, 3);

    assertEquals(before + 3, DummySyscalls.calls());
  }

  public void testHookIsNotInstrumented() throws Exception {
    final byte[] hookClass;
    try (var input = DummySyscalls.class.getResourceAsStream("DummySyscalls.class")) {
      hookClass = input.readAllBytes();
    }

    final SyscallInstrumenter.Result hookResult = new SyscallInstrumenter(table, config).instrument(hookClass);

    assertFalse(hookResult.modified());
  }

  public void testMalformedClass() {
    try {
      new SyscallInstrumenter(table, config).instrument(new byte[] { 0 });
      fail("bytes are not a class");
    } catch (IllegalArgumentException e) {
      // expected
    }
  }
}
