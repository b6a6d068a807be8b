package callfsm.program;

import callfsm.graph.Automaton;
import callfsm.graph.Transition;
import java.util.List;
import java.util.OptionalLong;
import java.util.Properties;
import java.util.Set;
import junit.framework.TestCase;

public class SyscallAutomatonBuilderTestCase extends TestCase {

  private static final String PRINTLN = LibraryCallAutomatonBuilderTestCase.PRINTLN;
  private static final String EXIT = LibraryCallAutomatonBuilderTestCase.EXIT;

  private CallTable table;
  private AnalysisConfig config;

  protected void setUp() throws Exception {
    super.setUp();
    table = new CallTable(List.of(PRINTLN, EXIT), Set.of(EXIT));
    config = AnalysisConfig.of(new Properties());
  }

  private static ProgramModel syscalls() {
    final var main = new FunctionModel("P.main()V", "P.main", List.of(
      new BlockModel(0, List.of(
        new CallSite("Sys.syscall(J)V", "Sys.syscall", OptionalLong.of(60)),
        new CallSite("H.dummySyscall(I)V", "H.dummySyscall", OptionalLong.of(3)),
        new CallSite(PRINTLN + "(I)V", PRINTLN),
        new CallSite("Sys.syscall(J)V", "Sys.syscall")
      ), List.of(), true)
    ));
    return new ProgramModel("P", List.of(main));
  }

  public void testSyscallEvents() {
    final Automaton automaton = new SyscallAutomatonBuilder(table, config).build(syscalls());

    assertTrue(automaton.accepts(0, List.of("syscall(60)", "dummy_syscall(3)", "syscall(?)")));
    assertFalse(automaton.emits(0, List.of("call:" + PRINTLN)));
    assertFalse(automaton.emits(0, List.of("dummy_syscall(3)")));
  }

  public void testSyscallPassEliminatesEpsilon() {
    final Automaton automaton = AnalysisPass.SYSCALL.run(syscalls(), table, config);

    assertEquals(0, automaton.start());
    assertTrue(automaton.emits(0, List.of("syscall(60)", "dummy_syscall(3)", "syscall(?)")));
    for (int node : automaton.reachable()) {
      for (Transition transition : automaton.transitions(node)) {
        assertFalse(transition.isEpsilon());
      }
    }
  }

  public void testDefinedSyscallFunctionIsStillAnEvent() {
    final var syscall = new FunctionModel("P.syscall(J)V", "P.syscall", List.of(
      new BlockModel(0, List.of(), List.of(), true)
    ));
    final var main = new FunctionModel("P.main()V", "P.main", List.of(
      new BlockModel(0, List.of(new CallSite("P.syscall(J)V", "P.syscall", OptionalLong.of(1))), List.of(), true)
    ));
    final Automaton automaton =
      new SyscallAutomatonBuilder(table, config).build(new ProgramModel("P", List.of(syscall, main)));

    assertTrue(automaton.accepts(0, List.of("syscall(1)")));
  }

  public void testTerminatingCallAccepts() {
    final var main = new FunctionModel("P.main()V", "P.main", List.of(
      new BlockModel(0, List.of(new CallSite(EXIT + "(I)V", EXIT, OptionalLong.of(1))), List.of(1), false),
      new BlockModel(1, List.of(new CallSite("Sys.syscall(J)V", "Sys.syscall", OptionalLong.of(2))), List.of(), true)
    ));
    final Automaton automaton =
      new SyscallAutomatonBuilder(table, config).build(new ProgramModel("P", List.of(main)));

    assertTrue(automaton.accepts(0, List.of()));
    assertTrue(automaton.accepts(0, List.of("syscall(2)")));
  }

  public void testSyscallPassKeepsAcceptance() {
    final var main = new FunctionModel("P.main()V", "P.main", List.of(
      new BlockModel(0, List.of(
        new CallSite("Sys.syscall(J)V", "Sys.syscall", OptionalLong.of(1)),
        new CallSite(EXIT + "(I)V", EXIT, OptionalLong.of(0))
      ), List.of(), true)
    ));
    final Automaton automaton = AnalysisPass.SYSCALL.run(new ProgramModel("P", List.of(main)), table, config);

    assertFalse(automaton.accepts(0, List.of()));
    assertTrue(automaton.accepts(0, List.of("syscall(1)")));
    assertFalse(automaton.accepts(0, List.of("syscall(1)", "syscall(1)")));
  }

  public void testConfiguredSyscallNames() {
    final var overrides = new Properties();
    overrides.setProperty(AnalysisConfig.SYSCALL_FUNCTION, "trap");
    final var main = new FunctionModel("P.main()V", "P.main", List.of(
      new BlockModel(0, List.of(
        new CallSite("Sys.trap(I)V", "Sys.trap", OptionalLong.of(4)),
        new CallSite("Sys.syscall(J)V", "Sys.syscall", OptionalLong.of(5))
      ), List.of(), true)
    ));
    final Automaton automaton = new SyscallAutomatonBuilder(table, AnalysisConfig.of(overrides))
      .build(new ProgramModel("P", List.of(main)));

    assertTrue(automaton.accepts(0, List.of("syscall(4)")));
  }
}
