package callfsm.program;

import callfsm.graph.Automaton;
import callfsm.graph.Transition;
import java.util.List;
import java.util.OptionalLong;
import java.util.Properties;
import java.util.Set;
import junit.framework.TestCase;

public class LibraryCallAutomatonBuilderTestCase extends TestCase {

  static final String PRINTLN = "java/io/PrintStream.println";
  static final String EXIT = "java/lang/System.exit";

  private CallTable table;
  private AnalysisConfig config;

  protected void setUp() throws Exception {
    super.setUp();
    table = new CallTable(List.of(PRINTLN, EXIT), Set.of(EXIT));
    config = AnalysisConfig.of(new Properties());
  }

  /**
   * {@code main} prints, calls {@code helper} then returns; {@code helper}
   * exits the process.
   */
  static ProgramModel printThenExit() {
    final var main = new FunctionModel("P.main()V", "P.main", List.of(
      new BlockModel(0, List.of(
        new CallSite(PRINTLN + "(Ljava/lang/String;)V", PRINTLN),
        new CallSite("P.helper()V", "P.helper")
      ), List.of(1), false),
      new BlockModel(1, List.of(), List.of(), true)
    ));
    final var helper = new FunctionModel("P.helper()V", "P.helper", List.of(
      new BlockModel(0, List.of(new CallSite(EXIT + "(I)V", EXIT, OptionalLong.of(0))), List.of(), true)
    ));
    return new ProgramModel("P", List.of(main, helper));
  }

  public void testStartEntersMain() {
    final Automaton automaton = new LibraryCallAutomatonBuilder(table, config).build(printThenExit());

    // start, then the entries of main and helper, then their exits
    assertEquals(0, automaton.start());
    assertEquals(List.of(new Transition(1, Automaton.EPSILON)), automaton.transitions(0));
    assertTrue(automaton.isAccepting(3));
    assertFalse(automaton.isAccepting(4));
    assertEquals(List.of(new Transition(5, "call:" + PRINTLN)), automaton.transitions(1));
    assertEquals(List.of(new Transition(2, "call:P.helper")), automaton.transitions(5));
  }

  public void testCallsAndReturnsAreObservable() {
    final Automaton automaton = new LibraryCallAutomatonBuilder(table, config).build(printThenExit());
    final int start = automaton.start();

    assertTrue(automaton.accepts(start, List.of("call:" + PRINTLN, "call:P.helper", "call:" + EXIT)));
    assertTrue(automaton.accepts(
      start,
      List.of("call:" + PRINTLN, "call:P.helper", "call:" + EXIT, "ret:P.helper", "ret:P.main")
    ));
    assertFalse(automaton.accepts(start, List.of("call:" + PRINTLN, "call:P.helper")));
    assertFalse(automaton.emits(start, List.of("call:P.helper")));
  }

  public void testLibcPassSimplifies() {
    final Automaton automaton = AnalysisPass.LIBC.run(printThenExit(), table, config);

    assertEquals(0, automaton.start());
    assertEquals(6, automaton.reachable().size());
    for (int node : automaton.reachable()) {
      assertTrue(automaton.transitions(node).size() <= 1);
      for (Transition transition : automaton.transitions(node)) {
        assertFalse(transition.isEpsilon());
      }
    }
    assertTrue(automaton.accepts(0, List.of("call:" + PRINTLN, "call:P.helper", "call:" + EXIT)));
    assertTrue(automaton.accepts(
      0,
      List.of("call:" + PRINTLN, "call:P.helper", "call:" + EXIT, "ret:P.helper", "ret:P.main")
    ));
    assertFalse(automaton.accepts(0, List.of()));
  }

  public void testUnknownExternalCallIsSilent() {
    final var main = new FunctionModel("P.main()V", "P.main", List.of(
      new BlockModel(0, List.of(new CallSite("Q.other()V", "Q.other")), List.of(), true)
    ));
    final Automaton automaton = AnalysisPass.LIBC.run(new ProgramModel("P", List.of(main)), table, config);

    assertTrue(automaton.accepts(0, List.of("ret:P.main")));
    assertEquals(2, automaton.reachable().size());
  }

  public void testDirectRecursionLoopsToEntry() {
    final var main = new FunctionModel("P.main()V", "P.main", List.of(
      new BlockModel(0, List.of(
        new CallSite(PRINTLN + "(I)V", PRINTLN),
        new CallSite("P.main()V", "P.main")
      ), List.of(), true)
    ));
    final Automaton automaton = AnalysisPass.LIBC.run(new ProgramModel("P", List.of(main)), table, config);

    assertTrue(automaton.emits(0, List.of("call:" + PRINTLN, "call:" + PRINTLN, "call:" + PRINTLN)));
    assertFalse(automaton.emits(0, List.of("call:P.main")));
  }

  public void testDeclarationsAreNotEntered() {
    final var declared = new FunctionModel("P.helper()V", "P.helper", List.of());
    final var main = new FunctionModel("P.main()V", "P.main", List.of(
      new BlockModel(0, List.of(new CallSite("P.helper()V", "P.helper")), List.of(), true)
    ));
    final Automaton automaton = AnalysisPass.LIBC.run(new ProgramModel("P", List.of(declared, main)), table, config);

    assertFalse(automaton.emits(0, List.of("call:P.helper")));
    assertTrue(automaton.accepts(0, List.of("ret:P.main")));
  }

  public void testMissingEntryFunction() {
    final var helper = new FunctionModel("P.helper()V", "P.helper", List.of(
      new BlockModel(0, List.of(), List.of(), true)
    ));
    try {
      new LibraryCallAutomatonBuilder(table, config).build(new ProgramModel("P", List.of(helper)));
      fail("program has no main");
    } catch (IllegalArgumentException e) {
      assertTrue(e.getMessage().contains("main"));
    }
  }

  public void testBuilderIsSingleUse() {
    final var builder = new LibraryCallAutomatonBuilder(table, config);
    builder.build(printThenExit());
    try {
      builder.build(printThenExit());
      fail("builder was already used");
    } catch (IllegalStateException e) {
      // expected
    }
  }

  public void testConfiguredEntryFunction() {
    final var overrides = new Properties();
    overrides.setProperty(AnalysisConfig.ENTRY_FUNCTION, "helper");
    final Automaton automaton =
      AnalysisPass.LIBC.run(printThenExit(), table, AnalysisConfig.of(overrides));

    assertTrue(automaton.accepts(0, List.of("call:" + EXIT)));
    assertFalse(automaton.emits(0, List.of("call:" + PRINTLN)));
  }
}
