package callfsm.graph;

import java.util.List;
import java.util.Set;
import junit.framework.TestCase;

public class AutomatonTestCase extends TestCase {

  private Automaton automaton;

  protected void setUp() throws Exception {
    super.setUp();
    automaton = new Automaton();
  }

  public void testIdsAreSequential() {
    assertEquals(0, automaton.createNode());
    assertEquals(1, automaton.createNode(true));
    assertEquals(2, automaton.createNode());

    assertFalse(automaton.isAccepting(0));
    assertTrue(automaton.isAccepting(1));
    assertEquals(3, automaton.liveStateCount());
  }

  public void testTransitionsAreAppendedWithoutDeduplication() {
    final int a = automaton.createNode();
    final int b = automaton.createNode();
    automaton.addTransition(a, "call:foo", b);
    automaton.addTransition(a, "call:foo", b);
    automaton.addTransition(a, "call:foo", a);

    assertEquals(
      List.of(new Transition(b, "call:foo"), new Transition(b, "call:foo"), new Transition(a, "call:foo")),
      automaton.transitions(a)
    );
  }

  public void testTransitionsViewIsReadOnly() {
    final int a = automaton.createNode();
    try {
      automaton.transitions(a).add(new Transition(a, "x"));
      fail("transitions should not be modifiable");
    } catch (UnsupportedOperationException e) {
      // expected
    }
  }

  public void testPreconditionsFailFast() {
    final int a = automaton.createNode();
    try {
      automaton.addTransition(a, "call:foo", 7);
      fail("unknown target should be rejected");
    } catch (IllegalArgumentException e) {
      // expected
    }
    try {
      automaton.addTransition(a, "", a);
      fail("empty label should be rejected");
    } catch (IllegalArgumentException e) {
      // expected
    }
    try {
      automaton.start();
      fail("no start state was designated");
    } catch (IllegalStateException e) {
      // expected
    }
  }

  public void testReachableIsBreadthFirst() {
    final int s = automaton.createNode();
    final int a = automaton.createNode();
    final int b = automaton.createNode();
    final int c = automaton.createNode();
    final int unreachable = automaton.createNode();
    automaton.addTransition(s, "x", b);
    automaton.addTransition(s, Automaton.EPSILON, a);
    automaton.addTransition(b, "y", c);
    automaton.addTransition(c, "z", s);
    automaton.addTransition(unreachable, "w", s);

    assertEquals(List.of(s, b, a, c), List.copyOf(automaton.reachable(s)));
    assertFalse(automaton.reachable(s).contains(unreachable));
  }

  public void testClearGraphReleasesCycles() {
    final int s = automaton.createNode();
    final int a = automaton.createNode();
    final int b = automaton.createNode();
    final int other = automaton.createNode();
    automaton.addTransition(s, "x", a);
    automaton.addTransition(a, Automaton.EPSILON, b);
    automaton.addTransition(b, "y", s);
    automaton.addTransition(b, "y", b);
    automaton.designateStart(s);

    assertEquals(3, automaton.clearGraph(s));

    for (int node : Set.of(s, a, b)) {
      assertFalse(automaton.contains(node));
    }
    assertTrue(automaton.contains(other));
    assertEquals(1, automaton.liveStateCount());
    assertFalse(automaton.hasStart());
  }

  public void testReclaimedStatesCannotBeUsed() {
    final int s = automaton.createNode();
    final int a = automaton.createNode();
    automaton.addTransition(s, "x", a);
    automaton.clearGraph(s);

    try {
      automaton.clearGraph(s);
      fail("reclaiming twice should fail");
    } catch (IllegalStateException e) {
      // expected
    }
    try {
      automaton.transitions(a);
      fail("reclaimed state should not be readable");
    } catch (IllegalStateException e) {
      // expected
    }
  }

  public void testReclaimingSharedStatesFails() {
    final int first = automaton.createNode();
    final int second = automaton.createNode();
    final int shared = automaton.createNode();
    automaton.addTransition(first, "x", shared);
    automaton.addTransition(second, "y", shared);
    automaton.clearGraph(first);

    try {
      automaton.clearGraph(second);
      fail("second graph references a reclaimed state");
    } catch (IllegalStateException e) {
      // expected
    }
    assertTrue(automaton.contains(second));
  }

  public void testClearDropsEverything() {
    automaton.designateStart(automaton.createNode());
    automaton.createNode();
    automaton.clear();

    assertEquals(0, automaton.liveStateCount());
    assertFalse(automaton.hasStart());
  }

  public void testEmitsAndAccepts() {
    final int s = automaton.createNode();
    final int a = automaton.createNode();
    final int b = automaton.createNode(true);
    automaton.addTransition(s, "open", a);
    automaton.addTransition(a, Automaton.EPSILON, b);
    automaton.addTransition(b, "read", b);

    assertTrue(automaton.emits(s, List.of()));
    assertTrue(automaton.emits(s, List.of("open", "read", "read")));
    assertFalse(automaton.emits(s, List.of("read")));

    assertFalse(automaton.accepts(s, List.of()));
    assertTrue(automaton.accepts(s, List.of("open")));
    assertTrue(automaton.accepts(s, List.of("open", "read")));
    assertFalse(automaton.accepts(s, List.of("open", "close")));
  }

  public void testDotGraph() {
    final int s = automaton.createNode();
    final int b = automaton.createNode(true);
    automaton.addTransition(s, "call:exit", b);
    automaton.addTransition(b, "call:exit", b);
    automaton.addTransition(b, "call:<init>", b);
    automaton.designateStart(s);

    final String dot = automaton.dotGraph("CFG");

    assertTrue(dot.startsWith("digraph \"CFG\" {\n"));
    assertTrue(dot.contains("  \"0\";\n"));
    assertTrue(dot.contains("  \"1\" [shape = doublecircle];\n"));
    assertTrue(dot.contains("  \"__start\" -> \"0\";\n"));
    assertTrue(dot.contains("  \"0\" -> \"1\" [label = <call:exit>];\n"));
    assertTrue(dot.contains("  \"1\" -> \"1\" [label = <call:exit>];\n"));
    assertTrue(dot.contains("  \"1\" -> \"1\" [label = <call:&lt;init&gt;>];\n"));
    assertTrue(dot.endsWith("}\n"));
  }

  public void testDotGraphWithoutStart() {
    final int s = automaton.createNode();

    try {
      automaton.dotGraph("CFG");
      fail("only states reachable from the start are rendered");
    } catch (IllegalStateException e) {
      // expected
    }
    automaton.designateStart(s);
    final String dot = automaton.dotGraph("CFG");
    assertTrue(dot.contains("  \"__start\" -> \"0\";\n"));
    assertFalse(dot.contains("[label"));
  }

  public void testDotGraphOmitsUnreachableStates() {
    final int s = automaton.createNode();
    automaton.createNode();
    automaton.designateStart(s);

    assertFalse(automaton.dotGraph("CFG").contains("\"1\""));
  }
}
