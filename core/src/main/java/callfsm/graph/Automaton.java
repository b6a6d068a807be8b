package callfsm.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;

/**
 * Labeled non-deterministic finite automaton over program events.
 *
 * <p>States are owned by the automaton (an arena) and referenced everywhere by
 * their integer index, so cycles introduced by loops and recursive calls need
 * no special treatment. Indices are handed out sequentially from {@code 0} and
 * double as the state IDs shown when rendering.
 *
 * <p>Transitions are labeled either with {@link #EPSILON} (a control-flow step
 * with no observable event) or with a non-empty event string such as
 * {@code call:exit} or {@code syscall(60)}. Labels are opaque: they are only
 * ever compared for string equality. Parallel transitions with the same label
 * and self-loops are legal.
 *
 * <p>Instances are not thread safe.
 */
public final class Automaton implements DotGraph<Integer, String> {

  /**
   * Label of silent transitions.
   */
  public static final String EPSILON = "ε";

  private static final Logger logger = Logger.getLogger("callfsm.graph");

  private static final class State {
    boolean accepting;
    final ArrayList<Transition> transitions = new ArrayList<>();

    State(boolean accepting) {
      this.accepting = accepting;
    }
  }

  // Reclaimed slots are set to `null` and never reused
  private final ArrayList<State> states = new ArrayList<>();

  private int start = -1;

  /**
   * Create a fresh non-accepting state.
   *
   * @return index of the new state
   */
  public int createNode() {
    return createNode(false);
  }

  /**
   * Create a fresh state.
   *
   * @param accepting whether the state is accepting
   * @return index of the new state
   */
  public int createNode(boolean accepting) {
    states.add(new State(accepting));
    return states.size() - 1;
  }

  /**
   * Append a transition (no de-duplication is done).
   *
   * @param from source state
   * @param label event label, or {@link #EPSILON}
   * @param to target state
   */
  public void addTransition(int from, String label, int to) {
    if (label == null || label.isEmpty()) {
      throw new IllegalArgumentException("transition " + from + " -> " + to + " has no label");
    }
    final State source = state(from);
    state(to);
    source.transitions.add(new Transition(to, label));
  }

  public void addEpsilonTransition(int from, int to) {
    addTransition(from, EPSILON, to);
  }

  /**
   * Outgoing transitions of a state, in insertion order.
   *
   * @param node state whose transitions to look up
   * @return unmodifiable view of the transitions
   */
  public List<Transition> transitions(int node) {
    return Collections.unmodifiableList(state(node).transitions);
  }

  /**
   * Overwrite the outgoing transitions of a state.
   *
   * @param node state to update
   * @param transitions new outgoing transitions
   */
  void replaceTransitions(int node, List<Transition> transitions) {
    final State target = state(node);
    for (Transition transition : transitions) {
      state(transition.target());
    }
    target.transitions.clear();
    target.transitions.addAll(transitions);
    target.transitions.trimToSize();
  }

  public boolean isAccepting(int node) {
    return state(node).accepting;
  }

  public void setAccepting(int node, boolean accepting) {
    state(node).accepting = accepting;
  }

  /**
   * Mark which state the automaton starts from.
   *
   * @param node start state
   */
  public void designateStart(int node) {
    state(node);
    start = node;
  }

  /**
   * Designated start state.
   *
   * @return index of the start state
   * @throws IllegalStateException if no start state was designated
   */
  public int start() {
    if (start < 0) {
      throw new IllegalStateException("automaton has no start state");
    }
    return start;
  }

  public boolean hasStart() {
    return start >= 0;
  }

  /**
   * Does the index refer to a state which has been created and not reclaimed?
   *
   * @param node state index
   */
  public boolean contains(int node) {
    return node >= 0 && node < states.size() && states.get(node) != null;
  }

  /**
   * Number of states currently alive in the arena (reachable or not).
   */
  public int liveStateCount() {
    int count = 0;
    for (State state : states) {
      if (state != null) {
        count++;
      }
    }
    return count;
  }

  /**
   * Breadth-first enumeration of every state reachable from {@code from},
   * following transitions of any label.
   *
   * @param from state from which to start the search
   * @return reachable states, in the order they were discovered
   */
  public Set<Integer> reachable(int from) {
    final var seenStates = new LinkedHashSet<Integer>();
    final var toVisit = new LinkedList<Integer>();

    state(from);
    seenStates.add(from);
    toVisit.addLast(from);

    while (!toVisit.isEmpty()) {
      for (Transition transition : state(toVisit.removeFirst()).transitions) {
        if (seenStates.add(transition.target())) {
          toVisit.addLast(transition.target());
        }
      }
    }

    return seenStates;
  }

  /**
   * States reachable from the designated start state.
   */
  public Set<Integer> reachable() {
    return reachable(start());
  }

  /**
   * Release every state reachable from {@code from} (cycles included).
   *
   * <p>Reclaimed indices stay reserved: any later use of them, including
   * reclaiming them a second time, fails with an {@code IllegalStateException}.
   *
   * @param from root of the states to release
   * @return number of states released
   */
  public int clearGraph(int from) {
    final Set<Integer> released = reachable(from);
    for (int node : released) {
      states.get(node).transitions.clear();
      states.set(node, null);
    }
    if (start >= 0 && released.contains(start)) {
      start = -1;
    }
    logger.log(Level.FINE, "Reclaimed {0} states from {1}", new Object[] { released.size(), from });
    return released.size();
  }

  /**
   * Drop every state in the arena.
   */
  public void clear() {
    for (int i = 0; i < states.size(); i++) {
      states.set(i, null);
    }
    start = -1;
  }

  /**
   * Check whether a sequence of events can be observed starting from a state,
   * regardless of where it ends.
   *
   * @param from state from which to run
   * @param events observable event labels, in order
   * @return whether some path emits exactly those events
   */
  public boolean emits(int from, List<String> events) {
    return !run(from, events).isEmpty();
  }

  /**
   * Check whether a sequence of events leads from a state into an accepting
   * state (silent steps are allowed anywhere along the way).
   *
   * @param from state from which to run
   * @param events observable event labels, in order
   * @return whether the sequence is accepted
   */
  public boolean accepts(int from, List<String> events) {
    return run(from, events).stream().anyMatch(this::isAccepting);
  }

  private Set<Integer> run(int from, List<String> events) {
    Set<Integer> current = EpsilonElimination.epsilonClosure(this, from);
    for (String event : events) {
      final var next = new HashSet<Integer>();
      for (int node : current) {
        for (Transition transition : state(node).transitions) {
          if (transition.label().equals(event)) {
            next.addAll(EpsilonElimination.epsilonClosure(this, transition.target()));
          }
        }
      }
      if (next.isEmpty()) {
        return next;
      }
      current = next;
    }
    return current;
  }

  private State state(int node) {
    if (node < 0 || node >= states.size()) {
      throw new IllegalArgumentException("unknown state " + node);
    }
    final State state = states.get(node);
    if (state == null) {
      throw new IllegalStateException("state " + node + " has been reclaimed");
    }
    return state;
  }

  @Override
  public Stream<DotGraph.Vertex<Integer>> vertices() {
    return reachable()
      .stream()
      .map((Integer id) -> new DotGraph.Vertex<Integer>(id, isAccepting(id)));
  }

  @Override
  public Stream<DotGraph.Edge<Integer, String>> edges() {
    return reachable()
      .stream()
      .flatMap((Integer from) -> state(from)
        .transitions
        .stream()
        .map(transition -> new DotGraph.Edge<Integer, String>(from, transition.target(), transition.label())));
  }

  @Override
  public Optional<Integer> initialVertex() {
    return hasStart() ? Optional.of(start) : Optional.empty();
  }

  @Override
  public String edgeLabel(String label) {
    return Transition.escapeHtml(label);
  }
}
