package callfsm.graph;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Epsilon-closures and epsilon-transition elimination.
 */
public final class EpsilonElimination {

  private static final Logger logger = Logger.getLogger("callfsm.graph");

  private EpsilonElimination() { }

  /**
   * Explore all states reachable from a state using only silent transitions.
   *
   * <p>The state itself is always part of its closure. The search is
   * breadth-first and visits each state at most once, so it terminates even
   * if the silent transitions form cycles.
   *
   * @param automaton automaton containing the state
   * @param node state from which to start the search
   * @return states reachable via zero or more epsilon transitions
   */
  public static Set<Integer> epsilonClosure(Automaton automaton, int node) {
    final var closure = new HashSet<Integer>();
    final var toVisit = new LinkedList<Integer>();

    closure.add(node);
    toVisit.addLast(node);

    while (!toVisit.isEmpty()) {
      for (Transition transition : automaton.transitions(toVisit.removeFirst())) {
        if (transition.isEpsilon() && closure.add(transition.target())) {
          toVisit.addLast(transition.target());
        }
      }
    }

    return closure;
  }

  /**
   * Rewrite every state reachable from {@code start} so that its transitions
   * are exactly the labeled transitions leaving any state of its closure.
   *
   * <p>After the rewrite no reachable state has an epsilon transition left.
   * Accepting flags are not changed. States whose closure has no labeled
   * transitions end up with no transitions at all. Running the elimination a
   * second time leaves the automaton unchanged.
   *
   * @param automaton automaton to rewrite in place
   * @param start state from which all rewritten states are reachable
   */
  public static void removeEpsilonTransitions(Automaton automaton, int start) {
    final Set<Integer> allStates = automaton.reachable(start);

    // Closures must all be computed against the graph before any rewriting
    final Map<Integer, List<Transition>> rewritten = new HashMap<>();
    int removed = 0;
    for (int node : allStates) {
      final var labeled = new ArrayList<Transition>();
      for (int closureNode : sorted(epsilonClosure(automaton, node))) {
        for (Transition transition : automaton.transitions(closureNode)) {
          if (!transition.isEpsilon()) {
            labeled.add(transition);
          }
        }
      }
      for (Transition transition : automaton.transitions(node)) {
        if (transition.isEpsilon()) {
          removed++;
        }
      }
      rewritten.put(node, labeled);
    }

    for (Map.Entry<Integer, List<Transition>> entry : rewritten.entrySet()) {
      automaton.replaceTransitions(entry.getKey(), entry.getValue());
    }

    logger.log(
      Level.FINE,
      "Removed {0} epsilon transitions across {1} states",
      new Object[] { removed, allStates.size() }
    );
  }

  // The closure's own order is unspecified; sort it so the rewritten lists are stable
  private static List<Integer> sorted(Set<Integer> states) {
    final var list = new ArrayList<Integer>(states);
    list.sort(null);
    return list;
  }
}
