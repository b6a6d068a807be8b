package callfsm.graph;

import java.util.HashMap;
import java.util.LinkedList;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Merges states reached under the same label into single states, using a
 * powerset (subset) construction.
 *
 * <p>Every state of the output stands for a set of states of the input. The
 * output has at most one transition per label out of any state, and a merged
 * state is accepting iff one of its members was. No further minimization is
 * attempted: two merged states with the same behaviour but different members
 * stay distinct.
 */
public final class StateMerger {

  private static final Logger logger = Logger.getLogger("callfsm.graph");

  private StateMerger() { }

  /**
   * Construct the merged automaton.
   *
   * <p>The input is consumed: every state reachable from {@code start} is
   * reclaimed once the new automaton is built. Epsilon is handled as an
   * ordinary label, so callers normally eliminate epsilon transitions first.
   *
   * <p>State IDs of the output are assigned in discovery order, starting
   * with {@code 0} for the start state. Out of each state, transitions are
   * added in lexicographic order of their labels.
   *
   * @param input automaton to merge
   * @param start start state in {@code input}
   * @return new automaton, whose designated start state is {@code 0}
   */
  public static Automaton mergeEquivalentStates(Automaton input, int start) {
    final Set<Integer> originalStates = input.reachable(start);

    final var output = new Automaton();
    final var mergedStates = new HashMap<StateSet, Integer>();
    final var toVisit = new LinkedList<StateSet>();

    final var initialState = StateSet.of(start);
    final int initialNode = output.createNode(anyAccepting(input, initialState));
    output.designateStart(initialNode);
    mergedStates.put(initialState, initialNode);
    toVisit.addLast(initialState);

    while (!toVisit.isEmpty()) {
      final StateSet powerState = toVisit.removeFirst();
      final int from = mergedStates.get(powerState);

      // Union of the targets of each label out of the constituent states
      final SortedMap<String, TreeSet<Integer>> targetsByLabel = new TreeMap<>();
      powerState.stream().forEach((int member) -> {
        for (Transition transition : input.transitions(member)) {
          targetsByLabel
            .computeIfAbsent(transition.label(), label -> new TreeSet<>())
            .add(transition.target());
        }
      });

      for (Map.Entry<String, TreeSet<Integer>> entry : targetsByLabel.entrySet()) {
        final var targetState = new StateSet(entry.getValue());
        if (targetState.isEmpty()) {
          continue;
        }

        Integer to = mergedStates.get(targetState);
        if (to == null) {
          to = output.createNode(anyAccepting(input, targetState));
          mergedStates.put(targetState, to);
          toVisit.addLast(targetState);
        }
        output.addTransition(from, entry.getKey(), to);
      }
    }

    logger.log(
      Level.FINE,
      "Merged {0} states into {1}",
      new Object[] { originalStates.size(), mergedStates.size() }
    );

    input.clearGraph(start);
    return output;
  }

  private static boolean anyAccepting(Automaton automaton, StateSet states) {
    return states.stream().anyMatch(automaton::isAccepting);
  }
}
