package callfsm;

import callfsm.graph.Automaton;
import callfsm.graph.EpsilonElimination;
import callfsm.graph.StateMerger;
import java.util.List;
import java.util.function.Consumer;

/**
 * Runs scenarios: each automaton goes through epsilon elimination and state
 * merging, then its events are run on the merged automaton.
 */
public class TestRunner implements Consumer<Scenario> {

  final ScenarioListener listener;

  public TestRunner(ScenarioListener listener) {
    this.listener = listener;
  }

  @Override
  public void accept(Scenario scenario) {

    // Build the automaton
    final Automaton automaton;
    final List<String> events;
    try {
      automaton = ScenarioParser.parseAutomaton(scenario.automaton());
      events = ScenarioParser.parseEvents(scenario.events());
    } catch (IllegalArgumentException error) {
      if (scenario.expectsError()) {
        listener.passed(scenario);
      } else {
        listener.rejected(scenario, error);
      }
      return;
    }

    // Simplify
    final int start = automaton.start();
    EpsilonElimination.removeEpsilonTransitions(automaton, start);
    final Automaton merged = StateMerger.mergeEquivalentStates(automaton, start);

    // Compare the outputs
    final boolean accepted = merged.accepts(merged.start(), events);
    final String foundOutput = Scenario.output(accepted, merged.reachable().size());
    merged.clear();
    if (scenario.expected().equals(foundOutput)) {
      listener.passed(scenario);
    } else {
      listener.mismatched(scenario, foundOutput);
    }
  }
}
