package callfsm.program;

import callfsm.graph.Automaton;
import callfsm.graph.EpsilonElimination;
import java.util.ArrayList;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Automaton of system calls.
 *
 * <p>Calls to the configured syscall function become {@code syscall(<n>)}
 * transitions and calls to the instrumentation hook become
 * {@code dummy_syscall(<n>)} transitions, where {@code <n>} is the constant
 * first argument ({@code ?} when it is not a constant). Everything else is
 * silent. Library calls ending the process lead to an accepting state.
 *
 * <p>Accepting states are mostly entered through silent steps here, and
 * epsilon elimination does not carry acceptance backwards. Once built, any
 * state whose epsilon-closure holds an accepting state is therefore made
 * accepting itself.
 */
public class SyscallAutomatonBuilder extends ProgramAutomatonBuilder {

  public SyscallAutomatonBuilder(CallClassifier classifier, AnalysisConfig config) {
    super(classifier, config);
  }

  @Override
  protected Optional<String> eventLabel(CallSite call) {
    final String callee = call.calleeSimpleName();
    if (callee.equals(config.syscallFunction())) {
      return Optional.of("syscall(" + argument(call.constantArgument()) + ")");
    } else if (callee.equals(config.dummySyscallFunction())) {
      return Optional.of("dummy_syscall(" + argument(call.constantArgument()) + ")");
    } else {
      return Optional.empty();
    }
  }

  @Override
  protected int visitExternalCall(int current, CallSite call) {
    final String name = call.calleeName();
    if (classifier.isLibraryCall(name)) {
      if (!classifier.isTerminatingCall(name)) {
        return current;
      }
      final int next = automaton.createNode(true);
      automaton.addTransition(current, Automaton.EPSILON, next);
      return next;
    } else {
      final int next = automaton.createNode();
      automaton.addTransition(current, Automaton.EPSILON, next);
      return next;
    }
  }

  @Override
  protected void completeAutomaton() {
    final var accepting = new ArrayList<Integer>();
    for (int node : automaton.reachable()) {
      if (EpsilonElimination.epsilonClosure(automaton, node).stream().anyMatch(automaton::isAccepting)) {
        accepting.add(node);
      }
    }
    for (int node : accepting) {
      automaton.setAccepting(node, true);
    }
  }

  private static String argument(OptionalLong constant) {
    return constant.isPresent() ? Long.toString(constant.getAsLong()) : "?";
  }
}
