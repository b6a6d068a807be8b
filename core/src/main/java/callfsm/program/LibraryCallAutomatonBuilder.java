package callfsm.program;

import callfsm.graph.Automaton;

/**
 * Automaton of library calls, calls between functions of the program and
 * returns from them.
 *
 * <p>Library calls become {@code call:<name>} transitions (into an accepting
 * state if the call ends the process), calls into the program become
 * {@code call:<name>} transitions into the callee and returns become
 * {@code ret:<name>} transitions. Calls to other external functions are
 * silent.
 */
public class LibraryCallAutomatonBuilder extends ProgramAutomatonBuilder {

  public static final String CALL_PREFIX = "call:";
  public static final String RETURN_PREFIX = "ret:";

  public LibraryCallAutomatonBuilder(CallClassifier classifier, AnalysisConfig config) {
    super(classifier, config);
  }

  @Override
  protected String callLabel(FunctionModel callee) {
    return CALL_PREFIX + callee.name();
  }

  @Override
  protected String returnLabel(FunctionModel function) {
    return RETURN_PREFIX + function.name();
  }

  @Override
  protected int visitExternalCall(int current, CallSite call) {
    final String name = call.calleeName();
    if (classifier.isLibraryCall(name)) {
      final int next = automaton.createNode(classifier.isTerminatingCall(name));
      automaton.addTransition(current, CALL_PREFIX + name, next);
      return next;
    } else {
      final int next = automaton.createNode();
      automaton.addTransition(current, Automaton.EPSILON, next);
      return next;
    }
  }
}
