package callfsm.program;

import callfsm.graph.Automaton;

/**
 * Raw interprocedural control-flow automaton, with syscall events but without
 * accepting states.
 */
public class ControlFlowAutomatonBuilder extends SyscallAutomatonBuilder {

  public ControlFlowAutomatonBuilder(CallClassifier classifier, AnalysisConfig config) {
    super(classifier, config);
  }

  @Override
  protected boolean acceptAtEntryExit() {
    return false;
  }

  @Override
  protected int visitExternalCall(int current, CallSite call) {
    if (classifier.isLibraryCall(call.calleeName())) {
      return current;
    }
    final int next = automaton.createNode();
    automaton.addTransition(current, Automaton.EPSILON, next);
    return next;
  }
}
