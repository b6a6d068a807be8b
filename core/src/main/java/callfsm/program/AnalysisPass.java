package callfsm.program;

import callfsm.graph.Automaton;
import callfsm.graph.EpsilonElimination;
import callfsm.graph.StateMerger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Analyses which can be run on a program. Each one pairs a builder with the
 * transformations applied to the automaton it produces.
 */
public enum AnalysisPass {

  /**
   * Interprocedural control flow, rendered as built.
   */
  CFG("cfg") {
    @Override
    public ProgramAutomatonBuilder newBuilder(CallClassifier classifier, AnalysisConfig config) {
      return new ControlFlowAutomatonBuilder(classifier, config);
    }

    @Override
    Automaton simplify(Automaton automaton) {
      return automaton;
    }
  },

  /**
   * System calls, with silent transitions eliminated.
   */
  SYSCALL("syscall") {
    @Override
    public ProgramAutomatonBuilder newBuilder(CallClassifier classifier, AnalysisConfig config) {
      return new SyscallAutomatonBuilder(classifier, config);
    }

    @Override
    Automaton simplify(Automaton automaton) {
      EpsilonElimination.removeEpsilonTransitions(automaton, automaton.start());
      return automaton;
    }
  },

  /**
   * Library calls, with silent transitions eliminated and states merged.
   */
  LIBC("libc") {
    @Override
    public ProgramAutomatonBuilder newBuilder(CallClassifier classifier, AnalysisConfig config) {
      return new LibraryCallAutomatonBuilder(classifier, config);
    }

    @Override
    Automaton simplify(Automaton automaton) {
      final int start = automaton.start();
      EpsilonElimination.removeEpsilonTransitions(automaton, start);
      return StateMerger.mergeEquivalentStates(automaton, start);
    }
  };

  private static final Logger logger = Logger.getLogger("callfsm.program");

  /**
   * Name used on the command line.
   */
  public final String passName;

  AnalysisPass(String passName) {
    this.passName = passName;
  }

  /**
   * Create a fresh builder for this analysis.
   *
   * @param classifier library call classification
   * @param config analysis settings
   */
  public abstract ProgramAutomatonBuilder newBuilder(CallClassifier classifier, AnalysisConfig config);

  abstract Automaton simplify(Automaton automaton);

  /**
   * Build and simplify the automaton of a program.
   *
   * @param program program to analyze
   * @param classifier library call classification
   * @param config analysis settings
   * @return final automaton (the one built first may have been consumed)
   */
  public Automaton run(ProgramModel program, CallClassifier classifier, AnalysisConfig config) {
    final Automaton built = newBuilder(classifier, config).build(program);
    final Automaton result = simplify(built);
    logger.log(
      Level.FINE,
      "{0} pass on {1}: {2} reachable states",
      new Object[] { passName, program.name, result.reachable().size() }
    );
    return result;
  }

  /**
   * Look up a pass by its command line name.
   *
   * @param passName name of the pass
   * @throws IllegalArgumentException if no pass has that name
   */
  public static AnalysisPass forName(String passName) {
    for (AnalysisPass pass : values()) {
      if (pass.passName.equals(passName)) {
        return pass;
      }
    }
    throw new IllegalArgumentException("unknown pass '" + passName + "'");
  }
}
