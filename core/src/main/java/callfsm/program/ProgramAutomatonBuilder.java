package callfsm.program;

import callfsm.graph.Automaton;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Walks the control and call structure of a program and builds the
 * corresponding automaton.
 *
 * <p>The shape of the automaton is shared by all analyses: a start state with
 * a silent transition into the entry function, one state per basic block, one
 * exit state per function, and a chain of fresh states through the calls of
 * each block. Calls to functions defined in the program jump into the callee
 * and come back through the callee's exit state. Which transitions are
 * observable, and what they are called, is left to subclasses.
 *
 * <p>A builder may only be used once.
 */
public abstract class ProgramAutomatonBuilder {

  private static final Logger logger = Logger.getLogger("callfsm.program");

  record BlockKey(String function, int block) { }

  protected final CallClassifier classifier;
  protected final AnalysisConfig config;

  /**
   * Automaton under construction.
   */
  protected final Automaton automaton = new Automaton();

  private final Map<BlockKey, Integer> blockNodes = new HashMap<>();
  private final Map<String, Integer> exitNodes = new HashMap<>();
  private boolean used = false;

  protected ProgramAutomatonBuilder(CallClassifier classifier, AnalysisConfig config) {
    this.classifier = classifier;
    this.config = config;
  }

  /**
   * Label of the transition from a call site into a callee defined in the
   * program.
   *
   * @param callee function being called
   */
  protected String callLabel(FunctionModel callee) {
    return Automaton.EPSILON;
  }

  /**
   * Label of the transition from a returning block to its function's exit.
   *
   * @param function function returning
   */
  protected String returnLabel(FunctionModel function) {
    return Automaton.EPSILON;
  }

  /**
   * Label of a call that is observable as an event by itself, whether or not
   * the callee is defined in the program.
   *
   * @param call call site
   * @return event label, or empty if the call is handled like any other call
   */
  protected Optional<String> eventLabel(CallSite call) {
    return Optional.empty();
  }

  /**
   * Should the exit of the entry function be accepting?
   */
  protected boolean acceptAtEntryExit() {
    return true;
  }

  /**
   * Handle a call to a function which is not defined in the program.
   *
   * @param current state reached right before the call
   * @param call call site
   * @return state reached right after the call
   */
  protected abstract int visitExternalCall(int current, CallSite call);

  /**
   * Last adjustments once every function has been walked.
   */
  protected void completeAutomaton() { }

  /**
   * Build the automaton of a program.
   *
   * @param program program to analyze
   * @return automaton, with its start state designated
   * @throws IllegalArgumentException if the program has no entry function
   */
  public Automaton build(ProgramModel program) {
    if (used) {
      throw new IllegalStateException("build may only be called once on an automaton builder");
    } else {
      used = true;
    }

    final int start = automaton.createNode();
    automaton.designateStart(start);

    for (FunctionModel function : program.functions()) {
      if (!function.isDeclaration()) {
        blockNodes.put(new BlockKey(function.id(), 0), automaton.createNode());
      }
    }
    for (FunctionModel function : program.functions()) {
      if (!function.isDeclaration()) {
        exitNodes.put(function.id(), automaton.createNode());
      }
    }

    final FunctionModel entryFunction = program.entryFunction(config.entryFunction());
    if (acceptAtEntryExit()) {
      automaton.setAccepting(exitNodes.get(entryFunction.id()), true);
    }
    automaton.addEpsilonTransition(start, blockNode(entryFunction, 0));

    for (FunctionModel function : program.functions()) {
      if (function.isDeclaration()) {
        continue;
      }

      for (BlockModel block : function.blocks()) {
        final int last = scanCalls(program, function, block);
        if (block.returns()) {
          automaton.addTransition(last, returnLabel(function), exitNodes.get(function.id()));
        }
        for (int successor : block.successors()) {
          automaton.addEpsilonTransition(last, blockNode(function, successor));
        }
      }
    }

    completeAutomaton();

    logger.log(
      Level.FINE,
      "Built automaton for {0} with {1} states",
      new Object[] { program.name, automaton.liveStateCount() }
    );
    return automaton;
  }

  /**
   * Chain the calls of a block.
   *
   * @return state reached at the end of the block
   */
  private int scanCalls(ProgramModel program, FunctionModel function, BlockModel block) {
    int current = blockNode(function, block.index());

    for (CallSite call : block.calls()) {

      // Direct recursion loops back to the entry (there is no matching return)
      if (call.calleeId().equals(function.id())) {
        automaton.addEpsilonTransition(current, blockNode(function, 0));
        continue;
      }

      final Optional<String> event = eventLabel(call);
      if (event.isPresent()) {
        final int next = automaton.createNode();
        automaton.addTransition(current, event.get(), next);
        current = next;
        continue;
      }

      final Optional<FunctionModel> callee = program.definedFunction(call.calleeId());
      if (callee.isPresent()) {
        automaton.addTransition(current, callLabel(callee.get()), blockNode(callee.get(), 0));
        final int next = automaton.createNode();
        automaton.addEpsilonTransition(exitNodes.get(callee.get().id()), next);
        current = next;
      } else {
        current = visitExternalCall(current, call);
      }
    }

    return current;
  }

  private int blockNode(FunctionModel function, int block) {
    if (block < 0 || block >= function.blocks().size()) {
      throw new IllegalArgumentException(function.name() + " has no block " + block);
    }
    return blockNodes.computeIfAbsent(new BlockKey(function.id(), block), key -> automaton.createNode());
  }
}
