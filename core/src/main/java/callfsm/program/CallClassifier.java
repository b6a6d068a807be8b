package callfsm.program;

/**
 * Decides which called functions are library calls.
 *
 * <p>Builders consult the classifier to choose transition labels; the automaton
 * itself never interprets labels.
 */
public interface CallClassifier {

  /**
   * Is the function part of the system library (rather than of the program)?
   *
   * @param calleeName human readable name of the called function
   */
  boolean isLibraryCall(String calleeName);

  /**
   * Does calling the function end the process?
   *
   * @param calleeName human readable name of the called function
   */
  boolean isTerminatingCall(String calleeName);
}
