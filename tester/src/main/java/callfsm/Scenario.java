package callfsm;

/**
 * Scenario read from a scenario file.
 *
 * @param automaton automaton description ({@code from>to:label} edges, {@code !n} accepting states)
 * @param events comma separated event labels to feed to the automaton ({@code -} for none)
 * @param expected expected output
 * @param source file the scenario was read from
 * @param line line of the file on which the scenario starts
 */
public record Scenario(
  String automaton,
  String events,
  String expected,
  String source,
  int line
) {

  /**
   * Output of a run: whether the events were accepted, then the number of
   * states of the merged automaton.
   */
  public static String output(boolean accepted, int stateCount) {
    return accepted + " " + stateCount;
  }

  /**
   * Is the automaton description meant to be rejected?
   */
  public boolean expectsError() {
    return expected.startsWith("error");
  }

  public String location() {
    return "[" + automaton + "] (at " + source + ":" + line + ")";
  }
}
