package callfsm;

/**
 * Told how each scenario ended. Exactly one method is called per scenario.
 */
interface ScenarioListener {

  /**
   * The scenario produced its expected output, or its automaton was rejected
   * and {@link Scenario#expectsError()} holds.
   */
  void passed(Scenario scenario);

  /**
   * The automaton or event line could not be parsed although the scenario
   * expected an output.
   *
   * @param scenario scenario being run
   * @param cause parse failure
   */
  void rejected(Scenario scenario, IllegalArgumentException cause);

  /**
   * The scenario ran but printed something else than {@link Scenario#expected()}.
   *
   * @param scenario scenario being run
   * @param actual output of the run
   */
  void mismatched(Scenario scenario, String actual);
}
