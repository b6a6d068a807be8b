package callfsm;

/**
 * Malformed automaton description in a scenario file.
 */
public class ScenarioSyntaxException extends IllegalArgumentException {

  @java.io.Serial
  private static final long serialVersionUID = 2208449017326164413L;

  /**
   * Token which could not be parsed.
   */
  public final String token;

  public ScenarioSyntaxException(String message, String token) {
    super(message + ": '" + token + "'");
    this.token = token;
  }
}
