package callfsm;

import callfsm.graph.Automaton;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Parses the one-line automaton descriptions used in scenario files.
 *
 * <p>Tokens are separated by whitespace. {@code 3>4:call:foo} adds a
 * transition from state 3 to state 4 labeled {@code call:foo} (the label
 * {@code ε} or {@code eps} is a silent transition) and {@code !4} marks state
 * 4 as accepting. States are numbered from {@code 0}, which is the start
 * state; every state up to the largest number mentioned is created, so
 * numbers above {@link #MAX_STATE} are rejected.
 */
public final class ScenarioParser {

  /** Largest state number a description may mention. */
  static final int MAX_STATE = 1 << 16;

  private ScenarioParser() { }

  record Edge(int from, int to, String label) { }

  /**
   * Build the automaton described by a line.
   *
   * @param description automaton description
   * @return automaton whose designated start state is {@code 0}
   * @throws ScenarioSyntaxException if a token is malformed
   */
  public static Automaton parseAutomaton(String description) {
    final var edges = new ArrayList<Edge>();
    final var accepting = new ArrayList<Integer>();
    int maxState = 0;

    for (String token : description.strip().split("\\s+")) {
      if (token.isEmpty()) {
        continue;
      } else if (token.startsWith("!")) {
        final int state = parseState(token.substring(1), token);
        accepting.add(state);
        maxState = Math.max(maxState, state);
      } else {
        final int arrow = token.indexOf('>');
        final int colon = token.indexOf(':', arrow + 1);
        if (arrow < 0 || colon < 0 || colon == token.length() - 1) {
          throw new ScenarioSyntaxException("expected 'from>to:label'", token);
        }
        final int from = parseState(token.substring(0, arrow), token);
        final int to = parseState(token.substring(arrow + 1, colon), token);
        String label = token.substring(colon + 1);
        if (label.equals("eps")) {
          label = Automaton.EPSILON;
        }
        edges.add(new Edge(from, to, label));
        maxState = Math.max(maxState, Math.max(from, to));
      }
    }

    final var automaton = new Automaton();
    for (int i = 0; i <= maxState; i++) {
      automaton.createNode();
    }
    automaton.designateStart(0);
    for (int state : accepting) {
      automaton.setAccepting(state, true);
    }
    for (Edge edge : edges) {
      automaton.addTransition(edge.from(), edge.label(), edge.to());
    }
    return automaton;
  }

  /**
   * Split an input line into event labels.
   *
   * @param input comma separated labels, or {@code -} for the empty sequence
   */
  public static List<String> parseEvents(String input) {
    final String trimmed = input.strip();
    if (trimmed.equals("-")) {
      return List.of();
    }
    return Arrays.asList(trimmed.split("\\s*,\\s*"));
  }

  private static int parseState(String state, String token) {
    try {
      final int parsed = Integer.parseInt(state);
      if (parsed < 0) {
        throw new ScenarioSyntaxException("negative state", token);
      } else if (parsed > MAX_STATE) {
        throw new ScenarioSyntaxException("state number above " + MAX_STATE, token);
      }
      return parsed;
    } catch (NumberFormatException e) {
      throw new ScenarioSyntaxException("expected a state number", token);
    }
  }
}
