package callfsm.graph;

/**
 * Labeled transition out of an automaton state.
 *
 * @param target index of the state at the other end of the transition
 * @param label observable event, or {@link Automaton#EPSILON} for a silent step
 */
public record Transition(int target, String label) {

  public boolean isEpsilon() {
    return Automaton.EPSILON.equals(label);
  }

  // Labels are rendered as HTML-like DOT labels
  static String escapeHtml(String text) {
    return text
      .replace("&", "&amp;")
      .replace("<", "&lt;")
      .replace(">", "&gt;");
  }
}
