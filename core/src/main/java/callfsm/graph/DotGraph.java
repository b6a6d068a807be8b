package callfsm.graph;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * State machine which can be rendered in the DOT language.
 *
 * <p>Rendering never mutates the machine. Parallel edges and self-loops are
 * written out as they are found.
 *
 * @param <V> vertex identifier
 * @param <E> edge label
 */
public interface DotGraph<V, E> {

  /**
   * Vertex of the rendered machine.
   *
   * @param id identifier, unique within the machine
   * @param accepting whether the vertex is drawn as a final state
   */
  record Vertex<V>(V id, boolean accepting) { }

  /**
   * Labeled edge between two vertices.
   */
  record Edge<V, E>(V from, V to, E label) { }

  Stream<Vertex<V>> vertices();

  Stream<Edge<V, E>> edges();

  /**
   * Vertex which gets an incoming arrow from nowhere, if any.
   */
  Optional<V> initialVertex();

  /**
   * HTML-like label of an edge.
   */
  default String edgeLabel(E label) {
    return label.toString();
  }

  /**
   * Render the machine into DOT source.
   *
   * <p>Compile the output using {@code dot -Tsvg cfg.dot > cfg.svg}.
   *
   * @param name title of the graph
   * @return DOT source
   */
  default String dotGraph(String name) {
    final var builder = new StringBuilder();
    try {
      writeDotGraph(name, builder);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    return builder.toString();
  }

  /**
   * Stream the DOT source of the machine.
   *
   * @param name title of the graph
   * @param out destination of the source
   */
  default void writeDotGraph(String name, Appendable out) throws IOException {
    out.append("digraph ").append(quote(name)).append(" {\n");
    out.append("  rankdir = LR;\n");
    out.append("  node [shape = circle];\n");

    for (Iterator<Vertex<V>> it = vertices().iterator(); it.hasNext(); ) {
      final Vertex<V> vertex = it.next();
      out.append("  ").append(quote(vertex.id()));
      if (vertex.accepting()) {
        out.append(" [shape = doublecircle]");
      }
      out.append(";\n");
    }

    final Optional<V> initial = initialVertex();
    if (initial.isPresent()) {
      out.append("  \"__start\" [shape = point];\n");
      out.append("  \"__start\" -> ").append(quote(initial.get())).append(";\n");
    }

    for (Iterator<Edge<V, E>> it = edges().iterator(); it.hasNext(); ) {
      final Edge<V, E> edge = it.next();
      out
        .append("  ")
        .append(quote(edge.from()))
        .append(" -> ")
        .append(quote(edge.to()))
        .append(" [label = <")
        .append(edgeLabel(edge.label()))
        .append(">];\n");
    }

    out.append("}\n");
  }

  // DOT IDs are double-quoted strings in which only quotes need escaping
  private static String quote(Object id) {
    return "\"" + id.toString().replace("\"", "\\\"") + "\"";
  }
}
