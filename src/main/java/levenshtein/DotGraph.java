package levenshtein;

import java.util.stream.Stream;

/**
 * Levenshtein automaton which can be rendered as a Graphviz digraph.
 *
 * <p>Vertices are drawn as double circles when the input that reaches them is
 * within the maximum distance of the query. The initial state is pointed at by
 * an arrow with no source.
 *
 * @param <V> states
 * @param <E> transition labels
 */
public interface DotGraph<V, E> {

  /**
   * State in the dot graph.
   *
   * @param id state, rendered with {@code toString} as the Dot ID
   * @param accepting is the state within the maximum distance?
   */
  record Vertex<V>(V id, boolean accepting) { }

  /**
   * Transition in the dot graph.
   *
   * @param from source state
   * @param to target state
   * @param label inputs taking the transition
   */
  record Edge<V, E>(V from, V to, E label) { }

  /**
   * State at which every walk starts.
   *
   * @return initial state
   */
  public V initialVertex();

  /**
   * States to draw.
   *
   * @return all vertices, each state once
   */
  public Stream<Vertex<V>> vertices();

  /**
   * Transitions to draw.
   *
   * @return edges between vertices
   */
  public Stream<Edge<V, E>> edges();

  /**
   * Render the label of a transition.
   *
   * @param edge transition
   * @return HTML label string
   */
  default String renderEdgeLabel(Edge<V, E> edge) {
    return escapeHtml(edge.label().toString());
  }

  /**
   * Render the label of a state.
   *
   * @param vertex state
   * @return HTML label string
   */
  default String renderVertexLabel(Vertex<V> vertex) {
    return escapeHtml(vertex.id().toString());
  }

  /**
   * Render a full Dot graph.
   *
   * @param name title given to the graph
   * @return source code for the graph
   */
  default String dotGraph(String name) {
    final var builder = new StringBuilder();
    builder.append("digraph " + escapeId(name) + " {\n");
    builder.append("  rankdir = LR;\n");
    builder.append("  " + START_ID + " [shape = none, label = <>];\n");

    vertices().forEachOrdered(vertex -> {
      final var shape = vertex.accepting() ? "doublecircle" : "circle";
      builder.append(
        "  " + escapeId(vertex.id().toString()) +
        " [shape = " + shape + ", label = <" + renderVertexLabel(vertex) + ">];\n"
      );
    });

    builder.append("  " + START_ID + " -> " + escapeId(initialVertex().toString()) + ";\n");
    edges().forEachOrdered(edge -> builder.append(
      "  " + escapeId(edge.from().toString()) + " -> " + escapeId(edge.to().toString()) +
      " [label = <" + renderEdgeLabel(edge) + ">];\n"
    ));

    builder.append("}");
    return builder.toString();
  }

  /**
   * Invisible vertex from which the arrow to the initial state starts.
   */
  static final String START_ID = "\"_start\"";

  /**
   * Escape text for use inside an HTML-like label.
   *
   * @param str raw text
   * @return text with markup characters replaced by entities
   */
  static String escapeHtml(String str) {
    return str
      .replace("&", "&amp;")
      .replace("<", "&lt;")
      .replace(">", "&gt;");
  }

  /**
   * Quote a Dot ID, escaping inner quotes.
   *
   * @param str string to escape into an ID
   */
  private static String escapeId(String str) {
    return "\"" + str.replace("\"", "\\\"") + "\"";
  }
}
