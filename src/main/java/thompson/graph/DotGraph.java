package thompson.graph;

import java.util.stream.Stream;

/**
 * Graphs which can be rendered using the DOT language.
 *
 * <p>Only the DOT source is produced; turning it into an image is left to
 * Graphviz.
 *
 * @param <V> vertex in the graph
 * @param <E> edge label in the graph
 */
public interface DotGraph<V, E> {

  /**
   * Vertex in the dot graph.
   *
   * @param id unique identifier for the vertex
   * @param accepting is this an accepting state?
   */
  record Vertex<V>(V id, boolean accepting) { }

  /**
   * Edge in the dot graph.
   *
   * @param from vertex where the edge starts (or a blank generated vertex if {@code null})
   * @param to vertex where the edge ends
   * @param label label on the edge (or no label if {@code null})
   */
  record Edge<V, E>(V from, V to, E label) { }

  /**
   * List out the vertices in the graph, in the order they should be emitted.
   *
   * @return all vertices
   */
  Stream<Vertex<V>> vertices();

  /**
   * List out the edges in the graph, in the order they should be emitted.
   *
   * @return all edges
   */
  Stream<Edge<V, E>> edges();

  /**
   * Render an edge label.
   *
   * @param edge edge associated with the label
   * @return HTML label string
   */
  default String renderEdgeLabel(Edge<V, E> edge) {
    final E label = edge.label();
    return label == null ? "" : escapeHtml(label.toString());
  }

  /**
   * Render the graph into its DOT source.
   *
   * @param name title given to the graph
   * @return source code for the graph
   */
  default String dotGraph(String name) {
    final var builder = new StringBuilder();
    builder.append("digraph " + escapeId(name) + " {\n");
    builder.append("  rankdir = LR;\n");

    // Vertices
    final Iterable<Vertex<V>> vs = () -> vertices().iterator();
    for (Vertex<V> vertex : vs) {
      final var id = escapeId(vertex.id().toString());
      final var shape = vertex.accepting() ? "doublecircle" : "circle";
      builder.append("  " + id + " [shape = " + shape + "];\n");
    }

    // Edges, where a missing source is a blank vertex (used to point at the start state)
    int gen = 0;
    final Iterable<Edge<V, E>> es = () -> edges().iterator();
    for (Edge<V, E> edge : es) {
      final V fromV = edge.from();
      final String from;
      if (fromV == null) {
        from = escapeId("_gen" + ++gen);
        builder.append("  " + from + " [shape = none, label = <>];\n");
      } else {
        from = escapeId(fromV.toString());
      }
      final var to = escapeId(edge.to().toString());
      builder.append("  " + from + " -> " + to + " [label = <" + renderEdgeLabel(edge) + ">];\n");
    }

    builder.append("}\n");
    return builder.toString();
  }

  /**
   * Turn a string into a Dot ID.
   *
   * <p>As per the docs, an ID can be "any double-quoted string ("...") possibly
   * containing escaped quotes (\")".
   *
   * @param str string to escape into an ID
   */
  private static String escapeId(String str) {
    return "\"" + str.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
  }

  /**
   * Escape text so it can sit inside an HTML-like label.
   *
   * @param str raw label text
   * @return text with markup characters replaced by entities
   */
  static String escapeHtml(String str) {
    return str
      .replace("&", "&amp;")
      .replace("<", "&lt;")
      .replace(">", "&gt;")
      .replace("\"", "&quot;");
  }
}
