package thompson.graph;

/**
 * Partially built sub-automaton, only alive while the NFA is being built.
 *
 * <p>The accept state never has outgoing transitions until the fragment is
 * combined into a larger one.
 *
 * @param start state where the fragment is entered
 * @param accept state where the fragment is exited
 * @param <Q> states in the automata
 */
public record Fragment<Q>(Q start, Q accept) { }
