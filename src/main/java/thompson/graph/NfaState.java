package thompson.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;

/**
 * State in a finished NFA along with its outgoing transitions.
 *
 * <p>The maps and sets are expected to be unmodifiable (see
 * {@link Nfa.Builder#constructNfa}).
 *
 * @param id identifier of the state, also its index in {@link Nfa#states}
 * @param symbolTransitions destination states, indexed by input symbol
 * @param epsilonTransitions destination states reachable without consuming input
 */
public record NfaState(
  int id,
  SortedMap<Character, SortedSet<Integer>> symbolTransitions,
  SortedSet<Integer> epsilonTransitions
) {

  /**
   * Destinations reachable from this state on an input symbol.
   *
   * @param symbol input symbol
   * @return destination states (possibly empty)
   */
  public SortedSet<Integer> onSymbol(char symbol) {
    return symbolTransitions.getOrDefault(symbol, Collections.emptySortedSet());
  }

  public boolean hasTransitions() {
    return !symbolTransitions.isEmpty() || !epsilonTransitions.isEmpty();
  }

  /**
   * Outgoing transitions in display order.
   *
   * <p>Symbol transitions come first, ascending by destination (then by
   * symbol), followed by epsilon transitions ascending by destination.
   *
   * @return ordered outgoing transitions
   */
  public List<Transition> transitions() {
    final var output = new ArrayList<Transition>();
    for (Map.Entry<Character, SortedSet<Integer>> entry : symbolTransitions.entrySet()) {
      for (int to : entry.getValue()) {
        output.add(Transition.ofSymbol(id, entry.getKey(), to));
      }
    }
    // Entries are grouped by symbol, so re-sort on destination (the sort is stable)
    output.sort((t1, t2) -> Integer.compare(t1.to(), t2.to()));

    for (int to : epsilonTransitions) {
      output.add(Transition.epsilon(id, to));
    }
    return output;
  }
}
