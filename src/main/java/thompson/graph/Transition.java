package thompson.graph;

import java.util.Optional;

/**
 * Edge in an NFA.
 *
 * @param from state where the transition starts
 * @param symbol input symbol consumed, or empty for an epsilon transition
 * @param to state where the transition ends
 */
public record Transition(int from, Optional<Character> symbol, int to) {

  /**
   * Label used when printing epsilon transitions.
   */
  public static final String EPSILON = "ε";

  public static Transition ofSymbol(int from, char symbol, int to) {
    return new Transition(from, Optional.of(symbol), to);
  }

  public static Transition epsilon(int from, int to) {
    return new Transition(from, Optional.empty(), to);
  }

  public boolean isEpsilon() {
    return symbol.isEmpty();
  }

  public String label() {
    return symbol.map(Object::toString).orElse(EPSILON);
  }

  @Override
  public String toString() {
    return from + " --" + label() + "--> " + to;
  }
}
