package thompson.graph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.Stack;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import thompson.parser.PostfixConverter;
import thompson.parser.Token;

/**
 * Non-deterministic finite state automaton built with Thompson's construction.
 *
 * The states are represented using consecutive integer values starting at 0,
 * in the order they were allocated during construction. Transitions either
 * consume a single input symbol or are epsilon transitions. There is exactly
 * one initial state and one final (accepting) state.
 */
public final class Nfa implements DotGraph<Integer, Transition> {

  /**
   * States, indexed by their ID.
   *
   * This list is not modifiable and supports fast random access. Every state
   * referenced by a transition is in the list.
   */
  public final List<NfaState> states;

  /**
   * Index of the initial state inside {@code states}.
   */
  public final int initialState;

  /**
   * Index of the final state inside {@code states}.
   *
   * The final state has no outgoing transitions. It is the same as the initial
   * state only for the empty pattern.
   */
  public final int finalState;

  private Nfa(List<NfaState> states, int initialState, int finalState) {
    this.states = states;
    this.initialState = initialState;
    this.finalState = finalState;
  }

  /**
   * Build an NFA from a regular expression pattern.
   *
   * @param pattern regular expression to parse
   * @return NFA accepting the language of the pattern
   */
  public static Nfa parse(String pattern) throws PatternSyntaxException {
    return parse(pattern, false);
  }

  /**
   * Build an NFA from a regular expression pattern.
   *
   * @param pattern regular expression to parse
   * @param printDebugInfo print to STDERR a trace of the construction
   * @return NFA accepting the language of the pattern
   */
  public static Nfa parse(String pattern, boolean printDebugInfo) throws PatternSyntaxException {
    final List<Token> postfix = PostfixConverter.parse(pattern);
    if (printDebugInfo) {
      System.err.println("[NFA] postfix form of /" + pattern + "/ is " + Token.render(postfix));
    }
    return new Builder(printDebugInfo).constructNfa(postfix);
  }

  /**
   * Arena-backed builder: states are indices into growing lists of
   * transitions, handed out in increasing order.
   */
  public static class Builder extends ThompsonBuilder<Integer> {

    private boolean used = false;
    private final List<SortedMap<Character, SortedSet<Integer>>> symbolTransitions = new ArrayList<>();
    private final List<SortedSet<Integer>> epsilonTransitions = new ArrayList<>();

    public Builder() {
      this(false);
    }

    public Builder(boolean printDebugInfo) {
      super(printDebugInfo);
    }

    @Override
    Integer freshState() {
      final int state = symbolTransitions.size();
      symbolTransitions.add(new TreeMap<>());
      epsilonTransitions.add(new TreeSet<>());
      return state;
    }

    @Override
    void addSymbolTransition(Integer from, char symbol, Integer to) {
      symbolTransitions
        .get(from)
        .computeIfAbsent(symbol, c -> new TreeSet<>())
        .add(to);
    }

    @Override
    void addEpsilonTransition(Integer from, Integer to) {
      epsilonTransitions.get(from).add(to);
    }

    /**
     * Finalize the construction of the NFA.
     *
     * @param postfix postfix token stream
     * @return valid NFA
     */
    public Nfa constructNfa(List<Token> postfix) {
      if (used) {
        throw new IllegalStateException("construct may only be called once on an NFA builder");
      } else {
        used = true;
      }

      // An empty pattern is a single state which is both initial and final
      final Fragment<Integer> whole = build(postfix).orElseGet(() -> {
        final Integer only = freshState();
        return new Fragment<>(only, only);
      });

      // Defensively prevent updates to the states
      final var states = new ArrayList<NfaState>(symbolTransitions.size());
      for (int id = 0; id < symbolTransitions.size(); id++) {
        final var symbols = symbolTransitions.get(id);
        symbols.replaceAll((symbol, targets) -> Collections.unmodifiableSortedSet(targets));
        states.add(new NfaState(
          id,
          Collections.unmodifiableSortedMap(symbols),
          Collections.unmodifiableSortedSet(epsilonTransitions.get(id))
        ));
      }

      if (printDebugInfo) {
        System.err.println("[NFA] built " + states.size() + " states, initial " + whole.start() + ", final " + whole.accept());
      }

      return new Nfa(Collections.unmodifiableList(states), whole.start(), whole.accept());
    }
  }

  /**
   * All transitions in display order.
   *
   * States are in ascending order. Within a state, symbol transitions come
   * before epsilon transitions (see {@link NfaState#transitions()}).
   *
   * @return ordered transitions
   */
  public List<Transition> transitions() {
    return states
      .stream()
      .flatMap(state -> state.transitions().stream())
      .collect(Collectors.toUnmodifiableList());
  }

  /**
   * Explore all states reachable via epsilon transitions only.
   *
   * @param startingStates states from which to initiate the search (included in the output)
   * @return states reachable without consuming input
   */
  public SortedSet<Integer> epsilonClosure(Collection<Integer> startingStates) {
    final var seenStates = new TreeSet<Integer>(startingStates);
    final var toVisit = new Stack<Integer>();
    toVisit.addAll(startingStates);

    while (!toVisit.isEmpty()) {
      final int next = toVisit.pop();
      for (int to : states.get(next).epsilonTransitions()) {
        if (seenStates.add(to)) {
          toVisit.push(to);
        }
      }
    }

    return seenStates;
  }

  /**
   * Explore all states reachable from the initial state along any transition.
   *
   * @return reachable states, including the initial one
   */
  public SortedSet<Integer> reachableStates() {
    final var seenStates = new TreeSet<Integer>();
    final var toVisit = new Stack<Integer>();
    seenStates.add(initialState);
    toVisit.push(initialState);

    while (!toVisit.isEmpty()) {
      for (Transition transition : states.get(toVisit.pop()).transitions()) {
        if (seenStates.add(transition.to())) {
          toVisit.push(transition.to());
        }
      }
    }

    return seenStates;
  }

  /**
   * Run the NFA on an input, tracking the set of active states.
   *
   * @param input input string
   * @param printDebugInfo print to STDERR a trace of what is happening
   * @return whether the whole input is accepted
   */
  public boolean checkSimulate(CharSequence input, boolean printDebugInfo) {
    Set<Integer> currentStates = epsilonClosure(List.of(initialState));

    if (printDebugInfo) {
      System.err.println("[NFA] starting run on: " + input);
      System.err.println("[NFA] entering " + currentStates);
    }

    for (int position = 0; position < input.length(); position++) {
      final char symbol = input.charAt(position);
      final var nextStates = new TreeSet<Integer>();
      for (int state : currentStates) {
        nextStates.addAll(states.get(state).onSymbol(symbol));
      }

      if (nextStates.isEmpty()) {
        if (printDebugInfo) {
          System.err.println("[NFA] ending run at " + currentStates + "; no transition for " + symbol);
        }
        return false;
      }

      currentStates = epsilonClosure(nextStates);
      if (printDebugInfo) {
        System.err.println("[NFA] entering " + currentStates);
      }
    }

    return currentStates.contains(finalState);
  }

  /**
   * Render the NFA as a human readable listing of its transitions.
   *
   * @return lines for the initial state, final state, and every transition
   */
  public String transitionTable() {
    final var builder = new StringBuilder();
    builder.append("Start: " + initialState + "\n");
    builder.append("Accept: " + finalState + "\n");
    builder.append("Transitions:\n");
    for (Transition transition : transitions()) {
      builder.append(transition + "\n");
    }
    return builder.toString();
  }

  @Override
  public String toString() {
    return transitionTable();
  }

  @Override
  public Stream<DotGraph.Vertex<Integer>> vertices() {
    return states
      .stream()
      .map((NfaState state) -> new DotGraph.Vertex<Integer>(state.id(), state.id() == finalState));
  }

  @Override
  public Stream<DotGraph.Edge<Integer, Transition>> edges() {
    final var transitionEdges = transitions()
      .stream()
      .map((Transition transition) -> new DotGraph.Edge<>(transition.from(), transition.to(), transition));
    final var initialEdge = Stream
      .of(new DotGraph.Edge<Integer, Transition>(null, initialState, null));
    return Stream.concat(initialEdge, transitionEdges);
  }

  @Override
  public String renderEdgeLabel(DotGraph.Edge<Integer, Transition> edge) {
    final Transition label = edge.label();
    if (label == null) {
      return "";
    } else if (label.isEpsilon()) {
      return "&epsilon;";
    } else {
      return DotGraph.escapeHtml(label.label());
    }
  }
}
