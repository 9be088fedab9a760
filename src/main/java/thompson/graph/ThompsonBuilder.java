package thompson.graph;

import java.util.List;
import java.util.Optional;
import java.util.Stack;
import thompson.parser.Token;

/**
 * Postfix token consumer which builds up the corresponding NFA using
 * Thompson's construction.
 *
 * <p>The choice of how to represent the NFA is left abstract: subclasses
 * decide what a state is and how transitions get recorded. This class only
 * keeps the stack of fragments and decides which states and transitions each
 * token calls for. Fresh states are always requested in pairs, start first
 * and then accept, so an implementation handing out increasing identifiers
 * produces the same numbering for the same pattern every time.
 *
 * @param <Q> states in the automata
 */
public abstract class ThompsonBuilder<Q> {

  private final Stack<Fragment<Q>> fragments = new Stack<>();

  /**
   * Print to STDERR a trace of each fragment as it is built.
   */
  protected final boolean printDebugInfo;

  protected ThompsonBuilder(boolean printDebugInfo) {
    this.printDebugInfo = printDebugInfo;
  }

  /**
   * Summon a fresh state identifier.
   *
   * @return fresh state ID
   */
  abstract Q freshState();

  /**
   * Register a transition which consumes one input symbol.
   *
   * @param from state at the start of the transition
   * @param symbol input symbol
   * @param to state at the other end of the transition
   */
  abstract void addSymbolTransition(Q from, char symbol, Q to);

  /**
   * Register a transition which consumes no input.
   *
   * @param from state at the start of the transition
   * @param to state at the other end of the transition
   */
  abstract void addEpsilonTransition(Q from, Q to);

  /**
   * Consume a whole postfix stream.
   *
   * @param postfix tokens in postfix order
   * @return the single remaining fragment, or empty if there were no tokens
   */
  public Optional<Fragment<Q>> build(List<Token> postfix) {
    for (Token token : postfix) {
      accept(token);
    }

    if (fragments.isEmpty()) {
      return Optional.empty();
    } else if (fragments.size() > 1) {
      throw new InternalConsistencyException(
        fragments.size() + " fragments left after consuming the postfix stream"
      );
    }
    return Optional.of(fragments.pop());
  }

  /**
   * Consume the next postfix token.
   *
   * @param token next token
   */
  public void accept(Token token) {
    final Fragment<Q> built;
    switch (token.kind()) {
      case LITERAL:
        built = visitLiteral(token.symbol());
        break;
      case CONCAT: {
        final Fragment<Q> rhs = pop(token);
        final Fragment<Q> lhs = pop(token);
        built = visitConcatenation(lhs, rhs);
        break;
      }
      case UNION: {
        final Fragment<Q> rhs = pop(token);
        final Fragment<Q> lhs = pop(token);
        built = visitUnion(lhs, rhs);
        break;
      }
      case STAR:
        built = visitKleene(pop(token));
        break;
      case PLUS:
        built = visitPlus(pop(token));
        break;
      case OPTIONAL:
        built = visitOptional(pop(token));
        break;
      default:
        throw new InternalConsistencyException(
          "unexpected " + token.kind() + " token at " + token.index() + " in a postfix stream"
        );
    }

    if (printDebugInfo) {
      System.err.println("[Thompson] " + token.kind() + " `" + token.render() + "` -> " + built);
    }
    fragments.push(built);
  }

  private Fragment<Q> pop(Token operator) {
    if (fragments.isEmpty()) {
      throw new InternalConsistencyException(
        "missing operand for " + operator.kind() + " at " + operator.index()
      );
    }
    return fragments.pop();
  }

  Fragment<Q> visitLiteral(char symbol) {
    final Q start = freshState();
    final Q accept = freshState();
    addSymbolTransition(start, symbol, accept);
    return new Fragment<>(start, accept);
  }

  Fragment<Q> visitConcatenation(Fragment<Q> lhs, Fragment<Q> rhs) {
    addEpsilonTransition(lhs.accept(), rhs.start());
    return new Fragment<>(lhs.start(), rhs.accept());
  }

  Fragment<Q> visitUnion(Fragment<Q> lhs, Fragment<Q> rhs) {
    final Q start = freshState();
    final Q accept = freshState();
    addEpsilonTransition(start, lhs.start());
    addEpsilonTransition(start, rhs.start());
    addEpsilonTransition(lhs.accept(), accept);
    addEpsilonTransition(rhs.accept(), accept);
    return new Fragment<>(start, accept);
  }

  // Zero or more: bypass and loop back
  Fragment<Q> visitKleene(Fragment<Q> inner) {
    final Q start = freshState();
    final Q accept = freshState();
    addEpsilonTransition(start, inner.start());
    addEpsilonTransition(start, accept);
    addEpsilonTransition(inner.accept(), inner.start());
    addEpsilonTransition(inner.accept(), accept);
    return new Fragment<>(start, accept);
  }

  // One or more: loop back, no bypass
  Fragment<Q> visitPlus(Fragment<Q> inner) {
    final Q start = freshState();
    final Q accept = freshState();
    addEpsilonTransition(start, inner.start());
    addEpsilonTransition(inner.accept(), inner.start());
    addEpsilonTransition(inner.accept(), accept);
    return new Fragment<>(start, accept);
  }

  // Zero or one: bypass, no loop back
  Fragment<Q> visitOptional(Fragment<Q> inner) {
    final Q start = freshState();
    final Q accept = freshState();
    addEpsilonTransition(start, inner.start());
    addEpsilonTransition(start, accept);
    addEpsilonTransition(inner.accept(), accept);
    return new Fragment<>(start, accept);
  }
}
