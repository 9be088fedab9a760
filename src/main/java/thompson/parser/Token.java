package thompson.parser;

import java.util.List;

/**
 * Atomic regex unit produced by the class expander.
 *
 * @param kind which operator (or literal) this is
 * @param symbol the input symbol for literals (the source character otherwise)
 * @param index position in the source pattern that produced the token
 */
public record Token(Kind kind, char symbol, int index) {

  public enum Kind {
    LITERAL(0, 0),
    UNION(2, 1),
    CONCAT(2, 2),
    STAR(1, 3),
    PLUS(1, 3),
    OPTIONAL(1, 3),
    OPEN(0, 0),
    CLOSE(0, 0);

    private final int arity;
    private final int precedence;

    Kind(int arity, int precedence) {
      this.arity = arity;
      this.precedence = precedence;
    }

    /**
     * Number of fragments the operator consumes (literals and parens consume none).
     */
    public int arity() {
      return arity;
    }

    /**
     * Binding strength in the shunting-yard pass.
     *
     * <p>{@code OPEN} has the lowest precedence so that it is never popped by
     * an incoming operator.
     */
    public int precedence() {
      return precedence;
    }

    public boolean isOperator() {
      return arity > 0;
    }

    /** Can a token of this kind be the last token of an expression? */
    public boolean canEnd() {
      return this == LITERAL || this == STAR || this == PLUS || this == OPTIONAL || this == CLOSE;
    }

    /** Can a token of this kind be the first token of an expression? */
    public boolean canStart() {
      return this == LITERAL || this == OPEN;
    }
  }

  public static Token literal(char symbol, int index) {
    return new Token(Kind.LITERAL, symbol, index);
  }

  /**
   * Token for a character seen outside of a bracket expression.
   *
   * @param c source character
   * @param index position of the character
   * @return operator token for metacharacters, literal otherwise
   */
  public static Token of(char c, int index) {
    switch (c) {
      case '|':
        return new Token(Kind.UNION, c, index);
      case '*':
        return new Token(Kind.STAR, c, index);
      case '+':
        return new Token(Kind.PLUS, c, index);
      case '?':
        return new Token(Kind.OPTIONAL, c, index);
      case '(':
        return new Token(Kind.OPEN, c, index);
      case ')':
        return new Token(Kind.CLOSE, c, index);
      default:
        return literal(c, index);
    }
  }

  /**
   * Render the token the way it would be written in a pattern.
   *
   * <p>Concatenation has no written form in infix patterns, so it is shown as
   * {@code .} (which is only unambiguous in postfix streams without literal
   * dots).
   */
  public String render() {
    switch (kind) {
      case LITERAL:
        return String.valueOf(symbol);
      case UNION:
        return "|";
      case CONCAT:
        return ".";
      case STAR:
        return "*";
      case PLUS:
        return "+";
      case OPTIONAL:
        return "?";
      case OPEN:
        return "(";
      case CLOSE:
        return ")";
      default:
        throw new IllegalStateException("unknown token kind " + kind);
    }
  }

  /**
   * Render a whole token stream.
   *
   * @param tokens infix or postfix token stream
   * @return concatenated rendering of each token
   */
  public static String render(List<Token> tokens) {
    final var builder = new StringBuilder();
    for (Token token : tokens) {
      builder.append(token.render());
    }
    return builder.toString();
  }
}
