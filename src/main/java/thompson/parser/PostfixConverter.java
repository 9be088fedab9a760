package thompson.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Stack;
import java.util.regex.PatternSyntaxException;

/**
 * Shunting-yard conversion of an infix token stream into postfix order.
 *
 * <p>Concatenation is implicit in patterns, so a {@code CONCAT} token is
 * inserted between any token which can end an expression and a following
 * token which can start one. Precedence, from loosest to tightest, is union,
 * concatenation, then the postfix quantifiers. Everything is
 * left-associative.
 *
 * <p>The output contains no parentheses and every operator follows its
 * operands, so it can be consumed in a single left to right pass.
 */
public final class PostfixConverter {

  private final String input;

  // Operators waiting for their right operand (and open parens acting as barriers)
  private final Stack<Token> operators = new Stack<>();
  private final List<Token> output = new ArrayList<>();

  // Positions of the currently open groups
  private final Stack<Integer> openGroups = new Stack<>();

  // Last token consumed from the input (never an inserted `CONCAT`)
  private Token previous = null;

  /**
   * Tokenize a pattern and convert it to postfix.
   *
   * @param input regular expression pattern
   * @return unmodifiable postfix token stream
   */
  public static List<Token> parse(String input) throws PatternSyntaxException {
    return toPostfix(input, ClassExpander.expand(input));
  }

  /**
   * Convert an infix token stream to postfix.
   *
   * @param input pattern from which the tokens came (used for errors)
   * @param infix tokens in infix order, possibly with parentheses
   * @return unmodifiable postfix token stream, empty for an empty pattern
   */
  public static List<Token> toPostfix(String input, List<Token> infix) throws PatternSyntaxException {
    final var converter = new PostfixConverter(input);
    for (Token token : infix) {
      converter.accept(token);
    }
    return Collections.unmodifiableList(converter.finish());
  }

  private PostfixConverter(String input) {
    this.input = input;
  }

  private RegexSyntaxException error(RegexSyntaxException.Kind kind, String message, int position) {
    return new RegexSyntaxException(kind, message, input, position);
  }

  private boolean operandReady() {
    return previous != null && previous.kind().canEnd();
  }

  private void accept(Token token) throws PatternSyntaxException {
    switch (token.kind()) {
      case LITERAL:
        insertConcatenation(token);
        output.add(token);
        break;

      case OPEN:
        insertConcatenation(token);
        operators.push(token);
        openGroups.push(token.index());
        break;

      case CLOSE:
        if (openGroups.isEmpty()) {
          throw error(RegexSyntaxException.Kind.UNBALANCED_PARENS, "Unmatched `)`", token.index());
        } else if (previous.kind() == Token.Kind.OPEN) {
          throw error(RegexSyntaxException.Kind.DANGLING_OPERATOR, "Empty group", previous.index());
        } else if (!operandReady()) {
          throw error(RegexSyntaxException.Kind.DANGLING_OPERATOR, "Missing right operand", previous.index());
        }
        while (operators.peek().kind() != Token.Kind.OPEN) {
          output.add(operators.pop());
        }
        operators.pop();
        openGroups.pop();
        break;

      case UNION:
      case CONCAT:
        if (!operandReady()) {
          throw error(RegexSyntaxException.Kind.DANGLING_OPERATOR, "Missing left operand", token.index());
        }
        pushOperator(token);
        break;

      case STAR:
      case PLUS:
      case OPTIONAL:
        if (!operandReady()) {
          throw error(RegexSyntaxException.Kind.DANGLING_OPERATOR, "Nothing to repeat", token.index());
        }
        pushOperator(token);
        break;
    }
    previous = token;
  }

  /**
   * Insert a concatenation before {@code next} if the previous token ended an
   * expression and {@code next} starts another.
   */
  private void insertConcatenation(Token next) {
    if (operandReady() && next.kind().canStart()) {
      pushOperator(new Token(Token.Kind.CONCAT, '.', next.index()));
    }
  }

  /**
   * Push an operator, first moving any operators that bind at least as tightly
   * to the output.
   */
  private void pushOperator(Token operator) {
    final int precedence = operator.kind().precedence();
    while (!operators.isEmpty() && operators.peek().kind().precedence() >= precedence) {
      output.add(operators.pop());
    }
    operators.push(operator);
  }

  private List<Token> finish() throws PatternSyntaxException {
    if (!openGroups.isEmpty()) {
      throw error(
        RegexSyntaxException.Kind.UNBALANCED_PARENS,
        "Expected `)` to close group (opened at " + openGroups.peek() + ")",
        input.length()
      );
    } else if (previous != null && !operandReady()) {
      throw error(RegexSyntaxException.Kind.DANGLING_OPERATOR, "Missing right operand", previous.index());
    }

    while (!operators.isEmpty()) {
      output.add(operators.pop());
    }
    return output;
  }
}
