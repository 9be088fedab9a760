package thompson.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.PatternSyntaxException;

/**
 * Tokenizer which rewrites bracket expressions into explicit unions.
 *
 * <p>Only two bracket forms are supported: a single inclusive ASCII range
 * ({@code [a-z]}) and a plain list of literals ({@code [xyz]}). Both turn into
 * a parenthesized union of their members, so {@code [a-c]} produces the same
 * tokens as {@code (a|b|c)}. Members of a bracket are always literals, even
 * when they would be metacharacters outside of it.
 *
 * <p>No concatenation operators are inserted here.
 */
public final class ClassExpander {

  private final String input;
  private final int length;
  private int position = 0;

  private final List<Token> output = new ArrayList<>();

  /**
   * Split a pattern into tokens, expanding any bracket expressions.
   *
   * @param input regular expression pattern
   * @return unmodifiable infix token stream
   */
  public static List<Token> expand(String input) throws PatternSyntaxException {
    final var expander = new ClassExpander(input);
    expander.run();
    return Collections.unmodifiableList(expander.output);
  }

  private ClassExpander(String input) {
    this.input = input;
    this.length = input.length();
  }

  private RegexSyntaxException malformed(String message, int bracketPosition) {
    return new RegexSyntaxException(RegexSyntaxException.Kind.MALFORMED_CLASS, message, input, bracketPosition);
  }

  private void run() throws PatternSyntaxException {
    while (position < length) {
      final char c = input.charAt(position);
      if (c == '[') {
        expandBracket();
      } else {
        output.add(Token.of(c, position));
        position++;
      }
    }
  }

  /**
   * Expand the bracket expression starting at the current position and move
   * past its closing {@code ]}.
   */
  private void expandBracket() throws PatternSyntaxException {
    final int open = position;
    final int close = input.indexOf(']', open + 1);
    if (close == -1) {
      throw malformed("Expected `]` to close character class", open);
    }
    final String body = input.substring(open + 1, close);
    final List<Character> members = classMembers(body, open);

    output.add(new Token(Token.Kind.OPEN, '(', open));
    boolean needsUnion = false;
    for (char member : members) {
      if (needsUnion) {
        output.add(new Token(Token.Kind.UNION, '|', open));
      } else {
        needsUnion = true;
      }
      output.add(Token.literal(member, open));
    }
    output.add(new Token(Token.Kind.CLOSE, ')', open));

    position = close + 1;
  }

  /**
   * Compute the members of a bracket expression body, in order.
   *
   * @param body text between the brackets
   * @param open position of the opening bracket (for errors)
   * @return members of the class
   */
  private List<Character> classMembers(String body, int open) throws PatternSyntaxException {
    if (body.isEmpty()) {
      throw malformed("Empty character class", open);
    } else if (body.charAt(0) == '^') {
      throw malformed("Negated character classes are not supported", open);
    } else if (body.indexOf('\\') != -1) {
      throw malformed("Escapes in character classes are not supported", open);
    } else if (body.indexOf('[') != -1) {
      throw malformed("Nested character classes are not supported", open);
    }

    final var members = new ArrayList<Character>();

    // Single range: `x-y`
    if (body.indexOf('-') != -1) {
      if (body.length() != 3 || body.charAt(1) != '-') {
        throw malformed("Only a single range like `a-z` is supported", open);
      }
      final char start = body.charAt(0);
      final char end = body.charAt(2);
      if (start > 127 || end > 127) {
        throw malformed("Range ends must be ASCII characters", open);
      } else if (start > end) {
        throw malformed("Range `" + body + "` is out of order", open);
      }
      for (char c = start; c <= end; c++) {
        members.add(c);
      }
      return members;
    }

    // Plain list of literals
    for (int i = 0; i < body.length(); i++) {
      members.add(body.charAt(i));
    }
    return members;
  }
}
