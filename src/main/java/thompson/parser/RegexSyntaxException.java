package thompson.parser;

import java.util.regex.PatternSyntaxException;

/**
 * Pattern syntax exception classified by what went wrong.
 *
 * <p>{@link #getIndex()} is the position of the offending character, or the
 * length of the pattern when the problem is only detected at the end of the
 * input.
 */
public class RegexSyntaxException extends PatternSyntaxException {

  @java.io.Serial
  private static final long serialVersionUID = 2912004853076241537L;

  public enum Kind {
    /** Bracket expression is not a single range or a plain list of literals. */
    MALFORMED_CLASS("Malformed character class"),

    /** Close paren without an open one, or an open paren never closed. */
    UNBALANCED_PARENS("Unbalanced parentheses"),

    /** Operator (or group) missing a required operand. */
    DANGLING_OPERATOR("Dangling operator");

    public final String title;

    Kind(String title) {
      this.title = title;
    }
  }

  /**
   * Classification of the error.
   */
  public final Kind kind;

  public RegexSyntaxException(Kind kind, String detail, String regex, int index) {
    super(kind.title + ": " + detail, regex, index);
    this.kind = kind;
  }
}
