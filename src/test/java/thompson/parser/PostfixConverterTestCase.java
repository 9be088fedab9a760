package thompson.parser;

import java.util.List;
import thompson.AbstractNfaTestCase;

public class PostfixConverterTestCase extends AbstractNfaTestCase {

  public PostfixConverterTestCase(String name) {
    super(name);
  }

  public void testImplicitConcatenation() {
    assertEquals("ab.", postfix("ab"));
    assertEquals("ab.c.", postfix("abc"));
    assertEquals("a*b.", postfix("a*b"));
    assertEquals("ab.c.", postfix("(ab)c"));
    assertEquals("ab.", postfix("a(b)"));
  }

  public void testPrecedence() {
    assertEquals("ab|", postfix("a|b"));
    assertEquals("abc.|", postfix("a|bc"));
    assertEquals("ab*.", postfix("ab*"));
    assertEquals("ab*|", postfix("a|b*"));
    assertEquals("a*b+.c?.", postfix("a*b+c?"));
  }

  public void testLeftAssociativity() {
    assertEquals("ab|c|", postfix("a|b|c"));
    assertEquals("a**", postfix("a**"));
    assertEquals("a*?+", postfix("a*?+"));
  }

  public void testParenthesesOverridePrecedence() {
    assertEquals("ab|c.", postfix("(a|b)c"));
    assertEquals("ab.*", postfix("(ab)*"));
    assertEquals("ab|*a.b.b.", postfix("(a|b)*abb"));
    assertEquals("a", postfix("((a))"));
  }

  public void testCharacterClass() {
    assertEquals("ab|c|", postfix("[a-c]"));
    assertEquals("xab|.y.", postfix("x[ab]y"));
  }

  public void testEmptyPattern() {
    assertTrue(PostfixConverter.parse("").isEmpty());
  }

  public void testNoParenthesesInOutput() {
    for (Token token : PostfixConverter.parse("((a|b)(c|d))*e")) {
      assertFalse(token.kind() == Token.Kind.OPEN || token.kind() == Token.Kind.CLOSE);
    }
  }

  public void testOperandCountsMatchArity() {
    final String[] patterns = {
      "a", "ab", "a|b", "a*", "(a|b)*abb", "a(b|c)?d+", "[a-e]x|y*", "((a|b)(c|d))*e"
    };
    for (String pattern : patterns) {
      final List<Token> tokens = PostfixConverter.parse(pattern);
      int operands = 0;
      for (Token token : tokens) {
        final int arity = token.kind().arity();
        assertTrue("underflow in /" + pattern + "/", operands >= arity);
        operands = operands - arity + 1;
      }
      assertEquals("operands left for /" + pattern + "/", 1, operands);
    }
  }

  public void testUnbalancedParens() {
    assertSyntaxError("(a|b", RegexSyntaxException.Kind.UNBALANCED_PARENS, 4);
    assertSyntaxError("((a)", RegexSyntaxException.Kind.UNBALANCED_PARENS, 4);
    assertSyntaxError("(", RegexSyntaxException.Kind.UNBALANCED_PARENS, 1);
    assertSyntaxError("a)", RegexSyntaxException.Kind.UNBALANCED_PARENS, 1);
    assertSyntaxError(")(", RegexSyntaxException.Kind.UNBALANCED_PARENS, 0);
    assertSyntaxError("(a))b", RegexSyntaxException.Kind.UNBALANCED_PARENS, 3);
  }

  public void testDanglingOperator() {
    assertSyntaxError("*a", RegexSyntaxException.Kind.DANGLING_OPERATOR, 0);
    assertSyntaxError("a|*", RegexSyntaxException.Kind.DANGLING_OPERATOR, 2);
    assertSyntaxError("(+a)", RegexSyntaxException.Kind.DANGLING_OPERATOR, 1);
    assertSyntaxError("|a", RegexSyntaxException.Kind.DANGLING_OPERATOR, 0);
    assertSyntaxError("a|", RegexSyntaxException.Kind.DANGLING_OPERATOR, 1);
    assertSyntaxError("(a|)", RegexSyntaxException.Kind.DANGLING_OPERATOR, 2);
    assertSyntaxError("a||b", RegexSyntaxException.Kind.DANGLING_OPERATOR, 2);
    assertSyntaxError("()", RegexSyntaxException.Kind.DANGLING_OPERATOR, 0);
    assertSyntaxError("a()*", RegexSyntaxException.Kind.DANGLING_OPERATOR, 1);
    assertSyntaxError("?", RegexSyntaxException.Kind.DANGLING_OPERATOR, 0);
  }
}
