package thompson.graph;

import java.util.List;
import junit.framework.TestCase;
import thompson.parser.Token;

public class ThompsonBuilderTestCase extends TestCase {

  public ThompsonBuilderTestCase(String name) {
    super(name);
  }

  private static Token literal(char c) {
    return Token.literal(c, 0);
  }

  private static Token operator(Token.Kind kind) {
    return new Token(kind, '.', 0);
  }

  private static void assertInconsistent(List<Token> postfix) {
    try {
      new Nfa.Builder().constructNfa(postfix);
      fail("postfix " + Token.render(postfix) + " should be rejected");
    } catch (InternalConsistencyException expected) {
      // expected
    }
  }

  public void testHandBuiltPostfix() {
    final Nfa nfa = new Nfa.Builder().constructNfa(
      List.of(literal('a'), literal('b'), operator(Token.Kind.UNION), operator(Token.Kind.STAR))
    );
    assertEquals(6, nfa.initialState);
    assertEquals(7, nfa.finalState);
    assertTrue(nfa.checkSimulate("abba", false));
    assertFalse(nfa.checkSimulate("abc", false));
  }

  public void testUnderflow() {
    assertInconsistent(List.of(operator(Token.Kind.STAR)));
    assertInconsistent(List.of(literal('a'), operator(Token.Kind.CONCAT)));
    assertInconsistent(List.of(literal('a'), operator(Token.Kind.UNION)));
  }

  public void testLeftoverFragments() {
    assertInconsistent(List.of(literal('a'), literal('b')));
  }

  public void testParensInPostfix() {
    assertInconsistent(List.of(operator(Token.Kind.OPEN), literal('a'), operator(Token.Kind.CLOSE)));
  }

  public void testBuilderIsSingleUse() {
    final var builder = new Nfa.Builder();
    builder.constructNfa(List.of(literal('a')));
    try {
      builder.constructNfa(List.of(literal('a')));
      fail("second construction should fail");
    } catch (IllegalStateException expected) {
      assertFalse(expected instanceof InternalConsistencyException);
    }
  }
}
