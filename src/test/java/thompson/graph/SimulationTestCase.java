package thompson.graph;

import thompson.AbstractNfaTestCase;
import thompson.parser.RegexSyntaxException;

public class SimulationTestCase extends AbstractNfaTestCase {

  public SimulationTestCase(String name) {
    super(name);
  }

  public void testLiteral() {
    assertAccepts("a", "a");
    assertRejects("a", "", "aa", "b");
  }

  public void testUnion() {
    assertAccepts("a|b", "a", "b");
    assertRejects("a|b", "ab", "");
    assertAccepts("cat|dog|bird", "cat", "dog", "bird");
    assertRejects("cat|dog|bird", "ca", "catdog");
  }

  public void testKleene() {
    assertAccepts("a*", "", "a", "aaaa");
    assertRejects("a*", "b", "aab");
    assertAccepts("(ab)*", "", "ab", "ababab");
    assertRejects("(ab)*", "a", "aba");
  }

  public void testPlus() {
    assertAccepts("a+", "a", "aaa");
    assertRejects("a+", "", "b");
    assertAccepts("(ab)+c", "abc", "ababc");
    assertRejects("(ab)+c", "c", "abac");
  }

  public void testOptional() {
    assertAccepts("colou?r", "color", "colour");
    assertRejects("colou?r", "colouur", "colr");
    assertAccepts("a?", "", "a");
    assertRejects("a?", "aa");
  }

  public void testEndsInAbb() {
    assertAccepts("(a|b)*abb", "abb", "aababb", "babb", "aabb");
    assertRejects("(a|b)*abb", "ab", "abab", "abbb", "");
  }

  public void testCharacterClass() {
    assertAccepts("[a-c]", "a", "b", "c");
    assertRejects("[a-c]", "d", "", "ab");
    assertAccepts("[0-9]+", "0", "42", "9001");
    assertRejects("[0-9]+", "", "4a");
    assertAccepts("x[pq]*y", "xy", "xpqpy");
    assertRejects("x[pq]*y", "xry");
  }

  public void testMetacharactersInClassAreLiterals() {
    assertAccepts("[*+]", "*", "+");
    assertRejects("[*+]", "", "**");
  }

  public void testLiteralDashAndBracket() {
    assertAccepts("a-b", "a-b");
    assertAccepts("a]", "a]");
    assertRejects("a-b", "ab");
  }

  public void testNestedQuantifiers() {
    assertAccepts("((a*)*|b)+", "", "a", "b", "abba");
    assertRejects("((a*)*|b)+", "c");
    assertAccepts("a**", "", "aaa");
    assertAccepts("(a?)+", "", "aa");
  }

  public void testEmptyPattern() {
    assertAccepts("", "");
    assertRejects("", "a");
  }

  public void testMalformedPatternsBuildNothing() {
    assertSyntaxError("(a|b", RegexSyntaxException.Kind.UNBALANCED_PARENS, 4);
    assertSyntaxError("[^a]", RegexSyntaxException.Kind.MALFORMED_CLASS, 0);
    assertSyntaxError("a|*", RegexSyntaxException.Kind.DANGLING_OPERATOR, 2);
  }
}
