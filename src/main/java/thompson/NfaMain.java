package thompson;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.PatternSyntaxException;
import thompson.graph.Nfa;
import thompson.parser.RegexSyntaxException;

/**
 * Builds the NFA for each regular expression passed on the command line.
 *
 * <pre>
 * NfaMain [--dot] [--debug] &lt;regex&gt;...
 * </pre>
 *
 * By default the transition table is printed. With {@code --dot} the Graphviz
 * source is printed instead (pipe it into {@code dot -Tpng} to get a picture).
 * {@code --debug} traces the construction on STDERR.
 */
public final class NfaMain {

  private NfaMain() { }

  public static void main(String[] args) {
    System.exit(run(args));
  }

  /**
   * Process the command line arguments.
   *
   * @param args flags followed by regular expressions
   * @return exit status: 0 if every pattern built, 1 if any failed, 2 on bad usage
   */
  static int run(String[] args) {
    boolean dot = false;
    boolean debug = false;
    final List<String> patterns = new ArrayList<>();

    boolean flagsDone = false;
    for (String arg : args) {
      if (!flagsDone && arg.equals("--dot")) {
        dot = true;
      } else if (!flagsDone && arg.equals("--debug")) {
        debug = true;
      } else if (!flagsDone && arg.equals("--")) {
        flagsDone = true;
      } else if (!flagsDone && arg.startsWith("--")) {
        System.err.println("Unknown option " + arg);
        return usage();
      } else {
        patterns.add(arg);
      }
    }
    if (patterns.isEmpty()) {
      return usage();
    }

    int failures = 0;
    for (String pattern : patterns) {
      final Nfa nfa;
      try {
        nfa = Nfa.parse(pattern, debug);
      } catch (PatternSyntaxException error) {
        System.err.println("Failed to build /" + pattern + "/: " + describe(error));
        failures++;
        continue;
      }

      if (dot) {
        System.out.print(nfa.dotGraph("NFA"));
      } else {
        System.out.println("/" + pattern + "/");
        System.out.print(nfa.transitionTable());
      }
    }

    return failures == 0 ? 0 : 1;
  }

  /**
   * One line description of a syntax error: the kind (when classified) and where.
   */
  static String describe(PatternSyntaxException error) {
    final String kind = error instanceof RegexSyntaxException classified
      ? classified.kind.name()
      : "SYNTAX_ERROR";
    return kind + " at index " + error.getIndex() + " (" + error.getDescription() + ")";
  }

  private static int usage() {
    System.err.println("Usage: NfaMain [--dot] [--debug] <regex>...");
    return 2;
  }
}
