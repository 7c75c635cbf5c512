package RegAlgebra;

import java.io.IOException;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import RegAlgebra.Format.JsonFormat;
import RegAlgebra.Grammar.Grammars;
import net.automatalib.automaton.fsa.impl.CompactDFA;

public class RegAlgebraCommandLine {
  public static boolean DEBUG = false;

  public static void main(String[] args) {
    String filename = null;
    List<String> positional = new ArrayList<>(3);

    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if ("--debug".equalsIgnoreCase(arg)) {
        DEBUG = true;
      } else if ("--write".equalsIgnoreCase(arg)) {
        // Require a value that isn't another flag
        if (i + 1 >= args.length || args[i + 1].startsWith("-")) {
          System.err.println("Missing value for --write");
          printUsageAndExit(); // exits
        }
        filename = args[++i]; // consume the value
      } else if (arg.startsWith("-")) {
        // Unknown flag
        printUsageAndExit();
      } else {
        positional.add(arg);
      }
    }

    if (positional.size() < 2) {
      printUsageAndExit();
    }

    String operation = positional.get(0);
    Automaton automaton = JsonFormat.getJsonFile(positional.get(1));
    List<String> rest = positional.subList(2, positional.size());
    System.out.println("Input automaton size: " + automaton.size());
    System.out.println("Alphabet size: " + automaton.getAlphabet().size());

    long before = System.currentTimeMillis();
    Automaton result = run(operation, automaton, rest);
    long after = System.currentTimeMillis();
    if (result != null) {
      System.out.println(operation + " result size: " + result.size());
    }
    System.out.println(operation + " duration: " + ((after - before) / 1000f) + "s");

    if (filename != null && result != null) {
      writeJsonFile(filename, result);
    }
  }

  private static void printUsageAndExit() {
    System.out.println(
        "RegAlgebra [--debug] [--write <JSON output file>] <operation> <JSON input file> [<argument>...]");
    System.out.println("[--debug] : Additional debug/progress output");
    System.out.println("[--write <JSON output file>] : Write the resulting automaton to the specified file");
    System.out.println();
    System.out.println("<operation> : one of the choices below:");
    System.out.println("  accept <word>...: Membership test of each word (one symbol per character).");
    System.out.println("  determinize: Subset construction.");
    System.out.println("  minimize: Determinize, then remove unreachable/dead states and merge equivalent ones.");
    System.out.println("  complement: Automaton of the complement language.");
    System.out.println("  union <JSON file>: Union with a second automaton.");
    System.out.println("  intersection <JSON file>: Intersection with a second automaton.");
    System.out.println("  contains <JSON file>: Whether the second automaton's language is contained in the first.");
    System.out.println("  equal <JSON file>: Whether both automata accept the same language.");
    System.out.println("  empty: Whether the language is empty.");
    System.out.println("  finite: Whether the language is finite.");
    System.out.println("  relabel: Rename states to q0, q1, ...");
    System.out.println("  relabelABC: Rename states to S, A, B, ...");
    System.out.println("  grammar: Print the equivalent regular grammar.");
    System.out.println("  verify: Cross-check the minimal DFA against AutomataLib's Hopcroft minimization.");
    System.out.println();
    System.out.println("<JSON file> : automaton record with states, alphabet, transitions, initial_state, final_states.");
    System.exit(0);
  }

  /**
   * Run one operation.
   * @param operation - operation passed in from command-line
   * @param automaton - input automaton, mutated by the operation
   * @param rest - remaining positional arguments
   * @return - resulting automaton, or null if the operation only answers a question
   */
  static Automaton run(String operation, Automaton automaton, List<String> rest) {
    System.out.println();
    System.out.println("Invoking operation:" + operation);
    switch (operation.toLowerCase()) {
      case "accept" -> {
        for (String word : rest) {
          System.out.println("'" + word + "': " + (automaton.accept(word) ? "accepted" : "rejected"));
        }
        return null;
      }
      case "determinize" -> automaton.determinize();
      case "minimize" -> {
        automaton.determinize();
        automaton.minimize();
      }
      case "complement" -> automaton.complement();
      case "union" -> automaton.union(second(rest));
      case "intersection" -> automaton.intersection(second(rest));
      case "contains" -> {
        System.out.println("contains: " + automaton.contains(second(rest)));
        return null;
      }
      case "equal" -> {
        System.out.println("equal: " + automaton.isEqual(second(rest)));
        return null;
      }
      case "empty" -> {
        System.out.println("empty: " + automaton.isEmpty());
        return null;
      }
      case "finite" -> {
        System.out.println("finite: " + automaton.isFinite());
        return null;
      }
      case "relabel" -> automaton.relabelNumeric();
      case "relabelabc" -> automaton.relabelAlphabetic();
      case "grammar" -> {
        automaton.relabelAlphabetic();
        System.out.print(Grammars.fromAutomaton(automaton));
      }
      case "verify" -> {
        verify(automaton);
        return null;
      }
      default -> throw new IllegalStateException("Unexpected operation choice: " + operation);
    }
    return automaton;
  }

  private static Automaton second(List<String> rest) {
    if (rest.isEmpty()) {
      throw new IllegalStateException("Operation needs a second JSON automaton file");
    }
    return JsonFormat.getJsonFile(rest.get(0));
  }

  /**
   * Compare our minimal DFA with AutomataLib's. AutomataLib's result is complete, so ours is completed and the
   * sink merged with any equivalent state.
   */
  private static void verify(Automaton automaton) {
    final CompactDFA<String> reference = AutomataLibAdapter.referenceMinimalDFA(automaton);

    final Automaton ours = automaton.copy();
    ours.determinize();
    ours.minimize();
    ours.complete();
    ours.mergeEquivalent();
    System.out.println("AutomataLib minimized DFA size: " + reference.size());
    System.out.println("RegAlgebra minimized DFA size (completed): " + ours.size());

    final boolean equivalent = AutomataLibAdapter.referenceEquivalent(automaton, ours);
    System.out.println("Language preserved: " + equivalent);
    if (!equivalent) {
      throw new IllegalStateException("Minimized automaton is not equivalent to its input");
    }
  }

  private static void writeJsonFile(String filename, Automaton automaton) {
    System.out.println("Writing to file: " + filename);
    try {
      JsonFormat.save(automaton, Paths.get(filename));
    } catch (IOException e) {
      throw new RuntimeException(e);
    }
  }
}
