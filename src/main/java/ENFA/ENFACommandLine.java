package ENFA;

import ENFA.Exceptions.IllegalStartTargetException;
import ENFA.Exceptions.InvalidSymbolException;
import ENFA.Exceptions.UnknownStateException;
import ENFA.Model.EpsilonNFA;
import ENFA.Simulation.Simulator;
import net.automatalib.exception.FormatException;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public class ENFACommandLine {
  static final int EXIT_OK = 0;
  static final int EXIT_USAGE = 1;
  static final int EXIT_FAILURE = 2;

  private static final String LOG_LEVEL_PROPERTY = "org.slf4j.simpleLogger.defaultLogLevel";

  public static void main(String[] args) {
    final int status = run(args, System.out, System.err);
    if (status != EXIT_OK) {
      System.exit(status);
    }
  }

  static int run(String[] args, PrintStream out, PrintStream err) {
    String algorithm = Simulator.CLOSURE;
    String jsonOutput = null;
    String dotOutput = null;
    boolean prune = false;
    List<String> positional = new ArrayList<>(3);
    List<String> words = new ArrayList<>();

    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if ("--".equals(arg)) {
        // everything after "--" is an input word, even if it starts with "-"
        words.addAll(List.of(args).subList(i + 1, args.length));
        break;
      } else if ("--debug".equalsIgnoreCase(arg)) {
        // only effective before the first logger is created
        System.setProperty(LOG_LEVEL_PROPERTY, "debug");
      } else if ("--prune".equalsIgnoreCase(arg)) {
        prune = true;
      } else if ("--algorithm".equalsIgnoreCase(arg)
          || "--writeJSON".equalsIgnoreCase(arg)
          || "--writeDOT".equalsIgnoreCase(arg)) {
        // Require a value that isn't another flag
        if (i + 1 >= args.length || args[i + 1].startsWith("-")) {
          err.println("Missing value for " + arg);
          return printUsage(err);
        }
        String value = args[++i]; // consume the value
        if ("--algorithm".equalsIgnoreCase(arg)) {
          algorithm = value;
        } else if ("--writeJSON".equalsIgnoreCase(arg)) {
          jsonOutput = value;
        } else {
          dotOutput = value;
        }
      } else if (arg.startsWith("-")) {
        // Unknown flag
        return printUsage(err);
      } else {
        positional.add(arg);
      }
    }

    if (positional.isEmpty()) {
      return printUsage(err);
    }
    String operation = positional.get(0).toLowerCase();
    List<String> inputFiles = positional.subList(1, positional.size());
    if (inputFiles.size() != arity(operation)) {
      return printUsage(err);
    }

    final Simulator simulator;
    try {
      simulator = Simulator.forName(algorithm);
    } catch (IllegalArgumentException e) {
      err.println(e.getMessage());
      return printUsage(err);
    }

    try {
      List<EpsilonNFA> operands = new ArrayList<>(inputFiles.size());
      for (String file : inputFiles) {
        EpsilonNFA nfa = JSONFormat.readFile(Path.of(file));
        out.println("Loaded " + file + ": " + describe(nfa));
        operands.add(nfa);
      }

      EpsilonNFA result = applyOperation(operation, operands);
      out.println(operation + " result: " + describe(result));

      if (prune) {
        int prevSize = result.size();
        result = NFATrim.prune(result);
        if (result.size() < prevSize) {
          out.println("Pruned to: " + result.size() + " states");
        }
      }

      for (String word : words) {
        boolean accepted = simulator.accepts(result, word);
        out.println("\"" + word + "\": " + (accepted ? "accept" : "reject"));
      }

      if (jsonOutput != null) {
        out.println("Writing JSON to file: " + jsonOutput);
        JSONFormat.writeFile(result, Path.of(jsonOutput));
      }
      if (dotOutput != null) {
        out.println("Writing DOT to file: " + dotOutput);
        DOTFormat.writeFile(result, Path.of(dotOutput));
      }
      return EXIT_OK;
    } catch (IOException | FormatException e) {
      err.println("Cannot process automaton: " + e.getMessage());
      return EXIT_FAILURE;
    } catch (InvalidSymbolException | UnknownStateException | IllegalStartTargetException e) {
      err.println("Invalid automaton: " + e.getMessage());
      return EXIT_FAILURE;
    }
  }

  /**
   * Apply a composition operation.
   * @param operation - operation passed in from command-line
   * @param operands - automata read from the input files, in order
   * @return - resulting automaton; a copy for "run"
   */
  static EpsilonNFA applyOperation(String operation, List<EpsilonNFA> operands) {
    return switch (operation) {
      case "run" -> operands.get(0).copy();
      case "concat" -> Thompson.concatenation(operands.get(0), operands.get(1));
      case "union" -> Thompson.union(operands.get(0), operands.get(1));
      case "star" -> Thompson.closure(operands.get(0));
      default -> throw new IllegalStateException("Unexpected operation: " + operation);
    };
  }

  private static int arity(String operation) {
    return switch (operation) {
      case "run", "star" -> 1;
      case "concat", "union" -> 2;
      default -> -1;
    };
  }

  private static String describe(EpsilonNFA nfa) {
    return nfa.size() + " states, " + nfa.transitionCount() + " transitions, "
        + nfa.getAcceptStates().size() + " accepting";
  }

  private static int printUsage(PrintStream err) {
    err.println(
        "ENFA [--debug] [--prune] [--algorithm <algorithm>] [--writeJSON <file>] [--writeDOT <file>] "
            + "<operation> <JSON file> [<JSON file>] [-- <word> ...]");
    err.println("[--debug] : Debug logging");
    err.println("[--prune] : Remove states unreachable from the start state before simulating");
    err.println("[--algorithm <algorithm>] : " + String.join(" or ", Simulator.ALGORITHMS)
        + " (default " + Simulator.CLOSURE + ")");
    err.println("[--writeJSON <file>] : Write the resulting automaton as JSON");
    err.println("[--writeDOT <file>] : Write the resulting automaton as a Graphviz graph");
    err.println();
    err.println("<operation> : one of the choices below:");
    err.println("  run: use the automaton as is (one file).");
    err.println("  concat: concatenation of two automata.");
    err.println("  union: union of two automata.");
    err.println("  star: Kleene closure of one automaton.");
    err.println();
    err.println("<word> ... : input strings to simulate; each prints accept or reject.");
    return EXIT_USAGE;
  }
}
