package com.cfgkit.cli;

import com.cfgkit.core.GrammarAnalyzer;
import com.cfgkit.core.ParseResult;
import com.cfgkit.core.cyk.Tokens;
import com.cfgkit.core.gen.GenerationResult;
import com.cfgkit.core.gen.ShortestStringsGenerator;
import com.cfgkit.core.grammar.GrammarException;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line front end.
 *
 * <pre>
 * cfgkit show &lt;grammar.json&gt;
 * cfgkit normalize &lt;grammar.json&gt;
 * cfgkit parse &lt;grammar.json&gt; &lt;input&gt;
 * cfgkit generate &lt;grammar.json&gt; [--count=N] [--max-derivation=L] [--max-frontier=M]
 * </pre>
 */
public final class CfgKitCli {

    private static final Logger log = LoggerFactory.getLogger(CfgKitCli.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private static final String USAGE =
            String.join(
                    "\n",
                    "usage: cfgkit show <grammar.json>",
                    "       cfgkit normalize <grammar.json>",
                    "       cfgkit parse <grammar.json> <input>",
                    "       cfgkit generate <grammar.json> [--count=N] [--max-derivation=L]"
                            + " [--max-frontier=M]");

    private CfgKitCli() {
        // Utility class
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        if (args == null || args.length < 2) {
            err.println(USAGE);
            return EXIT_USAGE;
        }
        String command = args[0];
        List<String> rest = Arrays.asList(args).subList(2, args.length);
        try {
            Session session = Session.load(Path.of(args[1]));
            return switch (command) {
                case "show" -> show(session, rest, out, err);
                case "normalize" -> normalize(session, rest, out, err);
                case "parse" -> parse(session, rest, out, err);
                case "generate" -> generate(session, rest, out, err);
                default -> usage(err, "Unknown command: " + command);
            };
        } catch (IOException e) {
            log.debug("Failed to read grammar {}", args[1], e);
            err.println("Cannot read grammar file " + args[1] + ": " + e.getMessage());
            return EXIT_FAILURE;
        } catch (GrammarException e) {
            log.debug("Command {} failed", command, e);
            err.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private static int show(Session session, List<String> rest, PrintStream out, PrintStream err) {
        if (!rest.isEmpty()) {
            return usage(err, "show takes no extra arguments");
        }
        out.println(session.grammar());
        if (session.grammar().isRightLinear()) {
            out.println("(right-linear)");
        }
        return EXIT_OK;
    }

    private static int normalize(Session session, List<String> rest, PrintStream out, PrintStream err) {
        if (!rest.isEmpty()) {
            return usage(err, "normalize takes no extra arguments");
        }
        out.print(TextRenderer.normalized(session.normalized()));
        return EXIT_OK;
    }

    private static int parse(Session session, List<String> rest, PrintStream out, PrintStream err) {
        if (rest.size() != 1) {
            return usage(err, "parse expects exactly one input argument");
        }
        List<String> tokens = Tokens.split(session.grammar().terminals(), rest.get(0));
        ParseResult result = GrammarAnalyzer.parse(session.normalized(), tokens);
        if (result.accepted()) {
            out.println("ACCEPTED");
            out.print(TextRenderer.tree(result.tree().orElseThrow()));
        } else {
            out.println("REJECTED");
        }
        return EXIT_OK;
    }

    private static int generate(Session session, List<String> rest, PrintStream out, PrintStream err) {
        ShortestStringsGenerator.Config config = new ShortestStringsGenerator.Config();
        for (String arg : rest) {
            if (arg.startsWith("--count=")) {
                config.count = parseNumber(arg, "--count=");
            } else if (arg.startsWith("--max-derivation=")) {
                config.maxDerivationLength = parseNumber(arg, "--max-derivation=");
            } else if (arg.startsWith("--max-frontier=")) {
                config.maxFrontierSize = parseNumber(arg, "--max-frontier=");
            } else {
                return usage(err, "Unknown option: " + arg);
            }
            if (config.count < 0 || config.maxDerivationLength < 0 || config.maxFrontierSize < 1) {
                return usage(err, "Invalid value: " + arg);
            }
        }
        GenerationResult result = GrammarAnalyzer.generateShortest(session.grammar(), config);
        out.print(TextRenderer.strings(result.strings()));
        if (!result.complete()) {
            out.println("(search bounds reached; the list may be incomplete)");
        }
        return EXIT_OK;
    }

    private static int parseNumber(String arg, String prefix) {
        String value = arg.substring(prefix.length());
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    private static int usage(PrintStream err, String message) {
        err.println(message);
        err.println(USAGE);
        return EXIT_USAGE;
    }
}
