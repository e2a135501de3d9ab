package com.viffx.Cyk;

import com.martiansoftware.jsap.FlaggedOption;
import com.martiansoftware.jsap.JSAP;
import com.martiansoftware.jsap.JSAPException;
import com.martiansoftware.jsap.JSAPResult;
import com.martiansoftware.jsap.Switch;
import com.martiansoftware.jsap.UnflaggedOption;
import com.viffx.Cyk.Grammar.Grammar;
import com.viffx.Cyk.Grammar.GrammarException;
import com.viffx.Cyk.Normalizer.Normalizer;
import com.viffx.Cyk.Parser.CYKParser;
import com.viffx.Cyk.Parser.ParseResult;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;

public class Main {
    public static void main(String[] args) throws Exception {
        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        System.exit(run(args, in, System.out, System.err));
    }

    /**
     * Runs the command line front end.
     *
     * @return the process exit code
     */
    public static int run(String[] args, BufferedReader in, PrintStream out, PrintStream err) throws IOException {
        JSAP jsap = new JSAP();
        JSAPResult config;
        try {
            config = processParameters(jsap, args);
        } catch (JSAPException e) {
            err.println("Options improperly configured: " + e.getMessage());
            return 1;
        }

        if (config.getBoolean("help")) {
            out.println("Usage: cyk " + jsap.getUsage());
            out.println();
            out.println(jsap.getHelp());
            return 0;
        }
        if (!config.success()) {
            for (Iterator<?> errors = config.getErrorMessageIterator(); errors.hasNext(); ) {
                err.println("Error: " + errors.next());
            }
            err.println("Usage: cyk " + jsap.getUsage());
            return 1;
        }

        Path grammarFile = Path.of(config.getString("grammar"));
        if (!Files.isReadable(grammarFile)) {
            err.println("Error: cannot read grammar file " + grammarFile);
            return 1;
        }
        Grammar grammar = readGrammar(grammarFile, err);
        if (grammar.isEmpty()) {
            err.println("Error: the grammar has no rules");
            return 1;
        }

        boolean verbose = config.getBoolean("verbose");
        out.println("Input grammar:");
        out.println(grammar);

        Normalizer normalizer = new Normalizer((stage, result) -> {
            if (!verbose || Normalizer.INPUT.equals(stage) || Normalizer.CHOMSKY.equals(stage)) return;
            out.println();
            out.println("After stage '" + stage + "' (start " + result.start() + "):");
            out.println(result);
        });
        CYKParser parser = new CYKParser(grammar, normalizer);
        out.println();
        out.println("Grammar in Chomsky Normal Form (start " + parser.start() + "):");
        out.println(parser.grammar());

        String[] words = config.contains("words") ? config.getStringArray("words") : new String[0];
        if (words.length > 0) {
            for (String word : words) recognize(parser, word, config.getBoolean("table"), out);
            return 0;
        }

        // no words on the command line, read one per line until a blank line
        String line;
        while ((line = in.readLine()) != null && !line.isBlank()) {
            recognize(parser, line.strip(), config.getBoolean("table"), out);
        }
        return 0;
    }

    private static JSAPResult processParameters(JSAP jsap, String[] args) throws JSAPException {
        jsap.registerParameter(new Switch("help",
                'h',
                "help",
                "print this help message"));

        jsap.registerParameter(new FlaggedOption("grammar",
                JSAP.STRING_PARSER,
                JSAP.NO_DEFAULT,
                JSAP.REQUIRED,
                'g',
                "grammar",
                "file holding one rule 'LHS -> RHS' per line; a blank line ends the grammar"));

        jsap.registerParameter(new Switch("table",
                't',
                "table",
                "print the recognition table of every word"));

        jsap.registerParameter(new Switch("verbose",
                'v',
                "verbose",
                "print the grammar after every normalization stage"));

        jsap.registerParameter(new UnflaggedOption("words",
                JSAP.STRING_PARSER,
                JSAP.NO_DEFAULT,
                JSAP.NOT_REQUIRED,
                JSAP.GREEDY,
                "words to recognize; without any, words are read from standard input, one per line"));

        return jsap.parse(args);
    }

    // Keeps going past rules that fail to decode, reporting each one.
    private static Grammar readGrammar(Path file, PrintStream err) throws IOException {
        Grammar grammar = new Grammar();
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.isBlank()) break;
            try {
                grammar.addRule(line);
            } catch (GrammarException e) {
                err.println("Error: line " + (i + 1) + ": " + e.getMessage());
            }
        }
        return grammar;
    }

    private static void recognize(CYKParser parser, String word, boolean printTable, PrintStream out) {
        ParseResult result = parser.parse(word);
        out.println();
        out.println("Word: '" + word + "'");
        if (printTable && !word.isEmpty()) out.println(parser.table().format());
        out.println(result);
    }
}
