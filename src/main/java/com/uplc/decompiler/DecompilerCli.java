package com.uplc.decompiler;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.uplc.debug.Debug;
import com.uplc.debug.DebugLevel;
import com.uplc.decompiler.convert.ConversionError;
import com.uplc.decompiler.convert.ConversionMode;
import com.uplc.decompiler.convert.DecodedTermJson;
import com.uplc.decompiler.ir.IRPrinter;
import com.uplc.decompiler.parser.ParseError;
import com.uplc.decompiler.term.TermPrinter;

/**
 * Command line front end.
 *
 * <pre>
 *   DecompilerCli [--strict] [--format=aiken|json|ir|text] [--verbose] [--no-fold] &lt;file.uplc|file.json&gt;
 * </pre>
 *
 * Exit codes: 0 success, 1 decompilation error, 2 usage, 3 unreadable input.
 */
public final class DecompilerCli {

    private static final String TAG = "Cli";
    private static final Set<String> FORMATS = Set.of("aiken", "json", "ir", "text");
    private static final Set<String> FLAGS = Set.of("strict", "format", "verbose", "no-fold");
    private static final String USAGE =
            "Usage: DecompilerCli [--strict] [--format=aiken|json|ir|text] [--verbose] [--no-fold] <file.uplc|file.json>";

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    public static int run(String[] args, PrintStream out, PrintStream err) {
        Map<String, String> flags = new HashMap<>();
        List<String> files = new ArrayList<>();
        for (String a : args) {
            if (a.startsWith("--")) {
                int eq = a.indexOf('=');
                if (eq < 0) flags.put(a.substring(2), "true");
                else flags.put(a.substring(2, eq), a.substring(eq + 1));
            } else {
                files.add(a);
            }
        }

        for (String key : flags.keySet()) {
            if (!FLAGS.contains(key)) {
                err.println("Unknown option: --" + key);
                err.println(USAGE);
                return 2;
            }
        }
        String format = flags.getOrDefault("format", "aiken");
        if (files.size() != 1 || !FORMATS.contains(format)) {
            err.println(USAGE);
            return 2;
        }
        if (flags.containsKey("verbose")) Debug.useSysOut(DebugLevel.DEBUG);

        DecompilerOptions options = DecompilerOptions.defaults();
        if (flags.containsKey("strict")) options.setConversionMode(ConversionMode.STRICT);
        if (flags.containsKey("no-fold")) options.optimizerOptions().setConstantFolding(false);

        final Path path = Path.of(files.get(0));
        final String input;
        try {
            input = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("Failed to read input file: " + path);
            return 3;
        }

        UplcDecompiler decompiler = new UplcDecompiler(options);
        try {
            DecompileResult result = path.toString().endsWith(".json")
                    ? decompiler.decompileDecoded(DecodedTermJson.read(input))
                    : decompiler.decompile(input);
            Debug.get().d(TAG, "decompiled " + path + " as " + result.structure.purpose.label);
            switch (format) {
                case "json":
                    out.println(StructureReport.write(result));
                    break;
                case "ir":
                    out.print(IRPrinter.print(decompiler.optimize(decompiler.toIR(result.term))));
                    break;
                case "text":
                    out.println(TermPrinter.showText(result.term));
                    break;
                default:
                    out.print(result.source);
                    break;
            }
            return 0;
        } catch (ParseError e) {
            err.println("Parse error: " + e.getMessage());
            return 1;
        } catch (ConversionError e) {
            err.println("Conversion error: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            err.println("Malformed decoded tree: " + e.getMessage());
            return 1;
        } catch (RuntimeException e) {
            Debug.get().e(TAG, "decompilation failed", e);
            err.println("Decompilation failed: " + e);
            return 1;
        }
    }

    private DecompilerCli() {}
}
