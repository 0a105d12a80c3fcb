package slate.cli;

import slate.Analysis;
import slate.Slate;
import slate.ast.Program;
import slate.ast.expr.Expr;
import slate.config.ConfigLoader;
import slate.config.ConfigurationException;
import slate.config.SlateConfig;
import slate.diag.DiagnosticCode;
import slate.diag.DiagnosticRenderer;
import slate.diag.Diagnostics;
import slate.emit.EmitFormat;
import slate.emit.Emitter;
import slate.parser.Parser;
import slate.rewrite.RuleConfigurationException;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Optional;

public final class Main {

    static final int OK = 0;
    static final int ERRORS = 1;
    static final int USAGE = 2;

    private static final String USAGE_TEXT = """
            Usage: slate [options] <program>
                   slate [options] -f <file>
                   slate --explain <CODE>

            Options:
              -f, --file <path>          read the program from a file
              -o, --output-form <form>   pretty (default), s-expression or latex
                  --frac                 typeset divisions as \\frac{}{} (latex only)
                  --parse-only           print the parsed program without simplifying it
                  --expr-pat             parse the input as a rewrite rule template
                  --config <path>        JSON configuration file
                  --rules <path>         JSON file of additional rewrite rules
                  --explain <CODE>       explain a diagnostic code, e.g. P0002
              -h, --help                 show this message""";

    private record Options(
            String program,
            Path file,
            EmitFormat format,
            boolean frac,
            boolean parseOnly,
            boolean exprPat,
            Path config,
            Path rules,
            String explain
    ) {}

    private static final class UsageException extends Exception {
        UsageException(String message) {
            super(message);
        }
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /** Runs the command line and returns its exit status. */
    static int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length == 1 && (args[0].equals("-h") || args[0].equals("--help"))) {
            out.println(USAGE_TEXT);
            return OK;
        }

        Options opts;
        try {
            opts = parseArgs(args);
        } catch (UsageException e) {
            err.println("error: " + e.getMessage());
            err.println(USAGE_TEXT);
            return USAGE;
        }

        if (opts.explain() != null) return explain(opts.explain(), out, err);

        String source;
        String origin = null;
        if (opts.file() != null) {
            try {
                source = Files.readString(opts.file());
                origin = opts.file().toString();
            } catch (IOException e) {
                err.println("error: cannot read " + opts.file() + ": " + e.getMessage());
                return ERRORS;
            }
        } else {
            source = opts.program();
        }

        Slate slate;
        Emitter emitter;
        try {
            SlateConfig config = loadConfig(opts);
            slate = new Slate(config);
            emitter = slate.emitter(opts.format(), opts.frac());
        } catch (ConfigurationException | RuleConfigurationException e) {
            err.println("error: " + e.getMessage());
            return ERRORS;
        } catch (IllegalStateException e) {
            err.println("error: " + e.getMessage());
            return USAGE;
        }

        DiagnosticRenderer renderer = new DiagnosticRenderer(source, origin);

        // 1. rule template
        if (opts.exprPat()) {
            Diagnostics diags = new Diagnostics();
            Optional<Expr> pattern = Parser.parsePattern(source, diags);
            pattern.ifPresent(p -> out.println(emitter.emit(p)));
            if (!diags.isEmpty()) err.print(renderer.render(diags.all()));
            return diags.hasErrors() ? ERRORS : OK;
        }

        // 2. parse only
        if (opts.parseOnly()) {
            Diagnostics diags = new Diagnostics();
            Program program = slate.parse(source, diags);
            printProgram(out, emitter, program);
            if (!diags.isEmpty()) err.print(renderer.render(diags.all()));
            return diags.hasErrors() ? ERRORS : OK;
        }

        // 3. full analysis
        Analysis analysis = slate.analyze(source);
        printProgram(out, emitter, analysis.simplified());
        if (!analysis.diagnostics().isEmpty()) err.print(renderer.render(analysis.diagnostics()));
        return analysis.hasErrors() ? ERRORS : OK;
    }

    // ================= helpers =================

    private static Options parseArgs(String[] args) throws UsageException {
        String program = null;
        Path file = null;
        EmitFormat format = EmitFormat.PRETTY;
        boolean frac = false;
        boolean parseOnly = false;
        boolean exprPat = false;
        Path config = null;
        Path rules = null;
        String explain = null;

        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            switch (a) {
                case "-f", "--file" -> file = Path.of(value(args, ++i, a));
                case "-o", "--output-form" -> {
                    String f = value(args, ++i, a);
                    format = EmitFormat.fromFlag(f)
                            .orElseThrow(() -> new UsageException("unknown output form \"" + f
                                    + "\" (expected pretty, s-expression or latex)"));
                }
                case "--frac" -> frac = true;
                case "--parse-only" -> parseOnly = true;
                case "--expr-pat" -> exprPat = true;
                case "--config" -> config = Path.of(value(args, ++i, a));
                case "--rules" -> rules = Path.of(value(args, ++i, a));
                case "--explain" -> explain = value(args, ++i, a);
                case "--" -> {
                    // everything after is the program, e.g. slate -- -x + 1
                    if (program != null || i + 1 >= args.length) throw new UsageException("expected one program after --");
                    program = String.join(" ", Arrays.copyOfRange(args, i + 1, args.length));
                    i = args.length;
                }
                default -> {
                    if (a.startsWith("-") && a.length() > 1 && !Character.isDigit(a.charAt(1))) {
                        throw new UsageException("unknown option " + a);
                    }
                    if (program != null) throw new UsageException("more than one program given");
                    program = a;
                }
            }
        }

        if (explain == null) {
            if (program == null && file == null) throw new UsageException("no program given");
            if (program != null && file != null) throw new UsageException("give either a program or --file, not both");
        }
        if (parseOnly && exprPat) throw new UsageException("--parse-only and --expr-pat cannot be combined");
        return new Options(program, file, format, frac, parseOnly, exprPat, config, rules, explain);
    }

    private static String value(String[] args, int i, String option) throws UsageException {
        if (i >= args.length) throw new UsageException(option + " needs a value");
        return args[i];
    }

    private static int explain(String code, PrintStream out, PrintStream err) {
        Optional<DiagnosticCode> c = DiagnosticCode.lookup(code);
        if (c.isEmpty()) {
            err.println("error: no diagnostic code \"" + code + "\"");
            return USAGE;
        }
        out.println(c.get().code() + ": " + c.get().title());
        out.println();
        out.println(c.get().explanation());
        return OK;
    }

    private static SlateConfig loadConfig(Options opts) {
        ConfigLoader loader = new ConfigLoader();
        SlateConfig config = opts.config() != null ? loader.load(opts.config()) : loader.defaults();
        if (opts.rules() != null) {
            config = config.withCustomRules(loader.loadRules(opts.rules()));
        }
        return config;
    }

    private static void printProgram(PrintStream out, Emitter emitter, Program program) {
        if (!program.statements().isEmpty()) out.println(emitter.emit(program));
    }
}
