package slate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import slate.ast.Program;
import slate.ast.stmt.Stmt;
import slate.check.DefinitionChecker;
import slate.config.ConfigLoader;
import slate.config.SlateConfig;
import slate.diag.Diagnostic;
import slate.diag.DiagnosticCode;
import slate.diag.Diagnostics;
import slate.diag.Span;
import slate.emit.EmitFormat;
import slate.emit.Emitter;
import slate.emit.Emitters;
import slate.emit.PrettyEmitter;
import slate.lexer.Lexer;
import slate.lexer.Token;
import slate.lexer.TokenType;
import slate.lint.Linter;
import slate.parser.Parser;
import slate.rewrite.RewriteEngine;
import slate.rewrite.RewriteIssue;
import slate.rewrite.Simplification;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * The whole pipeline: lex and parse, lint, simplify every statement, check definitions.
 * Holds only immutable state; one instance can serve any number of threads.
 */
public final class Slate {
    private static final Logger log = LoggerFactory.getLogger(Slate.class);

    private final SlateConfig config;
    private final RewriteEngine engine;
    private final DefinitionChecker checker;
    private final Linter linter = new Linter();
    private final Emitter pretty = new PrettyEmitter();

    /**
     * @throws slate.rewrite.RuleConfigurationException  if the configured rules are invalid
     * @throws slate.config.ConfigurationException      if the engine limits are invalid
     */
    public Slate(SlateConfig config) {
        this.config = config;
        this.engine = new RewriteEngine(config.registry(), config.limits());
        this.checker = new DefinitionChecker(engine);
    }

    public static Slate withDefaults() {
        return new Slate(new ConfigLoader().defaults());
    }

    public SlateConfig config() {
        return config;
    }

    public RewriteEngine engine() {
        return engine;
    }

    /**
     * The emitter for {@code format} under this configuration.
     *
     * @throws IllegalStateException if {@code format} is LaTeX and typesetting is disabled
     */
    public Emitter emitter(EmitFormat format, boolean frac) {
        return Emitters.forFormat(format, config.emitConfig().withFrac(frac));
    }

    public String emit(Program program, EmitFormat format) {
        return emitter(format, false).emit(program);
    }

    /** Lexes and parses only. */
    public Program parse(String source, Diagnostics diagnostics) {
        return Parser.parse(source, diagnostics);
    }

    public Analysis analyze(String source) {
        Diagnostics diags = new Diagnostics();
        List<Token> tokens = new Lexer(source, diags).tokenize();
        Program program = new Parser(tokens, diags).parseProgram();

        if (config.lint().enabled()) {
            diags.reportAll(linter.lint(tokens, program));
        }

        List<Stmt> simplified = new ArrayList<>();
        for (Stmt s : program.statements()) {
            Simplification result = engine.simplify(s.expr());
            for (RewriteIssue issue : result.issues()) {
                diags.report(toDiagnostic(issue, s.span(), result.passes()));
            }
            simplified.add(s.withExpr(result.expr()));
        }

        DefinitionChecker.Result definitions = checker.check(program);
        diags.reportAll(definitions.diagnostics());

        List<Diagnostic> ordered = new ArrayList<>(diags.all());
        ordered.sort(Comparator.comparingInt(d -> d.span().start()));
        log.debug("Analyzed {} statements, {} diagnostics", program.statements().size(), ordered.size());
        return new Analysis(source, program, new Program(simplified), definitions, ordered);
    }

    /**
     * Hover text at {@code offset}: the definitions of the variable under the cursor, one
     * {@code = value} line each ({@code ???} when it has none), or else the simplified form of the
     * statement under the cursor. Empty when the cursor is outside every statement.
     */
    public Optional<String> hover(String source, int offset) {
        Analysis analysis = analyze(source);

        Optional<Token> token = tokenAt(source, offset);
        if (token.isPresent() && token.get().type() == TokenType.IDENTIFIER) {
            List<Stmt> defs = analysis.simplifiedDefinitionsOf(token.get().lexeme());
            if (defs.isEmpty()) return Optional.of("???");
            StringJoiner lines = new StringJoiner("\n");
            for (Stmt d : defs) lines.add("= " + pretty.emit(d.expr()));
            return Optional.of(lines.toString());
        }

        List<Stmt> original = analysis.program().statements();
        for (int i = 0; i < original.size(); i++) {
            if (original.get(i).span().contains(offset)) {
                return Optional.of(pretty.emit(analysis.simplified().statements().get(i).expr()));
            }
        }
        return Optional.empty();
    }

    // ================= helpers =================

    private static Optional<Token> tokenAt(String source, int offset) {
        Lexer lexer = new Lexer(source);
        for (Token t = lexer.nextToken(); t.type() != TokenType.EOF; t = lexer.nextToken()) {
            if (t.span().contains(offset)) return Optional.of(t);
        }
        return Optional.empty();
    }

    private Diagnostic toDiagnostic(RewriteIssue issue, Span span, int passes) {
        return switch (issue.kind()) {
            case DIVISION_BY_ZERO -> Diagnostic.of(DiagnosticCode.R0001, span, DiagnosticCode.R0001.title(),
                    "\"" + pretty.emit(issue.at()) + "\" divides by zero");
            case NOT_CONVERGED -> Diagnostic.of(DiagnosticCode.R0002, span, DiagnosticCode.R0002.title(),
                            "stopped after " + passes + " passes")
                    .withNote("last form: " + pretty.emit(issue.at()));
        };
    }
}
