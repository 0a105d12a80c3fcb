package slate.emit;

import org.junit.jupiter.api.Test;
import slate.ast.Program;
import slate.ast.expr.Expr;
import slate.ast.expr.Num;
import slate.diag.Diagnostics;
import slate.math.Rational;
import slate.parser.Parser;

import static org.junit.jupiter.api.Assertions.*;
import static slate.ast.expr.Exprs.*;

public class EmitterTest {

    private final Emitter pretty = new PrettyEmitter();
    private final Emitter sexpr = new SExpressionEmitter();

    private static Program parse(String src) {
        return Parser.parse(src, new Diagnostics());
    }

    @Test
    void pretty_uses_minimal_parentheses() {
        assertEquals("x + 3", pretty.emit(add(var("x"), num(3))));
        assertEquals("(a + b) * c", pretty.emit(mul(add(var("a"), var("b")), var("c"))));
        assertEquals("a * (b + c)", pretty.emit(mul(var("a"), add(var("b"), var("c")))));
        assertEquals("a - (b - c)", pretty.emit(sub(var("a"), sub(var("b"), var("c")))));
        assertEquals("a - b - c", pretty.emit(sub(sub(var("a"), var("b")), var("c"))));
        assertEquals("a / (b * c)", pretty.emit(div(var("a"), mul(var("b"), var("c")))));
        assertEquals("a ^ b ^ c", pretty.emit(pow(var("a"), pow(var("b"), var("c")))));
        assertEquals("(a ^ b) ^ c", pretty.emit(pow(pow(var("a"), var("b")), var("c"))));
    }

    @Test
    void pretty_signs_and_rationals() {
        assertEquals("-x", pretty.emit(neg(var("x"))));
        assertEquals("-(x + 1)", pretty.emit(neg(add(var("x"), num(1)))));
        assertEquals("-(-x)", pretty.emit(neg(neg(var("x")))));
        assertEquals("-3", pretty.emit(num(-3)));
        assertEquals("1 / 2", pretty.emit(new Num(Rational.of(1, 2))));
        assertEquals("x / (1 / 2)", pretty.emit(div(var("x"), new Num(Rational.of(1, 2)))));
        assertEquals("(1 / 2) ^ 2", pretty.emit(pow(new Num(Rational.of(1, 2)), num(2))));
    }

    @Test
    void pretty_output_parses_back_to_the_same_tree() {
        for (String src : new String[]{"(a + b) * c", "a - (b - c)", "a ^ b ^ c", "(a ^ b) ^ c", "-x ^ 2", "x * -y"}) {
            Expr e = Parser.parse(src, new Diagnostics()).statements().get(0).expr();
            Expr stripped = stripParens(e);
            Expr again = stripParens(Parser.parse(pretty.emit(stripped), new Diagnostics()).statements().get(0).expr());
            assertEquals(stripped, again, src);
        }
    }

    @Test
    void pretty_statements_keep_definition_marker() {
        assertEquals("a := 1\nb = 2\nx + 1", pretty.emit(parse("a := 1; b = 2; x + 1")));
    }

    @Test
    void s_expression_form() {
        assertEquals("(+ x 3)", sexpr.emit(add(var("x"), num(3))));
        assertEquals("(- x)", sexpr.emit(neg(var("x"))));
        assertEquals("(* (+ a b) c)", sexpr.emit(parse("(a + b) * c").statements().get(0).expr()));
        assertEquals("(/ 1 2)", sexpr.emit(new Num(Rational.of(1, 2))));
        assertEquals("(:= a 1)", sexpr.emit(parse("a := 1").statements().get(0)));
    }

    @Test
    void latex_form() {
        var plain = new LatexEmitter(false);
        var frac = new LatexEmitter(true);
        assertEquals("x \\cdot 2", plain.emit(mul(var("x"), num(2))));
        assertEquals("x / 2", plain.emit(div(var("x"), num(2))));
        assertEquals("\\frac{x}{2}", frac.emit(div(var("x"), num(2))));
        assertEquals("-\\frac{1}{2}", frac.emit(new Num(Rational.of(-1, 2))));
        assertEquals("{\\left(a + b\\right)}^{2}", plain.emit(pow(add(var("a"), var("b")), num(2))));
        assertEquals("\\mathrm{abc} + 1", plain.emit(add(var("abc"), num(1))));
    }

    @Test
    void emitters_by_format() {
        assertTrue(Emitters.forFormat(EmitFormat.PRETTY, EmitConfig.DEFAULT) instanceof PrettyEmitter);
        assertTrue(Emitters.forFormat(EmitFormat.S_EXPRESSION, EmitConfig.DEFAULT) instanceof SExpressionEmitter);
        assertTrue(Emitters.forFormat(EmitFormat.LATEX, EmitConfig.DEFAULT) instanceof LatexEmitter);
        assertThrows(IllegalStateException.class,
                () -> Emitters.forFormat(EmitFormat.LATEX, new EmitConfig(false, false)));
        assertEquals(EmitFormat.S_EXPRESSION, EmitFormat.fromFlag("S-Expression").orElseThrow());
        assertTrue(EmitFormat.fromFlag("html").isEmpty());
    }
}
