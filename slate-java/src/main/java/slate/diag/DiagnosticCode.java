package slate.diag;

import java.util.Locale;
import java.util.Optional;

/**
 * Every diagnostic the engine can produce, with the explanation printed by {@code --explain}.
 */
public enum DiagnosticCode {

    // ---------- scanner ----------
    S0001("Invalid token", Severity.ERROR, """
            A character that is not part of the expression language was found.

            Programs may contain numbers, identifiers, the operators + - * / ^, parentheses,
            the definition markers := and =, and the statement separators ; and newline.
            For example, in

                1 + 2 @ 3
                      ^ invalid token

            "@" is not a recognized token. The statement containing it is skipped; the rest of
            the program is still analyzed."""),

    // ---------- parser ----------
    P0001("Unexpected extra tokens", Severity.ERROR, """
            Tokens were found after a complete statement but before the next separator.

                1 + 2 )
                      ^ not connected to the statement

            Put each statement on its own line or separate statements with ";". Only a number or
            a closing ")" multiplies the name after it (2x, (a + 1)x); two names side by side do
            not, so write "x * y" rather than "x y"."""),

    P0002("Expected an expression", Severity.ERROR, """
            A sequence of tokens was expected to form an expression but does not.

                4 -
                   ^ missing right operand

                1 + * 2
                    ^ "*" cannot start an expression

            Complete the expression or remove the dangling operator."""),

    P0003("Unclosed delimiter", Severity.ERROR, """
            An opening parenthesis has no matching closing parenthesis before the end of the
            statement.

                (1 + 2
                      ^ expected ")"
            """),

    P0004("Pattern in program", Severity.ERROR, """
            Pattern variables ($a, #a, _a) only make sense inside rewrite rules. A program
            containing one cannot be evaluated, because a pattern stands for an unknown
            expression rather than a value. Rename the variable without its sigil."""),

    P0005("Variable in pattern", Severity.ERROR, """
            Rewrite rule templates may only use pattern variables:

                $a  matches a variable
                #a  matches a numeric constant
                _a  matches any expression

            A plain variable in a template would only ever match a variable with that exact
            name, which is almost never intended."""),

    P0006("Unmatched closing delimiter", Severity.ERROR, """
            A closing parenthesis was found with no opening parenthesis to match it.

                1 + 2)
                     ^ unmatched
            """),

    // ---------- rewrite engine ----------
    R0001("Division by zero", Severity.ERROR, """
            An expression divides by a literal zero, or raises zero to a negative power.
            The expression is left as written; no rewrite is applied to it.

                x / 0
                (2 - 2) ^ -1

            Division by an expression that is not a literal is never folded unless a rule
            condition proves the divisor non-zero."""),

    R0002("Simplification did not converge", Severity.WARNING, """
            The rewrite engine hit its pass limit before the expression stopped changing.
            This usually means two rules undo each other. The last form reached is reported.
            Raise maxPassesPerNode or remove one of the cycling rules."""),

    // ---------- validation ----------
    V0001("Incompatible definitions", Severity.WARNING, """
            A variable has two definitions that evaluate to different concrete values.

                a := 1
                a := 12 - 10

            "a" is defined as 1 and as 2, which can never both hold.

            This is only reported when both definitions reduce to numbers. Given

                a := c
                a := 2c

            nothing is reported, since both hold when c = 0. Once the value of "c" is known,

                a := c
                a := 2c
                c := 1

            the two definitions of "a" become 1 and 2 and are reported."""),

    // ---------- lints ----------
    L0001("Redundant nesting", Severity.WARNING, """
            An expression is wrapped in more than one pair of parentheses.

                ((1))  ->  (1)

            One pair is enough to group an expression; more only make it harder to read."""),

    L0002("Unary series", Severity.WARNING, """
            A chain of unary signs can be reduced to at most one sign.

                --1    ->  1
                -+-1   ->  1
                +-1    ->  -1
            """),

    L0004("Mixed definition markers", Severity.WARNING, """
            A program uses both "=" and ":=" to define variables.

                a = 1
                b := 2

            Both mean the same thing. Use one of them consistently.""");

    private final String title;
    private final Severity severity;
    private final String explanation;

    DiagnosticCode(String title, Severity severity, String explanation) {
        this.title = title;
        this.severity = severity;
        this.explanation = explanation;
    }

    public String code() {
        return name();
    }

    public String title() {
        return title;
    }

    public Severity severity() {
        return severity;
    }

    public String explanation() {
        return explanation;
    }

    public static Optional<DiagnosticCode> lookup(String code) {
        try {
            return Optional.of(valueOf(code.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
