package modal.formula;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;
import modal.Formulas;

/**
 * Recursive descent reader for the prover's formula syntax.
 * Precedence, loosest first: ∨, ∧, then the prefix operators ¬ □ ◇. Binary operators
 * associate to the left. An atom is an identifier, optionally followed by a
 * parenthesised argument list that is kept verbatim as part of its name.
 * <p>
 * Formulas nested deeper than {@value #MAX_NESTING} operators or parentheses are rejected.
 */
public final class FormulaParser {
    public static final int MAX_NESTING = 1000;

    private final String input;
    private int pos;
    private int nesting;

    private FormulaParser(String input) {
        this.input = input;
        this.pos = 0;
    }

    /**
     * @return the parsed formula, or empty if the string is not well formed
     */
    public static Optional<Formula> parse(String formula) {
        if (formula == null) return Optional.empty();
        FormulaParser parser = new FormulaParser(formula);
        Formula result = parser.parseOr();
        parser.skipWhitespace();
        if (result == null || parser.pos != parser.input.length()) {
            return Optional.empty();
        }
        return Optional.of(result);
    }

    private Formula parseOr() {
        Formula left = parseAnd();
        while (left != null && accept(Formulas.OR)) {
            Formula right = parseAnd();
            if (right == null) return null;
            left = new Or(left, right);
        }
        return left;
    }

    private Formula parseAnd() {
        Formula left = parseUnary();
        while (left != null && accept(Formulas.AND)) {
            Formula right = parseUnary();
            if (right == null) return null;
            left = new And(left, right);
        }
        return left;
    }

    private Formula parseUnary() {
        Deque<String> prefixes = new ArrayDeque<>();
        while (true) {
            if (accept(Formulas.NOT)) prefixes.push(Formulas.NOT);
            else if (accept(Formulas.BOX)) prefixes.push(Formulas.BOX);
            else if (accept(Formulas.DIAMOND)) prefixes.push(Formulas.DIAMOND);
            else break;
            if (nesting + prefixes.size() > MAX_NESTING) return null;
        }
        nesting += prefixes.size();
        Formula operand = parseOperand();
        nesting -= prefixes.size();
        if (operand == null) return null;
        while (!prefixes.isEmpty()) {
            String prefix = prefixes.pop();
            if (prefix.equals(Formulas.NOT)) operand = new Not(operand);
            else if (prefix.equals(Formulas.BOX)) operand = new Box(operand);
            else operand = new Diamond(operand);
        }
        return operand;
    }

    private Formula parseOperand() {
        if (!accept("(")) return parseAtom();
        if (++nesting > MAX_NESTING) return null;
        Formula inner = parseOr();
        nesting--;
        if (inner == null || !accept(")")) return null;
        return inner;
    }

    private Formula parseAtom() {
        skipWhitespace();
        int start = pos;
        while (pos < input.length() && isIdentifierChar(input.charAt(pos))) {
            pos++;
        }
        if (start == pos) return null;
        if (pos < input.length() && input.charAt(pos) == '(') {
            int depth = 0;
            do {
                char c = input.charAt(pos);
                if (c == '(') depth++;
                if (c == ')') depth--;
                pos++;
            } while (depth > 0 && pos < input.length());
            if (depth != 0) return null;
        }
        return new Atom(input.substring(start, pos));
    }

    private boolean accept(String token) {
        skipWhitespace();
        if (input.startsWith(token, pos)) {
            pos += token.length();
            return true;
        }
        return false;
    }

    private void skipWhitespace() {
        while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
            pos++;
        }
    }

    private static boolean isIdentifierChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
