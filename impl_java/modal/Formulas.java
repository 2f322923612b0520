package modal;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * String-level operations on formulas. Both provers treat formulas as plain strings and
 * only ever inspect prefixes and infix occurrences of the operator tokens below.
 */
public final class Formulas {
    public static final String NOT = "¬";
    public static final String AND = "∧";
    public static final String OR = "∨";
    public static final String BOX = "□";
    public static final String DIAMOND = "◇";

    private Formulas() {
    }

    /**
     * Strip one leading negation if present, otherwise prepend one.
     * negate(negate(f)) == f for every f that does not start with ¬¬.
     */
    public static String negate(String formula) {
        if (formula.startsWith(NOT)) {
            return formula.substring(NOT.length());
        }
        return NOT + formula;
    }

    public static boolean isDoubleNegation(String formula) {
        return formula.startsWith(NOT + NOT);
    }

    public static String stripDoubleNegation(String formula) {
        return formula.substring(2 * NOT.length());
    }

    public static boolean isNecessity(String formula) {
        return formula.startsWith(BOX);
    }

    public static boolean isPossibility(String formula) {
        return formula.startsWith(DIAMOND);
    }

    /**
     * Drop exactly one leading operator token. Only meaningful for □ and ◇ formulas.
     */
    public static String stripModalPrefix(String formula) {
        return formula.substring(1);
    }

    /**
     * Split on the first occurrence of the operator, both halves trimmed.
     *
     * @return left and right halves, or empty if the operator does not occur
     */
    public static Optional<String[]> splitFirst(String formula, String operator) {
        int index = formula.indexOf(operator);
        if (index < 0) return Optional.empty();
        String left = formula.substring(0, index).trim();
        String right = formula.substring(index + operator.length()).trim();
        return Optional.of(new String[]{left, right});
    }

    /**
     * Split on every occurrence of the operator, every piece trimmed. No parenthesis awareness.
     */
    public static List<String> splitAll(String formula, String operator) {
        List<String> parts = new ArrayList<>();
        int from = 0;
        int index;
        while ((index = formula.indexOf(operator, from)) >= 0) {
            parts.add(formula.substring(from, index).trim());
            from = index + operator.length();
        }
        parts.add(formula.substring(from).trim());
        return parts;
    }
}
