package modal.formula;

public interface Formula {

    /**
     * Number of atom occurrences in the formula.
     */
    int countLiterals();

    /**
     * Maximum nesting of □ and ◇ operators.
     */
    int modalDepth();

    /**
     * Render in the prover's string syntax, parenthesising binary subformulas.
     */
    String toFormulaString();
}
