package modal.formula;

import modal.Formulas;

public record Or(Formula left, Formula right) implements Formula {

    @Override
    public int countLiterals() {
        return left.countLiterals() + right.countLiterals();
    }

    @Override
    public int modalDepth() {
        return Math.max(left.modalDepth(), right.modalDepth());
    }

    @Override
    public String toFormulaString() {
        return "(" + left.toFormulaString() + " " + Formulas.OR + " " + right.toFormulaString() + ")";
    }

    @Override
    public String toString() {
        return toFormulaString();
    }
}
