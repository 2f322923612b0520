package modal.formula;

import modal.Formulas;

public record Not(Formula formula) implements Formula {

    @Override
    public int countLiterals() {
        return formula.countLiterals();
    }

    @Override
    public int modalDepth() {
        return formula.modalDepth();
    }

    @Override
    public String toFormulaString() {
        return Formulas.NOT + formula.toFormulaString();
    }

    @Override
    public String toString() {
        return toFormulaString();
    }
}
