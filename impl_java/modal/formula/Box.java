package modal.formula;

import modal.Formulas;

public record Box(Formula formula) implements Formula {

    @Override
    public int countLiterals() {
        return formula.countLiterals();
    }

    @Override
    public int modalDepth() {
        return formula.modalDepth() + 1;
    }

    @Override
    public String toFormulaString() {
        return Formulas.BOX + formula.toFormulaString();
    }

    @Override
    public String toString() {
        return toFormulaString();
    }
}
