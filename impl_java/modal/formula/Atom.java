package modal.formula;

public record Atom(String name) implements Formula {

    @Override
    public int countLiterals() {
        return 1;
    }

    @Override
    public int modalDepth() {
        return 0;
    }

    @Override
    public String toFormulaString() {
        return name;
    }

    @Override
    public String toString() {
        return name;
    }
}
