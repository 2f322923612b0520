package tableau.closure;

import java.util.List;
import modal.Formulas;
import proof.ProofStep;
import tableau.Tableau;
import tableau.TableauNode;

/**
 * S4: T, then □P → □□P.
 */
public class TransitiveClosure implements ClosureRule {
    private final ClosureRule reflexive = new ReflexiveClosure();

    @Override
    public boolean apply(Tableau tableau, TableauNode node) {
        if (reflexive.apply(tableau, node)) return true;
        for (final var formula : List.copyOf(node.getFormulas())) {
            if (!Formulas.isNecessity(formula)) continue;
            String boxed = Formulas.BOX + formula;
            if (!node.addFormula(boxed)) continue;
            tableau.recordStep(new ProofStep("4", List.of(formula), boxed, "transitivity at world " + node.getWorld()));
            return true;
        }
        return false;
    }

    @Override
    public String getName() {
        return "S4";
    }
}
