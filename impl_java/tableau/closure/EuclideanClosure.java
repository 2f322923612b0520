package tableau.closure;

import java.util.List;
import modal.Formulas;
import proof.ProofStep;
import tableau.Tableau;
import tableau.TableauNode;

/**
 * S5: S4, then ◇P → □◇P.
 */
public class EuclideanClosure implements ClosureRule {
    private final ClosureRule transitive = new TransitiveClosure();

    @Override
    public boolean apply(Tableau tableau, TableauNode node) {
        if (transitive.apply(tableau, node)) return true;
        for (final var formula : List.copyOf(node.getFormulas())) {
            if (!Formulas.isPossibility(formula)) continue;
            String boxed = Formulas.BOX + formula;
            if (!node.addFormula(boxed)) continue;
            tableau.recordStep(new ProofStep("5", List.of(formula), boxed, "euclidean property at world " + node.getWorld()));
            return true;
        }
        return false;
    }

    @Override
    public String getName() {
        return "S5";
    }
}
