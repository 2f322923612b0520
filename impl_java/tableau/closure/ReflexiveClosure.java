package tableau.closure;

import java.util.List;
import modal.Formulas;
import proof.ProofStep;
import tableau.Tableau;
import tableau.TableauNode;

/**
 * T: □P → P at the same world.
 */
public class ReflexiveClosure implements ClosureRule {

    @Override
    public boolean apply(Tableau tableau, TableauNode node) {
        for (final var formula : List.copyOf(node.getFormulas())) {
            if (!Formulas.isNecessity(formula)) continue;
            String inner = Formulas.stripModalPrefix(formula);
            if (!node.addFormula(inner)) continue;
            tableau.recordStep(new ProofStep("T", List.of(formula), inner, "reflexivity at world " + node.getWorld()));
            return true;
        }
        return false;
    }

    @Override
    public String getName() {
        return "T";
    }
}
