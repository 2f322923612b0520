package tableau.rules;

import java.util.List;
import modal.Formulas;
import proof.ProofStep;
import tableau.Tableau;
import tableau.TableauNode;

/**
 * α-rule: both conjuncts hold at the same node.
 */
public class ConjunctionRule implements FormulaRule {

    @Override
    public boolean matches(TableauNode node, String formula) {
        return formula.contains(Formulas.AND);
    }

    @Override
    public void expand(Tableau tableau, TableauNode node, String formula) {
        String[] parts = Formulas.splitFirst(formula, Formulas.AND).orElseThrow();
        node.markExpanded(formula);
        node.addFormula(parts[0]);
        node.addFormula(parts[1]);
        tableau.recordStep(new ProofStep("AndElim", List.of(formula), parts[0] + ", " + parts[1],
                "conjunction at world " + node.getWorld()));
    }
}
