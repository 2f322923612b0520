package tableau.rules;

import java.util.List;
import modal.Formulas;
import proof.ProofStep;
import tableau.Tableau;
import tableau.TableauNode;

public class DoubleNegationRule implements FormulaRule {

    @Override
    public boolean matches(TableauNode node, String formula) {
        return Formulas.isDoubleNegation(formula);
    }

    @Override
    public void expand(Tableau tableau, TableauNode node, String formula) {
        String inner = Formulas.stripDoubleNegation(formula);
        node.markExpanded(formula);
        node.addFormula(inner);
        tableau.recordStep(new ProofStep("NotElim", List.of(formula), inner,
                "double negation at world " + node.getWorld()));
    }
}
