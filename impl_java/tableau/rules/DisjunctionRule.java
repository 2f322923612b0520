package tableau.rules;

import java.util.List;
import modal.Formulas;
import proof.ProofStep;
import tableau.Tableau;
import tableau.TableauNode;

/**
 * β-rule: one child per disjunct, both at the parent's world.
 */
public class DisjunctionRule implements FormulaRule {

    @Override
    public boolean matches(TableauNode node, String formula) {
        return formula.contains(Formulas.OR);
    }

    @Override
    public void expand(Tableau tableau, TableauNode node, String formula) {
        String[] parts = Formulas.splitFirst(formula, Formulas.OR).orElseThrow();
        node.markExpanded(formula);
        node.addChild(node.branch(node.getWorld(), parts[0], formula));
        node.addChild(node.branch(node.getWorld(), parts[1], formula));
        tableau.recordStep(new ProofStep("OrElim", List.of(formula), parts[0] + " | " + parts[1],
                "disjunction splits the branch at world " + node.getWorld()));
    }
}
