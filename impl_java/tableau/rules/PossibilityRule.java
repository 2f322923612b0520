package tableau.rules;

import java.util.List;
import modal.Formulas;
import proof.ProofStep;
import tableau.Tableau;
import tableau.TableauNode;

/**
 * ◇-rule. Always opens a fresh world.
 */
public class PossibilityRule implements FormulaRule {

    @Override
    public boolean matches(TableauNode node, String formula) {
        return Formulas.isPossibility(formula);
    }

    @Override
    public void expand(Tableau tableau, TableauNode node, String formula) {
        String inner = Formulas.stripModalPrefix(formula);
        node.markExpanded(formula);
        int world = tableau.newWorld();
        node.addAccessibleWorld(world);
        node.addChild(node.openWorld(world, inner));
        tableau.recordStep(new ProofStep("DiamondElim", List.of(formula), inner,
                "possibility: w%d -> w%d".formatted(node.getWorld(), world)));
    }
}
