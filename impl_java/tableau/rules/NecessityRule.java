package tableau.rules;

import java.util.List;
import modal.Formulas;
import proof.ProofStep;
import tableau.Tableau;
import tableau.TableauNode;

/**
 * □-rule. Fires only while the node has not opened any world yet; once it has, the
 * closure axioms of the logic are responsible for further □ reasoning.
 */
public class NecessityRule implements FormulaRule {

    @Override
    public boolean matches(TableauNode node, String formula) {
        return Formulas.isNecessity(formula) && node.getAccessibleWorlds().isEmpty();
    }

    @Override
    public void expand(Tableau tableau, TableauNode node, String formula) {
        String inner = Formulas.stripModalPrefix(formula);
        node.markExpanded(formula);
        int world = tableau.newWorld();
        node.addAccessibleWorld(world);
        node.addChild(node.openWorld(world, inner));
        tableau.recordStep(new ProofStep("BoxElim", List.of(formula), inner,
                "necessity: w%d -> w%d".formatted(node.getWorld(), world)));
    }
}
