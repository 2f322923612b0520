package tableau.rules;

import tableau.Tableau;
import tableau.TableauNode;

/**
 * A rule triggered by a single formula of a node.
 */
public interface FormulaRule {

    boolean matches(TableauNode node, String formula);

    /**
     * Expand {@code formula}, which {@link #matches} accepted, and mark it expanded on the node.
     */
    void expand(Tableau tableau, TableauNode node, String formula);
}
