package tableau.rules;

import tableau.Tableau;
import tableau.TableauNode;

public interface TableauRule {

    /**
     * Apply the rule to the node if it is applicable. This mutates the node: it either adds
     * formulas to it or attaches children.
     *
     * @return true if the rule fired
     */
    boolean apply(Tableau tableau, TableauNode node);

    String getName();
}
