package proofSearch;

import tableau.ExpansionHook;
import tableau.Tableau;
import tableau.TableauNode;

/**
 * Stops expanding a tableau once it has recorded {@code maxSteps} rule applications.
 */
public class ExpansionBudget implements ExpansionHook {
    private final int maxSteps;

    public ExpansionBudget(int maxSteps) {
        if (maxSteps <= 0) throw new IllegalArgumentException("maxSteps must be positive: " + maxSteps);
        this.maxSteps = maxSteps;
    }

    @Override
    public boolean shouldExpand(Tableau tableau, TableauNode node, int remainingDepth) {
        return tableau.getProofSteps().size() < maxSteps;
    }
}
