package tableau;

/**
 * Consulted before every expansion ply. Lets search optimizers veto work on a node without
 * touching the rule engine; a vetoed node stays OPEN, exactly as if the depth bound had hit.
 */
@FunctionalInterface
public interface ExpansionHook {

    ExpansionHook ALWAYS = (tableau, node, remainingDepth) -> true;

    boolean shouldExpand(Tableau tableau, TableauNode node, int remainingDepth);

    default ExpansionHook and(ExpansionHook other) {
        return (tableau, node, remainingDepth) ->
                shouldExpand(tableau, node, remainingDepth) && other.shouldExpand(tableau, node, remainingDepth);
    }
}
