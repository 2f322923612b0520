package tableau.rules;

import java.util.List;
import tableau.Tableau;
import tableau.TableauNode;

/**
 * Walks the node's unexpanded formulas in iteration order and fires the first member rule
 * matching the first eligible formula. At most one expansion per call.
 */
public class RuleGroup implements TableauRule {
    private final String name;
    private final List<FormulaRule> rules;

    public RuleGroup(String name, List<FormulaRule> rules) {
        this.name = name;
        this.rules = List.copyOf(rules);
    }

    public static RuleGroup propositional() {
        return new RuleGroup("propositional", List.of(new ConjunctionRule(), new DisjunctionRule(), new DoubleNegationRule()));
    }

    public static RuleGroup modal() {
        return new RuleGroup("modal", List.of(new NecessityRule(), new PossibilityRule()));
    }

    @Override
    public boolean apply(Tableau tableau, TableauNode node) {
        for (final var formula : List.copyOf(node.getFormulas())) {
            if (node.isExpanded(formula)) continue;
            for (var rule : rules) {
                if (!rule.matches(node, formula)) continue;
                rule.expand(tableau, node, formula);
                return true;
            }
        }
        return false;
    }

    @Override
    public String getName() {
        return name;
    }
}
