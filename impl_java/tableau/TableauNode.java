package tableau;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import modal.Formulas;

/**
 * A vertex of the proof tree: the formulas true at one world, plus bookkeeping for which
 * formulas have been expanded here and which worlds this node has opened.
 */
public class TableauNode {
    private final Set<String> formulas;
    private final int world;
    private NodeStatus status = NodeStatus.OPEN;
    private final TableauNode parent;
    private final List<TableauNode> children;
    private final Set<Integer> accessibleWorlds;
    private final Set<String> expandedFormulas;

    public TableauNode(Set<String> formulas, int world) {
        this(formulas, world, null, Set.of());
    }

    private TableauNode(Set<String> formulas, int world, TableauNode parent, Set<String> expandedFormulas) {
        this.formulas = new LinkedHashSet<>(formulas);
        this.world = world;
        this.parent = parent;
        this.children = new ArrayList<>(2);
        this.accessibleWorlds = new LinkedHashSet<>();
        this.expandedFormulas = new LinkedHashSet<>(expandedFormulas);
    }

    /**
     * Create a child at the given world holding this node's formulas minus {@code without},
     * plus {@code extra}. The child gets its own copy of the expanded-formula set.
     */
    public TableauNode branch(int world, String extra, String without) {
        Set<String> inherited = new LinkedHashSet<>(formulas);
        inherited.remove(without);
        TableauNode child = new TableauNode(inherited, world, this, expandedFormulas);
        child.addFormula(extra);
        return child;
    }

    /**
     * Create a child at a new world holding only the given formula.
     */
    public TableauNode openWorld(int world, String formula) {
        return new TableauNode(Set.of(formula), world, this, Set.of());
    }

    /**
     * @return true if the formula was not present before
     */
    public boolean addFormula(String formula) {
        return formulas.add(formula);
    }

    public boolean isContradictory() {
        for (final var formula : formulas) {
            if (formula.startsWith(Formulas.NOT)) {
                if (formulas.contains(formula.substring(Formulas.NOT.length())))
                    return true;
            } else if (formulas.contains(Formulas.NOT + formula)) {
                return true;
            }
        }
        return false;
    }

    public void close() {
        status = NodeStatus.CLOSED;
    }

    public void markSaturated() {
        status = NodeStatus.SATURATED;
    }

    public void markExpanded(String formula) {
        expandedFormulas.add(formula);
    }

    public boolean isExpanded(String formula) {
        return expandedFormulas.contains(formula);
    }

    public void addChild(TableauNode child) {
        children.add(child);
    }

    public void addAccessibleWorld(int world) {
        accessibleWorlds.add(world);
    }

    /**
     * Live view, iteration follows insertion order.
     */
    public Set<String> getFormulas() {
        return Collections.unmodifiableSet(formulas);
    }

    public int getWorld() {
        return world;
    }

    public NodeStatus getStatus() {
        return status;
    }

    public TableauNode getParent() {
        return parent;
    }

    public List<TableauNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public Set<Integer> getAccessibleWorlds() {
        return Collections.unmodifiableSet(accessibleWorlds);
    }

    public Set<String> getExpandedFormulas() {
        return Collections.unmodifiableSet(expandedFormulas);
    }

    public String createString(int indentation, String delim) {
        String indent = "  ".repeat(Math.max(0, indentation)) + delim + " ";
        StringBuilder sb = new StringBuilder(indent)
                .append("w").append(world)
                .append(" ").append(formulas)
                .append(" [").append(status).append("]");
        if (!accessibleWorlds.isEmpty()) {
            sb.append(" -> ").append(accessibleWorlds);
        }
        for (var child : children) {
            sb.append("\n").append(child.createString(indentation + 1, delim));
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return createString(0, "*");
    }
}
