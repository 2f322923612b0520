package tableau;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import modal.Formulas;
import modal.ModalLogic;
import modal.ProverOptions;
import proof.ProofStep;
import tableau.closure.ClosureRule;
import tableau.rules.RuleGroup;
import tableau.rules.TableauRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Refutation prover: negates the goal, seeds a root node with it and the assumptions, and
 * expands until every branch closes, some branch saturates, or the depth bound is reached.
 * <p>
 * Every call to {@link #prove} builds its own {@link Tableau}, so one instance can be shared
 * between threads.
 */
public class TableauProver {
    private static final Logger LOG = LoggerFactory.getLogger(TableauProver.class);

    private final ModalLogic logic;
    private final ProverOptions options;
    private final List<TableauRule> rules;
    private final ExpansionHook hook;

    public TableauProver(ModalLogic logic) {
        this(logic, ProverOptions.defaults());
    }

    public TableauProver(ModalLogic logic, ProverOptions options) {
        this(logic, options, ExpansionHook.ALWAYS);
    }

    private TableauProver(ModalLogic logic, ProverOptions options, ExpansionHook hook) {
        this.logic = logic;
        this.options = options;
        this.hook = hook;
        this.rules = rulesFor(logic);
    }

    /**
     * Rule chain tried on each ply, first applicable wins. Closure axioms of T, S4 and S5 come
     * before the world-creating rules so that they act on the node holding the □ formula.
     */
    static List<TableauRule> rulesFor(ModalLogic logic) {
        List<TableauRule> chain = new ArrayList<>();
        chain.add(RuleGroup.propositional());
        ClosureRule.forLogic(logic).ifPresent(chain::add);
        chain.add(RuleGroup.modal());
        return List.copyOf(chain);
    }

    /**
     * @return a prover that additionally consults {@code extra} before every ply
     */
    public TableauProver withHook(ExpansionHook extra) {
        return new TableauProver(logic, options, hook.and(extra));
    }

    public static String negate(String formula) {
        return Formulas.negate(formula);
    }

    public TableauResult prove(String goal) {
        return prove(goal, List.of());
    }

    public TableauResult prove(String goal, List<String> assumptions) {
        Set<String> seed = new LinkedHashSet<>();
        seed.add(negate(goal));
        if (assumptions != null) seed.addAll(assumptions);
        var tableau = new Tableau(new TableauNode(seed, 0), logic);
        long deadline = options.hasTimeout() ? System.nanoTime() + options.timeout().toNanos() : 0L;
        expand(tableau, tableau.getRoot(), options.maxDepth(), deadline);
        boolean success = tableau.isClosed();
        LOG.debug("{} tableau for '{}': {} ({} nodes, {} worlds, {} steps)", logic, goal,
                success ? "closed" : "open", tableau.countNodes(), tableau.getWorldCounter(),
                tableau.getProofSteps().size());
        return new TableauResult(success, tableau);
    }

    /**
     * Expand {@code start} and everything it produces, at most {@code maxDepth} plies deep.
     */
    public void expand(Tableau tableau, TableauNode start, int maxDepth) {
        expand(tableau, start, maxDepth, 0L);
    }

    private void expand(Tableau tableau, TableauNode start, int maxDepth, long deadline) {
        Deque<Pending> work = new ArrayDeque<>();
        work.push(new Pending(start, maxDepth));
        while (!work.isEmpty()) {
            if (Thread.currentThread().isInterrupted() || (deadline != 0L && System.nanoTime() - deadline > 0)) {
                LOG.debug("Stopping {} tableau expansion with {} pending nodes", logic, work.size());
                tableau.markInterrupted();
                return;
            }
            var pending = work.pop();
            List<Pending> next = expandNode(tableau, pending.node(), pending.depth());
            for (int i = next.size() - 1; i >= 0; i--) {
                work.push(next.get(i));
            }
        }
    }

    /**
     * One ply on one node.
     *
     * @return the nodes to expand next: the node itself if a rule only added formulas to it,
     *         the new children if a rule branched, nothing if the node is finished
     */
    private List<Pending> expandNode(Tableau tableau, TableauNode node, int depth) {
        if (depth <= 0) return List.of();
        if (!hook.shouldExpand(tableau, node, depth)) return List.of();
        if (node.isContradictory()) {
            node.close();
            tableau.recordStep(new ProofStep("Close", List.copyOf(node.getFormulas()), "⊥",
                    "contradiction at world " + node.getWorld()));
            return List.of();
        }
        for (var rule : rules) {
            int knownChildren = node.getChildren().size();
            if (!rule.apply(tableau, node)) continue;
            LOG.trace("{} rule applied at world {}", rule.getName(), node.getWorld());
            var children = node.getChildren();
            if (children.size() == knownChildren) {
                return List.of(new Pending(node, depth - 1));
            }
            List<Pending> next = new ArrayList<>(children.size() - knownChildren);
            for (var child : children.subList(knownChildren, children.size())) {
                next.add(new Pending(child, depth - 1));
            }
            return next;
        }
        node.markSaturated();
        return List.of();
    }

    public ModalLogic getLogic() {
        return logic;
    }

    public ProverOptions getOptions() {
        return options;
    }

    private record Pending(TableauNode node, int depth) {}
}
