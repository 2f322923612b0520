package resolution;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import modal.Formulas;
import modal.ProverOptions;
import proof.ProofStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Propositional refutation by binary resolution. A clause is an immutable set of literal
 * strings; the empty set is the empty clause.
 * <p>
 * Not thread safe: the clause set belongs to the instance and is reset by every
 * {@link #prove} call.
 */
public class ResolutionProver {
    private static final Logger LOG = LoggerFactory.getLogger(ResolutionProver.class);

    private static final Set<String> EMPTY_CLAUSE = Set.of();

    private final int maxRounds;
    private final Set<Set<String>> clauses = new LinkedHashSet<>();

    public ResolutionProver() {
        this(ProverOptions.defaults());
    }

    public ResolutionProver(ProverOptions options) {
        this.maxRounds = options.maxRounds();
    }

    public ResolutionResult prove(String goal) {
        return prove(goal, List.of());
    }

    public ResolutionResult prove(String goal, List<String> assumptions) {
        clauses.clear();
        List<ProofStep> steps = new ArrayList<>();
        clauses.addAll(toClauses(Formulas.negate(goal)));
        if (assumptions != null) {
            for (var assumption : assumptions) {
                clauses.addAll(toClauses(assumption));
            }
        }
        LOG.debug("Resolving {} clauses for goal '{}'", clauses.size(), goal);

        for (int round = 1; round <= maxRounds; round++) {
            Map<Set<String>, List<Set<String>>> resolvents = resolutionStep();
            List<Set<String>> refutation = resolvents.get(EMPTY_CLAUSE);
            if (refutation != null) {
                steps.add(new ProofStep("Resolution",
                        refutation.stream().map(ResolutionProver::render).toList(),
                        "⊥",
                        "Empty clause derived in round %d from %d clauses".formatted(round, clauses.size())));
                LOG.debug("Goal '{}' refuted in round {}", goal, round);
                return new ResolutionResult(true, steps);
            }
            int known = clauses.size();
            clauses.addAll(resolvents.keySet());
            if (clauses.size() == known) {
                LOG.debug("Saturated after {} rounds with {} clauses, goal '{}' not proved", round, known, goal);
                return new ResolutionResult(false, steps);
            }
        }
        LOG.debug("Round limit {} reached for goal '{}'", maxRounds, goal);
        return new ResolutionResult(false, steps);
    }

    /**
     * All resolvents of all clause pairs, each mapped to the first pair that produced it.
     * Each pair is resolved once, earlier clause first. {@link #resolve} is not symmetric on
     * double negations ({@code ¬¬A} cancels {@code ¬A}, not the reverse), so whether
     * {@code {¬A}} and {@code {¬¬A}} resolve depends on which was added first.
     */
    private Map<Set<String>, List<Set<String>>> resolutionStep() {
        List<Set<String>> current = new ArrayList<>(clauses);
        Map<Set<String>, List<Set<String>>> resolvents = new LinkedHashMap<>();
        for (int i = 0; i < current.size(); i++) {
            for (int j = i + 1; j < current.size(); j++) {
                var left = current.get(i);
                var right = current.get(j);
                for (var resolvent : resolve(left, right)) {
                    resolvents.putIfAbsent(resolvent, List.of(left, right));
                }
            }
        }
        return resolvents;
    }

    /**
     * Conjuncts become clauses. The split is on every ∧ and ignores parentheses, so a
     * parenthesised conjunction inside a disjunction is cut apart as well.
     */
    public static Set<Set<String>> toClauses(String formula) {
        Set<Set<String>> result = new LinkedHashSet<>();
        if (formula.contains(Formulas.AND)) {
            for (var conjunct : Formulas.splitAll(formula, Formulas.AND)) {
                result.add(Set.copyOf(parseClause(conjunct)));
            }
        } else {
            result.add(Set.copyOf(parseClause(formula)));
        }
        return result;
    }

    /**
     * @return the literals of a disjunction, left to right
     */
    public static List<String> parseClause(String clause) {
        if (clause.contains(Formulas.OR)) {
            return Formulas.splitAll(clause, Formulas.OR);
        }
        return List.of(clause.trim());
    }

    /**
     * Every resolvent obtained by cancelling a literal of {@code first} against its negation
     * in {@code second}.
     */
    public static Set<Set<String>> resolve(Set<String> first, Set<String> second) {
        Set<Set<String>> resolvents = new LinkedHashSet<>();
        for (var literal : first) {
            String complement = Formulas.negate(literal);
            if (!second.contains(complement)) continue;
            Set<String> resolvent = new HashSet<>(first);
            resolvent.remove(literal);
            for (var other : second) {
                if (!other.equals(complement)) resolvent.add(other);
            }
            resolvents.add(Set.copyOf(resolvent));
        }
        return resolvents;
    }

    public Set<Set<String>> getClauses() {
        return Collections.unmodifiableSet(clauses);
    }

    static String render(Set<String> clause) {
        return "{" + String.join(", ", clause.stream().sorted().toList()) + "}";
    }
}
