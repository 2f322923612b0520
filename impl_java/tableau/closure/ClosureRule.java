package tableau.closure;

import java.util.Optional;
import modal.ModalLogic;
import tableau.rules.TableauRule;

/**
 * Frame axiom of a modal logic, applied within a single node. Stronger logics include the
 * axioms of weaker ones by delegating to them first.
 */
public interface ClosureRule extends TableauRule {

    /**
     * @return the closure axioms for the logic, or empty for K and D which have none
     */
    static Optional<ClosureRule> forLogic(ModalLogic logic) {
        return switch (logic) {
            case K, D -> Optional.empty();
            case T -> Optional.of(new ReflexiveClosure());
            case S4 -> Optional.of(new TransitiveClosure());
            case S5 -> Optional.of(new EuclideanClosure());
        };
    }
}
