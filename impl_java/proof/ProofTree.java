package proof;

import java.util.List;
import java.util.Map;
import modal.ModalLogic;

/**
 * Outcome of a wrapped proof attempt.
 *
 * @param logic the modal logic used, or null for propositional resolution
 */
public record ProofTree(String goal, List<String> assumptions, ModalLogic logic, ProofStatus status,
        List<ProofStep> steps, Map<String, String> metadata) {

    public ProofTree {
        assumptions = List.copyOf(assumptions);
        steps = List.copyOf(steps);
        metadata = Map.copyOf(metadata);
    }

    public boolean isProved() {
        return status == ProofStatus.SUCCESS;
    }

    public String createString(String delim) {
        StringBuilder sb = new StringBuilder("ProofTree [")
                .append(logic == null ? "PROP" : logic)
                .append("] ")
                .append(goal)
                .append(" : ")
                .append(status)
                .append("\n");
        if (!assumptions.isEmpty()) {
            sb.append("  ").append(delim).append(" Assumptions: ").append(String.join(", ", assumptions)).append("\n");
        }
        for (var step : steps) {
            sb.append(step.getString(1, delim)).append("\n");
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return createString("*");
    }
}
