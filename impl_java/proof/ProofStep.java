package proof;

import java.util.List;

/**
 * One justification record of a proof: the rule that fired, what it consumed and what it produced.
 */
public record ProofStep(String ruleName, List<String> premises, String conclusion, String justification) {

    public ProofStep {
        premises = List.copyOf(premises);
    }

    @Override
    public String toString() {
        return getString(0, "");
    }

    public String getString(int indentation, String delim) {
        String head = ruleName + " : " + String.join(", ", premises) + " -> " + conclusion;
        if (indentation == 0)
            return head + " (" + justification + ")";
        return "  ".repeat(indentation) + delim + " " + head + " (" + justification + ")";
    }
}
