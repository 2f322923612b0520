package tableau;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import modal.ModalLogic;
import proof.ProofStep;

/**
 * The proof tree built by one {@link TableauProver#prove} call.
 */
public class Tableau {
    private final TableauNode root;
    private final ModalLogic logic;
    private final List<ProofStep> proofSteps;
    private int worldCounter = 0;
    private boolean interrupted = false;

    public Tableau(TableauNode root, ModalLogic logic) {
        this.root = root;
        this.logic = logic;
        this.proofSteps = new ArrayList<>();
    }

    /**
     * A node counts as closed if it is CLOSED itself, or if it has children and all of them
     * are closed. An unexpanded leaf keeps its branch open.
     */
    public boolean isClosed() {
        return isClosed(root);
    }

    private static boolean isClosed(TableauNode node) {
        if (node.getStatus() == NodeStatus.CLOSED) return true;
        if (node.getChildren().isEmpty()) return false;
        for (var child : node.getChildren()) {
            if (!isClosed(child)) return false;
        }
        return true;
    }

    /**
     * Allocate the next world id. World 0 belongs to the root, so the first call returns 1.
     */
    public int newWorld() {
        return ++worldCounter;
    }

    public void recordStep(ProofStep step) {
        proofSteps.add(step);
    }

    public int countNodes() {
        int count = 0;
        List<TableauNode> frontier = new ArrayList<>(List.of(root));
        while (!frontier.isEmpty()) {
            var node = frontier.remove(frontier.size() - 1);
            count++;
            frontier.addAll(node.getChildren());
        }
        return count;
    }

    void markInterrupted() {
        interrupted = true;
    }

    /**
     * @return true if expansion stopped early on a deadline or thread interrupt
     */
    public boolean isInterrupted() {
        return interrupted;
    }

    public TableauNode getRoot() {
        return root;
    }

    public ModalLogic getLogic() {
        return logic;
    }

    public int getWorldCounter() {
        return worldCounter;
    }

    public List<ProofStep> getProofSteps() {
        return Collections.unmodifiableList(proofSteps);
    }

    @Override
    public String toString() {
        return "Tableau (" + logic + ", " + worldCounter + " worlds):\n" + root.createString(1, "*");
    }
}
