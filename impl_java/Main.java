import java.util.Arrays;
import java.util.List;
import modal.ModalLogic;
import modal.ProverOptions;
import modal.UnsupportedLogicException;
import proof.ProofTree;
import proof.PropositionalProver;
import tableau.TableauProver;
import tableau.TableauResult;

public class Main {

    public static void main(String[] args) {
        if (args.length < 2) {
            System.err.println("Usage: Main <K|T|S4|S5|D|PROP> <goal> [assumption...]");
            System.exit(2);
        }
        final var options = ProverOptions.fromSystemProperties();
        final String tag = args[0];
        final String goal = args[1];
        final List<String> assumptions = Arrays.asList(args).subList(2, args.length);

        if (PropositionalProver.NAME.equalsIgnoreCase(tag)) {
            ProofTree proof = new PropositionalProver(options).prove(goal, assumptions);
            System.out.println(proof);
            System.exit(proof.isProved() ? 0 : 1);
        }

        ModalLogic logic;
        try {
            logic = ModalLogic.fromTag(tag);
        } catch (UnsupportedLogicException e) {
            System.err.println(e.getMessage());
            System.exit(2);
            return;
        }
        TableauResult result = new TableauProver(logic, options).prove(goal, assumptions);
        System.out.println((result.success() ? "Proved: " : "Not proved: ") + goal);
        result.tableau().getProofSteps().forEach(step -> System.out.println("  * " + step));
        System.out.println(result.tableau());
        System.exit(result.success() ? 0 : 1);
    }
}
