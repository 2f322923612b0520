package proofSearch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import modal.ModalLogic;
import org.junit.jupiter.api.Test;
import tableau.TableauProver;

final class ExpansionBudgetTest {

    @Test
    void stopsAfterTheGivenNumberOfSteps() {
        var prover = new TableauProver(ModalLogic.S4).withHook(new ExpansionBudget(2));
        var result = prover.prove("Q", List.of("□P"));
        assertFalse(result.success());
        assertEquals(2, result.tableau().getProofSteps().size());
    }

    @Test
    void budgetMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new ExpansionBudget(0));
    }
}
