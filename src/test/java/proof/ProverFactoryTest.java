package proof;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import modal.ModalLogic;
import modal.ProverOptions;
import modal.UnsupportedLogicException;
import org.junit.jupiter.api.Test;

final class ProverFactoryTest {

    @Test
    void createsTheDedicatedProvers() {
        assertEquals(ModalLogic.K, ProverFactory.create("k", ProverOptions.defaults()).getLogic());
        assertEquals(ModalLogic.S4, ProverFactory.create("S4", ProverOptions.defaults()).getLogic());
        assertEquals(ModalLogic.S5, ProverFactory.create(ModalLogic.S5, ProverOptions.defaults()).getLogic());
    }

    @Test
    void logicsWithoutADedicatedProverAreRejected() {
        var t = assertThrows(UnsupportedLogicException.class, () -> ProverFactory.create("T", ProverOptions.defaults()));
        assertEquals("T", t.getTag());
        assertTrue(t.getMessage().contains("K, S4, S5"));
        assertThrows(UnsupportedLogicException.class, () -> ProverFactory.create(ModalLogic.D, ProverOptions.defaults()));
    }

    @Test
    void unknownTagIsRejected() {
        var error = assertThrows(UnsupportedLogicException.class, () -> ProverFactory.create("KD45", ProverOptions.defaults()));
        assertTrue(error.getMessage().contains("KD45"));
    }
}
