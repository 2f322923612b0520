package proof;

import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;
import modal.ModalLogic;
import modal.ProverOptions;
import modal.UnsupportedLogicException;

/**
 * Creates the modal prover family. Only K, S4 and S5 have a dedicated prover; every other tag
 * is rejected here even though {@link tableau.TableauProver} itself accepts T and D.
 */
public final class ProverFactory {
    private static final Set<ModalLogic> SUPPORTED = EnumSet.of(ModalLogic.K, ModalLogic.S4, ModalLogic.S5);

    private ProverFactory() {
    }

    public static ModalProver create(String tag, ProverOptions options) {
        ModalLogic logic = ModalLogic.find(tag)
                .orElseThrow(() -> new UnsupportedLogicException(tag, supportedTags()));
        return create(logic, options);
    }

    public static ModalProver create(ModalLogic logic, ProverOptions options) {
        if (!SUPPORTED.contains(logic)) {
            throw new UnsupportedLogicException(logic.name(), supportedTags());
        }
        return new ModalProver(logic, options);
    }

    public static String supportedTags() {
        return SUPPORTED.stream().map(Enum::name).collect(Collectors.joining(", "));
    }
}
