package modal;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

public enum ModalLogic {
    K,
    T,
    S4,
    S5,
    /** Accepted as a tag, expanded with the K rule set. */
    D;

    /**
     * Parse a logic tag, ignoring case and surrounding whitespace.
     *
     * @throws UnsupportedLogicException if the tag names no known logic
     */
    public static ModalLogic fromTag(String tag) {
        return find(tag).orElseThrow(() -> new UnsupportedLogicException(tag, supportedTags()));
    }

    public static Optional<ModalLogic> find(String tag) {
        if (tag == null) return Optional.empty();
        String normalized = tag.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values()).filter(logic -> logic.name().equals(normalized)).findFirst();
    }

    public static String supportedTags() {
        return Arrays.stream(values()).map(Enum::name).collect(Collectors.joining(", "));
    }
}
