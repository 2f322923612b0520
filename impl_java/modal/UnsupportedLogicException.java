package modal;

public class UnsupportedLogicException extends RuntimeException {
    private final String tag;

    public UnsupportedLogicException(String tag, String supported) {
        super("Unsupported modal logic '%s'. Supported logics: %s".formatted(tag, supported));
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }
}
