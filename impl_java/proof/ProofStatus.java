package proof;

public enum ProofStatus {
    SUCCESS,
    FAILURE,
    TIMEOUT,
    UNKNOWN,
    ERROR
}
