package tableau;

/**
 * @param success true iff every branch of the tableau closed
 */
public record TableauResult(boolean success, Tableau tableau) {
}
