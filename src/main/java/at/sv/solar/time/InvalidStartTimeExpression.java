package at.sv.solar.time;

/**
 * Thrown if a start time expression is neither a valid local time nor a supported sun keyword with optional offset.
 */
public class InvalidStartTimeExpression extends RuntimeException {
    public InvalidStartTimeExpression(String message) {
        super(message);
    }
}
