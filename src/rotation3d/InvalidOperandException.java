package rotation3d;

/**
 * Thrown when an operator is applied to a pair of operand kinds it does not
 * define, e.g. a quaternion multiplied by a string.
 */
public class InvalidOperandException extends IllegalArgumentException {
    private final String leftKind;
    private final String rightKind;

    public InvalidOperandException(String message, String leftKind, String rightKind) {
        super(message);
        this.leftKind = leftKind;
        this.rightKind = rightKind;
    }

    public String getLeftKind() { return leftKind; }
    public String getRightKind() { return rightKind; }
}
