package nl.bytesoflife.kicadsexpr;

/**
 * Base class of the failures raised while reading S-expression text or required fields.
 */
public abstract class SExpressionException extends RuntimeException {

    private final int position;

    protected SExpressionException(String message, int position) {
        super(message);
        this.position = position;
    }

    /**
     * Character offset in the input where the problem was found, or -1 when not tied to input text.
     */
    public int getPosition() {
        return position;
    }
}
