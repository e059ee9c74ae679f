package nl.bytesoflife.kicadsexpr.fields;

import nl.bytesoflife.kicadsexpr.SExpressionException;

/**
 * A required token was not found and the caller supplied no default.
 */
public class MissingFieldException extends SExpressionException {

    private final String fieldName;

    public MissingFieldException(String fieldName) {
        super("Required token '" + fieldName + "' not found", -1);
        this.fieldName = fieldName;
    }

    public String getFieldName() {
        return fieldName;
    }
}
