package nl.bytesoflife.kicadsexpr.model;

/**
 * An enum constant that is written to a file as a bare token, e.g. {@code dash_dot}.
 */
public interface KicadToken {

    String token();
}
