package nl.bytesoflife.kicadsexpr.model;

public enum StrokeType implements KicadToken {
    DASH("dash"),
    DASH_DOT("dash_dot"),
    DASH_DOT_DOT("dash_dot_dot"),
    DOT("dot"),
    DEFAULT("default"),
    SOLID("solid");

    private final String token;

    StrokeType(String token) {
        this.token = token;
    }

    @Override
    public String token() {
        return token;
    }
}
