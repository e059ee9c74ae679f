package nl.bytesoflife.kicadsexpr.drc.model;

import nl.bytesoflife.kicadsexpr.model.KicadToken;

public enum Severity implements KicadToken {
    ERROR("error"),
    WARNING("warning"),
    EXCLUSION("exclusion"),
    IGNORE("ignore");

    private final String token;

    Severity(String token) {
        this.token = token;
    }

    @Override
    public String token() {
        return token;
    }
}
