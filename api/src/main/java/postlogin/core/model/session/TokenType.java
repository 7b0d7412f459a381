package postlogin.core.model.session;

/**
 * Kind of token minted for a session.
 */
public enum TokenType {
    ACCESS("access"),
    REFRESH("refresh");

    private final String claimValue;

    TokenType(String claimValue) {
        this.claimValue = claimValue;
    }

    /** Value written to the token type claim. */
    public String claimValue() {
        return claimValue;
    }

    /**
     * Resolves a token type from its claim value.
     *
     * @throws IllegalArgumentException if the value is not a known token type
     */
    public static TokenType fromClaimValue(String value) {
        for (TokenType type : values()) {
            if (type.claimValue.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown token type: " + value);
    }
}
