package warden.core.model.auth;

import java.util.Optional;

/**
 * Kinds of token minted by the token service.
 */
public enum TokenKind {
    ACCESS("access"),
    REFRESH("refresh");

    private final String claimValue;

    TokenKind(String claimValue) {
        this.claimValue = claimValue;
    }

    /**
     * Value carried in the {@code token_type} claim.
     */
    public String claimValue() {
        return claimValue;
    }

    public static Optional<TokenKind> fromClaim(Object value) {
        if (value == null) {
            return Optional.empty();
        }
        for (TokenKind kind : values()) {
            if (kind.claimValue.equals(value.toString())) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
