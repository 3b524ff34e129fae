package warden.core.model.auth;

/**
 * Access and refresh token returned by login and refresh.
 */
public record TokenPair(IssuedToken accessToken, IssuedToken refreshToken) {

    public TokenPair {
        if (accessToken == null || accessToken.kind() != TokenKind.ACCESS) {
            throw new IllegalArgumentException("Access token must be of kind access");
        }
        if (refreshToken == null || refreshToken.kind() != TokenKind.REFRESH) {
            throw new IllegalArgumentException("Refresh token must be of kind refresh");
        }
    }
}
