package warden.core.model.auth;

/**
 * Freshly generated API key halves.
 *
 * @param publicId  lookup identifier, safe to display
 * @param rawSecret secret half; exists only until it is hashed and returned once
 */
public record ApiKeyMaterial(String publicId, String rawSecret) {

    public ApiKeyMaterial {
        if (publicId == null || publicId.isBlank() || publicId.contains(".")) {
            throw new IllegalArgumentException("Public ID must be non-blank and must not contain '.'");
        }
        if (rawSecret == null || rawSecret.isBlank()) {
            throw new IllegalArgumentException("Raw secret cannot be null or blank");
        }
    }

    public String compositeKey() {
        return publicId + "." + rawSecret;
    }

    @Override
    public String toString() {
        return "ApiKeyMaterial[publicId=" + publicId + ", rawSecret=" + ApiKeyRecord.REDACTED + "]";
    }
}
