package warden.core.model.auth;

import java.util.UUID;

/**
 * Result of issuing a new API key.
 *
 * <p>This is the only time the composite key is available. After creation,
 * only the hash of its secret half is stored and it cannot be retrieved.
 *
 * @param recordId     identifier used to rename or delete the key
 * @param publicId     public half of the key
 * @param compositeKey the full key to present ({@code publicId.rawSecret}), returned once
 * @param name         display name
 */
public record ApiKeyCreateResult(UUID recordId, String publicId, String compositeKey, String name) {

    public ApiKeyCreateResult {
        if (recordId == null) {
            throw new IllegalArgumentException("Record ID cannot be null");
        }
        if (publicId == null || publicId.isBlank()) {
            throw new IllegalArgumentException("Public ID cannot be null or blank");
        }
        if (compositeKey == null || compositeKey.isBlank()) {
            throw new IllegalArgumentException("Composite key cannot be null or blank");
        }
        if (name == null) {
            name = "";
        }
    }
}
