package warden.core.model.account;

import java.util.UUID;

/**
 * A document collection owned by a user.
 *
 * @param id          collection identifier
 * @param ownerId     owning user
 * @param name        display name
 * @param description free-form description
 */
public record Collection(UUID id, UUID ownerId, String name, String description) {

    public Collection {
        if (id == null) {
            throw new IllegalArgumentException("Collection ID cannot be null");
        }
        if (ownerId == null) {
            throw new IllegalArgumentException("Collection owner cannot be null");
        }
        if (name == null || name.isBlank()) {
            name = "Default";
        }
        if (description == null) {
            description = "";
        }
    }
}
