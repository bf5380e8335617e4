package dev.reviewthor.domain.valueobject;

/**
 * Owner/name pair identifying a GitHub repository.
 */
public record RepositoryRef(String owner, String name) {
    public RepositoryRef {
        if (owner == null || owner.isBlank()) throw new IllegalArgumentException("owner must not be blank");
        if (name == null || name.isBlank()) throw new IllegalArgumentException("name must not be blank");
    }

    public String fullName() { return owner + "/" + name; }

    @Override
    public String toString() { return fullName(); }
}
