package tw.gc.auto.equity.research.exceptions;

import lombok.Getter;

/**
 * A version cannot be assigned: an explicit version already holds different content, or the
 * family has used up the positive integer range.
 */
@Getter
public class RegistryConflictException extends ModelResearchException {

    private final String family;
    private final int version;

    public RegistryConflictException(String family, int version, String existingHash, String newHash) {
        super("Version %d of family '%s' already exists with content %s (attempted %s)"
            .formatted(version, family, existingHash, newHash));
        this.family = family;
        this.version = version;
    }

    private RegistryConflictException(String family, int version, String message) {
        super(message);
        this.family = family;
        this.version = version;
    }

    public static RegistryConflictException versionsExhausted(String family, String newHash) {
        return new RegistryConflictException(family, Integer.MAX_VALUE,
            "Family '%s' already holds version %d, no automatic version left for content %s"
                .formatted(family, Integer.MAX_VALUE, newHash));
    }
}
