package tw.gc.auto.equity.research.exceptions;

import lombok.Getter;

/**
 * A stored payload no longer matches the content hash recorded in its metadata.
 */
@Getter
public class RegistryIntegrityException extends ModelResearchException {

    private final String family;
    private final int version;

    public RegistryIntegrityException(String family, int version, String expectedHash, String actualHash) {
        super("Payload of %s v%d does not match its content hash (%s != %s)"
            .formatted(family, version, actualHash, expectedHash));
        this.family = family;
        this.version = version;
    }
}
