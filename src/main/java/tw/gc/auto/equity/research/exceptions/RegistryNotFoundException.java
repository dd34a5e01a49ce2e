package tw.gc.auto.equity.research.exceptions;

import lombok.Getter;

@Getter
public class RegistryNotFoundException extends ModelResearchException {

    private final String family;

    public RegistryNotFoundException(String family, String message) {
        super(message);
        this.family = family;
    }

    public static RegistryNotFoundException unknownFamily(String family) {
        return new RegistryNotFoundException(family, "Unknown model family '%s'".formatted(family));
    }

    public static RegistryNotFoundException unknownVersion(String family, int version) {
        return new RegistryNotFoundException(family,
            "Version %d of model family '%s' does not exist".formatted(version, family));
    }
}
