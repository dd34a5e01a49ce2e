package tw.gc.auto.equity.research.registry;

/**
 * Either a concrete version number or the "latest" pointer of a family.
 *
 * @param version the requested version, or {@code null} for latest
 */
public record VersionSelector(Integer version) {

    public static final String LATEST = "latest";

    public VersionSelector {
        if (version != null && version < 1) {
            throw new IllegalArgumentException("version must be >= 1, got: " + version);
        }
    }

    public static VersionSelector latest() {
        return new VersionSelector(null);
    }

    public static VersionSelector of(int version) {
        return new VersionSelector(version);
    }

    /**
     * Accepts {@code "latest"} (any case) or a positive integer.
     */
    public static VersionSelector parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("version selector must be non-blank");
        }
        String trimmed = text.trim();
        if (LATEST.equalsIgnoreCase(trimmed)) {
            return latest();
        }
        try {
            return of(Integer.parseInt(trimmed));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("version selector must be 'latest' or a number, got: " + text, e);
        }
    }

    public boolean isLatest() {
        return version == null;
    }

    @Override
    public String toString() {
        return isLatest() ? LATEST : String.valueOf(version);
    }
}
