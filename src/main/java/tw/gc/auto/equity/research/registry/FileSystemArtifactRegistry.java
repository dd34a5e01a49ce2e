package tw.gc.auto.equity.research.registry;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.regex.Pattern;
import java.util.stream.Stream;

import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.extern.slf4j.Slf4j;
import tw.gc.auto.equity.research.config.CanonicalJson;
import tw.gc.auto.equity.research.exceptions.RegistryConflictException;
import tw.gc.auto.equity.research.exceptions.RegistryIntegrityException;
import tw.gc.auto.equity.research.exceptions.RegistryNotFoundException;

/**
 * {@link ArtifactRegistry} persisted on the local file system.
 *
 * <p>Layout:
 * <pre>
 * &lt;root&gt;/&lt;family&gt;/&lt;version&gt;/model.bin       serialized adapter, bit-exact
 * &lt;root&gt;/&lt;family&gt;/&lt;version&gt;/metadata.json   canonical JSON {@link ArtifactMetadata}
 * &lt;root&gt;/&lt;family&gt;/LATEST                  highest stored version
 * </pre>
 * A version directory is written under a staging name and moved into place in one step, so a
 * reader never sees a half-written version. The in-memory index is rebuilt from disk on start-up.
 *
 * <p>Writes to one family are serialized by a per-family lock; writes to different families run
 * concurrently. Reads take the current immutable index snapshot and never lock.
 */
@Slf4j
public class FileSystemArtifactRegistry implements ArtifactRegistry {

    public static final String PAYLOAD_FILE = "model.bin";
    public static final String METADATA_FILE = "metadata.json";
    public static final String LATEST_FILE = "LATEST";
    private static final String STAGING_PREFIX = ".staging-";
    private static final Pattern FAMILY_NAME = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]*");
    private static final Pattern VERSION_DIR = Pattern.compile("[1-9][0-9]*");

    /** Immutable per-family view: versions in order plus content hash lookup. */
    private record FamilyIndex(NavigableMap<Integer, ArtifactMetadata> versions, Map<String, Integer> byHash) {

        static FamilyIndex empty() {
            return new FamilyIndex(Collections.emptyNavigableMap(), Map.of());
        }

        FamilyIndex with(ArtifactMetadata metadata) {
            TreeMap<Integer, ArtifactMetadata> nextVersions = new TreeMap<>(versions);
            nextVersions.put(metadata.version(), metadata);
            Map<String, Integer> nextHashes = new HashMap<>(byHash);
            nextHashes.putIfAbsent(metadata.contentHash(), metadata.version());
            return new FamilyIndex(Collections.unmodifiableNavigableMap(nextVersions), Map.copyOf(nextHashes));
        }

        int latestVersion() {
            return versions.isEmpty() ? 0 : versions.lastKey();
        }
    }

    private final Path root;
    private final Clock clock;
    private final ObjectMapper mapper = CanonicalJson.mapper();
    private final Map<String, FamilyIndex> index = new ConcurrentHashMap<>();
    private final Map<String, ReentrantLock> familyLocks = new ConcurrentHashMap<>();

    public FileSystemArtifactRegistry(Path root, Clock clock) {
        this.root = root;
        this.clock = clock;
        try {
            Files.createDirectories(root);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create registry root " + root, e);
        }
        loadIndex();
    }

    @Override
    public int put(String family, byte[] payload, ArtifactDescriptor descriptor) {
        return store(family, payload, descriptor, null);
    }

    @Override
    public int put(String family, byte[] payload, ArtifactDescriptor descriptor, int explicitVersion) {
        if (explicitVersion < 1) {
            throw new IllegalArgumentException("explicitVersion must be >= 1, got: " + explicitVersion);
        }
        return store(family, payload, descriptor, explicitVersion);
    }

    private int store(String family, byte[] payload, ArtifactDescriptor descriptor, Integer explicitVersion) {
        validateFamily(family);
        if (payload == null) {
            throw new IllegalArgumentException("payload must be non-null");
        }
        if (descriptor == null) {
            throw new IllegalArgumentException("descriptor must be non-null");
        }
        byte[] bytes = payload.clone();
        String hash = ContentHashes.sha256(bytes);

        ReentrantLock lock = familyLocks.computeIfAbsent(family, f -> new ReentrantLock());
        lock.lock();
        try {
            FamilyIndex current = index.getOrDefault(family, FamilyIndex.empty());

            Integer existing = current.byHash().get(hash);
            if (existing != null) {
                log.info("♻️ {} content {} already stored as v{}, skipping write", family, shortHash(hash), existing);
                return existing;
            }

            int version;
            if (explicitVersion != null) {
                ArtifactMetadata clash = current.versions().get(explicitVersion);
                if (clash != null) {
                    throw new RegistryConflictException(family, explicitVersion, clash.contentHash(), hash);
                }
                version = explicitVersion;
            } else if (current.latestVersion() == Integer.MAX_VALUE) {
                throw RegistryConflictException.versionsExhausted(family, hash);
            } else {
                version = current.latestVersion() + 1;
            }

            ArtifactMetadata metadata = ArtifactMetadata.of(family, version, descriptor, hash, clock.instant(), bytes.length);
            writeVersion(family, version, bytes, metadata);

            FamilyIndex updated = current.with(metadata);
            index.put(family, updated);
            writeLatestPointer(family, updated.latestVersion());

            log.info("📦 Stored {} v{} ({} bytes, {})", family, version, bytes.length, shortHash(hash));
            return version;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Artifact get(String family, VersionSelector selector) {
        if (selector == null) {
            throw new IllegalArgumentException("selector must be non-null");
        }
        FamilyIndex snapshot = index.get(family);
        if (snapshot == null || snapshot.versions().isEmpty()) {
            throw RegistryNotFoundException.unknownFamily(family);
        }
        int version = selector.isLatest() ? snapshot.latestVersion() : selector.version();
        ArtifactMetadata metadata = snapshot.versions().get(version);
        if (metadata == null) {
            throw RegistryNotFoundException.unknownVersion(family, version);
        }

        byte[] payload;
        try {
            payload = Files.readAllBytes(versionDir(family, version).resolve(PAYLOAD_FILE));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read %s v%d".formatted(family, version), e);
        }
        String actual = ContentHashes.sha256(payload);
        if (!actual.equals(metadata.contentHash())) {
            throw new RegistryIntegrityException(family, version, metadata.contentHash(), actual);
        }
        return new Artifact(metadata, payload);
    }

    @Override
    public List<ArtifactMetadata> list(String family) {
        FamilyIndex snapshot = index.get(family);
        if (snapshot == null) {
            return List.of();
        }
        return List.copyOf(snapshot.versions().values());
    }

    @Override
    public List<String> families() {
        return index.entrySet().stream()
            .filter(e -> !e.getValue().versions().isEmpty())
            .map(Map.Entry::getKey)
            .sorted()
            .toList();
    }

    public Path getRoot() {
        return root;
    }

    private void writeVersion(String family, int version, byte[] payload, ArtifactMetadata metadata) {
        Path familyDir = root.resolve(family);
        Path target = versionDir(family, version);
        Path staging = familyDir.resolve(STAGING_PREFIX + UUID.randomUUID());
        try {
            Files.createDirectories(familyDir);
            if (Files.exists(target)) {
                throw new IllegalStateException("Version directory already exists on disk: " + target);
            }
            Files.createDirectories(staging);
            Files.write(staging.resolve(PAYLOAD_FILE), payload);
            Files.write(staging.resolve(METADATA_FILE), mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(metadata));
            moveAtomically(staging, target);
        } catch (IOException e) {
            deleteQuietly(staging);
            throw new UncheckedIOException("Cannot store %s v%d".formatted(family, version), e);
        }
    }

    private void writeLatestPointer(String family, int latest) {
        Path familyDir = root.resolve(family);
        Path temp = familyDir.resolve(LATEST_FILE + ".tmp");
        try {
            Files.writeString(temp, Integer.toString(latest), StandardCharsets.UTF_8);
            moveAtomically(temp, familyDir.resolve(LATEST_FILE));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot update latest pointer of " + family, e);
        }
    }

    private static void moveAtomically(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void loadIndex() {
        try (Stream<Path> families = Files.list(root)) {
            for (Path familyDir : families.filter(Files::isDirectory).sorted().toList()) {
                String family = familyDir.getFileName().toString();
                if (!FAMILY_NAME.matcher(family).matches()) {
                    continue;
                }
                FamilyIndex familyIndex = loadFamily(familyDir);
                if (!familyIndex.versions().isEmpty()) {
                    index.put(family, familyIndex);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot scan registry root " + root, e);
        }
        log.info("📚 Artifact registry at {}: {} families loaded", root, index.size());
    }

    private FamilyIndex loadFamily(Path familyDir) throws IOException {
        List<ArtifactMetadata> loaded = new ArrayList<>();
        try (Stream<Path> versions = Files.list(familyDir)) {
            for (Path versionDir : versions.filter(Files::isDirectory).toList()) {
                String name = versionDir.getFileName().toString();
                if (name.startsWith(STAGING_PREFIX)) {
                    log.warn("Ignoring incomplete staging directory {}", versionDir);
                    continue;
                }
                Path metadataFile = versionDir.resolve(METADATA_FILE);
                if (!VERSION_DIR.matcher(name).matches() || !Files.exists(metadataFile)) {
                    continue;
                }
                loaded.add(mapper.readValue(metadataFile.toFile(), ArtifactMetadata.class));
            }
        }
        loaded.sort(Comparator.comparingInt(ArtifactMetadata::version));
        FamilyIndex familyIndex = FamilyIndex.empty();
        for (ArtifactMetadata metadata : loaded) {
            familyIndex = familyIndex.with(metadata);
        }
        return familyIndex;
    }

    private Path versionDir(String family, int version) {
        return root.resolve(family).resolve(Integer.toString(version));
    }

    private static void validateFamily(String family) {
        if (family == null || !FAMILY_NAME.matcher(family).matches()) {
            throw new IllegalArgumentException("Invalid family name: " + family);
        }
    }

    private static String shortHash(String hash) {
        int colon = hash.indexOf(':');
        String hex = colon >= 0 ? hash.substring(colon + 1) : hash;
        return hex.substring(0, Math.min(12, hex.length()));
    }

    private static void deleteQuietly(Path dir) {
        if (!Files.exists(dir)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            for (Path p : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(p);
            }
        } catch (IOException e) {
            log.warn("Could not clean up staging directory {}: {}", dir, e.getMessage());
        }
    }
}
