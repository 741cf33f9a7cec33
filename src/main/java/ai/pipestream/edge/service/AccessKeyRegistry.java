package ai.pipestream.edge.service;

import com.password4j.Argon2Function;
import com.password4j.Password;
import com.password4j.types.Argon2;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves presented access keys to a {@link Capability}.
 * <p>
 * The writer and reader keys are read from configuration ({@code edge.access.writer-key},
 * {@code edge.access.reader-key}) and hashed with Argon2id on startup; only the hashes are kept.
 * A capability with no configured key cannot be obtained through this registry.
 * <p>
 * Argon2id parameters: 64 MB memory, 3 iterations, parallelism 4, 32-byte hash, PHC string output.
 */
@ApplicationScoped
public class AccessKeyRegistry {

    private static final Logger LOG = Logger.getLogger(AccessKeyRegistry.class);

    private static final Argon2Function ARGON2 = Argon2Function.getInstance(65536, 3, 4, 32, Argon2.ID);

    @ConfigProperty(name = "edge.access.writer-key")
    Optional<String> writerKey;

    @ConfigProperty(name = "edge.access.reader-key")
    Optional<String> readerKey;

    private final Map<Capability, String> hashes = new EnumMap<>(Capability.class);

    @PostConstruct
    void init() {
        writerKey.filter(k -> !k.isBlank())
            .ifPresent(k -> hashes.put(Capability.WRITER, hash(k)));
        readerKey.filter(k -> !k.isBlank())
            .ifPresent(k -> hashes.put(Capability.READER, hash(k)));
        LOG.infof("Access keys configured for capabilities %s", hashes.keySet());
    }

    /**
     * Resolve a presented key. The writer hash is checked first, so a key configured for both
     * roles resolves to the writer capability.
     *
     * @param presentedKey plaintext key supplied by the caller
     * @return the matching capability
     * @throws EdgeStoreException with {@link ErrorKind#UNAUTHORIZED} when no key matches
     */
    public Capability resolve(String presentedKey) {
        if (presentedKey != null && !presentedKey.isBlank()) {
            for (Capability capability : Capability.values()) {
                String hash = hashes.get(capability);
                if (hash != null && Password.check(presentedKey, hash).with(ARGON2)) {
                    return capability;
                }
            }
        }
        LOG.warn("Rejected unknown access key");
        throw new EdgeStoreException(ErrorKind.UNAUTHORIZED, "Unknown access key");
    }

    public boolean isConfigured(Capability capability) {
        return hashes.containsKey(capability);
    }

    String storedHash(Capability capability) {
        return hashes.get(capability);
    }

    private static String hash(String plaintextKey) {
        return Password.hash(plaintextKey).with(ARGON2).getResult();
    }
}
