package ch.uzh.ifi.grading.service;

import ch.uzh.ifi.grading.config.GraderProperties;
import ch.uzh.ifi.grading.exception.ConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.PosixFilePermissions;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * Holds the shared secret clients present in the {@code X-API-Key} header. A configured key wins, otherwise the key
 * stored in the key file is reused, otherwise a new one is generated and stored there readable by the owner only.
 */
@Slf4j
@Service
public class ApiKeyService {

    private static final int KEY_BYTES = 32;

    private final byte[] apiKey;

    public ApiKeyService(GraderProperties properties) {
        this.apiKey = resolveKey(properties).getBytes(StandardCharsets.UTF_8);
    }

    private String resolveKey(GraderProperties properties) {
        if (StringUtils.isNotBlank(properties.getApiKey()))
            return properties.getApiKey().strip();
        Path keyFile = Paths.get(properties.getApiKeyFile());
        try {
            if (Files.isRegularFile(keyFile)) {
                String stored = Files.readString(keyFile).strip();
                if (StringUtils.isNotBlank(stored))
                    return stored;
            }
            String generated = generateKey();
            Files.deleteIfExists(keyFile);
            createOwnerOnly(keyFile);
            Files.writeString(keyFile, generated);
            log.warn("Generated a new API key and stored it in {}", keyFile.toAbsolutePath());
            return generated;
        } catch (IOException e) {
            throw new ConfigurationException("Failed to access API key file %s: %s".formatted(keyFile, e.getMessage()));
        }
    }

    private String generateKey() {
        byte[] random = new byte[KEY_BYTES];
        new SecureRandom().nextBytes(random);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(random);
    }

    /**
     * Creates the file with its final permissions, so the key is never readable by others.
     */
    private void createOwnerOnly(Path keyFile) throws IOException {
        try {
            Files.createFile(keyFile, PosixFilePermissions.asFileAttribute(PosixFilePermissions.fromString("rw-------")));
        } catch (UnsupportedOperationException e) {
            log.warn("Cannot restrict permissions of {} on this file system", keyFile);
            Files.createFile(keyFile);
        }
    }

    /**
     * Compares in constant time.
     */
    public boolean isValid(String provided) {
        if (StringUtils.isBlank(provided))
            return false;
        return MessageDigest.isEqual(apiKey, provided.strip().getBytes(StandardCharsets.UTF_8));
    }
}
