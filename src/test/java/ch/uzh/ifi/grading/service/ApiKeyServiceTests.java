package ch.uzh.ifi.grading.service;

import ch.uzh.ifi.grading.config.GraderProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ApiKeyServiceTests {

    @TempDir
    Path tempDir;

    private GraderProperties properties;

    private Path keyFile;

    @BeforeEach
    void setUp() {
        keyFile = tempDir.resolve(".api_key");
        properties = new GraderProperties();
        properties.setApiKeyFile(keyFile.toString());
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void generatedKeyReadableByOwnerOnlyTest() throws Exception {
        new ApiKeyService(properties);
        assertEquals("rw-------", PosixFilePermissions.toString(Files.getPosixFilePermissions(keyFile)));
    }

    @Test
    void generatedKeyAcceptedAndReusedTest() throws Exception {
        ApiKeyService first = new ApiKeyService(properties);
        String stored = Files.readString(keyFile);
        assertEquals(43, stored.length());
        assertTrue(first.isValid(stored));
        ApiKeyService second = new ApiKeyService(properties);
        assertTrue(second.isValid(stored));
        assertEquals(stored, Files.readString(keyFile));
    }

    @Test
    void blankKeyFileReplacedTest() throws Exception {
        Files.writeString(keyFile, "  \n");
        ApiKeyService service = new ApiKeyService(properties);
        String stored = Files.readString(keyFile);
        assertFalse(stored.isBlank());
        assertTrue(service.isValid(stored));
    }

    @Test
    void configuredKeyWinsTest() {
        properties.setApiKey(" configured-key ");
        ApiKeyService service = new ApiKeyService(properties);
        assertTrue(service.isValid("configured-key"));
        assertFalse(Files.exists(keyFile));
    }

    @Test
    void blankAndWrongKeysRejectedTest() {
        properties.setApiKey("configured-key");
        ApiKeyService service = new ApiKeyService(properties);
        assertFalse(service.isValid(null));
        assertFalse(service.isValid(" "));
        assertFalse(service.isValid("configured-kez"));
    }
}
