package com.example.configserver.service;

import com.example.configserver.config.AppConfig;
import com.example.configserver.exception.BadRequestException;
import com.example.configserver.exception.ConfigFileNotFoundException;
import com.example.configserver.exception.EnvironmentNotFoundException;
import com.example.configserver.git.JGitBackend;
import com.example.configserver.model.RawFile;
import com.example.configserver.testutil.TestRepoSetup;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.MediaType;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RawFileServiceTest {

    private static final byte[] BINARY = {0x00, 0x01, '{', '{', 'H', 'O', 'S', 'T', 'N', 'A', 'M', 'E', '}', '}'};
    private static final byte[] INVALID_UTF8 = {'k', ':', ' ', (byte) 0xC3, 0x28};

    @TempDir
    static Path tempDir;

    private static RawFileService rawFileService;

    @BeforeAll
    static void setUp() throws Exception {
        Path upstream = TestRepoSetup.setupTestRepo(tempDir);
        TestRepoSetup.commitFiles(upstream, "Plain text", Map.of("VERSION", "{{HOSTNAME}}-1.0\n"));
        TestRepoSetup.commitBytes(upstream, "Binary blob", "bin/blob", BINARY);
        TestRepoSetup.commitBytes(upstream, "Latin-1 file", "legacy/latin1", INVALID_UTF8);

        AppConfig.GitConfig git = new AppConfig.GitConfig();
        git.setRepoUrl(TestRepoSetup.repoUrl(upstream));
        git.setWorkdir(tempDir.resolve("mirror").toString());
        AppConfig config = new AppConfig();
        config.setGit(git);
        config.setEnvFromProcess(true);
        EnvironmentRegistry registry = new EnvironmentRegistry(config, new EnvFileLoader(), Map.of("HOSTNAME", "web-1"));

        JGitBackend backend = new JGitBackend();
        backend.sync(registry.get(EnvironmentRegistry.DEFAULT_ENVIRONMENT).getGit());

        RefResolver refResolver = new RefResolver();
        rawFileService = new RawFileService(registry, new PathValidator(), refResolver,
            new RepositoryReader(backend, refResolver), new TemplateEngine());
    }

    @Test
    void testRead_TextFileIsTemplated() {
        RawFile file = rawFileService.read("default", "main", "templates/nginx.conf");

        assertFalse(file.isBinary());
        assertEquals("server_name web-1;\nlisten 80;\n", new String(file.getContent(), StandardCharsets.UTF_8));
        assertTrue(file.getContentType().isCompatibleWith(MediaType.TEXT_PLAIN));
    }

    @Test
    void testRead_UnknownExtensionDefaultsToUtf8Text() {
        RawFile file = rawFileService.read("default", "main", "VERSION");

        assertEquals("web-1-1.0\n", new String(file.getContent(), StandardCharsets.UTF_8));
        assertEquals(RawFileService.TEXT_PLAIN_UTF8, file.getContentType());
    }

    @Test
    void testRead_BinaryServedUntouched() {
        RawFile file = rawFileService.read("default", "main", "bin/blob");

        assertTrue(file.isBinary());
        assertArrayEquals(BINARY, file.getContent());
        assertEquals(MediaType.APPLICATION_OCTET_STREAM, file.getContentType());
    }

    @Test
    void testRead_InvalidUtf8TreatedAsBinary() {
        RawFile file = rawFileService.read("default", "main", "legacy/latin1");

        assertTrue(file.isBinary());
        assertArrayEquals(INVALID_UTF8, file.getContent());
    }

    @Test
    void testRead_NormalizesPath() {
        RawFile file = rawFileService.read("default", "main", "templates/./nginx.conf");

        assertFalse(file.isBinary());
    }

    @Test
    void testRead_MissingFile() {
        assertThrows(ConfigFileNotFoundException.class, () -> rawFileService.read("default", "main", "nope.yml"));
        assertThrows(ConfigFileNotFoundException.class, () -> rawFileService.read("default", "no-such-label", "orders.yml"));
        assertThrows(ConfigFileNotFoundException.class, () -> rawFileService.read("default", "main", "templates"));
    }

    @Test
    void testRead_EmptyPathIsNotFound() {
        assertThrows(ConfigFileNotFoundException.class, () -> rawFileService.read("default", "main", "./"));
    }

    @Test
    void testRead_TraversalRejected() {
        assertThrows(BadRequestException.class, () -> rawFileService.read("default", "main", "../etc/passwd"));
        assertThrows(BadRequestException.class, () -> rawFileService.read("default", "main", "/etc/passwd"));
    }

    @Test
    void testRead_UnknownEnvironment() {
        assertThrows(EnvironmentNotFoundException.class, () -> rawFileService.read("other", "main", "orders.yml"));
    }

    @Test
    void testDecodeText() {
        assertEquals("héllo", RawFileService.decodeText("héllo".getBytes(StandardCharsets.UTF_8)));
        assertNull(RawFileService.decodeText(new byte[]{'a', 0x00, 'b'}));
        assertNull(RawFileService.decodeText(new byte[]{(byte) 0xFF}));
        assertEquals("", RawFileService.decodeText(new byte[0]));
    }
}
