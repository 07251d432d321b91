package com.example.configserver.service;

import com.example.configserver.exception.ConfigFileNotFoundException;
import com.example.configserver.model.RawFile;
import com.example.configserver.model.TenantEnvironment;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.stereotype.Service;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Serves single repository files. Text files are templated; anything containing a NUL
 * byte or not valid UTF-8 is returned byte for byte.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RawFileService {
    static final MediaType TEXT_PLAIN_UTF8 = new MediaType(MediaType.TEXT_PLAIN, StandardCharsets.UTF_8);

    private final EnvironmentRegistry registry;
    private final PathValidator pathValidator;
    private final RefResolver refResolver;
    private final RepositoryReader repositoryReader;
    private final TemplateEngine templateEngine;

    public RawFile read(String environmentName, String label, String rawPath) {
        TenantEnvironment environment = registry.get(environmentName);
        String path = pathValidator.validate(rawPath);
        if (path.isEmpty()) {
            throw new ConfigFileNotFoundException(rawPath, label);
        }

        byte[] bytes = repositoryReader.readFile(environment.getGit(),
                refResolver.candidateRefs(environment.getGit(), label), path)
            .orElseThrow(() -> new ConfigFileNotFoundException(path, label));

        String text = decodeText(bytes);
        if (text == null) {
            MediaType type = MediaTypeFactory.getMediaType(path).orElse(MediaType.APPLICATION_OCTET_STREAM);
            log.debug("Serving binary file {} ({} bytes) as {}", path, bytes.length, type);
            return new RawFile(bytes, type, true);
        }

        String templated = templateEngine.substitute(text, environment.getVariables());
        MediaType type = MediaTypeFactory.getMediaType(path).orElse(TEXT_PLAIN_UTF8);
        return new RawFile(templated.getBytes(StandardCharsets.UTF_8), type, false);
    }

    /**
     * @return the decoded text, or {@code null} when the content must be treated as binary
     */
    static String decodeText(byte[] bytes) {
        for (byte b : bytes) {
            if (b == 0) {
                return null;
            }
        }
        try {
            return StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(bytes))
                .toString();
        } catch (CharacterCodingException e) {
            return null;
        }
    }
}
