package com.example.configserver.service;

import com.example.configserver.exception.ConfigParseException;
import com.example.configserver.model.AssembledProperties;
import com.example.configserver.model.GitEndpoint;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.AbstractConstruct;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.nodes.Node;
import org.yaml.snakeyaml.nodes.ScalarNode;
import org.yaml.snakeyaml.nodes.Tag;
import org.yaml.snakeyaml.representer.Representer;
import org.yaml.snakeyaml.resolver.Resolver;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Loads, templates, parses and merges the YAML files that apply to an
 * (application, profiles) pair. Later candidates override earlier ones key by key.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ConfigAssembler {
    private final RepositoryReader repositoryReader;
    private final RefResolver refResolver;
    private final TemplateEngine templateEngine;
    private final PropertyFlattener propertyFlattener;

    /**
     * Candidate file names in merge order: shared files, application files, then for each
     * profile the shared and application profile files.
     */
    public List<String> candidateFiles(String application, List<String> profiles) {
        List<String> candidates = new ArrayList<>();
        candidates.add("application.yml");
        candidates.add("application.yaml");
        candidates.add(application + ".yml");
        candidates.add(application + ".yaml");
        for (String profile : profiles) {
            candidates.add("application-" + profile + ".yml");
            candidates.add("application-" + profile + ".yaml");
            candidates.add(application + "-" + profile + ".yml");
            candidates.add(application + "-" + profile + ".yaml");
        }
        return candidates;
    }

    public AssembledProperties assemble(GitEndpoint endpoint, String application, List<String> profiles,
                                        String label, Map<String, String> variables) {
        List<String> refs = refResolver.candidateRefs(endpoint, label);
        Map<String, Object> result = new LinkedHashMap<>();
        boolean foundAny = false;

        for (String candidate : candidateFiles(application, profiles)) {
            Optional<byte[]> bytes = repositoryReader.readFile(endpoint, refs, candidate);
            if (bytes.isEmpty()) {
                continue;
            }
            foundAny = true;
            String content = decode(candidate, bytes.get());
            String templated = templateEngine.substitute(content, variables);
            propertyFlattener.flatten(parse(candidate, templated), result);
        }

        log.debug("Assembled {} properties for application={}, profiles={}, label={}",
            result.size(), application, profiles, label);
        return new AssembledProperties(result, foundAny);
    }

    private String decode(String file, byte[] bytes) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(bytes))
                .toString();
        } catch (CharacterCodingException e) {
            throw new ConfigParseException(file, "not valid UTF-8", e);
        }
    }

    private Object parse(String file, String content) {
        try {
            return newYaml().load(content);
        } catch (YAMLException e) {
            throw new ConfigParseException(file, e.getMessage(), e);
        }
    }

    /**
     * Yaml instances are not thread-safe, so one is built per document.
     */
    private static Yaml newYaml() {
        LoaderOptions loaderOptions = new LoaderOptions();
        loaderOptions.setAllowDuplicateKeys(false);
        DumperOptions dumperOptions = new DumperOptions();
        return new Yaml(new CoreSchemaConstructor(loaderOptions), new Representer(dumperOptions),
            dumperOptions, loaderOptions, new CoreSchemaResolver());
    }

    /**
     * Resolves plain scalars with the YAML 1.2 core schema. {@code on}, {@code no},
     * {@code 0755}, {@code 12:30} and {@code 1_000} stay strings, as do timestamps.
     */
    static class CoreSchemaResolver extends Resolver {
        static final Pattern CORE_BOOL = Pattern.compile("^(?:true|True|TRUE|false|False|FALSE)$");
        static final Pattern CORE_INT = Pattern.compile("^(?:[-+]?(?:0|[1-9][0-9]*)|0x[0-9a-fA-F]+|0o[0-7]+)$");
        static final Pattern CORE_FLOAT = Pattern.compile(
            "^(?:[-+]?(?:\\.[0-9]+|[0-9]+\\.[0-9]*)(?:[eE][-+]?[0-9]+)?"
                + "|[-+]?[0-9]+[eE][-+]?[0-9]+"
                + "|[-+]?\\.(?:inf|Inf|INF)"
                + "|\\.(?:nan|NaN|NAN))$");

        @Override
        public void addImplicitResolver(Tag tag, Pattern regexp, String first, int limit) {
            if (Tag.TIMESTAMP.equals(tag)) {
                return;
            }
            if (Tag.BOOL.equals(tag)) {
                super.addImplicitResolver(tag, CORE_BOOL, "tTfF", limit);
            } else if (Tag.INT.equals(tag)) {
                super.addImplicitResolver(tag, CORE_INT, "-+0123456789", limit);
            } else if (Tag.FLOAT.equals(tag)) {
                super.addImplicitResolver(tag, CORE_FLOAT, "-+0123456789.", limit);
            } else {
                super.addImplicitResolver(tag, regexp, first, limit);
            }
        }
    }

    /**
     * Builds integers per the core schema: {@code 0x} is hex, {@code 0o} is octal and
     * everything else is decimal.
     */
    static class CoreSchemaConstructor extends SafeConstructor {
        CoreSchemaConstructor(LoaderOptions loaderOptions) {
            super(loaderOptions);
            this.yamlConstructors.put(Tag.INT, new ConstructCoreInt());
        }

        private static class ConstructCoreInt extends AbstractConstruct {
            @Override
            public Object construct(Node node) {
                String value = ((ScalarNode) node).getValue();
                BigInteger number;
                if (value.startsWith("0x")) {
                    number = new BigInteger(value.substring(2), 16);
                } else if (value.startsWith("0o")) {
                    number = new BigInteger(value.substring(2), 8);
                } else {
                    number = new BigInteger(value.startsWith("+") ? value.substring(1) : value);
                }
                if (number.bitLength() < Integer.SIZE) {
                    return number.intValue();
                }
                if (number.bitLength() < Long.SIZE) {
                    return number.longValue();
                }
                return number;
            }
        }
    }
}
