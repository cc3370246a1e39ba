package com.oyemi.lexicon.config;

import com.oyemi.lexicon.model.PartOfSpeech;
import com.oyemi.lexicon.model.Valence;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Reads the classification tables from a classpath YAML file.
 * <p>
 * Unlike a lookup service there is no hardcoded fallback here: a build against
 * partial tables would silently produce a different lexicon, so any structural
 * problem fails the load.
 */
@Slf4j
public class LexiconTablesLoader {

    private static final Pattern FOUR_DIGITS = Pattern.compile("\\d{4}");

    public LexiconTables load(String resourcePath) {
        ClassPathResource resource = new ClassPathResource(resourcePath);
        if (!resource.exists()) {
            throw new IllegalStateException("Lexicon tables not found: " + resourcePath);
        }

        Map<String, Object> config;
        try (InputStream inputStream = resource.getInputStream()) {
            config = new Yaml().load(inputStream);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read lexicon tables: " + resourcePath, e);
        }

        if (config == null) {
            throw new IllegalStateException("Lexicon tables are empty: " + resourcePath);
        }

        SuperclassTable superclasses = new SuperclassTable(
                readSuperclasses(section(config, "superclasses")),
                readFallbacks(section(config, "fallbacks")));
        AbstractnessAnchors anchors = new AbstractnessAnchors(
                readConceptSet(config, "abstract_ancestors"),
                readConceptSet(config, "concrete_ancestors"));
        ValenceOverrides overrides = new ValenceOverrides(readOverrides(section(config, "valence_overrides")));

        String version = "unversioned";
        if (config.get("metadata") instanceof Map<?, ?> metadata && metadata.get("version") != null) {
            version = metadata.get("version").toString();
        }

        log.info("Loaded lexicon tables v{}: {} superclasses, {} abstract / {} concrete anchors, {} overrides",
                version, superclasses.size(), anchors.getAbstractAncestors().size(),
                anchors.getConcreteAncestors().size(), overrides.asMap().size());
        return new LexiconTables(version, superclasses, anchors, overrides);
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> section(Map<String, Object> config, String key) {
        Object value = config.get(key);
        if (!(value instanceof Map)) {
            throw new IllegalStateException("Invalid lexicon tables: missing '" + key + "' section");
        }
        return (Map<String, Object>) value;
    }

    private Map<String, String> readSuperclasses(Map<String, Object> section) {
        Map<String, String> codes = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : section.entrySet()) {
            codes.put(entry.getKey(), requireCode(entry.getKey(), entry.getValue()));
        }
        return codes;
    }

    private Map<PartOfSpeech, String> readFallbacks(Map<String, Object> section) {
        Map<PartOfSpeech, String> fallbacks = new EnumMap<>(PartOfSpeech.class);
        for (Map.Entry<String, Object> entry : section.entrySet()) {
            PartOfSpeech pos;
            try {
                pos = PartOfSpeech.valueOf(entry.getKey().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalStateException("Unknown part of speech in fallbacks: " + entry.getKey(), e);
            }
            fallbacks.put(pos, requireCode(entry.getKey(), entry.getValue()));
        }
        return fallbacks;
    }

    private Set<String> readConceptSet(Map<String, Object> config, String key) {
        if (!(config.get(key) instanceof List<?> values)) {
            throw new IllegalStateException("Invalid lexicon tables: '" + key + "' must be a list");
        }
        Set<String> concepts = new LinkedHashSet<>();
        values.forEach(value -> concepts.add(String.valueOf(value)));
        return concepts;
    }

    private Map<String, Valence> readOverrides(Map<String, Object> section) {
        Map<String, Valence> overrides = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : section.entrySet()) {
            Valence valence = switch (entry.getKey()) {
                case "positive" -> Valence.POSITIVE;
                case "negative" -> Valence.NEGATIVE;
                default -> throw new IllegalStateException("Unknown override polarity: " + entry.getKey());
            };
            if (!(entry.getValue() instanceof List<?> words)) {
                throw new IllegalStateException("Override polarity '" + entry.getKey() + "' must list words");
            }
            for (Object word : words) {
                String key = String.valueOf(word).toLowerCase(Locale.ROOT);
                Valence previous = overrides.put(key, valence);
                if (previous != null && previous != valence) {
                    throw new IllegalStateException("Word listed with both polarities: " + key);
                }
            }
        }
        return overrides;
    }

    private String requireCode(String key, Object value) {
        // YAML reads an unquoted 0233 as an octal integer, so only strings are trusted
        if (!(value instanceof String code) || !FOUR_DIGITS.matcher(code).matches()) {
            throw new IllegalStateException("Superclass code for '" + key + "' must be a quoted 4-digit string, got: " + value);
        }
        return code;
    }
}
