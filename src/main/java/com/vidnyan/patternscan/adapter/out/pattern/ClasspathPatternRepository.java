package com.vidnyan.patternscan.adapter.out.pattern;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.patternscan.application.port.out.PatternRepository;
import com.vidnyan.patternscan.domain.model.Category;
import com.vidnyan.patternscan.domain.model.Severity;
import com.vidnyan.patternscan.domain.pattern.DetectionRule;
import com.vidnyan.patternscan.domain.pattern.RuleCatalog;
import com.vidnyan.patternscan.domain.plugin.AnalyzerPlugin;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Classpath based pattern repository.
 * Loads rule catalogs from JSON files and compiles each of them once; the
 * compiled catalogs are then shared read-only by every scan.
 */
@Slf4j
@Component
public class ClasspathPatternRepository implements PatternRepository {

    public static final String DEFAULT_LOCATION = "classpath*:patterns/*.json";

    private final ObjectMapper objectMapper;
    private final String patternsLocation;

    private volatile Map<String, RuleCatalog> catalogs = Map.of();

    @Autowired
    public ClasspathPatternRepository(ObjectMapper objectMapper,
                                      @Value("${patternscan.engine.patterns-location:" + DEFAULT_LOCATION + "}")
                                      String patternsLocation) {
        this.objectMapper = objectMapper;
        this.patternsLocation = patternsLocation;
    }

    @PostConstruct
    public void loadPatterns() {
        Map<String, RuleCatalog> loaded = new TreeMap<>();
        try {
            PathMatchingResourcePatternResolver resolver = new PathMatchingResourcePatternResolver();
            Resource[] resources = resolver.getResources(patternsLocation);

            for (Resource resource : resources) {
                try (InputStream in = resource.getInputStream()) {
                    CatalogDto dto = objectMapper.readValue(in, CatalogDto.class);
                    register(loaded, resource.getFilename(), dto);
                } catch (IOException e) {
                    log.warn("Failed to load pattern catalog from {}: {}", resource.getFilename(), e.getMessage());
                }
            }
        } catch (IOException e) {
            log.error("Failed to resolve pattern catalogs at {}", patternsLocation, e);
        }
        catalogs = Collections.unmodifiableMap(loaded);
        log.info("Loaded pattern catalogs for {} from {}", loaded.keySet(), patternsLocation);
    }

    @Override
    public Map<String, DetectionRule> getPatterns(String language) {
        return getCatalog(language).rules();
    }

    @Override
    public RuleCatalog getCatalog(String language) {
        String key = normalize(language);
        RuleCatalog catalog = catalogs.get(key);
        return catalog != null ? catalog : RuleCatalog.empty(key);
    }

    @Override
    public Set<String> languages() {
        return catalogs.keySet();
    }

    private void register(Map<String, RuleCatalog> loaded, String source, CatalogDto dto) {
        if (dto.languages == null || dto.languages.isEmpty()) {
            log.warn("Pattern catalog {} declares no language, ignored", source);
            return;
        }
        List<String> aliases = dto.languages.stream().map(ClasspathPatternRepository::normalize).toList();
        List<DetectionRule> rules = new ArrayList<>();
        if (dto.rules != null) {
            for (RuleDto rule : dto.rules) {
                DetectionRule compiled = compile(source, rule);
                if (compiled != null) {
                    rules.add(compiled);
                }
            }
        }

        RuleCatalog catalog = new RuleCatalog(aliases.get(0), rules);
        for (String alias : aliases) {
            RuleCatalog previous = loaded.put(alias, catalog);
            if (previous != null) {
                log.warn("Language '{}' declared again in {}, replacing earlier catalog", alias, source);
            }
        }
        log.info("Loaded {} rules for {} from {}", rules.size(), aliases, source);
    }

    private DetectionRule compile(String source, RuleDto dto) {
        if (dto.id == null || dto.id.isBlank() || dto.pattern == null) {
            log.warn("Skipping rule without id or pattern in {}", source);
            return null;
        }
        try {
            return new DetectionRule(
                    dto.id,
                    Pattern.compile(dto.pattern, flags(dto.flags)),
                    Severity.parse(dto.severity),
                    Category.parse(dto.category),
                    dto.description != null ? dto.description : dto.id,
                    dto.reference,
                    dto.suggestion,
                    Boolean.TRUE.equals(dto.multiline));
        } catch (IllegalArgumentException e) {
            log.warn("Skipping rule {} in {}: {}", dto.id, source, e.getMessage());
            return null;
        }
    }

    static int flags(String flags) {
        if (flags == null) return 0;
        int result = 0;
        for (char c : flags.toCharArray()) {
            result |= switch (c) {
                case 'i' -> Pattern.CASE_INSENSITIVE;
                case 'm' -> Pattern.MULTILINE;
                case 's' -> Pattern.DOTALL;
                case 'u' -> Pattern.UNICODE_CASE;
                default -> throw new IllegalArgumentException("unsupported flag '" + c + "'");
            };
        }
        return result;
    }

    private static String normalize(String language) {
        return AnalyzerPlugin.normalizeLanguage(language);
    }

    // DTOs for JSON deserialization

    static class CatalogDto {
        public List<String> languages;
        public List<RuleDto> rules;
    }

    static class RuleDto {
        public String id;
        public String pattern;
        public String flags;
        public Boolean multiline;
        public String severity;
        public String category;
        public String description;
        public String reference;
        public String suggestion;
    }
}
