package io.vtascan;

import io.vtascan.ir.Function;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Configuration loaded from a YAML file.
 * Names the program description to analyze and how to analyze it.
 *
 * <pre>
 * program: programs/static.yaml
 * algorithm: vta
 * parallelism: 4
 * excludePackages:
 *   - fmt
 * excludeFunctions:
 *   - "init"
 *   - "P#(*C)."
 * </pre>
 */
public class ScanConfig {

    private static final Logger logger = LogManager.getLogger(ScanConfig.class);

    private static final Set<String> KNOWN_KEYS =
            Set.of("program", "algorithm", "parallelism", "excludePackages", "excludeFunctions");

    /**
     * Call graph construction algorithms.
     */
    public enum Algorithm {
        VTA,
        CHA,
        STATIC;

        public static Algorithm parse(String value) {
            try {
                return valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown algorithm '" + value + "' (expected vta, cha or static)", e);
            }
        }
    }

    private final Path programPath;
    private final Algorithm algorithm;
    private final int parallelism;
    private final Set<String> excludePackages;
    private final List<String> excludeFunctions;

    ScanConfig(Path programPath,
               Algorithm algorithm,
               int parallelism,
               Set<String> excludePackages,
               List<String> excludeFunctions) {
        this.programPath = programPath;
        this.algorithm = algorithm;
        this.parallelism = parallelism;
        this.excludePackages = excludePackages;
        this.excludeFunctions = excludeFunctions;
    }

    /**
     * Configuration used when no file is given: VTA on a single thread, nothing excluded.
     */
    public static ScanConfig defaults(Path programPath) {
        return new ScanConfig(programPath, Algorithm.VTA, 1, Set.of(), List.of());
    }

    /**
     * Load configuration from a YAML file.
     * A relative {@code program} path is resolved against the directory of the config file.
     */
    @SuppressWarnings("unchecked")
    public static ScanConfig load(Path configPath) throws IOException {
        Yaml yaml = new Yaml();

        try (InputStream in = Files.newInputStream(configPath)) {
            Map<String, Object> data;
            try {
                data = yaml.load(in);
            } catch (YAMLException | ClassCastException e) {
                throw new IOException("Invalid config file " + configPath + ": " + e.getMessage(), e);
            }
            if (data == null) {
                throw new IOException("Empty or invalid config file: " + configPath);
            }
            for (Object key : data.keySet()) {
                if (!KNOWN_KEYS.contains(String.valueOf(key))) {
                    logger.warn("Ignoring unknown key '{}' in {}", key, configPath);
                }
            }

            // Required: program
            Object programValue = data.get("program");
            if (programValue == null || programValue.toString().isBlank()) {
                throw new IOException("Config file must specify 'program'");
            }
            Path programPath = Path.of(programValue.toString());
            Path parent = configPath.toAbsolutePath().getParent();
            if (!programPath.isAbsolute() && parent != null) {
                programPath = parent.resolve(programPath).normalize();
            }

            Algorithm algorithm;
            int parallelism;
            try {
                // Optional: algorithm (default: vta)
                Object algorithmValue = data.get("algorithm");
                algorithm = algorithmValue == null ? Algorithm.VTA : Algorithm.parse(algorithmValue.toString());

                // Optional: parallelism (default: 1)
                Object parallelismValue = data.get("parallelism");
                parallelism = parallelismValue == null ? 1 : Integer.parseInt(parallelismValue.toString().trim());
            } catch (IllegalArgumentException e) {
                throw new IOException("Invalid config file " + configPath + ": " + e.getMessage(), e);
            }
            if (parallelism < 1) {
                throw new IOException("'parallelism' must be at least 1, got " + parallelism);
            }

            Set<String> excludePackages;
            List<String> excludeFunctions;
            try {
                excludePackages = toSet((List<Object>) data.get("excludePackages"));
                excludeFunctions = toList((List<Object>) data.get("excludeFunctions"));
            } catch (ClassCastException e) {
                throw new IOException("Invalid config file " + configPath + ": exclusions must be lists", e);
            }

            return new ScanConfig(programPath, algorithm, parallelism, excludePackages, excludeFunctions);
        }
    }

    private static Set<String> toSet(List<Object> list) {
        if (list == null || list.isEmpty()) {
            return Set.of();
        }
        Set<String> result = new LinkedHashSet<>();
        for (Object item : list) {
            if (item != null) {
                String trimmed = item.toString().trim();
                if (!trimmed.isEmpty()) {
                    result.add(trimmed);
                }
            }
        }
        return Collections.unmodifiableSet(result);
    }

    private static List<String> toList(List<Object> list) {
        if (list == null || list.isEmpty()) {
            return List.of();
        }
        return list.stream()
            .filter(s -> s != null && !s.toString().trim().isEmpty())
            .map(s -> s.toString().trim())
            .toList();
    }

    public Path getProgramPath() {
        return programPath;
    }

    public Algorithm getAlgorithm() {
        return algorithm;
    }

    public int getParallelism() {
        return parallelism;
    }

    public Set<String> getExcludePackages() {
        return excludePackages;
    }

    public List<String> getExcludeFunctions() {
        return excludeFunctions;
    }

    /**
     * Returns a copy with the given values replacing the configured ones; null keeps the current value.
     */
    public ScanConfig withOverrides(Path programPath, Algorithm algorithm, Integer parallelism) {
        return new ScanConfig(
            programPath != null ? programPath : this.programPath,
            algorithm != null ? algorithm : this.algorithm,
            parallelism != null ? parallelism : this.parallelism,
            excludePackages,
            excludeFunctions);
    }

    /**
     * Check if a value matches a pattern.
     * Trailing dot means prefix match, otherwise exact match.
     */
    private static boolean matchesPattern(String value, String pattern) {
        if (pattern.isEmpty()) {
            return true;
        }
        if (pattern.endsWith(".")) {
            return value.startsWith(pattern.substring(0, pattern.length() - 1));
        }
        return value.equals(pattern);
    }

    /**
     * Check if a function is left out of the printed call graph.
     * Pattern formats for excludeFunctions:
     * - "name" - the function with this relative name in any package, e.g. "g" or "(*C).f"
     * - "name." - prefix match on the relative name
     * - "pkg#name" - the function in one package
     * - "pkg#" - every function of the package
     * Packages listed in excludePackages match by prefix.
     */
    public boolean isFunctionExcluded(Function fn) {
        String pkg = fn.pkg();
        for (String prefix : excludePackages) {
            if (pkg.startsWith(prefix)) {
                return true;
            }
        }

        String name = fn.name();
        for (String pattern : excludeFunctions) {
            int hashIdx = pattern.indexOf('#');
            if (hashIdx == -1) {
                if (matchesPattern(name, pattern)) {
                    return true;
                }
            } else {
                String pkgPattern = pattern.substring(0, hashIdx);
                String namePattern = pattern.substring(hashIdx + 1);

                boolean pkgMatches = pkgPattern.isEmpty() || matchesPattern(pkg, pkgPattern);
                boolean nameMatches = namePattern.isEmpty() || matchesPattern(name, namePattern);

                if (pkgMatches && nameMatches) {
                    return true;
                }
            }
        }
        return false;
    }
}
