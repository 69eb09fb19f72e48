package com.netmeasure.service;

import com.netmeasure.model.ConfigurationException;
import com.netmeasure.model.RunSettings;
import com.netmeasure.model.TestDefinition;
import com.netmeasure.model.WorkerDefinition;
import com.netmeasure.model.WorkerSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Component;
import org.yaml.snakeyaml.Yaml;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Loads YAML test definitions and turns them into worker specs for a run.
 *
 * <p>Definitions come from {@code netmeasure.tests.path}, either a directory on disk or a
 * {@code classpath:} location.
 */
@Component
public class TestDefinitionRegistry {
    private static final Logger log = LoggerFactory.getLogger(TestDefinitionRegistry.class);

    private static final String CLASSPATH_PREFIX = "classpath:";
    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([A-Za-z0-9_]+)}");

    @Value("${netmeasure.tests.path:classpath:tests}")
    private String testsPath;

    private volatile Map<String, TestDefinition> definitions = Map.of();

    public TestDefinitionRegistry() {
    }

    public TestDefinitionRegistry(String testsPath) {
        this.testsPath = testsPath;
    }

    @PostConstruct
    public void loadDefinitions() {
        reloadDefinitions();
    }

    /**
     * Reloads every test definition and swaps the new set in at once.
     */
    public void reloadDefinitions() {
        Map<String, TestDefinition> loaded = new TreeMap<>();
        try {
            if (testsPath.startsWith(CLASSPATH_PREFIX)) {
                loadFromClasspath(testsPath.substring(CLASSPATH_PREFIX.length()), loaded);
            } else {
                loadFromDirectory(Paths.get(testsPath), loaded);
            }
        } catch (IOException e) {
            log.error("Failed to list test definitions: path={}", testsPath, e);
        }
        definitions = loaded;
        log.info("Loaded {} test definitions from {}", loaded.size(), testsPath);
    }

    private void loadFromDirectory(Path dir, Map<String, TestDefinition> into) throws IOException {
        if (!Files.isDirectory(dir)) {
            log.warn("Test definitions directory not found: {}", dir);
            return;
        }
        try (Stream<Path> files = Files.list(dir)) {
            files.filter(TestDefinitionRegistry::isYaml).sorted().forEach(file -> {
                try (InputStream in = Files.newInputStream(file)) {
                    register(in, file.getFileName().toString(), into);
                } catch (Exception e) {
                    log.error("Failed to load test definition: {}", file, e);
                }
            });
        }
    }

    private void loadFromClasspath(String location, Map<String, TestDefinition> into) throws IOException {
        String base = location.startsWith("/") ? location.substring(1) : location;
        Resource[] resources = new PathMatchingResourcePatternResolver()
                .getResources("classpath*:" + base + "/*.y*ml");
        for (Resource resource : resources) {
            try (InputStream in = resource.getInputStream()) {
                register(in, resource.getFilename(), into);
            } catch (Exception e) {
                log.error("Failed to load test definition: {}", resource, e);
            }
        }
    }

    private void register(InputStream in, String fileName, Map<String, TestDefinition> into) {
        TestDefinition definition = new Yaml().loadAs(in, TestDefinition.class);
        if (definition == null) {
            log.warn("Empty test definition: {}", fileName);
            return;
        }
        if (definition.getName() == null || definition.getName().isBlank()) {
            definition.setName(stripExtension(fileName));
        }
        definition.setSourceFile(fileName);
        into.put(definition.getName(), definition);
        log.debug("Loaded test definition: name={}, file={}, workers={}",
                definition.getName(), fileName, definition.getWorkers().keySet());
    }

    public Collection<TestDefinition> getDefinitions() {
        return definitions.values();
    }

    /**
     * @throws TestNotFoundException if no definition has this name
     */
    public TestDefinition getDefinition(String name) {
        TestDefinition definition = name == null ? null : definitions.get(name);
        if (definition == null) {
            throw new TestNotFoundException("Test not found: " + name + ". Available: " + definitions.keySet());
        }
        return definition;
    }

    /**
     * Builds the worker specs of a test for one run. Commands get their {@code ${...}}
     * placeholders filled from the run settings and the worker's own {@code params};
     * duplicated workers become
     * {@code name::1} to {@code name::n}.
     *
     * @param definition test definition
     * @param settings run settings
     * @return specs by worker name, in definition order
     * @throws ConfigurationException if a command uses an unknown placeholder
     */
    public Map<String, WorkerSpec> buildSpecs(TestDefinition definition, RunSettings settings) {
        Map<String, String> placeholders = settings.placeholders();
        Map<String, WorkerSpec> specs = new LinkedHashMap<>();
        if (definition.getWorkers() == null) {
            return specs;
        }
        definition.getWorkers().forEach((name, wd) -> {
            if (wd == null) {
                throw new ConfigurationException("Worker '" + name + "' of test " + definition.getName() + " is empty");
            }
            WorkerSpec spec = toSpec(name, wd, placeholders);
            int duplicates = wd.getDuplicates() == null ? 1 : wd.getDuplicates();
            if (duplicates <= 1) {
                putUnique(specs, spec, definition);
            } else {
                for (int i = 1; i <= duplicates; i++) {
                    putUnique(specs, spec.toBuilder().name(name + "::" + i).build(), definition);
                }
            }
        });
        return specs;
    }

    private static void putUnique(Map<String, WorkerSpec> specs, WorkerSpec spec, TestDefinition definition) {
        if (specs.putIfAbsent(spec.getName(), spec) != null) {
            throw new ConfigurationException("Duplicate worker name '" + spec.getName() + "' in test " + definition.getName());
        }
    }

    private static WorkerSpec toSpec(String name, WorkerDefinition wd, Map<String, String> placeholders) {
        WorkerSpec.WorkerSpecBuilder b = WorkerSpec.builder()
                .name(name)
                .kind(wd.getKind())
                .command(render(wd.getCommand(), withParams(placeholders, wd.getParams()), name))
                .pattern(wd.getPattern())
                .runAfter(wd.getRunAfter())
                .killAfter(wd.getKillAfter())
                .units(wd.getUnits())
                .killTimeout(wd.getKillTimeout())
                .length(wd.getLength())
                .smoothSteps(wd.getSmoothSteps());
        if (wd.getDelay() != null) {
            b.delay(wd.getDelay());
        }
        if (wd.getTransforms() != null) {
            b.transforms(wd.getTransforms());
        }
        if (wd.getApplyTo() != null) {
            b.applyTo(List.copyOf(wd.getApplyTo()));
        }
        return b.build();
    }

    // Run settings win over worker params of the same name.
    private static Map<String, String> withParams(Map<String, String> placeholders, Map<String, Object> params) {
        if (params == null || params.isEmpty()) {
            return placeholders;
        }
        Map<String, String> merged = new LinkedHashMap<>();
        params.forEach((k, v) -> merged.put(k, String.valueOf(v)));
        merged.putAll(placeholders);
        return merged;
    }

    static String render(String command, Map<String, String> placeholders, String worker) {
        if (command == null) {
            return null;
        }
        Matcher m = PLACEHOLDER.matcher(command);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String value = placeholders.get(m.group(1));
            if (value == null) {
                throw new ConfigurationException("Unknown placeholder ${" + m.group(1) + "} in command of worker '"
                        + worker + "'. Available: " + placeholders.keySet());
            }
            m.appendReplacement(sb, Matcher.quoteReplacement(value));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    private static boolean isYaml(Path p) {
        String name = p.getFileName().toString();
        return name.endsWith(".yaml") || name.endsWith(".yml");
    }

    private static String stripExtension(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
