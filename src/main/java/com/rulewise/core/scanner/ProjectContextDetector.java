package com.rulewise.core.scanner;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rulewise.core.model.Maturity;
import com.rulewise.core.model.ProjectContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Probes a project directory and builds a {@link ProjectContext} describing its
 * languages, frameworks, cloud providers and maturity.
 * <p>
 * All probes are read-only and look at well-known manifest and configuration
 * files in the project root (plus a few fixed sub-paths such as
 * {@code .github/workflows}). Directory listings are sorted before use, so the
 * same directory state always yields the same context.
 */
@Service
public class ProjectContextDetector {

    private static final Logger log = LoggerFactory.getLogger(ProjectContextDetector.class);

    /** Language → manifest files whose presence marks the language. */
    private static final Map<String, List<String>> LANGUAGE_MANIFESTS = new LinkedHashMap<>();

    static {
        LANGUAGE_MANIFESTS.put("typescript", List.of("tsconfig.json"));
        LANGUAGE_MANIFESTS.put("javascript", List.of("package.json"));
        LANGUAGE_MANIFESTS.put("python", List.of("requirements.txt", "pyproject.toml", "setup.py", "Pipfile"));
        LANGUAGE_MANIFESTS.put("java", List.of("pom.xml", "build.gradle", "build.gradle.kts"));
        LANGUAGE_MANIFESTS.put("go", List.of("go.mod"));
        LANGUAGE_MANIFESTS.put("rust", List.of("Cargo.toml"));
        LANGUAGE_MANIFESTS.put("ruby", List.of("Gemfile"));
        LANGUAGE_MANIFESTS.put("php", List.of("composer.json"));
    }

    /** npm package → framework. */
    private static final Map<String, String> NODE_FRAMEWORKS = Map.of(
            "react", "react",
            "next", "nextjs",
            "express", "express",
            "@nestjs/core", "nestjs",
            "vue", "vue",
            "@angular/core", "angular"
    );

    private static final List<String> PYTHON_FRAMEWORKS = List.of("fastapi", "django", "flask");

    private static final List<String> PYTHON_MANIFESTS = List.of("requirements.txt", "pyproject.toml", "Pipfile", "setup.py");

    private static final List<String> CI_FILES = List.of(
            ".gitlab-ci.yml", ".circleci/config.yml", "azure-pipelines.yml", "Jenkinsfile", "bitbucket-pipelines.yml");

    private static final List<String> TEST_DIRS = List.of("tests", "test", "__tests__", "spec", "src/test");

    private static final List<String> CONTAINER_FILES = List.of(
            "Dockerfile", "docker-compose.yml", "docker-compose.yaml", "compose.yaml");

    private static final List<String> ENV_CONFIG_FILES = List.of(
            ".env.production", ".env.staging",
            "src/main/resources/application-prod.yml", "src/main/resources/application-prod.properties",
            "application-prod.yml", "application-prod.properties");

    private static final List<String> SECURITY_SCAN_FILES = List.of(
            ".github/dependabot.yml", ".github/dependabot.yaml", ".snyk", "trivy.yaml", ".trivyignore", "SECURITY.md");

    private static final List<String> MONITORING_MARKERS = List.of(
            "sentry", "datadog", "newrelic", "opentelemetry", "prometheus");

    private static final Pattern TOML_VERSION = Pattern.compile("(?m)^\\s*version\\s*=\\s*\"([^\"]+)\"");

    private final ObjectMapper objectMapper;

    public ProjectContextDetector(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Detects the context of the given project root.
     *
     * @param projectRoot the directory to probe
     * @return a populated {@link ProjectContext}
     * @throws DetectionException if the path is not a readable directory
     */
    public ProjectContext detect(Path projectRoot) {
        if (projectRoot == null || !Files.isDirectory(projectRoot)) {
            throw new DetectionException("Not a directory: " + projectRoot, projectRoot);
        }

        var probe = new Probe(projectRoot);
        var languages = detectLanguages(probe);
        var frameworks = detectFrameworks(probe, languages);
        var cloudProviders = detectCloudProviders(probe);
        var signals = detectMaturitySignals(probe);

        Maturity maturity;
        if (signals.strong().size() >= 3) {
            maturity = Maturity.PRODUCTION;
        } else if (signals.weak().size() >= 2) {
            maturity = Maturity.PRE_PRODUCTION;
        } else {
            maturity = Maturity.MVP;
        }

        int totalSignals = languages.size() + frameworks.size() + cloudProviders.size()
                + signals.distinctCount();
        double confidence = confidence(totalSignals);

        log.debug("Detected context for {}: languages={}, frameworks={}, cloud={}, strong={}, weak={}, maturity={}",
                projectRoot, languages, frameworks, cloudProviders, signals.strong(), signals.weak(), maturity);

        return new ProjectContext(
                projectRoot.toString(),
                languages,
                frameworks,
                cloudProviders,
                maturity,
                confidence
        );
    }

    /**
     * Monotonically increasing in the number of signals; 0.1 with none, capped at 1.0.
     */
    static double confidence(int totalSignals) {
        double raw = Math.min(1.0, 0.1 + 0.15 * totalSignals);
        return Math.round(raw * 100.0) / 100.0;
    }

    // ── Languages ───────────────────────────────────────────────────

    private Set<String> detectLanguages(Probe probe) {
        var detected = new TreeSet<String>();
        for (var entry : LANGUAGE_MANIFESTS.entrySet()) {
            for (String manifest : entry.getValue()) {
                if (probe.isFile(manifest)) {
                    detected.add(entry.getKey());
                    break;
                }
            }
        }
        if (probe.rootNames().stream().anyMatch(n -> n.endsWith(".csproj") || n.endsWith(".sln"))) {
            detected.add("csharp");
        }
        if (probe.packageDependencies().contains("typescript")) {
            detected.add("typescript");
        }

        // tsconfig.json means the JavaScript manifest belongs to a TypeScript project
        if (detected.contains("typescript") && detected.contains("javascript") && probe.isFile("tsconfig.json")) {
            detected.remove("javascript");
        }
        return detected;
    }

    // ── Frameworks ──────────────────────────────────────────────────

    private Set<String> detectFrameworks(Probe probe, Set<String> languages) {
        var detected = new TreeSet<String>();

        if (languages.contains("typescript") || languages.contains("javascript")) {
            var deps = probe.packageDependencies();
            NODE_FRAMEWORKS.forEach((dependency, framework) -> {
                if (deps.contains(dependency)) {
                    detected.add(framework);
                }
            });
        }

        if (languages.contains("python")) {
            String manifests = probe.readAllLower(PYTHON_MANIFESTS);
            for (String framework : PYTHON_FRAMEWORKS) {
                if (manifests.contains(framework)) {
                    detected.add(framework);
                }
            }
        }

        if (languages.contains("java")) {
            if (probe.readLower("pom.xml").contains("spring-boot")
                    || probe.readLower("build.gradle").contains("org.springframework.boot")
                    || probe.readLower("build.gradle.kts").contains("org.springframework.boot")) {
                detected.add("springboot");
            }
        }

        if (languages.contains("go")) {
            String goMod = probe.readLower("go.mod");
            if (goMod.contains("github.com/gin-gonic/gin")) detected.add("gin");
            if (goMod.contains("github.com/labstack/echo")) detected.add("echo");
        }

        if (languages.contains("rust")) {
            String cargo = probe.readLower("Cargo.toml");
            if (cargo.contains("actix-web")) detected.add("actix");
            if (cargo.contains("axum")) detected.add("axum");
        }

        return detected;
    }

    // ── Cloud providers ─────────────────────────────────────────────

    private Set<String> detectCloudProviders(Probe probe) {
        var detected = new TreeSet<String>();
        var deps = probe.packageDependencies();
        String python = probe.readAllLower(PYTHON_MANIFESTS);
        String jvm = probe.readAllLower(List.of("pom.xml", "build.gradle", "build.gradle.kts"));

        if (probe.isDirectory(".aws") || probe.isDirectory("cdk") || probe.isDirectory("cloudformation")
                || probe.isDirectory("terraform") || probe.isFile("serverless.yml") || probe.isFile("cdk.json")
                || probe.isFile("samconfig.toml")
                || deps.contains("aws-sdk") || deps.stream().anyMatch(d -> d.startsWith("@aws-sdk/"))
                || python.contains("boto3") || python.contains("aws-")
                || jvm.contains("software.amazon.awssdk") || jvm.contains("aws-java-sdk")) {
            detected.add("aws");
        }

        if (probe.isFile("azure-pipelines.yml") || probe.isFile("host.json")
                || deps.stream().anyMatch(d -> d.startsWith("@azure/"))
                || python.contains("azure-") || jvm.contains("com.azure")) {
            detected.add("azure");
        }

        if (probe.isFile("cloudbuild.yaml") || probe.isFile("app.yaml")
                || deps.stream().anyMatch(d -> d.startsWith("@google-cloud/"))
                || python.contains("google-cloud") || jvm.contains("com.google.cloud")) {
            detected.add("gcp");
        }

        if (probe.isFile("vercel.json") || probe.isDirectory(".vercel")) {
            detected.add("vercel");
        }

        return detected;
    }

    // ── Maturity ────────────────────────────────────────────────────

    private MaturitySignals detectMaturitySignals(Probe probe) {
        var strong = new ArrayList<String>();
        var weak = new ArrayList<String>();

        boolean hasCi = probe.isDirectory(".github/workflows") || CI_FILES.stream().anyMatch(probe::isFile);
        if (hasCi) {
            strong.add("ci");
            weak.add("ci");
        }

        if (ENV_CONFIG_FILES.stream().anyMatch(probe::isFile)
                || probe.listNames("config").stream().anyMatch(n -> n.startsWith("production."))) {
            strong.add("environment-config");
        }

        String manifests = probe.readAllLower(List.of(
                "package.json", "requirements.txt", "pyproject.toml", "pom.xml", "build.gradle",
                "build.gradle.kts", "go.mod", "Cargo.toml", "Gemfile"));
        if (probe.isFile("prometheus.yml") || probe.isDirectory("grafana")
                || MONITORING_MARKERS.stream().anyMatch(manifests::contains)) {
            strong.add("monitoring");
        }

        if (SECURITY_SCAN_FILES.stream().anyMatch(probe::isFile)
                || probe.listNames(".github/workflows").stream().anyMatch(n -> n.startsWith("codeql"))) {
            strong.add("security-scanning");
        }

        if (TEST_DIRS.stream().anyMatch(probe::isDirectory)) {
            weak.add("tests");
        }
        if (CONTAINER_FILES.stream().anyMatch(probe::isFile)) {
            weak.add("container");
        }
        if (isReleaseVersion(declaredVersion(probe))) {
            weak.add("release-version");
        }

        return new MaturitySignals(strong, weak);
    }

    private String declaredVersion(Probe probe) {
        var packageJson = probe.packageJson();
        if (packageJson != null && packageJson.hasNonNull("version")) {
            return packageJson.get("version").asText();
        }
        for (String toml : List.of("pyproject.toml", "Cargo.toml")) {
            Matcher m = TOML_VERSION.matcher(probe.read(toml));
            if (m.find()) {
                return m.group(1);
            }
        }
        return "";
    }

    /** True for 0.9 and later. */
    static boolean isReleaseVersion(String version) {
        if (version == null || version.isBlank()) {
            return false;
        }
        String[] parts = version.trim().replaceFirst("^v", "").split("\\.");
        try {
            int major = Integer.parseInt(parts[0]);
            int minor = parts.length > 1 ? Integer.parseInt(parts[1].replaceAll("\\D.*$", "")) : 0;
            return major >= 1 || minor >= 9;
        } catch (NumberFormatException e) {
            log.debug("Ignoring unparseable version '{}'", version);
            return false;
        }
    }

    private record MaturitySignals(List<String> strong, List<String> weak) {

        /** A signal that is both strong and weak (CI) counts once. */
        int distinctCount() {
            var names = new HashSet<String>(strong);
            names.addAll(weak);
            return names.size();
        }
    }

    /**
     * Read-only view of one project root. Reads each file at most once per detection.
     */
    private final class Probe {

        private final Path root;
        private final Map<String, String> contents = new LinkedHashMap<>();
        private JsonNode packageJson;
        private boolean packageJsonLoaded;

        Probe(Path root) {
            this.root = root;
        }

        boolean isFile(String relative) {
            return Files.isRegularFile(root.resolve(relative));
        }

        boolean isDirectory(String relative) {
            return Files.isDirectory(root.resolve(relative));
        }

        List<String> rootNames() {
            return listNames("");
        }

        /** Sorted file names directly under the given sub-directory; empty if absent. */
        List<String> listNames(String relative) {
            Path dir = relative.isEmpty() ? root : root.resolve(relative);
            if (!Files.isDirectory(dir)) {
                return List.of();
            }
            try (var stream = Files.list(dir)) {
                return stream.map(p -> p.getFileName().toString()).sorted().toList();
            } catch (IOException e) {
                log.warn("Could not list {}: {}", dir, e.getMessage());
                return List.of();
            }
        }

        String read(String relative) {
            return contents.computeIfAbsent(relative, r -> {
                Path file = root.resolve(r);
                if (!Files.isRegularFile(file)) {
                    return "";
                }
                try {
                    return Files.readString(file);
                } catch (IOException e) {
                    log.warn("Could not read {}: {}", file, e.getMessage());
                    return "";
                }
            });
        }

        String readLower(String relative) {
            return read(relative).toLowerCase(Locale.ROOT);
        }

        String readAllLower(List<String> files) {
            var sb = new StringBuilder();
            for (String f : files) {
                sb.append(readLower(f)).append('\n');
            }
            return sb.toString();
        }

        JsonNode packageJson() {
            if (!packageJsonLoaded) {
                packageJsonLoaded = true;
                String raw = read("package.json");
                if (!raw.isBlank()) {
                    try {
                        packageJson = objectMapper.readTree(raw);
                    } catch (IOException e) {
                        log.warn("Could not parse package.json in {}: {}", root, e.getMessage());
                    }
                }
            }
            return packageJson;
        }

        Set<String> packageDependencies() {
            var deps = new TreeSet<String>();
            var json = packageJson();
            if (json == null) {
                return deps;
            }
            for (String section : List.of("dependencies", "devDependencies")) {
                var node = json.get(section);
                if (node != null && node.isObject()) {
                    node.fieldNames().forEachRemaining(deps::add);
                }
            }
            return deps;
        }
    }
}
