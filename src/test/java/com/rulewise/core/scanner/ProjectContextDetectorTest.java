package com.rulewise.core.scanner;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rulewise.core.model.Maturity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link ProjectContextDetector}.
 * <p>
 * Uses JUnit 5's {@code @TempDir} for isolated filesystem tests so that
 * results are deterministic and independent of the host machine.
 */
class ProjectContextDetectorTest {

    @TempDir
    Path tempDir;

    ProjectContextDetector detector = new ProjectContextDetector(new ObjectMapper());

    private void write(String relative, String content) throws IOException {
        Path file = tempDir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }

    // ── Empty project ────────────────────────────────────────────────

    @Test
    @DisplayName("empty directory is an MVP with minimum confidence")
    void emptyDirectory() {
        var context = detector.detect(tempDir);
        assertTrue(context.languages().isEmpty());
        assertTrue(context.frameworks().isEmpty());
        assertTrue(context.cloudProviders().isEmpty());
        assertEquals(Maturity.MVP, context.maturity());
        assertEquals(0.1, context.confidence(), 1e-9);
    }

    @Test
    @DisplayName("missing directory raises DetectionException")
    void missingDirectory() {
        assertThrows(DetectionException.class, () -> detector.detect(tempDir.resolve("nope")));
    }

    @Test
    @DisplayName("a regular file is not a project directory")
    void fileIsNotADirectory() throws IOException {
        write("README.md", "# hi");
        assertThrows(DetectionException.class, () -> detector.detect(tempDir.resolve("README.md")));
    }

    // ── Languages and frameworks ─────────────────────────────────────

    @Test
    @DisplayName("tsconfig.json makes a package.json project TypeScript only")
    void typescriptReplacesJavascript() throws IOException {
        write("tsconfig.json", "{}");
        write("package.json", """
                {"name": "web", "dependencies": {"react": "^18.0.0"}, "devDependencies": {"vitest": "1.0.0"}}
                """);

        var context = detector.detect(tempDir);
        assertEquals(Set.of("typescript"), context.languages());
        assertEquals(Set.of("react"), context.frameworks());
    }

    @Test
    @DisplayName("package.json without tsconfig is JavaScript")
    void javascriptWithExpress() throws IOException {
        write("package.json", """
                {"dependencies": {"express": "^4.18.0"}}
                """);

        var context = detector.detect(tempDir);
        assertEquals(Set.of("javascript"), context.languages());
        assertEquals(Set.of("express"), context.frameworks());
    }

    @Test
    @DisplayName("malformed package.json is skipped, not fatal")
    void malformedPackageJson() throws IOException {
        write("package.json", "{ not json");

        var context = detector.detect(tempDir);
        assertEquals(Set.of("javascript"), context.languages());
        assertTrue(context.frameworks().isEmpty());
    }

    @Test
    @DisplayName("python manifest with fastapi and boto3 yields python, fastapi and aws")
    void pythonFastapiAws() throws IOException {
        write("requirements.txt", "fastapi==0.110.0\nuvicorn\nboto3==1.34.0\n");

        var context = detector.detect(tempDir);
        assertEquals(Set.of("python"), context.languages());
        assertEquals(Set.of("fastapi"), context.frameworks());
        assertEquals(Set.of("aws"), context.cloudProviders());
    }

    @Test
    @DisplayName("Spring Boot parent in pom.xml yields java and springboot")
    void springBoot() throws IOException {
        write("pom.xml", """
                <project><parent><artifactId>spring-boot-starter-parent</artifactId></parent></project>
                """);

        var context = detector.detect(tempDir);
        assertEquals(Set.of("java"), context.languages());
        assertEquals(Set.of("springboot"), context.frameworks());
    }

    @Test
    @DisplayName("root .csproj marks csharp")
    void csharp() throws IOException {
        write("Api.csproj", "<Project/>");
        assertEquals(Set.of("csharp"), detector.detect(tempDir).languages());
    }

    @Test
    @DisplayName("go.mod with gin and vercel.json")
    void goGinVercel() throws IOException {
        write("go.mod", "module example.com/app\n\nrequire github.com/gin-gonic/gin v1.9.1\n");
        write("vercel.json", "{}");

        var context = detector.detect(tempDir);
        assertEquals(Set.of("go"), context.languages());
        assertEquals(Set.of("gin"), context.frameworks());
        assertEquals(Set.of("vercel"), context.cloudProviders());
    }

    // ── Maturity ─────────────────────────────────────────────────────

    @Test
    @DisplayName("three or more strong signals mean production")
    void production() throws IOException {
        write(".github/workflows/ci.yml", "on: push");
        write(".env.production", "API_URL=https://example.com");
        write("prometheus.yml", "scrape_configs: []");
        write("SECURITY.md", "# Security");

        assertEquals(Maturity.PRODUCTION, detector.detect(tempDir).maturity());
    }

    @Test
    @DisplayName("tests directory and Dockerfile mean pre-production")
    void preProduction() throws IOException {
        write("tests/test_app.py", "def test(): pass");
        write("Dockerfile", "FROM python:3.12");

        assertEquals(Maturity.PRE_PRODUCTION, detector.detect(tempDir).maturity());
    }

    @Test
    @DisplayName("declared release version counts as a weak signal")
    void releaseVersion() throws IOException {
        write("package.json", """
                {"name": "lib", "version": "1.2.0"}
                """);
        write("Dockerfile", "FROM node:20");

        assertEquals(Maturity.PRE_PRODUCTION, detector.detect(tempDir).maturity());
    }

    @Test
    @DisplayName("a single weak signal stays MVP")
    void singleWeakSignal() throws IOException {
        write("Dockerfile", "FROM node:20");
        assertEquals(Maturity.MVP, detector.detect(tempDir).maturity());
    }

    @Test
    @DisplayName("release version threshold is 0.9")
    void releaseVersionThreshold() {
        assertTrue(ProjectContextDetector.isReleaseVersion("1.0.0"));
        assertTrue(ProjectContextDetector.isReleaseVersion("0.9.1"));
        assertTrue(ProjectContextDetector.isReleaseVersion("v2.1"));
        assertFalse(ProjectContextDetector.isReleaseVersion("0.8.5"));
        assertFalse(ProjectContextDetector.isReleaseVersion("next"));
        assertFalse(ProjectContextDetector.isReleaseVersion(""));
    }

    // ── Confidence and determinism ───────────────────────────────────

    @Test
    @DisplayName("confidence grows with signals and caps at 1.0")
    void confidence() {
        assertEquals(0.1, ProjectContextDetector.confidence(0), 1e-9);
        assertEquals(0.25, ProjectContextDetector.confidence(1), 1e-9);
        assertEquals(0.4, ProjectContextDetector.confidence(2), 1e-9);
        assertEquals(1.0, ProjectContextDetector.confidence(6), 1e-9);
        assertEquals(1.0, ProjectContextDetector.confidence(20), 1e-9);
    }

    @Test
    @DisplayName("detected confidence counts languages, frameworks and cloud providers")
    void detectedConfidence() throws IOException {
        write("requirements.txt", "django\ngoogle-cloud-storage\n");
        // python + django + gcp = 3 signals
        assertEquals(0.55, detector.detect(tempDir).confidence(), 1e-9);
    }

    @Test
    @DisplayName("a CI workflow counts once toward confidence")
    void ciCountsOnce() throws IOException {
        write(".github/workflows/ci.yml", "on: push");

        var context = detector.detect(tempDir);

        assertEquals(Maturity.MVP, context.maturity());
        assertEquals(0.25, context.confidence(), 1e-9);
    }

    @Test
    @DisplayName("detecting the same directory twice gives equal contexts")
    void deterministic() throws IOException {
        write("tsconfig.json", "{}");
        write("package.json", """
                {"dependencies": {"next": "14.0.0", "react": "18.0.0", "@aws-sdk/client-s3": "3.0.0"}}
                """);
        write(".gitlab-ci.yml", "stages: [test]");

        assertEquals(detector.detect(tempDir), detector.detect(tempDir));
    }
}
