package com.rulewise.dispatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rulewise.core.classifier.IntentAnalyzer;
import com.rulewise.core.classifier.PromptClassifier;
import com.rulewise.core.classifier.TopicExtractor;
import com.rulewise.core.config.ConfigurationException;
import com.rulewise.core.config.RulewiseProperties;
import com.rulewise.core.engine.RulePipeline;
import com.rulewise.core.model.AssembledRule;
import com.rulewise.core.model.Maturity;
import com.rulewise.core.model.PipelineResult;
import com.rulewise.core.model.ProjectContext;
import com.rulewise.core.model.PromptCategory;
import com.rulewise.core.model.RuleCategory;
import com.rulewise.core.model.RuleDescriptor;
import com.rulewise.core.model.UserIntent;
import com.rulewise.core.scanner.ProjectContextDetector;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for the Rulewise CLI command structure.
 * These tests drive picocli through {@link CliRunner} without a Spring context,
 * validating command parsing, help output and execution behavior.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    private RulePipeline pipeline;
    private LoggingSystem loggingSystem;
    private RulewiseProperties properties;

    @BeforeEach
    void setUp() {
        pipeline = mock(RulePipeline.class);
        loggingSystem = mock(LoggingSystem.class);
        properties = new RulewiseProperties();
    }

    private static PipelineResult injected() {
        var descriptor = new RuleDescriptor("frameworks/fastapi/best-practices.md", "FastAPI Best Practices",
                RuleCategory.FRAMEWORK, "python", "fastapi", null, Set.of("api"), null, 1500);
        var context = new ProjectContext("/work/api", Set.of("python"), Set.of("fastapi"), Set.of(),
                Maturity.MVP, 0.4);
        return new PipelineResult(PipelineResult.Status.INJECTED, PromptCategory.CODE_IMPLEMENTATION, context,
                UserIntent.of("api"), List.of(new AssembledRule(descriptor, "Use routers.", 280)), false, 120);
    }

    /**
     * Custom picocli IFactory that provides test dependencies for commands.
     */
    private CommandLine.IFactory createFactory() {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == SelectCommand.class) {
                    return (K) new SelectCommand(pipeline, properties);
                }
                if (cls == ClassifyCommand.class) {
                    return (K) new ClassifyCommand(new PromptClassifier(), new IntentAnalyzer(new TopicExtractor()));
                }
                if (cls == DetectCommand.class) {
                    return (K) new DetectCommand(new ProjectContextDetector(new ObjectMapper()));
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            var runner = new CliRunner(new RulewiseCommand(loggingSystem), createFactory(), properties);
            runner.run(args);
            capturePrintStream.flush();
            return new CliResult(runner.getExitCode(), capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    // ── Help output ──────────────────────────────────────────────────

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help lists every subcommand")
        void helpListsSubcommands() {
            CliResult result = execute("--help");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("select"));
            assertTrue(result.output().contains("classify"));
            assertTrue(result.output().contains("detect"));
            assertTrue(result.output().contains("help"));
        }

        @Test
        @DisplayName("--version shows version")
        void versionOutput() {
            CliResult result = execute("--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Rulewise 0.1.0"));
        }

        @Test
        @DisplayName("no subcommand prints banner and usage")
        void noSubcommand() {
            CliResult result = execute();
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("RULEWISE v0.1.0"));
            assertTrue(result.output().contains("Usage: rulewise"));
        }

        @Test
        @DisplayName("select --help shows its options")
        void selectHelp() {
            CliResult result = execute("select", "--help");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("--max-rules"));
            assertTrue(result.output().contains("--markdown"));
        }

        @Test
        @DisplayName("select without a message is a usage error")
        void selectWithoutMessage() {
            CliResult result = execute("select");
            assertEquals(CommandLine.ExitCode.USAGE, result.exitCode());
        }
    }

    // ── select ───────────────────────────────────────────────────────

    @Nested
    @DisplayName("select")
    class SelectTests {

        @Test
        @DisplayName("prints selected rules with their scores")
        void printsRules() {
            when(pipeline.run(anyString(), any(), anyInt(), anyInt())).thenReturn(injected());

            CliResult result = execute("select", "Add", "a", "users", "endpoint");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Category: CODE_IMPLEMENTATION"));
            assertTrue(result.output().contains("Languages:  python"));
            assertTrue(result.output().contains("1 rule(s) selected:"));
            assertTrue(result.output().contains("frameworks/fastapi/best-practices.md"));
            assertTrue(result.output().contains("score 280"));
            verify(pipeline).run(eq("Add a users endpoint"), any(), eq(5), eq(5000));
        }

        @Test
        @DisplayName("limit options override configured defaults")
        void limitOptions(@TempDir Path dir) {
            when(pipeline.run(anyString(), any(), anyInt(), anyInt())).thenReturn(injected());

            execute("select", "--max-rules", "2", "--max-tokens", "900", "-d", dir.toString(), "fix", "the", "bug");

            verify(pipeline).run("fix the bug", dir, 2, 900);
        }

        @Test
        @DisplayName("--markdown prints only the injection block")
        void markdown() {
            var result = injected();
            when(pipeline.run(anyString(), any(), anyInt(), anyInt())).thenReturn(result);
            when(pipeline.render(result)).thenReturn("# Relevant Coding Rules\n");

            CliResult cli = execute("select", "-m", "Add", "an", "endpoint");

            assertEquals(0, cli.exitCode());
            assertEquals("# Relevant Coding Rules\n", cli.output());
        }

        @Test
        @DisplayName("skipped message says no rules were injected")
        void skipped() {
            when(pipeline.run(anyString(), any(), anyInt(), anyInt()))
                    .thenReturn(PipelineResult.skipped(PromptCategory.LEGAL_BUSINESS, 2));

            CliResult result = execute("select", "Draft", "our", "privacy", "policy");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Not a coding request"));
        }

        @Test
        @DisplayName("configuration errors exit with code 2")
        void configurationError() {
            when(pipeline.run(anyString(), any(), anyInt(), anyInt()))
                    .thenThrow(new ConfigurationException("Rule catalog not readable", "rulewise.catalog.location"));

            CliResult result = execute("select", "Add", "tests");

            assertEquals(CliExceptionHandler.CONFIGURATION_ERROR, result.exitCode());
            assertTrue(result.output().contains("Configuration error [rulewise.catalog.location]"));
        }
    }

    // ── classify / detect ────────────────────────────────────────────

    @Nested
    @DisplayName("classify and detect")
    class InspectionTests {

        @Test
        @DisplayName("classify shows category and intent")
        void classify() {
            CliResult result = execute("classify", "Fix", "this", "error", "in", "production");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Category: CODE_DEBUGGING"));
            assertTrue(result.output().contains("Actionable"));
            assertTrue(result.output().contains("Action:  fix"));
            assertTrue(result.output().contains("Urgency: high"));
        }

        @Test
        @DisplayName("classify flags non-actionable messages")
        void classifyNonActionable() {
            CliResult result = execute("classify", "Draft", "our", "privacy", "policy");
            assertTrue(result.output().contains("Not actionable"));
        }

        @Test
        @DisplayName("detect prints the project context")
        void detect(@TempDir Path dir) throws IOException {
            Files.writeString(dir.resolve("go.mod"), "module example.com/app\nrequire github.com/gin-gonic/gin v1.9.1\n");

            CliResult result = execute("detect", dir.toString());

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Languages:  go"));
            assertTrue(result.output().contains("Frameworks: gin"));
            assertTrue(result.output().contains("Maturity:   mvp"));
        }

        @Test
        @DisplayName("detect on a missing directory exits with 1")
        void detectMissing(@TempDir Path dir) {
            CliResult result = execute("detect", dir.resolve("absent").toString());
            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("Not a directory"));
        }
    }

    // ── verbose ──────────────────────────────────────────────────────

    @Nested
    @DisplayName("Verbose logging")
    class VerboseTests {

        @Test
        @DisplayName("-v raises the rulewise log level to DEBUG")
        void verboseFlag() {
            execute("classify", "-v", "Add", "tests");
            verify(loggingSystem, atLeastOnce()).setLogLevel("com.rulewise", LogLevel.DEBUG);
        }

        @Test
        @DisplayName("verbose property has the same effect")
        void verboseProperty() {
            properties.setVerbose(true);
            execute("classify", "Add", "tests");
            verify(loggingSystem, atLeastOnce()).setLogLevel("com.rulewise", LogLevel.DEBUG);
        }

        @Test
        @DisplayName("log level is untouched by default")
        void notVerbose() {
            execute("classify", "Add", "tests");
            verify(loggingSystem, never()).setLogLevel(anyString(), any());
        }
    }
}
