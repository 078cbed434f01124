package com.rulewise.core.classifier;

import com.rulewise.core.config.ConfigurationException;
import com.rulewise.core.model.PromptCategory;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Pattern and keyword tables used by {@link PromptClassifier}.
 * <p>
 * Patterns are compiled case-insensitively once, when the class loads. Several
 * carry negative lookaheads so a term shared with technical language (e.g. "SLA"
 * followed by "api") does not pull a technical prompt into a non-code category.
 */
final class ClassificationPatterns {

    /** Most distinctive categories first. */
    static final List<PromptCategory> PRIORITY = List.of(
            PromptCategory.LEGAL_BUSINESS,
            PromptCategory.CODE_DEBUGGING,
            PromptCategory.DEVOPS,
            PromptCategory.ARCHITECTURE,
            PromptCategory.CODE_REVIEW,
            PromptCategory.CODE_IMPLEMENTATION,
            PromptCategory.DOCUMENTATION,
            PromptCategory.GENERAL_QUESTION
    );

    static final Map<PromptCategory, List<Pattern>> PATTERNS;

    static final KeywordTable<PromptCategory> KEYWORD_WEIGHTS;

    static {
        var patterns = new EnumMap<PromptCategory, List<Pattern>>(PromptCategory.class);

        patterns.put(PromptCategory.LEGAL_BUSINESS, compile(
                // Legal documents
                "\\b(operating agreement|shareholder agreement|articles of incorporation)\\b",
                "\\b(terms of service|privacy policy|end user license agreement|EULA)\\b",
                "\\b(non-disclosure agreement|NDA|confidentiality agreement)\\b",
                "\\b(service level agreement)(?!.*\\b(api|code|implement|endpoint|monitoring)\\b)",
                "\\bSLA\\b(?!.*\\b(api|code|implement|endpoint|monitoring|metric)\\b)",
                // HR and employment
                "\\b(employee handbook|hr policy|vacation policy|pto policy)\\b",
                "\\b(employment contract|offer letter|severance agreement)\\b",
                "\\b(performance review|compensation|salary|benefits package)\\b",
                // Business operations
                "\\b(business plan|financial projection|revenue model)\\b",
                "\\b(financial (approval|decision|threshold))(?!.*(api|endpoint|function))",
                "\\b(budget allocation|expense policy|procurement process)\\b",
                // Compliance
                "\\b(GDPR compliance|CCPA|HIPAA|SOC 2|PCI DSS)\\b(?!.*(implement|code|api))",
                "\\b(regulatory compliance|audit requirements|legal opinion)\\b",
                "\\b(trademark|copyright|patent|intellectual property)\\b(?!.*(api|code))",
                // Governance
                "\\b(board resolution|corporate bylaws|governance policy)\\b",
                "\\b(risk assessment|due diligence)(?!.*(security|code|api))"
        ));

        patterns.put(PromptCategory.CODE_IMPLEMENTATION, compile(
                "\\b(implement|create|add|build|write)\\s+.*?\\b(function|class|component|module|endpoint|api|service|feature|handler|middleware)\\b",
                "\\b(develop)\\s+.*?\\b(feature|functionality|capability|service|component)\\b",
                "\\b(scaffold|bootstrap|generate)\\s+(a\\s+)?(project|app|service|module)\\b",
                "\\b(add|implement)\\s+.*\\s+(to|in|for)\\s+the\\s+(codebase|application|project)\\b",
                "\\b(create|build)\\s+(rest|graphql|grpc)\\s+api\\b",
                "\\b(setup|configure|initialize)\\s+(database|orm|migration|schema)\\b",
                "\\b(implement|add|create)\\s+.*\\.(js|ts|py|rs|go|java|rb|php|cpp|c|h)\\b"
        ));

        patterns.put(PromptCategory.CODE_DEBUGGING, compile(
                "\\b(fix|debug|resolve|solve)\\s+(this\\s+)?(error|bug|issue|problem)\\b",
                "\\b(error|exception|crash|failure)\\s+in\\s+\\w+\\.(js|ts|py|rs|go|java|rb|php)\\b",
                "\\b(stack trace|error message|exception thrown)\\b",
                "\\b(null pointer|segfault|memory leak|race condition)\\b",
                "\\b(not working|doesn'?t work|broken|failing|fails|not work)\\b",
                "\\b(why (is|does|doesn't|isn't|won't))\\s+.*\\s+(work|run|execute|compile|build|crash|fail)\\b",
                "\\bwhy does (it|this|the).*\\b(crash|fail|break|error)\\b",
                "\\b(stops|hangs|freezes|crashes)\\s+(when|after|during)\\b",
                "\\b(app|application|code|function|feature)\\s+(doesn'?t|does not|isn'?t|is not)\\s+(work|run|load)\\b",
                "\\b(test|tests|unit test)\\s+(fail|failing|failed|broken)\\b",
                "\\b(ci|build)\\s+(fail|failing|failed|broken|red)\\b"
        ));

        patterns.put(PromptCategory.CODE_REVIEW, compile(
                "\\b(review|check|validate|assess)\\s+(this|the|my)\\s+(code|function|class|implementation|solution)\\b",
                "\\b(code review|pull request review|pr review)\\b",
                "\\b(feedback on|opinion on|thoughts on)\\s+(this|the|my)\\s+(code|implementation|function|class)\\b",
                "\\b(is this|this)\\s+.*\\b(best practice|good code|clean code|correct|right approach)\\b",
                "\\b(improve|optimize|refactor)\\s+(this|the)\\s+(code|function|class|implementation)\\b",
                "\\b(how|what)\\b.*\\b(improve|optimize|refactor|better)\\b.*\\b(code|function|implementation)\\b",
                "\\b(how (do|to|should|can) I)\\s+test\\b.*\\b(component|function|class|module|code)\\b",
                "\\b(test|testing)\\s+(this|the|my)\\s+(component|function|class|code)\\b"
        ));

        patterns.put(PromptCategory.ARCHITECTURE, compile(
                "\\b(microservices|monolith|serverless|event-driven|layered|hexagonal)\\s+(architecture|design|pattern)\\b",
                "\\b(explain|describe|what is)\\s+(microservices|event-driven|serverless|monolith)\\s+architecture\\b",
                "\\b(design|architect)\\s+(a|the)\\s+(system|application|service|platform)\\b",
                "\\b(distributed system|scalability|horizontal scaling|vertical scaling|high availability)\\b",
                "\\b(system design|system architecture)\\b",
                "\\b(database (design|schema|model)|schema design|data model|entity relationship)\\b",
                "\\b(what|which)\\s+.*\\b(database|schema|data model)\\b",
                "\\b(normalized|denormalized|star schema|snowflake schema)\\b",
                "\\b(api design|api architecture|rest design|graphql schema design)\\b",
                "\\b(how to|how)\\s+.*\\bdesign\\b.*\\b(api|endpoint|service)\\b",
                "\\b(design pattern|architectural pattern)\\s+(for|to|like)\\b",
                "\\b(high-level design|technical design)\\b",
                "\\b(message queue|pub/sub|event sourcing|cqrs)\\b"
        ));

        patterns.put(PromptCategory.DEVOPS, compile(
                "\\b(docker|dockerfile|container|containerize|containerization)\\b",
                "\\b(kubernetes|k8s|helm|kubectl|pod|deployment|service)\\b",
                "\\b(ci/cd|continuous integration|continuous deployment|continuous delivery)\\b",
                "\\b(pipeline|jenkins|github actions|gitlab ci|circleci|travis)\\b",
                "\\b(deploy|deployment|release|rollout)\\s+(to|on|via)\\b",
                "\\b(infrastructure as code|iac|terraform|cloudformation|pulumi)\\b",
                "\\b(provision|provisioning|infrastructure|cloud resources)\\b",
                "\\b(monitoring|observability|metrics|logging|tracing)\\b",
                "\\b(prometheus|grafana|datadog|new relic|cloudwatch)\\b",
                "\\b(alert|alerting|notification|incident|on-call)\\b",
                "\\b(ansible|puppet|chef|salt|configuration management)\\b"
        ));

        patterns.put(PromptCategory.DOCUMENTATION, compile(
                "\\b(write|create|update|generate|make|add)\\s+(a\\s+|the\\s+)?(documentation|docs|readme|guide|tutorial)\\b",
                "\\b(document|documenting)\\s+(this|the)\\s+(api|function|class|module|code)\\b",
                "\\b(api documentation|api docs|swagger|openapi)\\b",
                "\\b(generate|create|write)\\s+(api|swagger|openapi)\\s+docs?\\b",
                "\\b(user guide|developer guide|onboarding guide|runbook)\\b",
                "\\b(technical specification|design document|architecture document)\\b",
                "\\b(add|write|update)\\s+(comments|docstrings|jsdoc|javadoc)\\b"
        ));

        patterns.put(PromptCategory.GENERAL_QUESTION, compile(
                "^(what|who|when|where|why|how)\\s+(is|are|does|do|can|would|should)\\b",
                "\\b(explain|describe|tell me about|help me understand)\\b",
                "\\b(what's the difference between|how does|how do)\\b",
                "\\b(learn|learning|understand|understanding|concept|tutorial)\\b",
                "\\b(best way to|recommended way to|how should I)\\b"
        ));

        for (PromptCategory category : PRIORITY) {
            if (!patterns.containsKey(category) || patterns.get(category).isEmpty()) {
                throw new ConfigurationException("No classification patterns defined for " + category);
            }
        }
        PATTERNS = Collections.unmodifiableMap(patterns);

        KEYWORD_WEIGHTS = KeywordTable.<PromptCategory>builder("category-keywords")
                .add(PromptCategory.CODE_IMPLEMENTATION, "implement", 3)
                .add(PromptCategory.CODE_IMPLEMENTATION, "create", 3)
                .add(PromptCategory.CODE_IMPLEMENTATION, "add", 2)
                .add(PromptCategory.CODE_IMPLEMENTATION, "build", 3)
                .add(PromptCategory.CODE_IMPLEMENTATION, "write", 2)
                .add(PromptCategory.CODE_IMPLEMENTATION, "develop", 2)
                .add(PromptCategory.CODE_IMPLEMENTATION, "new", 2)
                .add(PromptCategory.CODE_IMPLEMENTATION, "make", 2)
                .add(PromptCategory.CODE_IMPLEMENTATION, "feature", 2)
                .add(PromptCategory.CODE_IMPLEMENTATION, "function", 1)
                .add(PromptCategory.CODE_IMPLEMENTATION, "component", 1)
                .add(PromptCategory.CODE_IMPLEMENTATION, "helper", 1)
                .add(PromptCategory.CODE_IMPLEMENTATION, "utility", 1)
                .add(PromptCategory.CODE_IMPLEMENTATION, "module", 1)

                .add(PromptCategory.CODE_DEBUGGING, "error", 3)
                .add(PromptCategory.CODE_DEBUGGING, "bug", 3)
                .add(PromptCategory.CODE_DEBUGGING, "fix", 3)
                .add(PromptCategory.CODE_DEBUGGING, "debug", 3)
                .add(PromptCategory.CODE_DEBUGGING, "broken", 2)
                .add(PromptCategory.CODE_DEBUGGING, "issue", 2)
                .add(PromptCategory.CODE_DEBUGGING, "problem", 2)
                .add(PromptCategory.CODE_DEBUGGING, "crash", 3)
                .add(PromptCategory.CODE_DEBUGGING, "exception", 2)
                .add(PromptCategory.CODE_DEBUGGING, "fails", 2)
                .add(PromptCategory.CODE_DEBUGGING, "wrong", 2)
                .add(PromptCategory.CODE_DEBUGGING, "incorrect", 2)
                .add(PromptCategory.CODE_DEBUGGING, "not working", 3)

                .add(PromptCategory.CODE_REVIEW, "review", 3)
                .add(PromptCategory.CODE_REVIEW, "feedback", 2)
                .add(PromptCategory.CODE_REVIEW, "check", 2)
                .add(PromptCategory.CODE_REVIEW, "validate", 2)
                .add(PromptCategory.CODE_REVIEW, "improve", 2)
                .add(PromptCategory.CODE_REVIEW, "optimize", 2)
                .add(PromptCategory.CODE_REVIEW, "refactor", 2)
                .add(PromptCategory.CODE_REVIEW, "best practice", 3)

                .add(PromptCategory.ARCHITECTURE, "architecture", 3)
                .add(PromptCategory.ARCHITECTURE, "design", 2)
                .add(PromptCategory.ARCHITECTURE, "pattern", 2)
                .add(PromptCategory.ARCHITECTURE, "scalability", 3)
                .add(PromptCategory.ARCHITECTURE, "system", 1)
                .add(PromptCategory.ARCHITECTURE, "microservices", 3)
                .add(PromptCategory.ARCHITECTURE, "distributed", 2)
                .add(PromptCategory.ARCHITECTURE, "database", 1)

                .add(PromptCategory.DEVOPS, "deploy", 3)
                .add(PromptCategory.DEVOPS, "deployment", 3)
                .add(PromptCategory.DEVOPS, "ci/cd", 3)
                .add(PromptCategory.DEVOPS, "pipeline", 2)
                .add(PromptCategory.DEVOPS, "docker", 3)
                .add(PromptCategory.DEVOPS, "kubernetes", 3)
                .add(PromptCategory.DEVOPS, "container", 2)
                .add(PromptCategory.DEVOPS, "infrastructure", 2)

                .add(PromptCategory.DOCUMENTATION, "document", 3)
                .add(PromptCategory.DOCUMENTATION, "readme", 3)
                .add(PromptCategory.DOCUMENTATION, "docs", 2)
                .add(PromptCategory.DOCUMENTATION, "comment", 2)
                .add(PromptCategory.DOCUMENTATION, "explain", 2)
                .add(PromptCategory.DOCUMENTATION, "describe", 2)
                .add(PromptCategory.DOCUMENTATION, "guide", 2)
                .add(PromptCategory.DOCUMENTATION, "tutorial", 2)

                .add(PromptCategory.LEGAL_BUSINESS, "legal", 3)
                .add(PromptCategory.LEGAL_BUSINESS, "privacy", 3)
                .add(PromptCategory.LEGAL_BUSINESS, "gdpr", 3)
                .add(PromptCategory.LEGAL_BUSINESS, "compliance", 3)
                .add(PromptCategory.LEGAL_BUSINESS, "license", 2)
                .add(PromptCategory.LEGAL_BUSINESS, "contract", 3)
                .add(PromptCategory.LEGAL_BUSINESS, "terms", 2)
                .add(PromptCategory.LEGAL_BUSINESS, "policy", 2)

                .add(PromptCategory.GENERAL_QUESTION, "what", 2)
                .add(PromptCategory.GENERAL_QUESTION, "why", 2)
                .add(PromptCategory.GENERAL_QUESTION, "how", 2)
                .add(PromptCategory.GENERAL_QUESTION, "explain", 2)
                .add(PromptCategory.GENERAL_QUESTION, "tell", 1)
                .add(PromptCategory.GENERAL_QUESTION, "understand", 1)
                .add(PromptCategory.GENERAL_QUESTION, "help", 1)
                .add(PromptCategory.GENERAL_QUESTION, "describe", 1)
                .build();
    }

    private ClassificationPatterns() {} // constants only

    private static List<Pattern> compile(String... regexes) {
        return Arrays.stream(regexes)
                .map(regex -> Pattern.compile(regex, Pattern.CASE_INSENSITIVE))
                .toList();
    }
}
