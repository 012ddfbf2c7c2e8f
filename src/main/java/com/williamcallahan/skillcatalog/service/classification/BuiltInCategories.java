package com.williamcallahan.skillcatalog.service.classification;

import com.williamcallahan.skillcatalog.domain.classification.CategoryDefinition;
import java.util.List;

/**
 * The fixed part of the category vocabulary. Custom categories suggested during AI
 * classification are added from the relational store at runtime.
 */
final class BuiltInCategories {

    /** Catch-all category used when nothing else matches. */
    static final String FALLBACK_SLUG = "productivity";

    static final List<CategoryDefinition> ALL = List.of(
            // Development
            category("code-generation", "Code Generation", "Generate code, boilerplate, scaffolding",
                    "generate", "scaffold", "boilerplate", "template", "create", "init", "new"),
            category("refactoring", "Refactoring", "Code restructuring and optimization",
                    "refactor", "restructure", "optimize", "clean", "improve", "modernize"),
            category("debugging", "Debugging", "Find and fix bugs, error analysis",
                    "debug", "fix", "error", "bug", "trace", "diagnose", "troubleshoot"),
            category("testing", "Testing", "Unit tests, integration tests, test automation",
                    "test", "unit", "integration", "e2e", "spec", "coverage", "mock", "jest", "vitest"),
            category("code-review", "Code Review", "Automated code review and analysis",
                    "review", "analyze", "lint", "check", "inspect", "audit", "pr"),
            category("git", "Git & VCS", "Git operations, commit helpers, branch management",
                    "git", "commit", "branch", "merge", "rebase", "version control", "changelog", "github", "gitlab"),
            // Backend
            category("api", "API Dev", "API design, REST, GraphQL",
                    "api", "rest", "graphql", "openapi", "swagger", "endpoint", "http", "grpc"),
            category("database", "Database", "Database management and queries",
                    "database", "sql", "query", "migration", "schema", "orm", "prisma", "drizzle", "postgres",
                    "mysql", "mongodb"),
            category("auth", "Auth", "Authentication and authorization",
                    "auth", "authentication", "authorization", "oauth", "jwt", "session", "login", "signup"),
            category("caching", "Caching", "Caching strategies and implementation",
                    "cache", "redis", "memcached", "cdn", "invalidation"),
            // Frontend
            category("ui-components", "UI Components", "UI component generation and styling",
                    "ui", "component", "css", "style", "design", "tailwind", "react", "vue", "svelte", "html"),
            category("accessibility", "Accessibility", "Accessibility testing and improvements",
                    "a11y", "accessibility", "aria", "wcag", "screen reader"),
            category("animation", "Animation", "UI animations and transitions",
                    "animation", "transition", "motion", "framer", "gsap", "css animation"),
            category("responsive", "Responsive", "Responsive design and mobile-first",
                    "responsive", "mobile", "breakpoint", "media query", "adaptive"),
            // DevOps and infrastructure
            category("ci-cd", "CI/CD", "Continuous integration and deployment",
                    "ci", "cd", "pipeline", "deploy", "github actions", "jenkins", "circleci"),
            category("docker", "Docker", "Containerization and Docker",
                    "docker", "container", "dockerfile", "compose", "image"),
            category("kubernetes", "Kubernetes", "Kubernetes orchestration",
                    "kubernetes", "k8s", "helm", "pod", "deployment", "service"),
            category("cloud", "Cloud", "Cloud services and infrastructure",
                    "aws", "gcp", "azure", "cloudflare", "vercel", "netlify", "terraform", "pulumi"),
            category("monitoring", "Monitoring", "Logging, metrics, and observability",
                    "monitor", "log", "trace", "metric", "alert", "observability", "datadog", "grafana"),
            // Quality and security
            category("security", "Security", "Security scanning and vulnerability detection",
                    "security", "vulnerability", "scan", "audit", "owasp", "penetration", "xss", "sql injection"),
            category("performance", "Performance", "Performance profiling and optimization",
                    "performance", "optimize", "profile", "benchmark", "speed", "memory", "lighthouse"),
            category("linting", "Linting", "Code linting and formatting",
                    "lint", "eslint", "prettier", "format", "style", "biome"),
            category("types", "Types", "Type checking and type generation",
                    "typescript", "type", "typing", "zod", "schema", "validation"),
            // Documentation
            category("documentation", "Docs Gen", "Generate and maintain documentation",
                    "doc", "readme", "api", "comment", "jsdoc", "typedoc", "swagger", "markdown"),
            category("comments", "Comments", "Code comments and annotations",
                    "comment", "annotation", "docstring", "explain"),
            category("i18n", "i18n", "Localization and translation",
                    "i18n", "l10n", "translate", "locale", "language", "internationalization"),
            // Data
            category("data-processing", "Processing", "Data transformation and parsing",
                    "data", "transform", "parse", "json", "csv", "xml", "format", "etl"),
            category("analytics", "Analytics", "Data analysis and visualization",
                    "analytics", "chart", "graph", "visualization", "dashboard", "report"),
            category("scraping", "Scraping", "Web scraping and data extraction",
                    "scrape", "crawl", "extract", "puppeteer", "playwright", "cheerio"),
            category("math", "Math", "Mathematical computations, formulas, statistics",
                    "math", "mathematics", "calculation", "formula", "statistics", "algebra", "calculus",
                    "geometry", "numerical"),
            // AI and ML
            category("prompts", "Prompts", "Prompt engineering and templates",
                    "prompt", "llm", "gpt", "claude", "chatgpt", "template", "system prompt"),
            category("embeddings", "Embeddings", "Vector embeddings and similarity",
                    "embedding", "vector", "similarity", "rag", "semantic", "search"),
            category("agents", "Agents", "AI agents and automation",
                    "agent", "autonomous", "chain", "langchain", "workflow"),
            category("ml-ops", "ML Ops", "Machine learning operations",
                    "mlops", "model", "training", "inference", "pipeline", "jupyter"),
            // Productivity
            category(FALLBACK_SLUG, "Productivity", "General productivity and workflow helpers",
                    "productivity", "efficiency", "organize", "focus", "notes"),
            category("automation", "Automation", "Task automation and scripting",
                    "automate", "script", "task", "workflow", "batch", "cron", "schedule"),
            category("file-ops", "File Ops", "File manipulation and management",
                    "file", "directory", "folder", "copy", "move", "rename", "search", "glob"),
            category("cli", "CLI Tools", "Command line utilities",
                    "cli", "terminal", "shell", "bash", "command", "script"),
            category("templates", "Templates", "Project and code templates",
                    "template", "starter", "boilerplate", "scaffold", "cookiecutter"),
            // Content
            category("writing", "Writing", "Content writing and editing",
                    "write", "content", "blog", "article", "copy", "edit", "proofread"),
            category("email", "Email", "Email composition and templates",
                    "email", "mail", "newsletter", "template", "outreach"),
            category("social", "Social", "Social media content",
                    "social", "twitter", "linkedin", "post", "thread", "hashtag"),
            category("seo", "SEO", "Search engine optimization",
                    "seo", "meta", "keyword", "search", "ranking", "sitemap"),
            // Lifestyle
            category("finance", "Finance", "Personal finance, budgeting, financial tools",
                    "finance", "budget", "money", "investment", "expense", "accounting", "tax", "banking"),
            category("web3-crypto", "Web3 & Crypto", "Blockchain, cryptocurrency, Web3 development",
                    "web3", "crypto", "blockchain", "ethereum", "solidity", "nft", "defi", "wallet",
                    "smart contract"),
            category("legal", "Legal", "Legal document generation and compliance",
                    "legal", "law", "contract", "compliance", "policy", "terms", "license", "agreement"),
            category("academic", "Academic", "Academic writing, research, citations",
                    "academic", "research", "paper", "citation", "thesis", "dissertation", "bibliography",
                    "scholarly"),
            category("game-dev", "Game Dev", "Game development and game engine tools",
                    "game", "gaming", "unity", "unreal", "godot", "gamedev", "sprite", "physics", "level design"));

    private BuiltInCategories() {}

    private static CategoryDefinition category(String slug, String name, String description, String... keywords) {
        return new CategoryDefinition(slug, name, description, List.of(keywords));
    }
}
