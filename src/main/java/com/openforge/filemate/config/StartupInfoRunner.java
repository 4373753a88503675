package com.openforge.filemate.config;

import com.openforge.filemate.archive.ArchiveProperties;
import com.openforge.filemate.catalog.RuleCatalog;
import com.openforge.filemate.catalog.RulesProperties;
import com.openforge.filemate.date.DateProperties;
import com.openforge.filemate.llm.LlmProperties;
import com.openforge.filemate.naming.NamingProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Prints a structured startup summary once the context is ready, before any
 * document is touched.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
@RequiredArgsConstructor
public class StartupInfoRunner implements ApplicationRunner {

    private final ArchiveProperties archive;
    private final NamingProperties  naming;
    private final DateProperties    dates;
    private final RulesProperties   rulesProperties;
    private final RuleCatalog       rules;
    private final LlmProperties     llm;

    @Override
    public void run(ApplicationArguments args) {
        log.info("""

                ╔══════════════════════════════════════════════════════════╗
                ║              filemate  —  Startup Summary                ║
                ╠══════════════════════════════════════════════════════════╣
                ║  Archive                                                 ║
                ║    Root           : {}
                ║    Inbox          : {}
                ║    structure.md   : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Rules                                                   ║
                ║    File           : {}
                ║    Categories     : {}  fallback folders={}
                ║    Threshold      : {}  new folders={}
                ╠══════════════════════════════════════════════════════════╣
                ║  Naming                                                  ║
                ║    Version        : {}  initial={}
                ║    Date format    : {}  max length={}
                ╠══════════════════════════════════════════════════════════╣
                ║  LLM Oracle                                              ║
                ║    Enabled        : {}
                ║    Primary        : {}
                ║    Fallback       : {}
                ╚══════════════════════════════════════════════════════════╝
                """,
                archive.rootPath(),
                archive.inboxPath(),
                archive.structureReport() ? "✔ maintained" : "✘ off",

                rulesProperties.location(),
                rules.size(), rules.fallbackFolders().size(),
                rules.strategy().semanticThreshold(), rules.strategy().allowNewFolders(),

                naming.versionFormat(), naming.initialTag(),
                dates.format(), naming.maxLength(),

                llm.enabled() && llm.primaryConfigured() ? "✔ yes" : "✘ no (rules only)",
                describe(llm.primary()),
                describe(llm.fallback())
        );
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private static String describe(LlmProperties.ProviderConfig provider) {
        if (provider == null || !provider.isConfigured()) {
            return "(not configured)";
        }
        return "%s  [%s]  key=%s".formatted(provider.name(), provider.model(), maskKey(provider.apiKey()));
    }

    /**
     * Masks an API key: shows first 6 chars + "..." + last 4 chars.
     */
    static String maskKey(String key) {
        if (key == null || key.isBlank()) {
            return "(not set)";
        }
        if (key.length() <= 10) return "***";
        return key.substring(0, 6) + "..." + key.substring(key.length() - 4);
    }
}
