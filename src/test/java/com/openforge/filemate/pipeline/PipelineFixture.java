package com.openforge.filemate.pipeline;

import com.openforge.filemate.archive.ArchiveMover;
import com.openforge.filemate.archive.ArchiveProperties;
import com.openforge.filemate.archive.ArchiveScanner;
import com.openforge.filemate.archive.ArchiveStructureReporter;
import com.openforge.filemate.catalog.DefaultRuleCatalog;
import com.openforge.filemate.catalog.GenericRuleTable;
import com.openforge.filemate.catalog.RuleCatalog;
import com.openforge.filemate.classify.FolderResolutionEngine;
import com.openforge.filemate.date.DateProperties;
import com.openforge.filemate.date.DateResolver;
import com.openforge.filemate.document.DocumentReaders;
import com.openforge.filemate.document.TextDocumentReader;
import com.openforge.filemate.naming.FilenameBuilder;
import com.openforge.filemate.naming.NamingProperties;
import com.openforge.filemate.naming.VersionResolver;
import com.openforge.filemate.oracle.OracleAdapter;
import com.openforge.filemate.oracle.OracleProperties;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

/** Real pipeline components over a temporary archive, text files only. */
final class PipelineFixture {

    static final Clock CLOCK = Clock.fixed(Instant.parse("2024-06-01T10:15:30Z"), ZoneOffset.UTC);

    final Path            root;
    final Path            inbox;
    final DocumentReaders readers;
    final DocumentPipeline pipeline;

    PipelineFixture(Path root, Path inbox, OracleAdapter oracle) {
        this.root  = root.toAbsolutePath().normalize();
        this.inbox = inbox.toAbsolutePath().normalize();

        ArchiveProperties archive = ArchiveProperties.of(this.root, this.inbox);
        NamingProperties  naming  = NamingProperties.defaults();
        RuleCatalog       rules   = DefaultRuleCatalog.create();
        ArchiveScanner    scanner = new ArchiveScanner(archive);

        this.readers  = new DocumentReaders(List.of(new TextDocumentReader()), CLOCK);
        this.pipeline = new DocumentPipeline(
                readers,
                new SubjectExtractor(oracle, naming),
                new DateResolver(DateProperties.defaults(), CLOCK),
                scanner,
                new FolderResolutionEngine(rules, GenericRuleTable.standard(), naming),
                new VersionResolver(naming),
                new FilenameBuilder(naming),
                new ArchiveMover(archive, CLOCK),
                new ArchiveStructureReporter(scanner, rules, archive, CLOCK),
                oracle,
                ProcessingProperties.defaults(),
                OracleProperties.defaults());
    }
}
