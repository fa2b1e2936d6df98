package com.dcruver.litsync.config;

import com.dcruver.litsync.app.SyncService;
import com.dcruver.litsync.extract.PdfBoxTextExtractor;
import com.dcruver.litsync.extract.TextExtractor;
import com.dcruver.litsync.io.DocumentStore;
import com.dcruver.litsync.io.VaultBackupWriter;
import com.dcruver.litsync.io.VaultDocumentStore;
import com.dcruver.litsync.library.LibraryClient;
import com.dcruver.litsync.library.ZoteroSqliteLibraryClient;
import com.dcruver.litsync.nlp.OllamaSummarizer;
import com.dcruver.litsync.nlp.RateLimitedCaller;
import com.dcruver.litsync.nlp.ResponseCache;
import com.dcruver.litsync.nlp.RetryPolicy;
import com.dcruver.litsync.nlp.Sleeper;
import com.dcruver.litsync.nlp.Summarizer;
import com.dcruver.litsync.nlp.SummaryRequest;
import com.dcruver.litsync.nlp.SummaryResponse;
import com.dcruver.litsync.pipeline.BatchPipeline;
import com.dcruver.litsync.pipeline.ItemProcessor;
import com.dcruver.litsync.reconcile.Differ;
import com.dcruver.litsync.reconcile.PlanFile;
import com.dcruver.litsync.reconcile.ReconciliationExecutor;
import com.dcruver.litsync.render.MarkdownNoteRenderer;
import com.dcruver.litsync.render.NoteRenderer;
import com.dcruver.litsync.reporting.AuditLogWriter;
import com.dcruver.litsync.state.CheckpointStore;
import com.dcruver.litsync.state.DoneRecord;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.time.Clock;

/**
 * Wires the sync components from {@link SyncProperties}.
 */
@Configuration
public class SyncConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public LibraryClient libraryClient(NamedParameterJdbcTemplate zoteroJdbcTemplate, SyncProperties properties) {
        return new ZoteroSqliteLibraryClient(zoteroJdbcTemplate, properties.zoteroDir(), properties.getItemTypes());
    }

    @Bean
    public DocumentStore documentStore(SyncProperties properties) {
        return new VaultDocumentStore(properties.vaultDir(), properties.getArchiveFolder(), properties.getImageFolder());
    }

    @Bean
    public DoneRecord doneRecord(SyncProperties properties) {
        return new DoneRecord(properties.stateDirPath().resolve("done.txt"));
    }

    @Bean
    public CheckpointStore checkpointStore(SyncProperties properties) {
        return new CheckpointStore(properties.stateDirPath().resolve("checkpoint.json"));
    }

    @Bean
    public AuditLogWriter auditLogWriter(SyncProperties properties, Clock clock) {
        return new AuditLogWriter(properties.stateDirPath().resolve("logs"), clock);
    }

    @Bean
    public ResponseCache responseCache(SyncProperties properties, Clock clock) {
        return new ResponseCache(properties.stateDirPath().resolve("cache").resolve("summary-cache.json"),
            properties.getCacheFreshness(), clock);
    }

    @Bean
    public Differ differ() {
        return new Differ();
    }

    @Bean
    public ReconciliationExecutor reconciliationExecutor(DocumentStore documentStore, AuditLogWriter auditLogWriter,
                                                         SyncProperties properties, Clock clock) {
        return new ReconciliationExecutor(documentStore, new VaultBackupWriter(properties.backupDirPath(), clock),
            auditLogWriter, clock, properties.getArchiveFolder(), properties.stateDirPath());
    }

    @Bean
    public PlanFile planFile(DocumentStore documentStore, Clock clock) {
        return new PlanFile(documentStore.getRoot(), clock);
    }

    @Bean
    public TextExtractor textExtractor(SyncProperties properties) {
        return new PdfBoxTextExtractor(properties.getSummarizer().getMaxImages());
    }

    @Bean
    public NoteRenderer noteRenderer() {
        return new MarkdownNoteRenderer();
    }

    @Bean
    public Summarizer summarizer(ChatModel chatModel, SyncProperties properties,
                                 @Value("${spring.ai.ollama.chat.options.model:gpt-oss:20b}") String modelName) {
        return new OllamaSummarizer(chatModel, modelName, properties.getSummarizer().getMaxTextLength());
    }

    @Bean
    public RateLimitedCaller<SummaryRequest, SummaryResponse> summaryCaller(Summarizer summarizer,
                                                                           ResponseCache responseCache,
                                                                           SyncProperties properties) {
        return new RateLimitedCaller<>(summarizer.cacheNamespace(), summarizer, SummaryResponse.class,
            responseCache, RetryPolicy.from(properties.getRetry()), Sleeper.SYSTEM);
    }

    @Bean
    public ItemProcessor itemProcessor(LibraryClient libraryClient, TextExtractor textExtractor,
                                       RateLimitedCaller<SummaryRequest, SummaryResponse> summaryCaller,
                                       NoteRenderer noteRenderer, DocumentStore documentStore,
                                       SyncProperties properties, Clock clock) {
        return new ItemProcessor(libraryClient, textExtractor, summaryCaller, noteRenderer, documentStore, clock,
            properties.getSummarizer().getLanguage(), properties.getImageFolder());
    }

    @Bean
    public BatchPipeline batchPipeline(ItemProcessor itemProcessor, DoneRecord doneRecord,
                                       CheckpointStore checkpointStore, AuditLogWriter auditLogWriter, Clock clock) {
        return new BatchPipeline(itemProcessor, doneRecord, checkpointStore, auditLogWriter, clock);
    }

    @Bean
    public SyncService syncService(LibraryClient libraryClient, DocumentStore documentStore, Differ differ,
                                   ReconciliationExecutor reconciliationExecutor, BatchPipeline batchPipeline,
                                   ResponseCache responseCache, PlanFile planFile, SyncProperties properties) {
        return new SyncService(libraryClient, documentStore, differ, reconciliationExecutor, batchPipeline,
            responseCache, planFile, properties.stateDirPath());
    }
}
