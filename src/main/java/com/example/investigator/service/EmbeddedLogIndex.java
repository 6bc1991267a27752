package com.example.investigator.service;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.apache.lucene.analysis.core.WhitespaceAnalyzer;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.document.TextField;
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.IndexReader;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.StoredFields;
import org.apache.lucene.queryparser.classic.ParseException;
import org.apache.lucene.queryparser.classic.QueryParser;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.store.ByteBuffersDirectory;
import org.apache.lucene.store.Directory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * In-memory log index backing the {@code search_logs} tool. Fields: {@code service}, {@code level},
 * {@code status_code}, {@code message} (default search field) and stored {@code trace_id}.
 */
@Service
public class EmbeddedLogIndex {

    public static final Set<String> SCENARIOS =
            Set.of("healthy", "pod-crashloop", "dns-failure", "auth-failure", "db-timeout");

    private static final Logger log = LoggerFactory.getLogger(EmbeddedLogIndex.class);
    private final Directory memoryIndex = new ByteBuffersDirectory();
    private final WhitespaceAnalyzer analyzer = new WhitespaceAnalyzer();
    private volatile String scenario = "none";

    public record SearchResult(
            String query, long matchCount, List<String> traceIds, List<String> messages) {

        public String render() {
            StringBuilder sb = new StringBuilder();
            sb.append("Found ").append(matchCount).append(" matches for query: ").append(query);
            for (int i = 0; i < messages.size(); i++) {
                sb.append('\n').append(traceIds.get(i)).append(": ").append(messages.get(i));
            }
            return sb.toString();
        }
    }

    @PostConstruct
    public void init() {
        loadScenario("healthy");
    }

    public String currentScenario() {
        return scenario;
    }

    /** Wipes the index and reseeds it with the named scenario. */
    public synchronized void loadScenario(String scenarioName) {
        String name = scenarioName.toLowerCase(Locale.ROOT).trim();
        if (!SCENARIOS.contains(name)) {
            throw new IllegalArgumentException(
                    "Unknown log scenario '" + scenarioName + "', expected one of " + SCENARIOS);
        }
        log.info(">>> SIMULATION: Switching log index to scenario '{}'", name);
        try (IndexWriter writer = new IndexWriter(memoryIndex, new IndexWriterConfig(analyzer))) {
            writer.deleteAll();
            switch (name) {
                case "healthy" -> seedHealthy(writer);
                case "pod-crashloop" -> seedPodCrashLoop(writer);
                case "dns-failure" -> seedDnsFailure(writer);
                case "auth-failure" -> seedAuthFailure(writer);
                case "db-timeout" -> seedDbTimeout(writer);
                default -> throw new IllegalStateException("unreachable scenario " + name);
            }
            writer.commit();
            scenario = name;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load log scenario " + name, e);
        }
    }

    // --- Scenario data ---

    private void seedHealthy(IndexWriter w) throws IOException {
        addLog(w, "checkout", "INFO", "200", "ok-1", "Order placed successfully");
        addLog(w, "inventory", "INFO", "200", "ok-2", "Stock level updated");
        addLog(w, "api-gateway", "INFO", "200", "ok-3", "Routed request to checkout in 12ms");
    }

    private void seedPodCrashLoop(IndexWriter w) throws IOException {
        for (int i = 0; i < 12; i++) {
            addLog(
                    w,
                    "checkout",
                    "ERROR",
                    "500",
                    "oom-" + i,
                    "OOMKilled: container checkout exceeded memory limit 512Mi");
        }
        addLog(w, "checkout", "WARN", "503", "backoff-1", "Back-off restarting failed container");
    }

    private void seedDnsFailure(IndexWriter w) throws IOException {
        for (int i = 0; i < 8; i++) {
            addLog(
                    w,
                    "api-gateway",
                    "ERROR",
                    "502",
                    "dns-" + i,
                    "upstream connect error: lookup checkout.prod.svc: no such host");
        }
    }

    private void seedAuthFailure(IndexWriter w) throws IOException {
        for (int i = 0; i < 6; i++) {
            addLog(
                    w,
                    "auth-proxy",
                    "WARN",
                    "401",
                    "auth-" + i,
                    "Token validation failed: signature expired for client billing-worker");
        }
    }

    private void seedDbTimeout(IndexWriter w) throws IOException {
        for (int i = 0; i < 15; i++) {
            addLog(
                    w,
                    "inventory",
                    "ERROR",
                    "500",
                    "db-" + i,
                    "HikariPool-1 - Connection is not available, request timed out after 30000ms");
        }
    }

    private void addLog(
            IndexWriter w, String service, String level, String status, String traceId, String message)
            throws IOException {
        Document doc = new Document();
        doc.add(new StringField("service", service, Field.Store.YES));
        doc.add(new StringField("level", level, Field.Store.YES));
        doc.add(new TextField("status_code", status, Field.Store.YES));
        doc.add(new TextField("message", message, Field.Store.YES));
        doc.add(new StoredField("trace_id", traceId));
        w.addDocument(doc);
    }

    /**
     * Runs a Lucene query-parser query.
     *
     * @throws IllegalArgumentException if the query does not parse
     */
    public SearchResult search(String queryString, int limit) {
        Query query;
        try {
            query = new QueryParser("message", analyzer).parse(queryString);
        } catch (ParseException e) {
            throw new IllegalArgumentException("Invalid log query [" + queryString + "]", e);
        }

        // fresh reader per search so scenario switches are visible immediately
        try (IndexReader reader = DirectoryReader.open(memoryIndex)) {
            IndexSearcher searcher = new IndexSearcher(reader);
            TopDocs docs = searcher.search(query, limit);
            StoredFields storedFields = searcher.storedFields();

            List<String> traceIds = new ArrayList<>();
            List<String> messages = new ArrayList<>();
            for (ScoreDoc scoreDoc : docs.scoreDocs) {
                Document d = storedFields.document(scoreDoc.doc);
                traceIds.add(d.get("trace_id"));
                messages.add(d.get("level") + " " + d.get("service") + " " + d.get("message"));
            }
            return new SearchResult(queryString, docs.totalHits.value, traceIds, messages);
        } catch (IOException e) {
            throw new IllegalStateException("Log search failed", e);
        }
    }
}
