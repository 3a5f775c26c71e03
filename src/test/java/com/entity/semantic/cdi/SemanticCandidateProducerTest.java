package com.entity.semantic.cdi;

import com.entity.semantic.api.SemanticCandidateService;
import com.entity.semantic.core.model.RecordKey;
import com.entity.semantic.core.model.SourceRecord;
import com.entity.semantic.embedding.CharacterNGramEmbeddingModel;
import com.entity.semantic.embedding.EmbeddingModel;
import com.entity.semantic.embedding.OllamaEmbeddingModel;
import com.entity.semantic.pipeline.IngestionStatus;
import com.entity.semantic.store.InMemoryDurableStore;
import com.entity.semantic.store.JsonLinesDurableStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SemanticCandidateProducer Tests")
class SemanticCandidateProducerTest {

    private SemanticCandidateProducer producer;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        producer = new SemanticCandidateProducer();
        producer.embeddingProvider = "ngram";
        producer.dimension = 64;
        producer.ollamaBaseUrl = "http://localhost:11434";
        producer.ollamaModel = "all-minilm";
        producer.ollamaTimeoutSeconds = 5;
        producer.batchSize = 16;
        producer.embeddingThreads = 2;
        producer.maxRetries = 1;
        producer.cacheEnabled = true;
        producer.cacheMaxSize = 100;
        producer.cacheTtlSeconds = 60;
        producer.m = 16;
        producer.efConstruction = 200;
        producer.efSearch = 100;
        producer.threshold = 0.75;
        producer.limit = 10;
        producer.queryTimeoutMillis = 5000;
        producer.workerThreads = 2;
        producer.storeType = "none";
        producer.storePath = Optional.empty();
    }

    @Nested
    @DisplayName("Embedding model")
    class EmbeddingModelTests {

        @Test
        @DisplayName("ngram provider should produce the character n-gram model")
        void ngram() {
            EmbeddingModel model = producer.createEmbeddingModel();
            assertInstanceOf(CharacterNGramEmbeddingModel.class, model);
            assertEquals(64, model.dimension());
        }

        @Test
        @DisplayName("Unknown provider should fall back to character n-grams")
        void unknown() {
            producer.embeddingProvider = "word2vec";
            assertInstanceOf(CharacterNGramEmbeddingModel.class, producer.createEmbeddingModel());
        }

        @Test
        @DisplayName("ollama provider should produce the Ollama client")
        void ollama() {
            producer.embeddingProvider = "OLLAMA";
            EmbeddingModel model = producer.createEmbeddingModel();
            assertInstanceOf(OllamaEmbeddingModel.class, model);
            assertEquals(64, model.dimension());
        }
    }

    @Nested
    @DisplayName("Durable store")
    class DurableStoreTests {

        @Test
        @DisplayName("none should produce no store")
        void none() {
            assertNull(producer.createDurableStore());
        }

        @Test
        @DisplayName("memory should produce an in-memory store")
        void memory() {
            producer.storeType = "memory";
            assertInstanceOf(InMemoryDurableStore.class, producer.createDurableStore());
        }

        @Test
        @DisplayName("jsonl without a path should be rejected")
        void jsonlWithoutPath() {
            producer.storeType = "jsonl";
            assertThrows(IllegalStateException.class, () -> producer.createDurableStore());
        }

        @Test
        @DisplayName("jsonl with a path should produce a file store")
        void jsonl() {
            producer.storeType = "jsonl";
            producer.storePath = Optional.of(tempDir.resolve("index.jsonl").toString());
            assertInstanceOf(JsonLinesDurableStore.class, producer.createDurableStore());
        }
    }

    @Test
    @DisplayName("Produced service should be usable and expose its index")
    void producesService() {
        producer.storeType = "memory";
        SemanticCandidateService service = producer.semanticCandidateService();
        try {
            assertEquals(64, producer.vectorIndex(service).dimension());
            assertTrue(service.getDurableStore().isPresent());

            SourceRecord record = SourceRecord.of(RecordKey.of("CUSTOMERS", "1"),
                    Map.of("NAME_FULL", "Robert Johnson"));
            assertEquals(IngestionStatus.INDEXED, service.ingest(record).status());
            assertEquals(1, producer.vectorIndex(service).size());
        } finally {
            producer.closeService(service);
        }
    }
}
