package com.entity.semantic.augment;

import com.entity.semantic.core.model.RecordNode;
import com.entity.semantic.core.model.SourceRecord;
import com.entity.semantic.embedding.EmbeddingException;
import com.entity.semantic.embedding.EmbeddingProvider;
import com.entity.semantic.embedding.EmbeddingResult;
import com.entity.semantic.extract.NameExtractor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Adds inline semantic features to a record for resolution engines that generate
 * semantic candidates themselves:
 * <ul>
 *   <li>{@code NAME_SEM_KEY_LABEL}: the canonical name</li>
 *   <li>{@code NAME_SEM_KEY_EMBEDDING}: the embedding as JSON array text</li>
 * </ul>
 * Records without a canonical name are returned unchanged.
 */
public class SemanticFeatureAugmenter {

    public static final String LABEL_FIELD = "NAME_SEM_KEY_LABEL";
    public static final String EMBEDDING_FIELD = "NAME_SEM_KEY_EMBEDDING";

    private final NameExtractor extractor;
    private final EmbeddingProvider embeddingProvider;
    private final ObjectMapper objectMapper;

    public SemanticFeatureAugmenter(NameExtractor extractor, EmbeddingProvider embeddingProvider) {
        this.extractor = extractor;
        this.embeddingProvider = embeddingProvider;
        this.objectMapper = new ObjectMapper();
    }

    /**
     * @throws EmbeddingException if the name cannot be embedded
     */
    public SourceRecord augment(SourceRecord record) {
        Optional<String> name = extractor.extract(record);
        if (name.isEmpty()) {
            return record;
        }
        EmbeddingResult result = embeddingProvider.embed(name.get());
        if (!result.isSuccess()) {
            throw new EmbeddingException("Cannot embed '" + name.get() + "': " + result.error(), result.retryable());
        }

        Map<String, RecordNode> fields = new LinkedHashMap<>(record.body().fields());
        fields.put(LABEL_FIELD, new RecordNode.ScalarNode(name.get()));
        fields.put(EMBEDDING_FIELD, new RecordNode.ScalarNode(writeJson(result.embedding().toArray())));
        return new SourceRecord(record.key(), new RecordNode.MapNode(fields));
    }

    /**
     * Serializes a record back to a JSON object, e.g. to hand it to the resolution engine.
     */
    public String toJson(SourceRecord record) {
        return writeJson(toPlain(record.body()));
    }

    private String writeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize record: " + e.getOriginalMessage(), e);
        }
    }

    private static Object toPlain(RecordNode node) {
        if (node instanceof RecordNode.MapNode map) {
            Map<String, Object> out = new LinkedHashMap<>();
            map.fields().forEach((key, value) -> out.put(key, toPlain(value)));
            return out;
        }
        if (node instanceof RecordNode.ListNode list) {
            List<Object> out = new ArrayList<>(list.items().size());
            list.items().forEach(item -> out.add(toPlain(item)));
            return out;
        }
        return ((RecordNode.ScalarNode) node).value();
    }
}
