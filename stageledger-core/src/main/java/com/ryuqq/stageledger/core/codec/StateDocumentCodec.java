package com.ryuqq.stageledger.core.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.stageledger.core.exception.MalformedDocumentException;
import com.ryuqq.stageledger.core.model.StageName;
import com.ryuqq.stageledger.core.model.StageStatus;
import com.ryuqq.stageledger.core.model.StateDocument;

import java.io.IOException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Canonical JSON codec for {@link StateDocument}.
 *
 * <p>Encoding is compact with stage keys in sorted order:</p>
 * <pre>
 * {"version":"v1","stages":{"a":"completed","b":"started"}}
 * </pre>
 *
 * <p>Decoding is strict: anything that is not exactly this shape fails with
 * {@link MalformedDocumentException}. Pure functions, no I/O.</p>
 *
 * @author StageLedger Team
 * @since 1.0.0
 */
public final class StateDocumentCodec {

    static final String VERSION_FIELD = "version";
    static final String STAGES_FIELD = "stages";

    private static final ObjectMapper MAPPER = JsonMapper.builder()
        .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
        .enable(StreamReadFeature.STRICT_DUPLICATE_DETECTION)
        .build();

    private StateDocumentCodec() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Serializes a document.
     *
     * @param document the document to encode
     * @return UTF-8 JSON bytes
     * @throws IllegalArgumentException if document is null
     */
    public static byte[] encode(StateDocument document) {
        if (document == null) {
            throw new IllegalArgumentException("document cannot be null");
        }
        ObjectNode root = MAPPER.createObjectNode();
        root.put(VERSION_FIELD, document.version());
        ObjectNode stages = root.putObject(STAGES_FIELD);
        document.stages().forEach((name, status) -> stages.put(name.getValue(), status.wireValue()));
        try {
            return MAPPER.writeValueAsBytes(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize state document", e);
        }
    }

    /**
     * Parses a document.
     *
     * @param bytes raw document bytes
     * @return the decoded document
     * @throws MalformedDocumentException if the bytes are not a valid v1 state document
     */
    public static StateDocument decode(byte[] bytes) {
        if (bytes == null) {
            throw new MalformedDocumentException("State document is empty");
        }
        JsonNode root;
        try {
            root = MAPPER.readTree(bytes);
        } catch (IOException e) {
            throw new MalformedDocumentException("State document is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedDocumentException("State document must be a JSON object");
        }

        JsonNode version = root.get(VERSION_FIELD);
        if (version == null || !version.isTextual()) {
            throw new MalformedDocumentException("State document has no '" + VERSION_FIELD + "' string");
        }
        if (!StateDocument.SCHEMA_VERSION.equals(version.textValue())) {
            throw new MalformedDocumentException(
                String.format("Unsupported state document version: %s (expected %s)",
                    version.textValue(), StateDocument.SCHEMA_VERSION)
            );
        }

        JsonNode stages = root.get(STAGES_FIELD);
        if (stages == null || !stages.isObject()) {
            throw new MalformedDocumentException("State document has no '" + STAGES_FIELD + "' object");
        }

        Map<StageName, StageStatus> decoded = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = stages.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            decoded.put(decodeName(field.getKey()), decodeStatus(field.getKey(), field.getValue()));
        }
        return new StateDocument(StateDocument.SCHEMA_VERSION, decoded);
    }

    /**
     * Creates the document written on first initialization.
     *
     * @return {"version":"v1","stages":{}}
     */
    public static StateDocument newEmpty() {
        return StateDocument.empty();
    }

    private static StageName decodeName(String name) {
        try {
            return StageName.of(name);
        } catch (IllegalArgumentException e) {
            throw new MalformedDocumentException("Invalid stage name in state document: '" + name + "'", e);
        }
    }

    private static StageStatus decodeStatus(String name, JsonNode value) {
        if (!value.isTextual()) {
            throw new MalformedDocumentException("Status of stage '" + name + "' is not a string");
        }
        try {
            return StageStatus.fromWireValue(value.textValue());
        } catch (IllegalArgumentException e) {
            throw new MalformedDocumentException(
                "Invalid status '" + value.textValue() + "' for stage '" + name + "'", e);
        }
    }
}
