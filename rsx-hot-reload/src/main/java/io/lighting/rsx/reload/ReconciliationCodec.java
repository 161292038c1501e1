package io.lighting.rsx.reload;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.lighting.rsx.diff.LiteralPatch;
import io.lighting.rsx.diff.SlotMapping;
import io.lighting.rsx.diff.Verdict;
import io.lighting.rsx.markup.SourcePosition;
import io.lighting.rsx.markup.SourceSpan;
import io.lighting.rsx.markup.TemplateKey;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JSON form of reconciliation records and hot-reload messages.
 * <p>
 * Objects are flat and tagged: a record carries {@code "verdict"} set to
 * {@code "hot_reloadable"} or {@code "needs_full_rebuild"}, a message carries
 * {@code "type"} set to {@code "update_template"}, {@code "update_asset"} or
 * {@code "shutdown"}. On a stream every message occupies one line.
 * <pre>{@code
 * {"type":"update_template","record":{"file":"src/View.java","line":12,"column":9,
 *   "verdict":"hot_reloadable","slotMapping":[{"newIndex":0,"oldIndex":0,"updatedExpression":"count + 1"}],
 *   "literalPatches":[]}}
 * }</pre>
 * Instances are thread-safe.
 */
public final class ReconciliationCodec {
    private static final Logger LOGGER = LoggerFactory.getLogger(ReconciliationCodec.class);

    static final String HOT_RELOADABLE = "hot_reloadable";
    static final String NEEDS_FULL_REBUILD = "needs_full_rebuild";
    static final String UPDATE_TEMPLATE = "update_template";
    static final String UPDATE_ASSET = "update_asset";
    static final String SHUTDOWN = "shutdown";

    private final ObjectMapper mapper;

    public ReconciliationCodec() {
        this(JsonMapper.builder().build());
    }

    public ReconciliationCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public String encode(ReconciliationRecord record) {
        return write(recordNode(record));
    }

    public String encode(HotReloadMessage message) {
        return write(messageNode(message));
    }

    /**
     * @throws IllegalArgumentException if the text is not a well-formed record
     */
    public ReconciliationRecord decodeRecord(String json) {
        return readRecord(parse(json));
    }

    /**
     * @throws IllegalArgumentException if the text is not a well-formed message
     */
    public HotReloadMessage decodeMessage(String json) {
        return readMessage(parse(json));
    }

    /**
     * Writes one message followed by a newline and flushes.
     */
    public void writeMessage(Writer out, HotReloadMessage message) throws IOException {
        Objects.requireNonNull(out, "out");
        out.write(encode(message));
        out.write('\n');
        out.flush();
    }

    /**
     * Reads newline-delimited messages until the end of the stream. Blank lines
     * are ignored; lines that cannot be decoded are logged and skipped.
     */
    public List<HotReloadMessage> readMessages(Reader in) throws IOException {
        Objects.requireNonNull(in, "in");
        BufferedReader reader = in instanceof BufferedReader buffered ? buffered : new BufferedReader(in);
        List<HotReloadMessage> messages = new ArrayList<>();
        String line;
        int lineNumber = 0;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            try {
                messages.add(decodeMessage(line));
            } catch (IllegalArgumentException ex) {
                LOGGER.warn("Ignoring hot-reload message on line {}: {}", lineNumber, ex.getMessage());
            }
        }
        return messages;
    }

    private ObjectNode messageNode(HotReloadMessage message) {
        Objects.requireNonNull(message, "message");
        ObjectNode node = mapper.createObjectNode();
        if (message instanceof HotReloadMessage.UpdateTemplate update) {
            node.put("type", UPDATE_TEMPLATE);
            node.set("record", recordNode(update.record()));
        } else if (message instanceof HotReloadMessage.UpdateAsset asset) {
            node.put("type", UPDATE_ASSET);
            node.put("path", asset.path());
        } else if (message instanceof HotReloadMessage.Shutdown) {
            node.put("type", SHUTDOWN);
        } else {
            throw new IllegalStateException("Unknown message: " + message.getClass().getName());
        }
        return node;
    }

    private ObjectNode recordNode(ReconciliationRecord record) {
        Objects.requireNonNull(record, "record");
        ObjectNode node = mapper.createObjectNode();
        TemplateKey key = record.templateKey();
        node.put("file", key.file());
        node.put("line", key.line());
        node.put("column", key.column());
        Verdict verdict = record.verdict();
        if (verdict instanceof Verdict.HotReloadable reloadable) {
            node.put("verdict", HOT_RELOADABLE);
            ArrayNode mapping = node.putArray("slotMapping");
            for (SlotMapping entry : reloadable.slotMapping()) {
                ObjectNode item = mapping.addObject();
                item.put("newIndex", entry.newIndex());
                item.put("oldIndex", entry.oldIndex());
                if (entry.isUpdated()) {
                    item.put("updatedExpression", entry.updatedExpression());
                }
            }
            ArrayNode patches = node.putArray("literalPatches");
            for (LiteralPatch patch : reloadable.literalPatches()) {
                ObjectNode item = patches.addObject();
                item.put("location", patch.location());
                item.put("oldText", patch.oldText());
                item.put("newText", patch.newText());
                item.set("span", spanNode(patch.span()));
            }
        } else {
            Verdict.NeedsFullRebuild rebuild = (Verdict.NeedsFullRebuild) verdict;
            node.put("verdict", NEEDS_FULL_REBUILD);
            node.put("reason", rebuild.reason());
            node.set("mismatchSpan", spanNode(rebuild.mismatchSpan()));
        }
        return node;
    }

    private ObjectNode spanNode(SourceSpan span) {
        ObjectNode node = mapper.createObjectNode();
        node.put("file", span.file());
        node.set("start", positionNode(span.start()));
        node.set("end", positionNode(span.end()));
        return node;
    }

    private ObjectNode positionNode(SourcePosition position) {
        ObjectNode node = mapper.createObjectNode();
        node.put("line", position.line());
        node.put("column", position.column());
        node.put("offset", position.offset());
        return node;
    }

    private HotReloadMessage readMessage(JsonNode node) {
        String type = text(node, "type");
        switch (type) {
            case UPDATE_TEMPLATE:
                return new HotReloadMessage.UpdateTemplate(readRecord(required(node, "record")));
            case UPDATE_ASSET:
                return new HotReloadMessage.UpdateAsset(text(node, "path"));
            case SHUTDOWN:
                return new HotReloadMessage.Shutdown();
            default:
                throw new IllegalArgumentException("Unknown message type: " + type);
        }
    }

    private ReconciliationRecord readRecord(JsonNode node) {
        TemplateKey key = new TemplateKey(text(node, "file"), integer(node, "line"), integer(node, "column"));
        String verdict = text(node, "verdict");
        if (HOT_RELOADABLE.equals(verdict)) {
            List<SlotMapping> mapping = new ArrayList<>();
            for (JsonNode item : array(node, "slotMapping")) {
                JsonNode updated = item.get("updatedExpression");
                mapping.add(new SlotMapping(
                    integer(item, "newIndex"),
                    integer(item, "oldIndex"),
                    updated == null || updated.isNull() ? null : updated.asText()
                ));
            }
            List<LiteralPatch> patches = new ArrayList<>();
            for (JsonNode item : array(node, "literalPatches")) {
                patches.add(new LiteralPatch(
                    text(item, "location"),
                    text(item, "oldText"),
                    text(item, "newText"),
                    readSpan(required(item, "span"))
                ));
            }
            return new ReconciliationRecord(key, new Verdict.HotReloadable(mapping, patches));
        }
        if (NEEDS_FULL_REBUILD.equals(verdict)) {
            return ReconciliationRecord.rebuild(key, text(node, "reason"), readSpan(required(node, "mismatchSpan")));
        }
        throw new IllegalArgumentException("Unknown verdict: " + verdict);
    }

    private SourceSpan readSpan(JsonNode node) {
        return new SourceSpan(
            text(node, "file"),
            readPosition(required(node, "start")),
            readPosition(required(node, "end"))
        );
    }

    private SourcePosition readPosition(JsonNode node) {
        return new SourcePosition(integer(node, "line"), integer(node, "column"), integer(node, "offset"));
    }

    private JsonNode parse(String json) {
        Objects.requireNonNull(json, "json");
        try {
            JsonNode node = mapper.readTree(json);
            if (node == null || !node.isObject()) {
                throw new IllegalArgumentException("Expected a JSON object");
            }
            return node;
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Malformed JSON: " + ex.getOriginalMessage(), ex);
        }
    }

    private String write(JsonNode node) {
        try {
            return mapper.writeValueAsString(node);
        } catch (JsonProcessingException ex) {
            throw new UncheckedIOException(ex);
        }
    }

    private static JsonNode required(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new IllegalArgumentException("Missing field '" + field + "'");
        }
        return value;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = required(node, field);
        if (!value.isTextual()) {
            throw new IllegalArgumentException("Field '" + field + "' must be a string");
        }
        return value.asText();
    }

    private static int integer(JsonNode node, String field) {
        JsonNode value = required(node, field);
        if (!value.canConvertToInt() || !value.isIntegralNumber()) {
            throw new IllegalArgumentException("Field '" + field + "' must be an integer");
        }
        return value.intValue();
    }

    private static JsonNode array(JsonNode node, String field) {
        JsonNode value = required(node, field);
        if (!value.isArray()) {
            throw new IllegalArgumentException("Field '" + field + "' must be an array");
        }
        return value;
    }
}
