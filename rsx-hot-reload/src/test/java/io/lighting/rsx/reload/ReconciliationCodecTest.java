package io.lighting.rsx.reload;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.json.JsonMapper;
import io.lighting.rsx.diff.LiteralPatch;
import io.lighting.rsx.diff.SlotMapping;
import io.lighting.rsx.diff.Verdict;
import io.lighting.rsx.markup.SourcePosition;
import io.lighting.rsx.markup.SourceSpan;
import io.lighting.rsx.markup.TemplateKey;
import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.List;
import org.junit.jupiter.api.Test;

class ReconciliationCodecTest {

    private static final TemplateKey KEY = new TemplateKey("src/View.java", 12, 9);
    private static final SourceSpan SPAN = new SourceSpan(
        "src/View.java",
        new SourcePosition(13, 5, 20),
        new SourcePosition(13, 12, 27)
    );

    private final ReconciliationCodec codec = new ReconciliationCodec();

    @Test
    void encodesHotReloadableRecordsAsFlatTaggedObjects() throws IOException {
        ReconciliationRecord record = new ReconciliationRecord(KEY, new Verdict.HotReloadable(
            List.of(SlotMapping.unchanged(0, 1), new SlotMapping(1, 0, "count + 1")),
            List.of(new LiteralPatch("/0/@class", "a", "b", SPAN))
        ));

        JsonNode json = JsonMapper.builder().build().readTree(codec.encode(record));

        assertEquals("src/View.java", json.get("file").asText());
        assertEquals(12, json.get("line").asInt());
        assertEquals(9, json.get("column").asInt());
        assertEquals("hot_reloadable", json.get("verdict").asText());
        assertEquals(1, json.get("slotMapping").get(0).get("oldIndex").asInt());
        assertFalse(json.get("slotMapping").get(0).has("updatedExpression"));
        assertEquals("count + 1", json.get("slotMapping").get(1).get("updatedExpression").asText());
        assertEquals("/0/@class", json.get("literalPatches").get(0).get("location").asText());
        assertEquals(20, json.get("literalPatches").get(0).get("span").get("start").get("offset").asInt());
        assertFalse(json.has("mismatchSpan"));
    }

    @Test
    void decodesRebuildRecords() {
        String json = """
            {"file":"src/View.java","line":12,"column":9,"verdict":"needs_full_rebuild",
             "reason":"Element at /0 changed from <div> to <section>",
             "mismatchSpan":{"file":"src/View.java",
               "start":{"line":13,"column":5,"offset":20},"end":{"line":13,"column":12,"offset":27}}}
            """;

        ReconciliationRecord record = codec.decodeRecord(json);

        assertEquals(KEY, record.templateKey());
        assertFalse(record.hotReloadable());
        assertEquals(SPAN, record.mismatchSpan().orElseThrow());
        assertEquals("Element at /0 changed from <div> to <section>", record.rebuildReason().orElseThrow());
    }

    @Test
    void decodedRecordEqualsTheEncodedOne() {
        ReconciliationRecord record = new ReconciliationRecord(KEY, new Verdict.HotReloadable(
            List.of(new SlotMapping(0, 0, "title.toUpperCase()")),
            List.of(new LiteralPatch("/0/0/#text[0]", "Hello ", "Hi ", SPAN))
        ));

        assertEquals(record, codec.decodeRecord(codec.encode(record)));
    }

    @Test
    void encodesMessagesByType() {
        ReconciliationRecord record = new ReconciliationRecord(
            KEY,
            new Verdict.HotReloadable(List.of(SlotMapping.unchanged(0, 0)), List.of())
        );

        assertTrue(codec.encode(new HotReloadMessage.UpdateTemplate(record)).startsWith("{\"type\":\"update_template\""));
        assertEquals(
            "{\"type\":\"update_asset\",\"path\":\"assets/main.css\"}",
            codec.encode(new HotReloadMessage.UpdateAsset("assets/main.css"))
        );
        assertEquals("{\"type\":\"shutdown\"}", codec.encode(new HotReloadMessage.Shutdown()));
    }

    @Test
    void rejectsUnknownTagsAndMalformedInput() {
        assertThrows(IllegalArgumentException.class, () -> codec.decodeMessage("{\"type\":\"reload_everything\"}"));
        assertThrows(IllegalArgumentException.class, () -> codec.decodeRecord(
            "{\"file\":\"a\",\"line\":1,\"column\":1,\"verdict\":\"maybe\"}"
        ));
        assertThrows(IllegalArgumentException.class, () -> codec.decodeMessage("{\"type\":"));
        assertThrows(IllegalArgumentException.class, () -> codec.decodeMessage("[]"));
        assertThrows(IllegalArgumentException.class, () -> codec.decodeMessage("{\"type\":\"update_asset\"}"));
        assertThrows(IllegalArgumentException.class, () -> codec.decodeRecord(
            "{\"file\":\"a\",\"line\":\"one\",\"column\":1,\"verdict\":\"hot_reloadable\"}"
        ));
    }

    @Test
    void updateTemplateMustCarryAHotReloadableRecord() {
        String json = """
            {"type":"update_template","record":{"file":"a","line":1,"column":1,"verdict":"needs_full_rebuild",
             "reason":"New template","mismatchSpan":{"file":"a",
               "start":{"line":1,"column":1,"offset":0},"end":{"line":1,"column":5,"offset":4}}}}
            """;

        assertThrows(IllegalArgumentException.class, () -> codec.decodeMessage(json));
    }

    @Test
    void streamsNewlineDelimitedMessages() throws IOException {
        StringWriter out = new StringWriter();
        codec.writeMessage(out, new HotReloadMessage.UpdateAsset("assets/logo.svg"));
        codec.writeMessage(out, new HotReloadMessage.Shutdown());

        String stream = out.toString();
        assertEquals(2, stream.lines().count());
        assertTrue(stream.endsWith("\n"));

        String noisy = "not json\n\n" + stream + "{\"type\":\"unknown\"}\n";
        List<HotReloadMessage> messages = codec.readMessages(new StringReader(noisy));

        assertEquals(2, messages.size());
        assertEquals("assets/logo.svg", assertInstanceOf(HotReloadMessage.UpdateAsset.class, messages.get(0)).path());
        assertInstanceOf(HotReloadMessage.Shutdown.class, messages.get(1));
    }
}
