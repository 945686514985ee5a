package org.dxworks.markframe.reader;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.dxworks.markframe.TestUtils;
import org.dxworks.markframe.model.Document;
import org.dxworks.markframe.model.block.DefinitionList;
import org.dxworks.markframe.model.block.Div;
import org.dxworks.markframe.model.inline.Note;
import org.dxworks.markframe.model.inline.Span;
import org.dxworks.markframe.writer.NativeWriter;
import org.junit.jupiter.api.Test;

import static org.dxworks.markframe.Trees.blocks;
import static org.dxworks.markframe.Trees.of;
import static org.dxworks.markframe.Trees.para;
import static org.dxworks.markframe.Trees.str;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class NativeRoundTripTest {

    private static final String MARKDOWN = "# Title\n\n"
            + "Some *emph*, **strong**, ~~gone~~ and `code`  \nwith a [link](/u \"t\") and ![img](/i.png).\n\n"
            + "- one\n- two\n\n"
            + "3) three\n\n"
            + "> quoted\n\n"
            + "```java\nint x;\n```\n\n"
            + "| a | b |\n| :- | -: |\n| 1 |\n\n"
            + "<https://example.com>\n\n"
            + "***\n";

    @Test
    void markdownDocument_survivesNativeRoundTrip() throws Exception {
        Document document = TestUtils.read(MARKDOWN);

        String json = new NativeWriter().write(document);
        Document back = new NativeReader().read(json);

        assertEquals(document, back);
        assertEquals(json, new NativeWriter().write(back));
    }

    @Test
    void variantsTheMarkdownReaderNeverProduces_alsoRoundTrip() throws Exception {
        Div div = new Div();
        div.blocks.add(para("inside"));
        DefinitionList definitions = new DefinitionList();
        DefinitionList.Item item = new DefinitionList.Item();
        item.term.add(str("term"));
        item.definitions.add(blocks(para("definition")));
        definitions.items.add(item);
        Span span = new Span();
        span.content.add(str("s"));
        Note note = new Note();
        note.blocks.add(para("note"));
        Document document = new Document(blocks(div, definitions, para(of(span, note))));
        document.meta.put("title", "Meta");

        assertEquals(document, new NativeReader().read(new NativeWriter(true).write(document)));
    }

    @Test
    void everyElementIsTaggedWithItsVariant() throws Exception {
        JsonNode json = new ObjectMapper().readTree(new NativeWriter().write(TestUtils.read("*a*")));

        JsonNode para = json.get("blocks").get(0);
        assertEquals("Para", para.get("t").asText());
        assertEquals("Emph", para.get("content").get(0).get("t").asText());
        assertEquals("a", para.get("content").get(0).get("content").get(0).get("text").asText());
        assertTrue(json.get("meta").isEmpty());
    }

    @Test
    void malformedJson_isRejected() {
        NativeReader reader = new NativeReader();

        assertThrows(DocumentReadException.class, () -> reader.read("{\"blocks\": ["));
        assertThrows(DocumentReadException.class, () -> reader.read("{\"blocks\": [{\"t\": \"Nope\"}]}"));
        assertThrows(DocumentReadException.class, () -> reader.read("{\"unknown\": 1}"));
        assertThrows(DocumentReadException.class, () -> reader.read("null"));
    }
}
