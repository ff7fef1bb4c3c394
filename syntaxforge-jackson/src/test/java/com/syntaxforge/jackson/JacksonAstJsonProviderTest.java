package com.syntaxforge.jackson;

import com.fasterxml.jackson.databind.JsonNode;
import com.syntaxforge.ast.Identifier;
import com.syntaxforge.json.AstJsonProvider;
import com.syntaxforge.json.AstJsonSerializer;
import com.syntaxforge.lang.PythonParser;
import com.syntaxforge.parser.ParseResult;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class JacksonAstJsonProviderTest {

    @Test
    void testDiscoveredThroughServiceLoader() {
        assertTrue(AstJsonProvider.isProviderAvailable());
        assertInstanceOf(JacksonAstJsonProvider.class, AstJsonProvider.getProvider());
        assertEquals("Jackson", AstJsonProvider.getProvider("jackson").getName());
        assertEquals("Jackson", AstJsonProvider.getProvider("JACKSON").getName());
    }

    @Test
    void testUnknownProviderName() {
        IllegalStateException e = assertThrows(IllegalStateException.class,
            () -> AstJsonProvider.getProvider("gson"));
        assertTrue(e.getMessage().contains("'gson'"));
    }

    @Test
    void testSerializeNode() {
        AstJsonSerializer serializer = new JacksonAstJsonProvider().getSerializer();

        assertEquals("{\"type\":\"Identifier\",\"name\":\"x\"}", serializer.serialize(new Identifier("x")));
        String pretty = serializer.serializePretty(new Identifier("x"));
        assertTrue(pretty.contains("\n"));
        assertTrue(pretty.contains("\"name\" : \"x\""));
    }

    @Test
    void testSerializeParseResult() throws Exception {
        JacksonAstJsonProvider provider = new JacksonAstJsonProvider();
        ParseResult result = new PythonParser().parse("def f(:\n", "broken.py");
        assertFalse(result.isSuccess());

        String json = provider.getSerializer().serialize(result);
        JsonNode tree = provider.getObjectMapper().readTree(json);

        assertEquals("Program", tree.get("ast").get("type").asText());
        assertEquals(0, tree.get("ast").get("body").size());
        assertEquals("module", tree.get("ast").get("sourceType").asText());
        assertEquals("error", tree.get("errors").get(0).get("severity").asText());
        assertEquals("python", tree.get("metadata").get("language").asText());
        assertEquals("broken.py", tree.get("metadata").get("filename").asText());

        String pretty = provider.getSerializer().serializePretty(result);
        assertEquals(tree, provider.getObjectMapper().readTree(pretty));
    }
}
