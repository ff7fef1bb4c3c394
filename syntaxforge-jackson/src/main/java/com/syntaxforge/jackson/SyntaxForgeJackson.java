package com.syntaxforge.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Factory for creating properly configured ObjectMapper instances for AST serialization.
 *
 * Usage:
 * <pre>
 * ObjectMapper mapper = SyntaxForgeJackson.createObjectMapper();
 * String json = mapper.writeValueAsString(result.ast());
 * </pre>
 */
public final class SyntaxForgeJackson {

    private SyntaxForgeJackson() {
        // Utility class
    }

    /**
     * Creates a new ObjectMapper configured for AST serialization.
     *
     * The returned mapper omits null values except for the fields {@link AstModule}
     * marks as always present.
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();

        // Specific null fields (like alternate, argument) are included via mixins in AstModule
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);

        mapper.registerModule(new AstModule());

        return mapper;
    }
}
