package com.syntaxforge.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.syntaxforge.ast.Range;

import java.io.IOException;

/**
 * Writes a {@link Range} as {@code [start, end]}.
 */
public class RangeSerializer extends StdSerializer<Range> {

    public RangeSerializer() {
        super(Range.class);
    }

    @Override
    public void serialize(Range range, JsonGenerator gen, SerializerProvider provider) throws IOException {
        gen.writeStartArray();
        gen.writeNumber(range.start());
        gen.writeNumber(range.end());
        gen.writeEndArray();
    }
}
