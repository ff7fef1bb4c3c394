package com.syntaxforge.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;
import java.math.BigInteger;

/**
 * Writes {@code Literal.value}. Doubles holding an integral value are written without
 * a fraction, so {@code 1.0} becomes {@code 1}; non-finite doubles become {@code null}.
 */
public class LiteralValueSerializer extends JsonSerializer<Object> {

    // 2^53, the last integral double without gaps
    private static final double MAX_EXACT_INTEGER = 9007199254740992.0;

    @Override
    public void serialize(Object value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
        if (value == null) {
            gen.writeNull();
        } else if (value instanceof Double d) {
            if (d.isInfinite() || d.isNaN()) {
                gen.writeNull();
            } else if (d == Math.floor(d) && Math.abs(d) <= MAX_EXACT_INTEGER) {
                gen.writeNumber(d.longValue());
            } else {
                gen.writeNumber(d);
            }
        } else if (value instanceof Long l) {
            gen.writeNumber(l);
        } else if (value instanceof Integer i) {
            gen.writeNumber(i);
        } else if (value instanceof BigInteger bi) {
            gen.writeNumber(bi);
        } else if (value instanceof Number n) {
            gen.writeNumber(n.doubleValue());
        } else if (value instanceof Boolean b) {
            gen.writeBoolean(b);
        } else if (value instanceof String s) {
            gen.writeString(s);
        } else {
            gen.writeObject(value);
        }
    }
}
