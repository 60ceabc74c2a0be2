package com.jsast.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;
import java.math.BigInteger;
import java.util.Locale;

/**
 * Writes literal values the way JavaScript prints numbers: a double with no fractional
 * part is written as an integer, and NaN or an infinity, which JSON cannot express, as null.
 */
public class JavaScriptNumberSerializer extends StdSerializer<Number> {

    private static final double MAX_SAFE_INTEGER = 9007199254740992.0;

    public JavaScriptNumberSerializer() {
        super(Number.class);
    }

    @Override
    public void serialize(Number value, JsonGenerator gen, SerializerProvider provider) throws IOException {
        if (value == null) {
            gen.writeNull();
        } else if (value instanceof Integer i) {
            gen.writeNumber(i);
        } else if (value instanceof Long l) {
            gen.writeNumber(l);
        } else if (value instanceof BigInteger bi) {
            gen.writeNumber(bi);
        } else {
            writeDouble(value.doubleValue(), gen);
        }
    }

    private static void writeDouble(double d, JsonGenerator gen) throws IOException {
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            gen.writeNull();
        } else if (d == Math.floor(d) && Math.abs(d) <= MAX_SAFE_INTEGER) {
            gen.writeNumber((long) d);
        } else if (d == Math.floor(d) && Math.abs(d) < 1e21) {
            // past 2^53 JavaScript still prints every digit, rounded
            gen.writeNumber(new BigInteger(String.format(Locale.ROOT, "%.0f", d)));
        } else {
            gen.writeNumber(d);
        }
    }
}
