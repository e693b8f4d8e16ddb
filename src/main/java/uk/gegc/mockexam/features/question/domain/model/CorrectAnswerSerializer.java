package uk.gegc.mockexam.features.question.domain.model;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;
import java.math.BigInteger;
import java.util.regex.Pattern;

/**
 * Writes integer answers of numerical questions as JSON numbers and option letters as strings.
 */
public class CorrectAnswerSerializer extends StdSerializer<String> {

    private static final Pattern INTEGER = Pattern.compile("-?\\d+");

    public CorrectAnswerSerializer() {
        super(String.class);
    }

    @Override
    public void serialize(String value, JsonGenerator gen, SerializerProvider provider) throws IOException {
        if (INTEGER.matcher(value).matches()) {
            gen.writeNumber(new BigInteger(value));
        } else {
            gen.writeString(value);
        }
    }
}
