package ai.gently.util;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import java.io.IOException;
import java.nio.file.Path;

/** JSON utility for the persisted Gently documents, with Path serialization support. */
public class Json {

    private static final ObjectMapper MAPPER = createMapper();

    private Json() {
        // Utility class - no instantiation
    }

    private static ObjectMapper createMapper() {
        var pathModule = new SimpleModule("PathModule")
                .addSerializer(Path.class, new PathSerializer())
                .addDeserializer(Path.class, new PathDeserializer());

        return new ObjectMapper()
                .registerModule(pathModule)
                .enable(SerializationFeature.INDENT_OUTPUT)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /** Serializes an object to an indented JSON string. */
    public static String toJson(Object obj) throws IOException {
        return MAPPER.writeValueAsString(obj);
    }

    /** Deserializes a JSON string to an object of the specified type. */
    public static <T> T fromJson(String json, Class<T> type) throws IOException {
        return MAPPER.readValue(json, type);
    }

    private static class PathSerializer extends JsonSerializer<Path> {
        @Override
        public void serialize(Path value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
            gen.writeString(value.toString());
        }
    }

    private static class PathDeserializer extends JsonDeserializer<Path> {
        @Override
        public Path deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            return Path.of(p.getValueAsString()).normalize();
        }
    }
}
