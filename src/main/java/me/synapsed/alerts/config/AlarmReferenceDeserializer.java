package me.synapsed.alerts.config;

import java.io.IOException;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.node.ObjectNode;

public class AlarmReferenceDeserializer extends StdDeserializer<AlarmReference> {

    public AlarmReferenceDeserializer() {
        super(AlarmReference.class);
    }

    @Override
    public AlarmReference deserialize(JsonParser parser, DeserializationContext context) throws IOException {
        JsonNode node = parser.getCodec().readTree(parser);
        if (node.isTextual()) {
            return AlarmReference.named(node.asText());
        }
        if (node.isObject()) {
            return AlarmReference.inline((ObjectNode) node);
        }
        throw JsonMappingException.from(parser,
            "Alarm reference must be a definition name or an object, got " + node.getNodeType());
    }
}
