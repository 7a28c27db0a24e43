package io.weft.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.weft.core.workflow.connection.PortReference;
import java.io.IOException;
import java.io.Serial;

/// Reads a connection endpoint in object form or compact string form.
///
/// Accepted shapes:
/// - `{"node": "fetch", "port": "data"}`, optionally with `"scope": "iterate"`
/// - `"fetch.data"` or `"loop.item:iterate"`
///
/// The node id is everything before the first dot; the scope follows the last colon.
///
/// @see PortReferenceSerializer for the inverse operation
class PortReferenceDeserializer extends StdDeserializer<PortReference> {

    @Serial private static final long serialVersionUID = -1582946602719365213L;

    PortReferenceDeserializer() {
        super(PortReference.class);
    }

    @Override
    public PortReference deserialize(JsonParser p, DeserializationContext ctx) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);

        if (root.isTextual()) {
            return parse(root.asText());
        }
        if (!root.isObject() || !root.hasNonNull("node") || !root.hasNonNull("port")) {
            throw new IOException("Port reference requires 'node' and 'port': " + root);
        }
        String scope = root.hasNonNull("scope") ? root.get("scope").asText() : null;
        return new PortReference(root.get("node").asText(), root.get("port").asText(), scope);
    }

    static PortReference parse(String text) throws IOException {
        String ref = text.trim();
        String scope = null;
        int colon = ref.lastIndexOf(':');
        if (colon >= 0) {
            scope = ref.substring(colon + 1);
            ref = ref.substring(0, colon);
        }
        int dot = ref.indexOf('.');
        if (dot <= 0 || dot == ref.length() - 1) {
            throw new IOException("Expected 'node.port[:scope]' but got '" + text + "'");
        }
        if (scope != null && scope.isEmpty()) {
            throw new IOException("Empty scope in port reference '" + text + "'");
        }
        return new PortReference(ref.substring(0, dot), ref.substring(dot + 1), scope);
    }
}
