package io.weft.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.weft.core.workflow.connection.PortReference;
import java.io.IOException;
import java.io.Serial;

/// Writes a connection endpoint as `{"node": .., "port": .., "scope": ..}`.
///
/// `scope` is omitted for unscoped endpoints.
///
/// @see PortReferenceDeserializer for the inverse operation
class PortReferenceSerializer extends StdSerializer<PortReference> {

    @Serial private static final long serialVersionUID = 2716405388196251470L;

    PortReferenceSerializer() {
        super(PortReference.class);
    }

    @Override
    public void serialize(PortReference ref, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("node", ref.node());
        gen.writeStringField("port", ref.port());
        if (ref.isScoped()) {
            gen.writeStringField("scope", ref.scope());
        }
        gen.writeEndObject();
    }
}
