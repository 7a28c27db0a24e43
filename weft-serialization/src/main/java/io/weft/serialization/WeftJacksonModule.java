package io.weft.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.weft.core.workflow.Workflow;
import io.weft.core.workflow.connection.Connection;
import io.weft.core.workflow.connection.PortReference;
import io.weft.core.workflow.node.NodeType;
import io.weft.core.workflow.port.PortDefinition;
import io.weft.serialization.mixin.ConnectionMixin;
import io.weft.serialization.mixin.NodeTypeBuilderMixin;
import io.weft.serialization.mixin.NodeTypeMixin;
import io.weft.serialization.mixin.PortDefinitionBuilderMixin;
import io.weft.serialization.mixin.PortDefinitionMixin;
import io.weft.serialization.mixin.WorkflowBuilderMixin;
import io.weft.serialization.mixin.WorkflowMixin;
import java.io.Serial;

/// Jackson `SimpleModule` that registers all weft serialization configuration in one place.
///
/// **Custom serializer/deserializer pair**:
/// - `PortReference`: `PortReferenceSerializer` / `PortReferenceDeserializer`,
///   object form on write, object or `"node.port[:scope]"` string form on read
///
/// **Mixin/builder pairs** (immutable builder-pattern model types):
/// - `Workflow` + `Workflow.Builder`
/// - `NodeType` + `NodeType.Builder`
/// - `PortDefinition` + `PortDefinition.Builder`
///
/// Records (`NodeInstance`, `Connection`, `WorkflowOptions`, ...) bind through their
/// canonical constructors. `Connection` gets a mixin hiding derived flags.
///
/// @implNote All registrations are explicit. No classpath scanning.
/// @see WorkflowSerializer for the convenience factory API
public class WeftJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 6120983377410592216L;

    public WeftJacksonModule() {
        super("WeftJacksonModule");

        addSerializer(PortReference.class, new PortReferenceSerializer());
        addDeserializer(PortReference.class, new PortReferenceDeserializer());
    }

    /// Applies mixin annotations to builder-pattern model types.
    ///
    /// @param context the setup context provided by Jackson, not null
    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        context.setMixInAnnotations(Workflow.class, WorkflowMixin.class);
        context.setMixInAnnotations(Workflow.Builder.class, WorkflowBuilderMixin.class);

        context.setMixInAnnotations(NodeType.class, NodeTypeMixin.class);
        context.setMixInAnnotations(NodeType.Builder.class, NodeTypeBuilderMixin.class);

        context.setMixInAnnotations(PortDefinition.class, PortDefinitionMixin.class);
        context.setMixInAnnotations(PortDefinition.Builder.class, PortDefinitionBuilderMixin.class);

        context.setMixInAnnotations(Connection.class, ConnectionMixin.class);
    }
}
