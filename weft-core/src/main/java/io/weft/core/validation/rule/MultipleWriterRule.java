package io.weft.core.validation.rule;

import io.weft.core.validation.Diagnostic;
import io.weft.core.validation.DiagnosticCode;
import io.weft.core.validation.Diagnostics;
import io.weft.core.validation.ValidationContext;
import io.weft.core.validation.ValidationRule;
import io.weft.core.workflow.ReservedNames;
import io.weft.core.workflow.WorkflowIndex;
import io.weft.core.workflow.connection.Connection;
import io.weft.core.workflow.port.DataType;
import io.weft.core.workflow.port.PortDefinition;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/// Rejects data inputs that receive more than one value.
///
/// STEP inputs may have many writers, as may inputs declaring a merge strategy.
/// Exit ports are covered by {@link DataFlowRule}. Writers that sit on distinct
/// branches of one node never run together and are accepted.
public final class MultipleWriterRule implements ValidationRule {

    @Override
    public Diagnostics check(ValidationContext context) {
        WorkflowIndex index = context.index();
        Map<String, List<Connection>> writersByInput = new LinkedHashMap<>();
        for (Connection conn : context.workflow().getConnections()) {
            if (ReservedNames.isExit(conn.to().node())) {
                continue;
            }
            Optional<PortDefinition> target =
                    index.typeOf(conn.to().node()).map(t -> t.getInputs().get(conn.to().port()));
            if (target.isPresent()
                    && (target.get().getDataType() == DataType.STEP
                            || target.get().getMergeStrategy() != null)) {
                continue;
            }
            writersByInput
                    .computeIfAbsent(conn.to().node() + "." + conn.to().port(), k -> new ArrayList<>())
                    .add(conn);
        }

        Diagnostics diagnostics = Diagnostics.empty();
        for (List<Connection> writers : writersByInput.values()) {
            if (writers.size() < 2) {
                continue;
            }
            List<String> sources = writers.stream().map(c -> c.from().node()).toList();
            if (BranchExclusivity.areMutuallyExclusive(sources, index)) {
                continue;
            }
            Connection first = writers.get(0);
            diagnostics.add(
                    Diagnostic.error(
                                    DiagnosticCode.MULTIPLE_CONNECTIONS_TO_INPUT,
                                    "Input port \""
                                            + first.to().port()
                                            + "\" on node \""
                                            + first.to().node()
                                            + "\" has "
                                            + writers.size()
                                            + " connections ("
                                            + DataFlowRule.describeSources(writers)
                                            + "). Only one value can be received.")
                            .withNode(first.to().node())
                            .withConnection(first));
        }
        return diagnostics;
    }
}
