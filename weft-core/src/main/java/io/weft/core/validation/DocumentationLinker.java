package io.weft.core.validation;

import java.util.List;

/// Attaches documentation links to diagnostics whose code has a reference page.
final class DocumentationLinker implements DiagnosticPostProcessor {

    @Override
    public List<Diagnostic> apply(List<Diagnostic> diagnostics, ValidationContext context) {
        String base = context.options().getDocsBaseUrl();
        return diagnostics.stream()
                .map(
                        d -> {
                            String url = d.code().docUrl(base);
                            return d.docUrl() == null && url != null ? d.withDocUrl(url) : d;
                        })
                .toList();
    }
}
