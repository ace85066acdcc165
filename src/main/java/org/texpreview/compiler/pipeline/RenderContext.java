package org.texpreview.compiler.pipeline;

import org.texpreview.compiler.CompilerSettings;
import org.texpreview.compiler.api.IFileResolver;
import org.texpreview.compiler.backend.asset.AssetBinding;
import org.texpreview.compiler.backend.math.IMathTypesetter;
import org.texpreview.compiler.diagnostics.DiagnosticsEngine;
import org.texpreview.compiler.frontend.preprocessor.DocumentMetadata;

import java.time.Clock;
import java.time.LocalDate;

/**
 * State of one compile pass shared by the render stages. Created at the start of a pass and
 * discarded at its end.
 */
public class RenderContext {

    private final String entryFileName;
    private final CompilerSettings settings;
    private final IFileResolver files;
    private final AssetBinding assets;
    private final IMathTypesetter mathTypesetter;
    private final DiagnosticsEngine diagnostics;
    private final Clock clock;
    private DocumentMetadata metadata = DocumentMetadata.EMPTY;

    /**
     * Creates the context of a pass.
     * @param entryFileName The name of the entry file.
     * @param settings The compiler settings.
     * @param files The file resolver snapshot.
     * @param assets The asset binding built for this pass.
     * @param mathTypesetter The math typesetter.
     * @param diagnostics The diagnostic log of this pass.
     * @param clock The clock used for {@code \today}.
     */
    public RenderContext(String entryFileName, CompilerSettings settings, IFileResolver files, AssetBinding assets,
                         IMathTypesetter mathTypesetter, DiagnosticsEngine diagnostics, Clock clock) {
        this.entryFileName = entryFileName;
        this.settings = settings;
        this.files = files;
        this.assets = assets;
        this.mathTypesetter = mathTypesetter;
        this.diagnostics = diagnostics;
        this.clock = clock;
    }

    public String getEntryFileName() { return entryFileName; }

    public CompilerSettings getSettings() { return settings; }

    public IFileResolver getFiles() { return files; }

    public AssetBinding getAssets() { return assets; }

    public IMathTypesetter getMathTypesetter() { return mathTypesetter; }

    public DiagnosticsEngine getDiagnostics() { return diagnostics; }

    /**
     * @return The current date according to the pass clock.
     */
    public LocalDate today() { return LocalDate.now(clock); }

    /**
     * @return The document metadata recorded by the stripper, or {@link DocumentMetadata#EMPTY}.
     */
    public DocumentMetadata getMetadata() { return metadata; }

    /**
     * Records the document metadata.
     * @param metadata The metadata extracted from the source.
     */
    public void setMetadata(DocumentMetadata metadata) { this.metadata = metadata; }
}
