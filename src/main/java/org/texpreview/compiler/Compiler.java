package org.texpreview.compiler;

import org.texpreview.compiler.api.CompileResult;
import org.texpreview.compiler.api.CompilerErrorCode;
import org.texpreview.compiler.api.IAssetResolver;
import org.texpreview.compiler.api.ICompiler;
import org.texpreview.compiler.api.IFileResolver;
import org.texpreview.compiler.backend.asset.AssetBinding;
import org.texpreview.compiler.backend.math.IMathTypesetter;
import org.texpreview.compiler.backend.math.JLatexMathTypesetter;
import org.texpreview.compiler.diagnostics.CompilerLogger;
import org.texpreview.compiler.diagnostics.DiagnosticsEngine;
import org.texpreview.compiler.internal.i18n.Messages;
import org.texpreview.compiler.pipeline.IRenderStage;
import org.texpreview.compiler.pipeline.RenderContext;
import org.texpreview.compiler.pipeline.StageRegistry;
import org.texpreview.compiler.util.Lengths;

import java.time.Clock;
import java.util.Optional;

/**
 * The main compiler implementation. This class orchestrates the rendering pipeline from a set of
 * source files to a preview fragment. Every call to {@link #compile} is an independent pass; the
 * instance itself holds only immutable settings.
 */
public class Compiler implements ICompiler {

    private final CompilerSettings settings;
    private final IMathTypesetter mathTypesetter;
    private final Clock clock;
    private final StageRegistry stages;
    private int verbosity = -1;

    /**
     * Creates a compiler with the classpath default settings.
     */
    public Compiler() {
        this(CompilerSettings.defaults());
    }

    /**
     * Creates a compiler that typesets math with JLaTeXMath.
     * @param settings The compiler settings.
     */
    public Compiler(CompilerSettings settings) {
        this(settings, new JLatexMathTypesetter(settings.mathFontSize()), Clock.systemDefaultZone());
    }

    /**
     * Creates a compiler with an explicit typesetter and clock.
     * @param settings The compiler settings.
     * @param mathTypesetter The math typesetter.
     * @param clock The clock for {@code \today} and diagnostic timestamps.
     */
    public Compiler(CompilerSettings settings, IMathTypesetter mathTypesetter, Clock clock) {
        this(settings, mathTypesetter, clock, StageRegistry.initializeWithDefaults());
    }

    /**
     * Creates a compiler with a custom stage registry.
     * @param settings The compiler settings.
     * @param mathTypesetter The math typesetter.
     * @param clock The clock for {@code \today} and diagnostic timestamps.
     * @param stages The stages to run, in order.
     */
    public Compiler(CompilerSettings settings, IMathTypesetter mathTypesetter, Clock clock, StageRegistry stages) {
        this.settings = settings;
        this.mathTypesetter = mathTypesetter;
        this.clock = clock;
        this.stages = stages;
    }

    @Override
    public CompileResult compile(String entryFileName, IFileResolver files, IAssetResolver assets) {
        if (verbosity >= 0) {
            CompilerLogger.setLevel(verbosity);
        }
        DiagnosticsEngine diagnostics = new DiagnosticsEngine(clock);
        try {
            // Phase 1: Entry location
            Optional<String> entry = locateEntry(entryFileName, files);
            if (entry.isEmpty()) {
                CompilerLogger.warn("Compiler: no entry file among {} file(s)", files.names().size());
                diagnostics.reportError(Messages.get(CompilerErrorCode.FATAL_NO_ENTRY.messageKey()), null, null);
                return new CompileResult("", diagnostics.getDiagnostics());
            }
            String entryName = entry.get();
            String source = files.lookup(entryName).orElse("");
            if (source.isEmpty()) {
                CompilerLogger.warn("Compiler: entry file '{}' is empty", entryName);
                diagnostics.reportError(Messages.get(CompilerErrorCode.FATAL_NO_ENTRY.messageKey()), entryName, null);
                return new CompileResult("", diagnostics.getDiagnostics());
            }
            CompilerLogger.info("Compiler: {}", entryName);

            // Phase 2: Asset binding, once per pass
            AssetBinding binding = AssetBinding.from(assets, settings.imageExtensions());
            RenderContext context = new RenderContext(entryName, settings, files, binding, mathTypesetter, diagnostics, clock);

            // Phase 3: Render stages
            String output = source;
            for (IRenderStage stage : stages.stages()) {
                output = runStage(stage, output, context);
            }

            // Phase 4: Summary
            if (!context.getMetadata().hasDocumentClass()) {
                diagnostics.reportWarning(Messages.get(CompilerErrorCode.STRUCTURAL_WARNING.messageKey()), entryName, null);
            } else {
                diagnostics.reportInfo(Messages.get("diagnostic.compiled",
                        String.valueOf(output.length()), Lengths.format(output.length() / 1024.0)), entryName);
            }
            CompilerLogger.debug("Compiler: diagnostics of this pass:\n{}", diagnostics.summary());
            return new CompileResult(output, diagnostics.getDiagnostics());
        } catch (RuntimeException e) {
            CompilerLogger.warn("Compiler: pass aborted: {}", e.toString());
            DiagnosticsEngine failed = new DiagnosticsEngine(clock);
            failed.reportError(Messages.get("diagnostic.internal-error", e.toString()), entryFileName, null);
            return new CompileResult("", failed.getDiagnostics());
        }
    }

    /**
     * Selects the entry file: the requested name if known, then the configured default, then the
     * first {@code .tex} name in sorted order.
     * @param requested The requested entry name, or {@code null}.
     * @param files The file resolver.
     * @return The entry name, or empty if the project has no candidate.
     */
    public Optional<String> locateEntry(String requested, IFileResolver files) {
        if (requested != null && files.lookup(requested).isPresent()) {
            return Optional.of(requested);
        }
        if (files.lookup(settings.entryFile()).isPresent()) {
            return Optional.of(settings.entryFile());
        }
        return files.names().stream()
                .filter(name -> name.endsWith(settings.defaultExtension()))
                .sorted()
                .findFirst();
    }

    private String runStage(IRenderStage stage, String input, RenderContext context) {
        long start = System.nanoTime();
        try {
            String output = stage.apply(input, context);
            CompilerLogger.debug("Compiler: stage '{}' took {} us, {} -> {} chars",
                    stage.name(), (System.nanoTime() - start) / 1000, input.length(), output.length());
            return output;
        } catch (RuntimeException e) {
            CompilerLogger.warn("Compiler: stage '{}' failed, passing its input through: {}", stage.name(), e.toString());
            return input;
        }
    }

    @Override
    public void setVerbosity(int level) {
        this.verbosity = level;
    }

    /**
     * @return The settings of this compiler.
     */
    public CompilerSettings getSettings() {
        return settings;
    }
}
