package org.texpreview.compiler.api;

/**
 * Defines the public interface of the preview compiler.
 */
public interface ICompiler {

    /**
     * Compiles a multi-file document into a rendered preview.
     * <p>
     * Never throws for document content: missing includes, include cycles, missing images and
     * malformed math degrade to inline markers, and a missing entry file yields an empty output
     * with a single error diagnostic.
     *
     * @param entryFileName The preferred entry file name. If the file resolver does not know it,
     *                      the configured default entry and then any {@code .tex} file are tried.
     * @param files The text files of the project.
     * @param assets The image assets of the project.
     * @return The rendered output and the diagnostic log.
     */
    CompileResult compile(String entryFileName, IFileResolver files, IAssetResolver assets);

    /**
     * Sets the verbosity level for log output.
     * @param level The verbosity level (0=error, 1=warn, 2=info, 3=debug, 4=trace).
     */
    void setVerbosity(int level);
}
