package org.texpreview.compiler.pipeline;

/**
 * One step of the rendering pipeline. A stage maps the accumulated text to new text and may read
 * or record pass-wide state through the {@link RenderContext}.
 */
public interface IRenderStage {

    /**
     * @return A short stable name of the stage, used in logs.
     */
    String name();

    /**
     * Applies this stage.
     *
     * @param source  The output of the previous stage.
     * @param context The state of the current compile pass.
     * @return The rewritten text.
     */
    String apply(String source, RenderContext context);
}
