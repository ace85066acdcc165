package org.texpreview.compiler.pipeline;

import org.texpreview.compiler.backend.asset.AssetBinder;
import org.texpreview.compiler.backend.math.MathRenderer;
import org.texpreview.compiler.frontend.environment.EnvironmentHandler;
import org.texpreview.compiler.frontend.format.InlineFormatter;
import org.texpreview.compiler.frontend.preprocessor.IncludeResolver;
import org.texpreview.compiler.frontend.preprocessor.PreambleStripper;
import org.texpreview.compiler.frontend.structure.StructuralTransformer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Registry of render stages applied in registration order.
 */
public final class StageRegistry {

    private final List<IRenderStage> stages = new ArrayList<>();

    /**
     * Registers a new stage after all previously registered ones.
     * @param stage The stage to register.
     */
    public void register(IRenderStage stage) { stages.add(stage); }

    /**
     * @return The registered stages in execution order.
     */
    public List<IRenderStage> stages() { return Collections.unmodifiableList(stages); }

    /**
     * Initializes a registry with the default pipeline. The order matters: includes are expanded
     * before comments are stripped, headings and environments are rewritten while their raw
     * directives are still intact, and display math is recognized by the last stage only.
     * @return A new registry with the default stages.
     */
    public static StageRegistry initializeWithDefaults() {
        StageRegistry reg = new StageRegistry();
        reg.register(new IncludeResolver());
        reg.register(new PreambleStripper());
        reg.register(new StructuralTransformer());
        reg.register(new EnvironmentHandler());
        reg.register(new InlineFormatter());
        reg.register(new AssetBinder());
        reg.register(new MathRenderer());
        return reg;
    }
}
