package org.texpreview.compiler.pipeline;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class StageRegistryTest {

    @Test
    @Tag("unit")
    void defaultPipelineRunsStagesInFixedOrder() {
        StageRegistry registry = StageRegistry.initializeWithDefaults();

        assertThat(registry.stages())
                .extracting(IRenderStage::name)
                .containsExactly("include", "strip", "structure", "environment", "format", "assets", "math");
    }

    @Test
    @Tag("unit")
    void registeredStagesAreAppendedAndReadOnly() {
        StageRegistry registry = new StageRegistry();
        IRenderStage upper = new IRenderStage() {
            @Override
            public String name() { return "upper"; }

            @Override
            public String apply(String source, RenderContext context) { return source.toUpperCase(); }
        };

        registry.register(upper);

        assertThat(registry.stages()).containsExactly(upper);
        assertThatThrownBy(() -> registry.stages().add(upper)).isInstanceOf(UnsupportedOperationException.class);
    }
}
