package org.texpreview.compiler.backend.asset;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.texpreview.compiler.CompilerFixtures.assets;

public class AssetBindingTest {

    private final AssetBinding binding = AssetBinding.from(assets(
            "logo.png", "data:logo",
            "figures-chart.jpg", "data:figures-chart",
            "b-chart.png", "data:b-chart"), List.of(".png", ".jpg"));

    @Test
    @Tag("unit")
    void prefersExactKey() {
        assertThat(binding.resolve("logo.png")).contains("data:logo");
    }

    @Test
    @Tag("unit")
    void triesRasterExtensions() {
        assertThat(binding.resolve("logo")).contains("data:logo");
        assertThat(binding.resolve("figures-chart")).contains("data:figures-chart");
    }

    @Test
    @Tag("unit")
    void fallsBackToFirstSortedKeyContainingName() {
        assertThat(binding.resolve("chart")).contains("data:b-chart");
    }

    @Test
    @Tag("unit")
    void returnsEmptyForUnknownOrBlankNames() {
        assertThat(binding.resolve("ghost")).isEmpty();
        assertThat(binding.resolve("")).isEmpty();
        assertThat(AssetBinding.empty().resolve("logo")).isEmpty();
    }
}
