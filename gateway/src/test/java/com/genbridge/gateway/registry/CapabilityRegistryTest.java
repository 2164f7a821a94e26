package com.genbridge.gateway.registry;

import com.genbridge.gateway.component.ComponentSpec;
import com.genbridge.gateway.component.impl.ImageEdit;
import com.genbridge.gateway.component.impl.ImageGeneration;
import com.genbridge.gateway.component.impl.ImageToVideoSubmit;
import com.genbridge.gateway.component.impl.KeyframeToVideoFetch;
import com.genbridge.gateway.component.impl.KeyframeToVideoSubmit;
import com.genbridge.gateway.component.impl.TextToSpeech;
import com.genbridge.gateway.component.impl.TextToVideoSubmit;
import com.genbridge.gateway.component.impl.VideoToVideoSubmit;
import com.genbridge.gateway.component.impl.WanVideoFetch;
import com.genbridge.gateway.task.AsyncTaskGateway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for the shipped bundle layout.
 * No Spring context; components are built by hand around a mock gateway.
 */
@ExtendWith(MockitoExtension.class)
class CapabilityRegistryTest {

    @Mock AsyncTaskGateway gateway;

    CapabilityRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new CapabilityCatalog().capabilityRegistry(
                new ImageGeneration(gateway, "wan2.6-t2i"),
                new TextToVideoSubmit(gateway, "wan2.6-t2v"),
                new ImageToVideoSubmit(gateway, "wan2.6-i2v"),
                new WanVideoFetch(gateway),
                new ImageEdit(gateway, "wan2.6-image"),
                new VideoToVideoSubmit(gateway, "wan2.6-r2v"),
                new KeyframeToVideoSubmit(gateway, "wan2.2-kf2v-flash"),
                new KeyframeToVideoFetch(gateway),
                new TextToSpeech(gateway, "qwen-tts"));
    }

    @Test
    void bundles_inRegistrationOrder() {
        assertThat(registry.bundleNames()).containsExactly(
                CapabilityCatalog.WAN26_MEDIA,
                CapabilityCatalog.WAN22_KEYFRAME_VIDEO,
                CapabilityCatalog.QWEN_TEXT_TO_SPEECH);
    }

    @Test
    void wan26Bundle_listsComponentsInOrder() {
        CapabilityBundle bundle = registry.bundle(CapabilityCatalog.WAN26_MEDIA).orElseThrow();

        assertThat(bundle.instructions()).contains("modelstudio_wan_video_fetch");
        assertThat(bundle.components()).extracting(ComponentSpec::name).containsExactly(
                "modelstudio_wanx26_image_generation",
                "modelstudio_text_to_video_wan26_submit_task",
                "modelstudio_image_to_video_wan26_submit_task",
                "modelstudio_wan_video_fetch",
                "modelstudio_image_edit_wan26",
                "modelstudio_video_to_video_wan26_submit_task");
    }

    @Test
    void keyframeBundle_pairsSubmitAndFetch() {
        assertThat(registry.bundle(CapabilityCatalog.WAN22_KEYFRAME_VIDEO).orElseThrow().components())
                .extracting(ComponentSpec::name)
                .containsExactly(KeyframeToVideoSubmit.NAME, KeyframeToVideoFetch.NAME);
    }

    @Test
    void componentSpec_lookupAcrossBundles() {
        assertThat(registry.componentSpec(TextToSpeech.NAME)).isPresent();
        assertThat(registry.componentSpec("nope")).isEmpty();
        assertThat(registry.bundle("nope")).isEmpty();
    }

    @Test
    void duplicateComponentName_failsConstruction() {
        CapabilityBundle media = registry.bundle(CapabilityCatalog.WAN26_MEDIA).orElseThrow();
        Map<String, CapabilityBundle> bundles = new LinkedHashMap<>();
        bundles.put("a", media);
        bundles.put("b", new CapabilityBundle("again", media.components().subList(0, 1)));

        assertThatThrownBy(() -> new CapabilityRegistry(bundles))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("modelstudio_wanx26_image_generation");
    }

    @Test
    void bundles_areReadOnly() {
        assertThatThrownBy(() -> registry.bundles().clear())
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
