package com.libragraph.depot.cli;

import com.libragraph.depot.core.registry.HttpRegistryClient;
import com.libragraph.depot.core.registry.RegistryClient;
import com.libragraph.depot.core.upload.UploadSettings;
import com.libragraph.depot.core.ValidationException;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@QuarkusTest
class PipelineFactoryTest {

    @Inject
    PipelineFactory factory;

    @Inject
    RegistryClient registry;

    @Test
    void shouldUseConfiguredUploadSettings() {
        UploadSettings settings = factory.uploadSettings(null, null);

        assertThat(settings.partSize()).isEqualTo(UploadSettings.MIN_PART_SIZE);
        assertThat(settings.concurrency()).isEqualTo(3);
    }

    @Test
    void shouldPreferCommandLineOverrides() {
        UploadSettings settings = factory.uploadSettings(8L * 1024 * 1024, 1);

        assertThat(settings.partSize()).isEqualTo(8L * 1024 * 1024);
        assertThat(settings.concurrency()).isEqualTo(1);
    }

    @Test
    void shouldRejectTooSmallPartSize() {
        assertThatThrownBy(() -> factory.uploadSettings(1024L, null))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void shouldBuildServicesFromConfig() {
        UploadSettings settings = factory.uploadSettings(null, null);

        assertThat(registry).isInstanceOf(HttpRegistryClient.class);
        assertThat(factory.processor(settings)).isNotNull();
        assertThat(factory.pushService(settings)).isNotNull();
    }
}
