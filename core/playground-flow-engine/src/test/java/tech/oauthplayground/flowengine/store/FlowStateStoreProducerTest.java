package tech.oauthplayground.flowengine.store;

import jakarta.enterprise.inject.Instance;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import tech.oauthplayground.flowengine.support.TestFlowEngineConfig;

import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

class FlowStateStoreProducerTest {

    private Instance<InMemoryFlowStateStore> inMemory;
    private Instance<FileFlowStateStore> file;

    @TempDir
    Path directory;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        inMemory = mock(Instance.class);
        file = mock(Instance.class);
    }

    @Test
    @DisplayName("memory type should produce the in-memory store")
    void flowStateStore_shouldProduceInMemory_whenTypeMemory() {
        InMemoryFlowStateStore store = new InMemoryFlowStateStore(Duration.ofMinutes(1), 10);
        when(inMemory.get()).thenReturn(store);
        TestFlowEngineConfig config = new TestFlowEngineConfig();

        FlowStateStore produced = new FlowStateStoreProducer(config, inMemory, file).flowStateStore();

        assertThat(produced).isSameAs(store);
        verifyNoInteractions(file);
    }

    @Test
    @DisplayName("file type should produce the file-backed store")
    void flowStateStore_shouldProduceFileStore_whenTypeFile() {
        FileFlowStateStore store = new FileFlowStateStore(directory, Duration.ofMinutes(1), 10);
        when(file.get()).thenReturn(store);
        TestFlowEngineConfig config = new TestFlowEngineConfig()
            .storeType(FlowStateStore.StoreType.FILE, directory.toString());

        FlowStateStore produced = new FlowStateStoreProducer(config, inMemory, file).flowStateStore();

        assertThat(produced).isSameAs(store);
        verifyNoInteractions(inMemory);
    }
}
