package com.g11macro.manager.service;

import com.g11macro.manager.config.MacroConfigProperties;
import com.g11macro.manager.exception.ConfigStorageException;
import com.g11macro.manager.model.Direction;
import com.g11macro.manager.model.KeyBinding;
import com.g11macro.manager.model.KeyValue;
import com.g11macro.manager.model.Step;
import com.g11macro.manager.ron.RonParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BindingsStoreTest {

    @TempDir
    Path tempDir;

    private Path configDir;
    private BindingsStore store;

    @BeforeEach
    void setUp() {
        configDir = tempDir.resolve("g11-macro-daemon");
        store = new BindingsStore(new MacroConfigProperties(configDir.toString(), null, null));
    }

    private void writeBindings(String text) throws Exception {
        Files.createDirectories(configDir);
        Files.writeString(configDir.resolve("key_bindings.ron"), text, StandardCharsets.UTF_8);
    }

    @Test
    void defaultFileNames() {
        assertThat(store.bindingsPath()).isEqualTo(configDir.resolve("key_bindings.ron"));
        assertThat(store.recordingsPath()).isEqualTo(configDir.resolve("key_recordings.ron"));
    }

    @Test
    void missingFileLoadsAsEmptyWithoutError() {
        BindingsStore.LoadResult result = store.loadBindings();

        assertThat(result.bindings()).isEmpty();
        assertThat(result.hasError()).isFalse();
    }

    @Test
    void stubIsCreatedOnceAndParsesToNothing() throws Exception {
        store.ensureConfigDirectory();

        assertThat(Files.readString(store.bindingsPath())).isEqualTo(BindingsStore.STUB);
        assertThat(RonParser.parse(BindingsStore.STUB)).isEmpty();
        assertThat(store.loadBindings().bindings()).isEmpty();

        writeBindings("[KeyBinding(m: 1, g: 1, on: Press)]");
        store.ensureConfigDirectory();
        assertThat(store.loadBindings().bindings()).hasSize(1);
    }

    @Test
    void malformedFileFallsBackToEmptyWithError() throws Exception {
        writeBindings("[KeyBinding(m: 1, g: 1, on: Sideways)]");

        BindingsStore.LoadResult result = store.loadBindings();

        assertThat(result.bindings()).isEmpty();
        assertThat(result.error()).contains("Sideways");
    }

    @Test
    void saveThenLoad() throws Exception {
        List<KeyBinding> bindings = List.of(new KeyBinding(2, 5, Direction.Release, List.of(
                new Step.Text("saved"))));

        store.saveBindings(bindings);

        assertThat(Files.readString(store.bindingsPath()))
                .startsWith("#![enable(explicit_struct_names, implicit_some)]\n[\n    KeyBinding(");
        assertThat(store.loadBindings().bindings()).isEqualTo(bindings);
    }

    @Test
    void upsertReplacesInPlaceAndAppendsNewKeys() throws Exception {
        writeBindings("""
                [
                    KeyBinding(m: 1, g: 1, on: Press, script: [Text("one")]),
                    KeyBinding(m: 1, g: 2, on: Press, script: [Text("two")]),
                ]
                """);

        store.upsertBinding(new KeyBinding(1, 1, Direction.Release, List.of(new Step.Text("replaced"))));
        List<KeyBinding> saved = store.upsertBinding(new KeyBinding(3, 9, Direction.Press));

        assertThat(saved).extracting(KeyBinding::keyId).containsExactly(
                new KeyBinding.KeyId(1, 1), new KeyBinding.KeyId(1, 2), new KeyBinding.KeyId(3, 9));
        assertThat(store.loadBindings().bindings().get(0).script())
                .containsExactly(new Step.Text("replaced"));
    }

    @Test
    void upsertRefusesToOverwriteAnInvalidFile() throws Exception {
        writeBindings("KeyBinding(m: 1, on: Press)");

        assertThatThrownBy(() -> store.upsertBinding(new KeyBinding(1, 1, Direction.Press)))
                .isInstanceOf(ConfigStorageException.class)
                .hasMessageContaining("Incomplete KeyBinding");
        assertThat(Files.readString(store.bindingsPath())).isEqualTo("KeyBinding(m: 1, on: Press)");
    }

    @Test
    void concurrentUpsertsKeepEveryBinding() throws Exception {
        store.ensureConfigDirectory();
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Callable<List<KeyBinding>>> tasks = new ArrayList<>();
            for (int g = 1; g <= 18; g++) {
                KeyBinding binding = new KeyBinding(1, g, Direction.Press, List.of(new Step.Text("g" + g)));
                tasks.add(() -> store.upsertBinding(binding));
            }
            for (Future<List<KeyBinding>> future : executor.invokeAll(tasks)) {
                future.get();
            }
        } finally {
            executor.shutdown();
            executor.awaitTermination(10, TimeUnit.SECONDS);
        }

        assertThat(store.loadBindings().bindings()).extracting(KeyBinding::g)
                .containsExactlyInAnyOrder(1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12, 13, 14, 15, 16, 17, 18);
    }

    @Test
    void findBindingUsesTheLastDuplicate() throws Exception {
        writeBindings("""
                [
                    KeyBinding(m: 2, g: 3, on: Press, script: [Key(Alt, Press)]),
                    KeyBinding(m: 2, g: 3, on: Release, script: [Key(Alt, Release)]),
                ]
                """);

        assertThat(store.findBinding(2, 3)).hasValueSatisfying(binding -> {
            assertThat(binding.on()).isEqualTo(Direction.Release);
            assertThat(binding.script()).containsExactly(new Step.Key(KeyValue.named("Alt"), Direction.Release));
        });
        assertThat(store.findBinding(1, 1)).isEmpty();
    }

    @Test
    void recordingsAreReadFromTheirOwnFile() throws Exception {
        Files.createDirectories(configDir);
        Files.writeString(store.recordingsPath(), "[KeyBinding(m: 1, g: 7, on: Press, script: [Text(\"rec\")])]");

        assertThat(store.loadRecordings().bindings()).extracting(KeyBinding::g).containsExactly(7);
        assertThat(store.loadBindings().bindings()).isEmpty();
    }
}
