package com.g11macro.manager.controller;

import com.g11macro.manager.dto.BindingsResponse;
import com.g11macro.manager.dto.SaveResponse;
import com.g11macro.manager.exception.ConfigStorageException;
import com.g11macro.manager.model.KeyBinding;
import com.g11macro.manager.service.BindingValidator;
import com.g11macro.manager.service.BindingsStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api")
public class BindingsController {

    private static final Logger logger = LoggerFactory.getLogger(BindingsController.class);

    private final BindingsStore store;
    private final BindingValidator validator;

    public BindingsController(BindingsStore store, BindingValidator validator) {
        this.store = store;
        this.validator = validator;
    }

    @GetMapping("/bindings")
    public ResponseEntity<BindingsResponse> loadBindings() {
        try {
            store.ensureConfigDirectory();
        } catch (ConfigStorageException e) {
            logger.warn("Config directory unavailable: {}", e.getMessage());
        }

        BindingsStore.LoadResult result = store.loadBindings();
        if (result.hasError()) {
            logger.warn("Serving empty binding list, config error: {}", result.error());
        }
        return ResponseEntity.ok(new BindingsResponse(
            result.bindings(), configError(result), store.bindingsPath().toString()));
    }

    @GetMapping("/bindings/recordings")
    public ResponseEntity<BindingsResponse> loadRecordings() {
        BindingsStore.LoadResult result = store.loadRecordings();
        return ResponseEntity.ok(new BindingsResponse(
            result.bindings(), configError(result), store.recordingsPath().toString()));
    }

    @GetMapping("/bindings/{m}/{g}")
    public ResponseEntity<KeyBinding> findBinding(@PathVariable int m, @PathVariable int g) {
        return store.findBinding(m, g)
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PutMapping("/bindings/{m}/{g}")
    public ResponseEntity<SaveResponse> saveBinding(@PathVariable int m, @PathVariable int g,
                                                    @RequestBody KeyBinding binding) {
        logger.info("Received binding for M{}/G{} with {} steps", m, g, binding.script().size());

        if (binding.m() != m || binding.g() != g) {
            return ResponseEntity.badRequest().body(SaveResponse.invalid(List.of(
                "binding is for M" + binding.m() + "/G" + binding.g() + " but was sent to M" + m + "/G" + g)));
        }

        List<String> violations = validator.validate(binding);
        if (!violations.isEmpty()) {
            logger.warn("Rejected binding M{}/G{}: {}", m, g, violations);
            return ResponseEntity.badRequest().body(SaveResponse.invalid(violations));
        }

        try {
            List<KeyBinding> all = store.upsertBinding(binding);
            return ResponseEntity.ok(SaveResponse.saved(all.size()));
        } catch (ConfigStorageException e) {
            logger.error("Saving binding M{}/G{} failed: {}", m, g, e.getMessage());
            return ResponseEntity.internalServerError().body(SaveResponse.failed(e.getMessage()));
        }
    }

    @PutMapping("/bindings")
    public ResponseEntity<SaveResponse> saveAll(@RequestBody List<KeyBinding> bindings) {
        logger.info("Received full binding list ({} entries)", bindings.size());

        List<String> violations = validator.validateAll(bindings);
        if (!violations.isEmpty()) {
            logger.warn("Rejected binding list: {}", violations);
            return ResponseEntity.badRequest().body(SaveResponse.invalid(violations));
        }

        try {
            store.saveBindings(bindings);
            return ResponseEntity.ok(SaveResponse.saved(bindings.size()));
        } catch (ConfigStorageException e) {
            logger.error("Saving binding list failed: {}", e.getMessage());
            return ResponseEntity.internalServerError().body(SaveResponse.failed(e.getMessage()));
        }
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("G11 Macro Manager backend is healthy");
    }

    private static String configError(BindingsStore.LoadResult result) {
        return result.hasError() ? "Config error: " + result.error() : null;
    }
}
