package com.vidnyan.patternscan.application.service;

import com.vidnyan.patternscan.domain.error.NotFoundException;
import com.vidnyan.patternscan.domain.error.TypeContractViolationException;
import com.vidnyan.patternscan.domain.plugin.AnalyzerPlugin;
import lombok.extern.slf4j.Slf4j;

import java.lang.reflect.Modifier;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Name to plugin-type bindings.
 * Populated once at bootstrap; reads are lock-free against an immutable map
 * that writers replace wholesale.
 */
@Slf4j
public class PluginRegistry {
    
    private final Object writeLock = new Object();
    private volatile Map<String, Class<? extends AnalyzerPlugin>> bindings = Map.of();
    
    /**
     * Bind a plugin type to a name. An existing binding is overwritten.
     *
     * @throws TypeContractViolationException if the type is not a concrete,
     *         publicly constructible {@link AnalyzerPlugin}
     */
    public void register(String name, Class<?> pluginType) {
        Class<? extends AnalyzerPlugin> type = validate(name, pluginType);
        Class<? extends AnalyzerPlugin> previous;
        synchronized (writeLock) {
            Map<String, Class<? extends AnalyzerPlugin>> copy = new TreeMap<>(bindings);
            previous = copy.put(name, type);
            bindings = Collections.unmodifiableMap(copy);
        }
        if (previous != null && previous != type) {
            log.info("Plugin '{}' rebound from {} to {}", name, previous.getSimpleName(), type.getSimpleName());
        } else {
            log.debug("Registered plugin '{}' -> {}", name, type.getName());
        }
    }
    
    /**
     * @throws NotFoundException when nothing is bound to the name
     */
    public Class<? extends AnalyzerPlugin> get(String name) {
        Class<? extends AnalyzerPlugin> type = bindings.get(name);
        if (type == null) {
            throw new NotFoundException("Plugin", name);
        }
        return type;
    }
    
    /**
     * Copy of all bindings, ordered by name.
     */
    public Map<String, Class<? extends AnalyzerPlugin>> list() {
        return new TreeMap<>(bindings);
    }
    
    public int size() {
        return bindings.size();
    }
    
    /**
     * Drop every binding. Bootstrap and test reset only.
     */
    public void clear() {
        synchronized (writeLock) {
            bindings = Map.of();
        }
        log.debug("Plugin registry cleared");
    }
    
    private static Class<? extends AnalyzerPlugin> validate(String name, Class<?> type) {
        if (name == null || name.isBlank()) {
            throw new TypeContractViolationException(String.valueOf(name), type, "name must not be blank");
        }
        if (type == null) {
            throw new TypeContractViolationException(name, null, "type must not be null");
        }
        if (!AnalyzerPlugin.class.isAssignableFrom(type)) {
            throw new TypeContractViolationException(name, type,
                    "does not implement " + AnalyzerPlugin.class.getSimpleName());
        }
        if (type.isInterface() || Modifier.isAbstract(type.getModifiers())) {
            throw new TypeContractViolationException(name, type, "must be a concrete class");
        }
        if (type.getConstructors().length == 0) {
            throw new TypeContractViolationException(name, type, "has no public constructor");
        }
        return type.asSubclass(AnalyzerPlugin.class);
    }
}
