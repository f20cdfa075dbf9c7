package com.leadflow.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Action handlers by action kind. One handler per kind; handlers are
 * registered while the engine is wired.
 */
public class ActionHandlerRegistry {
    
    private static final Logger log = LoggerFactory.getLogger(ActionHandlerRegistry.class);
    
    private final Map<String, ActionHandler> handlers = new ConcurrentHashMap<>();
    
    /**
     * Registry holding the built-in {@code wait} handler.
     */
    public static ActionHandlerRegistry withBuiltIns() {
        ActionHandlerRegistry registry = new ActionHandlerRegistry();
        registry.register(WaitActionHandler.KIND, new WaitActionHandler());
        return registry;
    }
    
    /**
     * Register a handler.
     * 
     * @throws IllegalArgumentException if the kind is blank or already registered
     */
    public ActionHandlerRegistry register(String actionKind, ActionHandler handler) {
        if (actionKind == null || actionKind.isBlank()) {
            throw new IllegalArgumentException("Action kind cannot be empty");
        }
        if (handlers.putIfAbsent(actionKind, handler) != null) {
            throw new IllegalArgumentException("Handler already registered for action kind: " + actionKind);
        }
        log.info("Registered action handler: {}", actionKind);
        return this;
    }
    
    public Optional<ActionHandler> find(String actionKind) {
        return Optional.ofNullable(handlers.get(actionKind));
    }
    
    public boolean contains(String actionKind) {
        return handlers.containsKey(actionKind);
    }
    
    public Set<String> kinds() {
        return new TreeSet<>(handlers.keySet());
    }
}
