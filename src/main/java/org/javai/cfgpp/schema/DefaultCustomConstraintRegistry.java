package org.javai.cfgpp.schema;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Default implementation of CustomConstraintRegistry.
 * 
 * Handlers are normally registered once at start-up; the backing map tolerates
 * validations running while that happens.
 */
public class DefaultCustomConstraintRegistry implements CustomConstraintRegistry {

	private final Map<String, CustomConstraintHandler> handlers = new ConcurrentHashMap<>();

	/**
	 * Adds or replaces the handler for a custom constraint name.
	 *
	 * @throws IllegalArgumentException if name is null or blank, or handler is null
	 */
	public DefaultCustomConstraintRegistry addHandler(String name, CustomConstraintHandler handler) {
		if (name == null || name.isBlank()) {
			throw new IllegalArgumentException("Constraint name cannot be null or empty");
		}
		if (handler == null) {
			throw new IllegalArgumentException("Handler cannot be null");
		}
		handlers.put(name, handler);
		return this;
	}

	@Override
	public CustomConstraintHandler getHandler(String name) {
		return handlers.get(name);
	}

	@Override
	public boolean isRegistered(String name) {
		return handlers.containsKey(name);
	}

	public int size() {
		return handlers.size();
	}

	public void clear() {
		handlers.clear();
	}
}
