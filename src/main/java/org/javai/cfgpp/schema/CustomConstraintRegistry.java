package org.javai.cfgpp.schema;

/**
 * Lookup of handlers for {@link Constraint.Custom} constraints during validation.
 * <p>
 * When the validator meets a custom constraint it asks this registry for the
 * handler registered under the constraint's name. Unregistered names pass.
 */
public interface CustomConstraintRegistry {

	/**
	 * A registry without handlers: every custom constraint passes.
	 */
	CustomConstraintRegistry NONE = new CustomConstraintRegistry() {
		@Override
		public CustomConstraintHandler getHandler(String name) {
			return null;
		}

		@Override
		public boolean isRegistered(String name) {
			return false;
		}
	};

	/**
	 * @param name the custom constraint name
	 * @return the handler, or null if none is registered
	 */
	CustomConstraintHandler getHandler(String name);

	boolean isRegistered(String name);
}
