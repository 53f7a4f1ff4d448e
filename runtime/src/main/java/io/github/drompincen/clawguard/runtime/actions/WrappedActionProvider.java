package io.github.drompincen.clawguard.runtime.actions;

/**
 * Provider that decorates another one. Used to find the undecorated provider when re-wrapping.
 */
public interface WrappedActionProvider extends ActionProvider {

    ActionProvider inner();

    static ActionProvider unwrap(ActionProvider provider) {
        ActionProvider current = provider;
        while (current instanceof WrappedActionProvider wrapped) {
            current = wrapped.inner();
        }
        return current;
    }
}
