package io.wafgate.core.lifecycle;

/** Where a {@link WafLifecycle} stands. {@code READY} and {@code FAILED} are terminal. */
public enum LifecycleState {
    UNINITIALIZED,
    READY,
    FAILED
}
