package it.unimib.datai.frontdoor.lambda.init;

public enum LifecycleState {
    UNINITIALIZED,
    INITIALIZING,
    READY
}
