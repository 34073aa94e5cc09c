package com.merlt.orchestrator.router;

public enum RouterState {
    GENERATE,
    VALIDATE,
    DONE,
    REJECTED
}
