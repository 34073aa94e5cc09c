package com.merlt.orchestrator.router;

public record PlanValidation(boolean valid, String reason) {

    public static PlanValidation ok() {
        return new PlanValidation(true, null);
    }

    public static PlanValidation invalid(String reason) {
        return new PlanValidation(false, reason);
    }
}
