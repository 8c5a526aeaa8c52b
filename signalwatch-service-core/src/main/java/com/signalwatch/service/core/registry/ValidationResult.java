package com.signalwatch.service.core.registry;

import java.util.List;

public record ValidationResult(boolean valid, List<String> errors) {

    private static final ValidationResult OK = new ValidationResult(true, List.of());

    public ValidationResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static ValidationResult ok() {
        return OK;
    }

    public static ValidationResult invalid(List<String> errors) {
        if (errors == null || errors.isEmpty()) {
            throw new IllegalArgumentException("an invalid result needs at least one error");
        }
        return new ValidationResult(false, errors);
    }

    public static ValidationResult invalid(String error) {
        return invalid(List.of(error));
    }
}
