package com.think.script;

import java.util.List;

import com.think.script.parser.ThinkException;
import com.think.script.parser.ValidationError;

/**
 * Raised when a program with validation errors is handed to execution. Carries
 * every diagnostic; the position is that of the first one.
 */
public class ThinkValidationException extends ThinkException {

    private static final long serialVersionUID = 1L;

    private final transient List<ValidationError> errors;

    public ThinkValidationException(List<ValidationError> errors) {
        super(summary(errors), errors.isEmpty() ? -1 : errors.get(0).getLine(),
                errors.isEmpty() ? -1 : errors.get(0).getColumn());
        this.errors = List.copyOf(errors);
    }

    public List<ValidationError> getErrors() {
        return errors;
    }

    private static String summary(List<ValidationError> errors) {
        StringBuilder sb = new StringBuilder();
        sb.append("Program has ").append(errors.size()).append(" validation error")
                .append(errors.size() == 1 ? "" : "s");
        for (ValidationError e : errors) {
            sb.append("\n  ").append(e);
        }
        return sb.toString();
    }
}
