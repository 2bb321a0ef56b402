package com.agile.Buro.exception;

import lombok.Getter;
import java.util.List;

@Getter
public class DuplicateFieldsException extends RuntimeException {
    private final List<String> duplicateFields;

    public DuplicateFieldsException(List<String> duplicateFields) {
        super("Already registered: " + String.join(", ", duplicateFields));
        this.duplicateFields = duplicateFields;
    }
}
