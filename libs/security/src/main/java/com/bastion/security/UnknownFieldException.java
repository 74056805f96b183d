package com.bastion.security;

/**
 * Thrown when an update names a field that is not part of the user schema.
 */
public class UnknownFieldException extends UserDirectoryException {

    private final String fieldName;

    public UnknownFieldException(String fieldName) {
        super("Attribute " + fieldName + " does not exist");
        this.fieldName = fieldName;
    }

    public String fieldName() {
        return fieldName;
    }
}
