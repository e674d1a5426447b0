package com.gdin.inspection.semanticrouter.typesense;

public class TypesenseObjectAlreadyExistsException extends TypesenseException {

    public TypesenseObjectAlreadyExistsException(String message) {
        super(409, message);
    }
}
