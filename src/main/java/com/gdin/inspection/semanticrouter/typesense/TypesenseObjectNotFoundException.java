package com.gdin.inspection.semanticrouter.typesense;

public class TypesenseObjectNotFoundException extends TypesenseException {

    public TypesenseObjectNotFoundException(String message) {
        super(404, message);
    }
}
