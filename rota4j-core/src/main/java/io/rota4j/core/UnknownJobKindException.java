package io.rota4j.core;

import io.rota4j.failure.PermanentJobException;

public class UnknownJobKindException extends PermanentJobException {

    public UnknownJobKindException(String kind) {
        super("No Worker registered for kind: " + kind);
    }
}
