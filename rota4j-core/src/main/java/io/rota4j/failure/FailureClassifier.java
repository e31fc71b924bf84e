package io.rota4j.failure;

@FunctionalInterface
public interface FailureClassifier {

    FailureKind classify(Throwable error);
}
