package io.lapse4j.core;

public enum SubjectKind {
    CAMERA,
    EXPORT
}
