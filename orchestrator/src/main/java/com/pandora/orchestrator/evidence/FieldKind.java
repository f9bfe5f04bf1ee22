package com.pandora.orchestrator.evidence;

/** Declared type of a mapped field; decides the default used when the source lacks it. */
public enum FieldKind {
    NUMBER,
    STRING,
    DATE,
    BOOLEAN
}
