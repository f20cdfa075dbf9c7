package com.leadflow.core.model;

/**
 * Declared type of an entity field addressable by rules.
 */
public enum FieldType {
    STRING,
    NUMBER,
    BOOLEAN,
    DATETIME,
    COLLECTION
}
