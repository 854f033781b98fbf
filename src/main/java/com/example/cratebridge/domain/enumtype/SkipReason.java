package com.example.cratebridge.domain.enumtype;

/**
 * Why a single document entry or track was left out of a read or migration.
 */
public enum SkipReason {

    MISSING_REQUIRED_FIELD,

    MISSING_PATH_COLUMN,

    DUPLICATE_IDENTITY,

    UNRESOLVED_REFERENCE,

    UNSUPPORTED_CUE_TYPE,

    INVALID_VALUE,

    FILE_MISSING
}
