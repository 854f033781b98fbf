package com.example.cratebridge.domain.enumtype;

/**
 * What a migration does with a track whose audio file is not on disk.
 */
public enum MissingFileHandling {

    SKIP,

    INCLUDE_WITH_WARNING,

    /** Search the registered scan folders by file name; see {@code MigrationOptions#getNotLocatedFallback()}. */
    ATTEMPT_TO_LOCATE
}
