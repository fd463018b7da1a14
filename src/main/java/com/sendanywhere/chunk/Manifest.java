package com.sendanywhere.chunk;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Immutable description of what is being transferred: either a single file
 * or a folder of files. The two variants are told apart on the wire by the
 * explicit {@code kind} property.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = FileManifest.class, name = "file"),
        @JsonSubTypes.Type(value = FolderManifest.class, name = "folder")
})
public sealed interface Manifest permits FileManifest, FolderManifest {

    /** Display name: the file name or the folder name. */
    String name();

    int chunkSize();

    /** Total payload bytes. */
    long totalBytes();

    /**
     * Number of chunks in the transport id space. For a folder this is the
     * sum over its files, in file order.
     */
    int totalChunks();
}
