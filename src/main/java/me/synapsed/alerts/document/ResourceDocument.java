package me.synapsed.alerts.document;

import java.util.Map;
import java.util.Optional;

import me.synapsed.alerts.model.Resource;

/**
 * Destination of a compile pass: resources keyed by logical id.
 * The compiler only inserts, merges and deletes entries; it never owns the document.
 */
public interface ResourceDocument {

    Optional<Resource> get(String logicalId);

    /**
     * Merges the given resources into the document. An entry whose logical id already exists
     * is deep-merged over the existing declaration.
     */
    void merge(Map<String, Resource> resources);

    void delete(String logicalId);

    /**
     * @return a read-only view of all resources, in insertion order
     */
    Map<String, Resource> resources();
}
