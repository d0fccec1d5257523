package io.routeweave.core.merge;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Instant;

/**
 * A merged routing document together with its serialized form.
 *
 * @param document    the document; callers must not mutate it
 * @param json        compact JSON of {@code document}, byte-stable across merges of equal input
 * @param sourceType  data source the upstream part came from
 * @param generatedAt when the merge ran
 */
public record MergedConfig(ObjectNode document, String json, String sourceType, Instant generatedAt) {}
