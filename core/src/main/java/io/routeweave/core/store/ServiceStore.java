package io.routeweave.core.store;

import com.fasterxml.jackson.databind.JsonNode;
import io.routeweave.core.model.ServiceRecord;
import java.util.List;
import java.util.Optional;

/** Persistence for {@link ServiceRecord} rows. */
public interface ServiceStore {

    Optional<ServiceRecord> findById(String id);

    /** All active services, ordered by id. Rows that cannot be read are skipped. */
    List<ServiceRecord> findActive();

    /** Ids of active services created by {@code sourceType}. */
    List<String> activeIdsBySourceType(String sourceType);

    /** Inserts or fully replaces a service row. */
    void save(ServiceRecord service);

    /** Replaces type and config of an upstream service and reactivates it. */
    void updateDefinition(String id, String type, JsonNode config);

    boolean disable(String id);
}
