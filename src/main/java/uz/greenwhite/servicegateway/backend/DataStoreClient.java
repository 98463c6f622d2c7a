package uz.greenwhite.servicegateway.backend;

import java.util.List;
import java.util.Map;

/**
 * Primary data store, reached only through the orchestrator's internal path.
 */
public interface DataStoreClient {

    List<Map<String, Object>> fetch(String table, Map<String, Object> filters);

    List<Map<String, Object>> insert(String table, Map<String, Object> data);

    List<Map<String, Object>> update(String table, String id, Map<String, Object> data);

    void delete(String table, String id);

    /**
     * @return true when the store answers
     */
    boolean ping();
}
