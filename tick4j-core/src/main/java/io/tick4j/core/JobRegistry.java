package io.tick4j.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Registered jobs of one scheduler, in registration order.
 */
public class JobRegistry {

    private final Map<String, JobDefinition> definitionsById = new LinkedHashMap<>();

    public synchronized void add(JobDefinition definition) {
        if (definitionsById.putIfAbsent(definition.id(), definition) != null) {
            throw new ConfigurationException("Duplicate job id: " + definition.id());
        }
    }

    public synchronized JobDefinition get(String id) {
        return definitionsById.get(id);
    }

    /**
     * Snapshot in registration order.
     */
    public synchronized List<JobDefinition> all() {
        return Collections.unmodifiableList(new ArrayList<>(definitionsById.values()));
    }

    public synchronized int size() {
        return definitionsById.size();
    }
}
