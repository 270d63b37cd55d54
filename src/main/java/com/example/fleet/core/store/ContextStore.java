package com.example.fleet.core.store;

import java.util.List;
import java.util.Map;

public interface ContextStore {

    /**
     * Context name to the names of the servers enabled in that context.
     */
    Map<String, List<String>> contextServerMappings();
}
