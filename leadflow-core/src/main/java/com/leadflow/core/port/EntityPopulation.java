package com.leadflow.core.port;

import java.util.List;

/**
 * The set of entity ids segment recalculation runs over.
 */
@FunctionalInterface
public interface EntityPopulation {

    List<String> entityIds();
}
