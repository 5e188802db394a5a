package com.huntflow.datasource;

import java.util.List;
import java.util.Map;

/**
 * Connector for one URI scheme, e.g. {@code file} or {@code stixshifter}
 */
public interface DataSourceConnector {

    String scheme();

    /**
     * Names of the sources this connector knows about, without the {@code scheme://} prefix
     */
    List<String> listDataSources();

    /**
     * Entities matching a wire pattern, as rows of the pattern's center type
     *
     * @throws DataSourceException if the source cannot be read
     * @throws com.huntflow.store.StorePatternException if the pattern cannot be evaluated
     */
    List<Map<String, Object>> query(String uri, String wirePattern);
}
