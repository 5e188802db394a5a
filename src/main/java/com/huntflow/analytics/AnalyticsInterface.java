package com.huntflow.analytics;

import com.huntflow.display.Display;
import com.huntflow.session.HuntSession;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Analytics provider for one URI scheme.
 *
 * <p>An analytics reads its input variables through the session and may enrich them by
 * creating variables of the same name; whatever it wants shown is returned as a display.
 */
public interface AnalyticsInterface {

    String scheme();

    /**
     * Names of the analytics, without the {@code scheme://} prefix
     */
    List<String> listAnalytics();

    Optional<Display> execute(String uri, List<String> inputs, Map<String, Object> arguments, HuntSession session);
}
