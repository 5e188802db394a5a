package com.huntflow.analytics;

import com.huntflow.display.Display;
import com.huntflow.session.HuntSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Routes APPLY to the analytics registered for the URI scheme
 */
public class AnalyticsRegistry {

    private static final Logger log = LoggerFactory.getLogger(AnalyticsRegistry.class);

    private final Map<String, AnalyticsInterface> analytics = new LinkedHashMap<>();

    public AnalyticsRegistry(List<AnalyticsInterface> analytics) {
        analytics.forEach(this::register);
    }

    public void register(AnalyticsInterface provider) {
        analytics.put(provider.scheme().toLowerCase(Locale.ROOT), provider);
    }

    public Set<String> schemes() {
        return new TreeSet<>(analytics.keySet());
    }

    public List<String> listAnalytics(String scheme) {
        AnalyticsInterface provider = analytics.get(scheme.toLowerCase(Locale.ROOT));
        return provider != null ? provider.listAnalytics() : Collections.emptyList();
    }

    public Optional<Display> execute(String uri, List<String> inputs, Map<String, Object> arguments,
                                     HuntSession session) {
        int separator = uri.indexOf("://");
        if (separator <= 0) {
            throw new AnalyticsException("analytics URI has no scheme", uri);
        }
        String scheme = uri.substring(0, separator).toLowerCase(Locale.ROOT);
        AnalyticsInterface provider = analytics.get(scheme);
        if (provider == null) {
            throw new AnalyticsException("no analytics registered for scheme " + scheme, uri);
        }
        log.debug("Applying {} on {} with {}", uri, inputs, arguments);
        return provider.execute(uri, inputs, arguments, session);
    }
}
