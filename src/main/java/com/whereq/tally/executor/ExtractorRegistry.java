package com.whereq.tally.executor;

import com.whereq.tally.exception.UnsupportedMethodException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Selects the extractor for a job's extraction method
 */
@Slf4j
@Service
public class ExtractorRegistry {

    private final Map<String, Extractor> extractors = new ConcurrentHashMap<>();

    @Autowired
    public ExtractorRegistry(List<Extractor> extractors) {
        extractors.forEach(this::register);
    }

    /**
     * Add or replace the extractor for its method
     */
    public void register(Extractor extractor) {
        Extractor previous = extractors.put(extractor.getMethod(), extractor);
        if (previous != null && previous != extractor) {
            log.warn("Extractor for method '{}' replaced: {} -> {}", extractor.getMethod(),
                previous.getClass().getSimpleName(), extractor.getClass().getSimpleName());
        } else {
            log.info("Registered extractor {} for method '{}'", extractor.getClass().getSimpleName(), extractor.getMethod());
        }
    }

    /**
     * @throws UnsupportedMethodException if no extractor serves the method
     */
    public Extractor get(String method) {
        Extractor extractor = method != null ? extractors.get(method) : null;
        if (extractor == null) {
            throw new UnsupportedMethodException("Unsupported extraction method: " + method);
        }
        return extractor;
    }

    public boolean supports(String method) {
        return method != null && extractors.containsKey(method);
    }

    public Set<String> getMethods() {
        return new TreeSet<>(extractors.keySet());
    }
}
