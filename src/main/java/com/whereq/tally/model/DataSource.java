package com.whereq.tally.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Where to extract from. Passed through to the extractor untouched.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DataSource {

    /**
     * banking, erp or custom
     */
    private String type;

    private String url;

    private String apiEndpoint;

    @Builder.Default
    private Map<String, String> selectors = new HashMap<>();

    @Builder.Default
    private List<String> accountIdentifiers = new ArrayList<>();

    @Builder.Default
    private Map<String, String> headers = new HashMap<>();

    /**
     * Extractor-specific options
     */
    @Builder.Default
    private Map<String, Object> options = new HashMap<>();

    public DataSource copy() {
        return new DataSource(type, url, apiEndpoint,
            selectors != null ? new HashMap<>(selectors) : new HashMap<>(),
            accountIdentifiers != null ? new ArrayList<>(accountIdentifiers) : new ArrayList<>(),
            headers != null ? new HashMap<>(headers) : new HashMap<>(),
            options != null ? new HashMap<>(options) : new HashMap<>());
    }
}
