package com.example.deckfinds.service;

import com.example.deckfinds.model.Find;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** A find as handed to callers, with the viewer-dependent {@code isNew} flag attached. */
public record ReportedFind(Find find, boolean isNew) {

    public ReportedFind {
        Objects.requireNonNull(find, "find");
    }

    /** Flat view used for JSON output. */
    public Map<String, Object> toView() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("id", find.id());
        m.put("name", find.name());
        m.put("icon", find.icon());
        m.put("color", find.color());
        m.put("rarity", find.rarity().label());
        m.put("positions", find.positions());
        m.put("isNew", isNew);
        return m;
    }
}
