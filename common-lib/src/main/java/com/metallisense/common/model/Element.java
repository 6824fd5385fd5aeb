package com.metallisense.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.HashMap;
import java.util.Map;

/**
 * Chemical elements tracked by the spectrometer, in the fixed order used for
 * feature vectors and regression outputs.
 */
public enum Element {
    FE("Fe"),
    C("C"),
    SI("Si"),
    MN("Mn"),
    P("P"),
    S("S");

    private static final Map<String, Element> BY_SYMBOL = new HashMap<>();

    static {
        for (Element e : values()) {
            BY_SYMBOL.put(e.symbol, e);
        }
    }

    private final String symbol;

    Element(String symbol) {
        this.symbol = symbol;
    }

    @JsonValue
    public String symbol() {
        return symbol;
    }

    /**
     * Resolves a chemical symbol ("Fe", "Si", ...) to its element.
     * Returns null for symbols that are not tracked.
     */
    public static Element fromSymbol(String symbol) {
        return BY_SYMBOL.get(symbol);
    }
}
