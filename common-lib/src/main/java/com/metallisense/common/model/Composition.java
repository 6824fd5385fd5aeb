package com.metallisense.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.metallisense.common.exception.InvalidCompositionException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable spectrometer reading: percentage of every tracked {@link Element}.
 *
 * <p>Every element must be present and each value must lie in [0, 100]. Values
 * are a measurement, so they are not required to sum to 100.
 */
public final class Composition {

    private static final double MIN_PERCENT = 0.0;
    private static final double MAX_PERCENT = 100.0;

    private final Map<Element, Double> values;

    private Composition(EnumMap<Element, Double> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    /**
     * Builds a composition from a symbol-keyed map such as {@code {"Fe": 85.5, "C": 3.2, ...}}.
     *
     * @throws InvalidCompositionException when an element is missing, unknown, non-finite
     *                                     or outside [0, 100]
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Composition of(Map<String, Double> bySymbol) {
        if (bySymbol == null) {
            throw new InvalidCompositionException("Composition is required");
        }
        EnumMap<Element, Double> parsed = new EnumMap<>(Element.class);
        for (Map.Entry<String, Double> entry : bySymbol.entrySet()) {
            Element element = Element.fromSymbol(entry.getKey());
            if (element == null) {
                throw new InvalidCompositionException("Unknown element: " + entry.getKey());
            }
            parsed.put(element, entry.getValue());
        }
        return ofElements(parsed);
    }

    public static Composition ofElements(Map<Element, Double> byElement) {
        EnumMap<Element, Double> copy = new EnumMap<>(Element.class);
        for (Element element : Element.values()) {
            Double value = byElement.get(element);
            if (value == null) {
                throw new InvalidCompositionException("Missing required element: " + element.symbol());
            }
            if (value.isNaN() || value.isInfinite() || value < MIN_PERCENT || value > MAX_PERCENT) {
                throw new InvalidCompositionException(String.format(
                    "Percentage for %s must be between 0 and 100, got %s", element.symbol(), value));
            }
            copy.put(element, value);
        }
        return new Composition(copy);
    }

    public double get(Element element) {
        return values.get(element);
    }

    /** Values in {@link Element} declaration order. */
    public double[] toVector() {
        double[] vector = new double[Element.values().length];
        for (Element element : Element.values()) {
            vector[element.ordinal()] = values.get(element);
        }
        return vector;
    }

    @JsonValue
    public Map<String, Double> toSymbolMap() {
        Map<String, Double> out = new LinkedHashMap<>();
        values.forEach((element, value) -> out.put(element.symbol(), value));
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Composition other)) return false;
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }

    @Override
    public String toString() {
        return toSymbolMap().toString();
    }
}
