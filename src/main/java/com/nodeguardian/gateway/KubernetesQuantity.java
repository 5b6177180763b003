package com.nodeguardian.gateway;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parser for Kubernetes resource quantities such as {@code 250m}, {@code 3920m}, {@code 16Gi},
 * {@code 123456789n} or {@code 1e3}.
 */
public final class KubernetesQuantity {

    private static final BigDecimal KI = BigDecimal.valueOf(1024);

    // binary suffixes first so "Mi" is not read as "M"
    private static final Map<String, BigDecimal> SUFFIXES = new LinkedHashMap<>();

    static {
        SUFFIXES.put("Ki", KI);
        SUFFIXES.put("Mi", KI.pow(2));
        SUFFIXES.put("Gi", KI.pow(3));
        SUFFIXES.put("Ti", KI.pow(4));
        SUFFIXES.put("Pi", KI.pow(5));
        SUFFIXES.put("Ei", KI.pow(6));
        SUFFIXES.put("n", new BigDecimal("1e-9"));
        SUFFIXES.put("u", new BigDecimal("1e-6"));
        SUFFIXES.put("m", new BigDecimal("1e-3"));
        SUFFIXES.put("k", new BigDecimal("1e3"));
        SUFFIXES.put("M", new BigDecimal("1e6"));
        SUFFIXES.put("G", new BigDecimal("1e9"));
        SUFFIXES.put("T", new BigDecimal("1e12"));
        SUFFIXES.put("P", new BigDecimal("1e15"));
        SUFFIXES.put("E", new BigDecimal("1e18"));
    }

    private KubernetesQuantity() {}

    /**
     * @return the quantity in base units (cores for CPU, bytes for memory)
     * @throws NumberFormatException if {@code quantity} is not a valid quantity
     */
    public static BigDecimal parse(String quantity) {
        if (quantity == null || quantity.isBlank()) {
            throw new NumberFormatException("Empty quantity");
        }
        String text = quantity.trim();
        for (Map.Entry<String, BigDecimal> suffix : SUFFIXES.entrySet()) {
            if (text.endsWith(suffix.getKey())) {
                String number = text.substring(0, text.length() - suffix.getKey().length());
                return number(number, quantity).multiply(suffix.getValue());
            }
        }
        return number(text, quantity);
    }

    private static BigDecimal number(String number, String quantity) {
        try {
            return new BigDecimal(number);
        } catch (NumberFormatException e) {
            throw new NumberFormatException("Invalid quantity " + quantity);
        }
    }
}
