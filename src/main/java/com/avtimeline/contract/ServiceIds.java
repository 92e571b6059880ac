package com.avtimeline.contract;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Derives the stable service identifier from company and location.
 */
public final class ServiceIds {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private ServiceIds() {
    }

    /**
     * "Waymo", "San Francisco" becomes "waymo-san-francisco".
     */
    public static String of(String company, String location) {
        if (company == null || company.isBlank() || location == null || location.isBlank()) {
            throw new ContractViolationException("company and location are required to identify a service");
        }
        return slug(company) + "-" + slug(location);
    }

    static String slug(String text) {
        return WHITESPACE.matcher(text.trim().toLowerCase(Locale.ROOT)).replaceAll("-");
    }
}
