package com.example.docstandards.compliance.model;

import com.example.docstandards.standard.model.Severity;

import java.util.Comparator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public record Finding(
        String ruleId,
        Severity severity,
        String location,
        String message
) {
    // Indexed locations such as heading[0042]
    private static final Pattern INDEXED_LOCATION = Pattern.compile("(.*)\\[(\\d{1,18})]");

    /**
     * Orders indexed locations of the same kind by index, so {@code heading[9999]} precedes
     * {@code heading[10000]}; other locations compare as text.
     */
    public static final Comparator<Finding> BY_LOCATION_THEN_MESSAGE = Comparator
            .comparing(Finding::location, Finding::compareLocations)
            .thenComparing(Finding::message);

    static int compareLocations(String first, String second) {
        Matcher a = INDEXED_LOCATION.matcher(first);
        Matcher b = INDEXED_LOCATION.matcher(second);
        if (a.matches() && b.matches() && a.group(1).equals(b.group(1))) {
            int byIndex = Long.compare(Long.parseLong(a.group(2)), Long.parseLong(b.group(2)));
            if (byIndex != 0) {
                return byIndex;
            }
        }
        return first.compareTo(second);
    }
}
