package com.interngenie.gateway.recommend.util;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Case-insensitive plain substring matching shared by the scorer and the explanation generator.
 * Blank values count as absent.
 */
public final class MatchTextUtils {

    private MatchTextUtils() {
    }

    public static boolean isPresent(String value) {
        return value != null && !value.isBlank();
    }

    public static boolean containsIgnoreCase(String haystack, String needle) {
        if (haystack == null || needle == null) {
            return false;
        }
        return haystack.toLowerCase(Locale.ROOT).contains(needle.toLowerCase(Locale.ROOT));
    }

    /**
     * True when both locations are declared and either one contains the other.
     */
    public static boolean locationsOverlap(String profileLocation, String postingLocation) {
        if (!isPresent(profileLocation) || !isPresent(postingLocation)) {
            return false;
        }
        return containsIgnoreCase(profileLocation, postingLocation)
            || containsIgnoreCase(postingLocation, profileLocation);
    }

    public static boolean educationSatisfied(String profileEducation, String minEducation) {
        if (!isPresent(profileEducation) || !isPresent(minEducation)) {
            return false;
        }
        return containsIgnoreCase(profileEducation, minEducation);
    }

    public static List<String> splitSkills(String skills) {
        List<String> result = new ArrayList<>();
        if (!isPresent(skills)) {
            return result;
        }
        for (String token : skills.split(",")) {
            String trimmed = token.trim();
            if (!trimmed.isEmpty()) {
                result.add(trimmed);
            }
        }
        return result;
    }

    /**
     * Profile skills, in profile order and without dedup, that some required skill contains.
     */
    public static List<String> matchingSkills(List<String> profileSkills, List<String> requiredSkills) {
        List<String> matches = new ArrayList<>();
        for (String skill : profileSkills) {
            for (String required : requiredSkills) {
                if (containsIgnoreCase(required, skill)) {
                    matches.add(skill);
                    break;
                }
            }
        }
        return matches;
    }
}
