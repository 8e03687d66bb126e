package io.github.cyfko.boolql.core.utils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Edit-distance helpers used to suggest close matches for misspelled names.
 *
 * @since 1.0.0
 */
public final class EditDistanceUtils {

    /**
     * Largest distance at which a name is still suggested by {@link #suggest(String, Collection)}.
     */
    public static final int DEFAULT_MAX_DISTANCE = 3;

    private EditDistanceUtils() {}

    /**
     * Levenshtein distance: the minimum number of single-character insertions, deletions
     * and substitutions turning {@code a} into {@code b}. Case-sensitive.
     *
     * @param a first string
     * @param b second string
     * @return the distance, {@code 0} iff the strings are equal
     */
    public static int levenshtein(String a, String b) {
        Objects.requireNonNull(a);
        Objects.requireNonNull(b);
        if (a.length() < b.length()) {
            return levenshtein(b, a);
        }
        if (b.isEmpty()) {
            return a.length();
        }

        // two-row dynamic programming over the shorter string
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }

        for (int i = 0; i < a.length(); i++) {
            current[0] = i + 1;
            for (int j = 0; j < b.length(); j++) {
                int insertion = previous[j + 1] + 1;
                int deletion = current[j] + 1;
                int substitution = previous[j] + (a.charAt(i) == b.charAt(j) ? 0 : 1);
                current[j + 1] = Math.min(Math.min(insertion, deletion), substitution);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }

        return previous[b.length()];
    }

    /**
     * Suggests candidates within {@value #DEFAULT_MAX_DISTANCE} edits of {@code name}.
     *
     * @see #suggest(String, Collection, int)
     */
    public static List<String> suggest(String name, Collection<String> candidates) {
        return suggest(name, candidates, DEFAULT_MAX_DISTANCE);
    }

    /**
     * Ranks candidates by case-insensitive edit distance to {@code name}.
     * <p>
     * Candidates farther than {@code maxDistance} are dropped; the rest are sorted by
     * distance, then by name.
     * </p>
     *
     * @param name        the name to match
     * @param candidates  available names
     * @param maxDistance largest accepted distance
     * @return matching candidates, closest first
     */
    public static List<String> suggest(String name, Collection<String> candidates, int maxDistance) {
        Objects.requireNonNull(name, "Name is required");
        Objects.requireNonNull(candidates, "Candidates are required");

        String lowerName = name.toLowerCase(Locale.ROOT);
        List<Candidate> matches = new ArrayList<>();
        for (String candidate : candidates) {
            int distance = levenshtein(lowerName, candidate.toLowerCase(Locale.ROOT));
            if (distance <= maxDistance) {
                matches.add(new Candidate(candidate, distance));
            }
        }

        return matches.stream()
                .sorted(Comparator.comparingInt(Candidate::distance).thenComparing(Candidate::name))
                .map(Candidate::name)
                .collect(Collectors.toList());
    }

    private record Candidate(String name, int distance) {}
}
