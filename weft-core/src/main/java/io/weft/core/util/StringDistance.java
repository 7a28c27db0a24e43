package io.weft.core.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/// Levenshtein-based "did you mean" suggestions for unknown names.
///
/// ### Contracts
/// - Exact matches are never suggested.
/// - Results are ordered by ascending distance; ties keep candidate order.
/// - The default threshold adapts to the target length: up to 3 characters allow
///   distance 1, up to 6 allow 2, longer names allow 3.
///
/// @implNote Stateless; safe for concurrent use.
public final class StringDistance {

    private StringDistance() {}

    /// Computes the edit distance between two strings.
    ///
    /// @param a first string, not null
    /// @param b second string, not null
    /// @return minimum number of single-character insertions, deletions or
    ///     substitutions turning `a` into `b`
    public static int levenshtein(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                current[j] =
                        Math.min(
                                Math.min(current[j - 1] + 1, previous[j] + 1),
                                previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }

    /// Returns candidates within the adaptive threshold for the target.
    ///
    /// @param target unknown name, not null
    /// @param candidates known names, not null
    /// @return close candidates, nearest first, never null
    public static List<String> findClosestMatches(String target, Collection<String> candidates) {
        return findClosestMatches(target, candidates, defaultMaxDistance(target));
    }

    /// Returns candidates within `maxDistance` of the target.
    ///
    /// @param target unknown name, not null
    /// @param candidates known names, not null
    /// @param maxDistance inclusive distance bound
    /// @return close candidates, nearest first, never null
    public static List<String> findClosestMatches(
            String target, Collection<String> candidates, int maxDistance) {
        List<Scored> scored = new ArrayList<>();
        for (String candidate : candidates) {
            if (candidate.equals(target)) {
                continue;
            }
            int distance = levenshtein(target, candidate);
            if (distance <= maxDistance) {
                scored.add(new Scored(candidate, distance));
            }
        }
        // List.sort is stable, so equidistant candidates keep their input order
        scored.sort(Comparator.comparingInt(Scored::distance));
        return scored.stream().map(Scored::candidate).toList();
    }

    /// Formats the best suggestion as a message suffix.
    ///
    /// @param target unknown name, not null
    /// @param candidates known names, not null
    /// @return ` Did you mean "x"?` or an empty string, never null
    public static String didYouMean(String target, Collection<String> candidates) {
        List<String> matches = findClosestMatches(target, candidates);
        return matches.isEmpty() ? "" : " Did you mean \"" + matches.get(0) + "\"?";
    }

    static int defaultMaxDistance(String target) {
        if (target.length() <= 3) {
            return 1;
        }
        if (target.length() <= 6) {
            return 2;
        }
        return 3;
    }

    private record Scored(String candidate, int distance) {}
}
