package com.catalai.classifier.service.clarification;

import java.util.Arrays;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/** Text comparisons used by the clarification loop guards. */
public final class QuestionSimilarity {

  private static final Pattern NON_WORD = Pattern.compile("[^a-z0-9 ]");
  private static final Pattern SPACES = Pattern.compile("\\s+");

  private static final Set<String> STOP_WORDS =
      new HashSet<>(
          Arrays.asList(
              "a", "an", "the", "is", "are", "do", "does", "you", "your", "of", "to", "in", "for",
              "this", "that", "it", "how", "what", "on", "and", "or", "be"));

  private static final List<Pattern> DONT_KNOW =
      List.of(
          Pattern.compile("\\b(i )?(do not|dont|don t) know\\b"),
          Pattern.compile("\\bnot (really )?sure\\b"),
          Pattern.compile("\\bno (idea|clue)\\b"),
          Pattern.compile("\\bunsure\\b"),
          Pattern.compile("\\b(cannot|cant|can t) (say|tell)\\b"),
          Pattern.compile("\\bnot certain\\b"),
          Pattern.compile("^(idk|n a|na|unknown|pass|skip)$"));

  private QuestionSimilarity() {}

  /** Lower-cases, drops punctuation and collapses whitespace. */
  public static String normalize(String text) {
    if (text == null) {
      return "";
    }
    String lower = text.toLowerCase(Locale.ROOT).replace('’', '\'').replace("'", "");
    return SPACES.matcher(NON_WORD.matcher(lower).replaceAll(" ")).replaceAll(" ").trim();
  }

  /** Jaccard similarity of the content words of two questions. */
  public static double similarity(String a, String b) {
    Set<String> left = tokens(a);
    Set<String> right = tokens(b);
    if (left.isEmpty() && right.isEmpty()) {
      return normalize(a).equals(normalize(b)) ? 1.0 : 0.0;
    }
    Set<String> intersection = new HashSet<>(left);
    intersection.retainAll(right);
    Set<String> union = new HashSet<>(left);
    union.addAll(right);
    return (double) intersection.size() / union.size();
  }

  public static boolean isDuplicate(String candidate, Collection<String> previous, double threshold) {
    String normalized = normalize(candidate);
    for (String earlier : previous) {
      if (normalized.equals(normalize(earlier)) || similarity(candidate, earlier) >= threshold) {
        return true;
      }
    }
    return false;
  }

  public static boolean isDontKnow(String answer) {
    String normalized = normalize(answer);
    if (normalized.isEmpty()) {
      return true;
    }
    return DONT_KNOW.stream().anyMatch(p -> p.matcher(normalized).find());
  }

  private static Set<String> tokens(String text) {
    String normalized = normalize(text);
    if (normalized.isEmpty()) {
      return new HashSet<>();
    }
    return Arrays.stream(normalized.split(" "))
        .filter(t -> !STOP_WORDS.contains(t))
        .collect(Collectors.toSet());
  }
}
