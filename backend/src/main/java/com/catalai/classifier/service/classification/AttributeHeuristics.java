package com.catalai.classifier.service.classification;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

import com.catalai.classifier.dto.classification.ClarificationExchange;
import com.catalai.classifier.dto.matrix.Attribute;
import com.catalai.classifier.dto.matrix.AttributeType;
import com.catalai.classifier.service.matrix.DecisionMatrixEvaluator;

import lombok.extern.slf4j.Slf4j;

/**
 * Keyword-based attribute extraction, used when the LLM could not extract attributes. Only the
 * standard business attributes are recognised; every other declared attribute is unknown.
 */
@Slf4j
@Component
public class AttributeHeuristics {

  private static final Pattern USER_COUNT = Pattern.compile("(\\d+)\\s*(users?|people|employees|staff)");

  public Map<String, Object> extract(
      String description, List<ClarificationExchange> exchanges, List<Attribute> declared) {
    StringBuilder text = new StringBuilder(description == null ? "" : description);
    for (ClarificationExchange exchange : exchanges) {
      text.append(' ').append(exchange.getQuestion()).append(' ').append(exchange.getAnswer());
    }
    Map<String, String> guesses = guess(text.toString().toLowerCase(Locale.ROOT));

    Map<String, Object> values = new LinkedHashMap<>();
    for (Attribute attribute : declared) {
      String guess = guesses.get(attribute.getName());
      values.put(attribute.getName(), accepts(attribute, guess) ? guess : DecisionMatrixEvaluator.UNKNOWN);
    }
    log.debug("Heuristic attributes: {}", values);
    return values;
  }

  Map<String, String> guess(String text) {
    Map<String, String> guesses = new LinkedHashMap<>();

    if (text.contains("hourly") || text.contains("every hour")) {
      guesses.put("frequency", "hourly");
    } else if (text.contains("daily") || text.contains("every day")) {
      guesses.put("frequency", "daily");
    } else if (text.contains("weekly") || text.contains("every week")) {
      guesses.put("frequency", "weekly");
    } else if (text.contains("monthly") || text.contains("every month")) {
      guesses.put("frequency", "monthly");
    } else if (text.contains("quarterly") || text.contains("yearly") || text.contains("annually")) {
      guesses.put("frequency", "rare");
    }

    if (text.contains("critical") || text.contains("essential") || text.contains("vital")) {
      guesses.put("business_value", "critical");
    } else if (text.contains("high value") || text.contains("important")) {
      guesses.put("business_value", "high");
    } else if (text.contains("low value") || text.contains("minor")) {
      guesses.put("business_value", "low");
    } else {
      guesses.put("business_value", "medium");
    }

    if (text.contains("very complex") || text.contains("extremely complex")) {
      guesses.put("complexity", "very_high");
    } else if (text.contains("complex") || text.contains("complicated")) {
      guesses.put("complexity", "high");
    } else if (text.contains("simple") || text.contains("straightforward")) {
      guesses.put("complexity", "low");
    } else {
      guesses.put("complexity", "medium");
    }

    if (text.contains("critical risk") || text.contains("high risk")) {
      guesses.put("risk", "critical");
    } else if (text.contains("low risk") || text.contains("safe")) {
      guesses.put("risk", "low");
    } else if (text.contains("risky") || text.contains("risk")) {
      guesses.put("risk", "high");
    } else {
      guesses.put("risk", "medium");
    }

    Matcher users = USER_COUNT.matcher(text);
    if (users.find()) {
      guesses.put("user_count", userBucket(Long.parseLong(users.group(1))));
    }

    if (text.contains("restricted") || text.contains("classified")) {
      guesses.put("data_sensitivity", "restricted");
    } else if (text.contains("confidential") || text.contains("sensitive")) {
      guesses.put("data_sensitivity", "confidential");
    } else if (text.contains("internal")) {
      guesses.put("data_sensitivity", "internal");
    } else {
      guesses.put("data_sensitivity", "public");
    }
    return guesses;
  }

  static String userBucket(long count) {
    if (count <= 10) {
      return "1-10";
    }
    if (count <= 50) {
      return "11-50";
    }
    if (count <= 200) {
      return "51-200";
    }
    return "200+";
  }

  private static boolean accepts(Attribute attribute, String value) {
    if (value == null) {
      return false;
    }
    if (attribute.getType() != AttributeType.CATEGORICAL) {
      return false;
    }
    if (attribute.getPossibleValues() == null || attribute.getPossibleValues().isEmpty()) {
      return true;
    }
    return attribute.getPossibleValues().stream().anyMatch(v -> v.equalsIgnoreCase(value));
  }
}
