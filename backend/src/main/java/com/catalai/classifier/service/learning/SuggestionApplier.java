package com.catalai.classifier.service.learning;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import org.springframework.stereotype.Component;

import com.catalai.classifier.dto.learning.LearningSuggestion;
import com.catalai.classifier.dto.learning.ProposedChange;
import com.catalai.classifier.dto.matrix.Attribute;
import com.catalai.classifier.dto.matrix.DecisionMatrix;
import com.catalai.classifier.dto.matrix.Rule;
import com.catalai.classifier.exception.WorkflowViolationException;
import com.catalai.classifier.service.matrix.DecisionMatrixParser;

import lombok.extern.slf4j.Slf4j;

/**
 * Merges an approved suggestion into a draft of the active matrix. The active matrix itself is
 * never modified; the caller publishes the draft as a new version.
 */
@Slf4j
@Component
public class SuggestionApplier {

  public DecisionMatrix apply(DecisionMatrix active, LearningSuggestion suggestion) {
    ProposedChange change = suggestion.getProposedChange();
    if (change == null) {
      throw new WorkflowViolationException("Suggestion " + suggestion.getId() + " carries no change");
    }
    List<Attribute> attributes = new ArrayList<>();
    for (Attribute attribute : active.getAttributes()) {
      attributes.add(attribute.toBuilder().build());
    }
    List<Rule> rules = new ArrayList<>();
    for (Rule rule : active.getRules()) {
      rules.add(
          rule.toBuilder()
              .conditions(
                  rule.getConditions() == null ? null : new ArrayList<>(rule.getConditions()))
              .build());
    }

    switch (suggestion.getType()) {
      case NEW_RULE:
        rules.add(
            change.getRule().toBuilder()
                .ruleId(change.getRule().getRuleId() != null ? change.getRule().getRuleId() : UUID.randomUUID().toString())
                .build());
        break;
      case MODIFY_RULE:
        int index = indexOfRule(rules, change.getRuleId(), suggestion);
        rules.set(index, change.getRule().toBuilder().ruleId(change.getRuleId()).build());
        break;
      case REMOVE_RULE:
        int removed = indexOfRule(rules, change.getRuleId(), suggestion);
        rules.set(removed, rules.get(removed).toBuilder().active(false).build());
        break;
      case ADJUST_WEIGHT:
        Attribute target =
            attributes.stream()
                .filter(a -> a.getName().equals(change.getAttributeName()))
                .findFirst()
                .orElseThrow(
                    () ->
                        new WorkflowViolationException(
                            String.format(
                                "Attribute '%s' of suggestion %s no longer exists",
                                change.getAttributeName(), suggestion.getId())));
        target.setWeight(DecisionMatrixParser.clamp(change.getWeight(), 0.0, 1.0));
        break;
      case NEW_ATTRIBUTE:
        String name = change.getAttribute().getName();
        if (attributes.stream().anyMatch(a -> a.getName().equals(name))) {
          throw new WorkflowViolationException(
              String.format("Attribute '%s' of suggestion %s already exists", name, suggestion.getId()));
        }
        attributes.add(change.getAttribute());
        break;
      default:
        throw new IllegalStateException("Unhandled suggestion type " + suggestion.getType());
    }
    log.debug("Applied {} suggestion {} to a draft of {}", suggestion.getType().getValue(), suggestion.getId(), active.getVersion());

    return DecisionMatrix.builder()
        .description(active.getDescription())
        .attributes(attributes)
        .rules(rules)
        .basedOnVersion(active.getVersion())
        .build();
  }

  private static int indexOfRule(List<Rule> rules, String ruleId, LearningSuggestion suggestion) {
    for (int i = 0; i < rules.size(); i++) {
      if (ruleId != null && ruleId.equals(rules.get(i).getRuleId())) {
        return i;
      }
    }
    throw new WorkflowViolationException(
        String.format("Rule '%s' of suggestion %s no longer exists", ruleId, suggestion.getId()));
  }
}
