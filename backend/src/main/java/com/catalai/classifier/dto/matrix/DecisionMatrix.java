package com.catalai.classifier.dto.matrix;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One published version of the decision matrix. Versions are never edited once stored; every
 * change is saved as a new version.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Versioned set of attributes and rules")
public class DecisionMatrix {

  @Schema(description = "Dotted major.minor version", example = "1.3")
  private String version;

  private Instant createdAt;

  private MatrixCreator createdBy;

  private String description;

  @Builder.Default private List<Attribute> attributes = new ArrayList<>();

  @Builder.Default private List<Rule> rules = new ArrayList<>();

  private boolean active;

  @Schema(description = "Version the author edited; differs from previousVersion on a save conflict")
  private String basedOnVersion;

  @Schema(description = "Version that was active when this one was published")
  private String previousVersion;

  @JsonIgnore
  public Optional<Attribute> findAttribute(String name) {
    if (name == null || attributes == null) {
      return Optional.empty();
    }
    return attributes.stream().filter(a -> name.equals(a.getName())).findFirst();
  }

  @JsonIgnore
  public Optional<Rule> findRule(String ruleId) {
    if (ruleId == null || rules == null) {
      return Optional.empty();
    }
    return rules.stream().filter(r -> ruleId.equals(r.getRuleId())).findFirst();
  }
}
