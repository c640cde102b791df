package com.ecoenergy.anomaly.rules;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Tunables shared by every rule. What {@code multiplier} scales depends on the rule.
 */
@Value
@Builder(toBuilder = true)
public class RuleSettings {

    @Builder.Default
    boolean enabled = true;
    double multiplier;
    @NonNull
    SeverityTable severity;

    public static RuleSettings of(double multiplier, SeverityTable severity) {
        return RuleSettings.builder().multiplier(multiplier).severity(severity).build();
    }
}
