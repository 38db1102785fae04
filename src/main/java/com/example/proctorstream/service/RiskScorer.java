package com.example.proctorstream.service;

import com.example.proctorstream.model.Severity;
import com.example.proctorstream.model.Violation;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;

/**
 * Folds a violation ledger into a risk score in [0, 1]: the sum of confidence times the
 * severity weight, capped at 1. The fold is order-independent, so recomputing it is idempotent.
 */
@Component
public class RiskScorer {

    private final Map<Severity, Double> weights = new EnumMap<>(Severity.class);

    public RiskScorer(@Value("${app.risk.weight.critical:0.4}") double critical,
                      @Value("${app.risk.weight.high:0.25}") double high,
                      @Value("${app.risk.weight.medium:0.1}") double medium,
                      @Value("${app.risk.weight.low:0.05}") double low) {
        weights.put(Severity.CRITICAL, critical);
        weights.put(Severity.HIGH, high);
        weights.put(Severity.MEDIUM, medium);
        weights.put(Severity.LOW, low);
    }

    public double score(Collection<Violation> violations) {
        double sum = 0.0;
        for (Violation violation : violations) {
            sum += violation.getConfidence() * weight(violation.severity());
        }
        return Math.max(0.0, Math.min(1.0, sum));
    }

    public double weight(Severity severity) {
        return weights.getOrDefault(severity, 0.0);
    }
}
