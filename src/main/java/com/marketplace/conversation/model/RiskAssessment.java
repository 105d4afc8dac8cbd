package com.marketplace.conversation.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RiskAssessment {
    private int score;                  // capped sum of signal points, 0..100
    private RiskTier tier;
    private List<RiskSignal> signals;

    public boolean hasSignal(RiskSignal signal) {
        return signals != null && signals.contains(signal);
    }

    public int profileContribution() {
        return contribution(RiskSignal.Source.PROFILE);
    }

    public int contentContribution() {
        return contribution(RiskSignal.Source.CONTENT);
    }

    private int contribution(RiskSignal.Source source) {
        if (signals == null) return 0;
        return signals.stream()
                .filter(s -> s.getSource() == source)
                .mapToInt(RiskSignal::getPoints)
                .sum();
    }
}
