package uk.gegc.mockexam.features.question.infra.factory;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.mockexam.features.question.domain.model.QuestionType;
import uk.gegc.mockexam.features.question.infra.rules.QuestionRuleSet;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
@Slf4j
public class QuestionRuleSetFactory {
    private final Map<QuestionType, QuestionRuleSet> ruleSets = new EnumMap<>(QuestionType.class);

    public QuestionRuleSetFactory(List<QuestionRuleSet> ruleSets) {
        ruleSets.forEach(ruleSet -> this.ruleSets.put(ruleSet.supportedType(), ruleSet));
        log.info("QuestionRuleSetFactory initialized with rule sets for types: {}", this.ruleSets.keySet());
    }

    /**
     * Records without a type are checked as multiple-choice.
     */
    public QuestionRuleSet getRuleSet(QuestionType type) {
        QuestionType resolved = type == null ? QuestionType.MULTIPLE_CHOICE : type;
        QuestionRuleSet ruleSet = ruleSets.get(resolved);
        if (ruleSet == null) {
            throw new UnsupportedOperationException("No rule set for type " + resolved);
        }
        return ruleSet;
    }
}
