package me.golemcore.relay.domain.model.rule;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HeuristicRuleSetTest {

    private static Optional<String> reason(HeuristicRuleSet ruleSet, RuleInput input) {
        return ruleSet.evaluate(input).map(HeuristicRuleSet.Violation::reason);
    }

    @Test
    void shouldEnforceLengthBounds() {
        HeuristicRuleSet ruleSet = new HeuristicRuleSet(List.of(
                new HeuristicRule.MaxLength(5), new HeuristicRule.MinLength(2)));

        assertEquals(Optional.of("Message exceeds maximum length of 5"),
                reason(ruleSet, RuleInput.direct("toolong", null, "bob")));
        assertEquals(Optional.of("Message is shorter than minimum length of 2"),
                reason(ruleSet, RuleInput.direct("x", null, "bob")));
        assertTrue(reason(ruleSet, RuleInput.direct("fine", null, "bob")).isEmpty());
    }

    @Test
    void shouldRequireEveryRequiredPattern() {
        HeuristicRuleSet ruleSet = new HeuristicRuleSet(List.of(new HeuristicRule.RequiredPatterns(List.of(
                Pattern.compile("hello", Pattern.CASE_INSENSITIVE),
                Pattern.compile("world", Pattern.CASE_INSENSITIVE)))));

        assertEquals(Optional.of("Message missing required pattern"),
                reason(ruleSet, RuleInput.direct("hello there", null, "bob")));
        assertTrue(reason(ruleSet, RuleInput.direct("Hello World", null, "bob")).isEmpty());
    }

    @Test
    void shouldReportFirstViolationInFixedOrder() {
        HeuristicRuleSet ruleSet = new HeuristicRuleSet(List.of(
                new HeuristicRule.TrustedRecipients(List.of("alice")),
                new HeuristicRule.RequireContext(),
                new HeuristicRule.MaxLength(3)));

        HeuristicRuleSet.Violation violation = ruleSet.evaluate(RuleInput.direct("long message", null, "bob"))
                .orElseThrow();

        assertInstanceOf(HeuristicRule.MaxLength.class, violation.rule());
    }

    @Test
    void shouldNameGroupWhenContextIsMissing() {
        HeuristicRuleSet ruleSet = new HeuristicRuleSet(List.of(new HeuristicRule.RequireContext()));

        assertEquals(Optional.of("Context is required for messages to group 'Team'"),
                reason(ruleSet, RuleInput.group("hi", "", "Team")));
        assertEquals(Optional.of("Context is required for this message"),
                reason(ruleSet, RuleInput.direct("hi", null, "bob")));
        assertTrue(reason(ruleSet, RuleInput.direct("hi", "weekly sync", "bob")).isEmpty());
    }

    @Test
    void shouldApplyRecipientListsToDirectSendsOnly() {
        HeuristicRuleSet blocked = new HeuristicRuleSet(List.of(new HeuristicRule.BlockedRecipients(List.of("eve"))));
        HeuristicRuleSet trusted = new HeuristicRuleSet(List.of(new HeuristicRule.TrustedRecipients(List.of("bob"))));

        assertEquals(Optional.of("Recipient is blocked by policy"),
                reason(blocked, RuleInput.direct("hi", null, "eve")));
        assertEquals(Optional.of("Recipient not in trusted list"),
                reason(trusted, RuleInput.direct("hi", null, "carol")));
        assertTrue(reason(trusted, RuleInput.direct("hi", null, "bob")).isEmpty());
        assertTrue(reason(trusted, RuleInput.group("hi", null, "Team")).isEmpty());
        assertTrue(reason(blocked, RuleInput.group("hi", null, "eve")).isEmpty());
    }
}
