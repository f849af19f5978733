package me.golemcore.relay.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import me.golemcore.relay.domain.exception.ErrorCode;
import me.golemcore.relay.domain.exception.RelayException;
import me.golemcore.relay.domain.model.rule.HeuristicRule;
import me.golemcore.relay.domain.model.rule.HeuristicRuleSet;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Parses heuristic policy content into a {@link HeuristicRuleSet}.
 *
 * <p>
 * Recognized keys: {@code maxLength}, {@code minLength},
 * {@code blockedPatterns}, {@code requiredPatterns}, {@code requireContext},
 * {@code blockedRecipients}, {@code trustedRecipients}. Any other key, a
 * wrongly typed value or an uncompilable regex is an {@link ErrorCode#INVALID_POLICY}
 * error. Patterns are compiled case-insensitively.
 */
@Component
@RequiredArgsConstructor
public class HeuristicRuleParser {

    private final ObjectMapper objectMapper;

    public HeuristicRuleSet parse(String content) {
        JsonNode root;
        try {
            root = content != null ? objectMapper.readTree(content) : null;
        } catch (JsonProcessingException e) {
            throw invalid("Policy content must be valid JSON");
        }
        if (root == null || !root.isObject()) {
            throw invalid("Policy content must be valid JSON");
        }

        List<HeuristicRule> rules = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String key = field.getKey();
            JsonNode value = field.getValue();
            if (value.isNull()) {
                continue;
            }
            switch (key) {
            case "maxLength" -> rules.add(new HeuristicRule.MaxLength(intValue(key, value)));
            case "minLength" -> rules.add(new HeuristicRule.MinLength(intValue(key, value)));
            case "blockedPatterns" -> rules.add(new HeuristicRule.BlockedPatterns(patterns(key, value)));
            case "requiredPatterns" -> rules.add(new HeuristicRule.RequiredPatterns(patterns(key, value)));
            case "requireContext" -> {
                if (!value.isBoolean()) {
                    throw invalid("requireContext must be a boolean");
                }
                if (value.booleanValue()) {
                    rules.add(new HeuristicRule.RequireContext());
                }
            }
            case "blockedRecipients" -> rules.add(new HeuristicRule.BlockedRecipients(strings(key, value)));
            case "trustedRecipients" -> rules.add(new HeuristicRule.TrustedRecipients(strings(key, value)));
            default -> throw invalid("Unknown heuristic rule: " + key);
            }
        }
        return new HeuristicRuleSet(rules);
    }

    private int intValue(String key, JsonNode value) {
        if (!value.isNumber()) {
            throw invalid(key + " must be a number");
        }
        if (!value.canConvertToExactIntegral() || !value.canConvertToInt()) {
            throw invalid(key + " must be a whole number");
        }
        return value.intValue();
    }

    private List<Pattern> patterns(String key, JsonNode value) {
        List<Pattern> patterns = new ArrayList<>();
        for (String source : strings(key, value)) {
            try {
                patterns.add(Pattern.compile(source, Pattern.CASE_INSENSITIVE));
            } catch (PatternSyntaxException e) {
                throw invalid("Invalid regex pattern: " + source);
            }
        }
        return List.copyOf(patterns);
    }

    private List<String> strings(String key, JsonNode value) {
        if (!value.isArray()) {
            throw invalid(key + " must be an array");
        }
        List<String> result = new ArrayList<>();
        for (JsonNode item : value) {
            if (!item.isTextual()) {
                throw invalid(key + " must contain only strings");
            }
            result.add(item.asText());
        }
        return List.copyOf(result);
    }

    private static RelayException invalid(String message) {
        return new RelayException(ErrorCode.INVALID_POLICY, message);
    }
}
