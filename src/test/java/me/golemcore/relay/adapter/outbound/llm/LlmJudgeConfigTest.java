package me.golemcore.relay.adapter.outbound.llm;

import me.golemcore.relay.infrastructure.config.RelayProperties;
import me.golemcore.relay.port.outbound.LlmJudgePort;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

class LlmJudgeConfigTest {

    private static RelayProperties.LlmProperties config(String provider, String apiKey) {
        RelayProperties.LlmProperties config = new RelayProperties.LlmProperties();
        config.setProvider(provider);
        config.setApiKey(apiKey);
        return config;
    }

    @Test
    void shouldUseNoOpJudgeWithoutApiKey() throws Exception {
        LlmJudgePort port = LlmJudgeConfig.select(config("anthropic", ""));

        assertInstanceOf(NoOpJudgeAdapter.class, port);
        assertFalse(port.isAvailable());
        assertEquals("PASS\nLLM evaluation not configured", port.complete("anything").get());
    }

    @Test
    void shouldUseNoOpJudgeForProviderNone() {
        assertInstanceOf(NoOpJudgeAdapter.class, LlmJudgeConfig.select(config("none", "key")));
    }

    @Test
    void shouldBuildConfiguredProviders() {
        LlmJudgePort anthropic = LlmJudgeConfig.select(config("anthropic", "test-key"));
        LlmJudgePort openai = LlmJudgeConfig.select(config("OpenAI", "test-key"));

        assertInstanceOf(Langchain4jJudgeAdapter.class, anthropic);
        assertEquals("anthropic", anthropic.getProviderId());
        assertInstanceOf(Langchain4jJudgeAdapter.class, openai);
    }

    @Test
    void shouldRejectUnknownProvider() {
        assertThrows(IllegalStateException.class, () -> LlmJudgeConfig.select(config("cohere", "test-key")));
    }
}
