package com.merlt.orchestrator.llm;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ResilientLanguageModelClientTest {

    record Verdict(String answer, double score) {
    }

    private static final class ScriptedProvider implements LanguageModelProvider {
        private final String name;
        private final Supplier<String> reply;
        private final AtomicInteger calls = new AtomicInteger();

        ScriptedProvider(String name, Supplier<String> reply) {
            this.name = name;
            this.reply = reply;
        }

        @Override
        public String name() {
            return this.name;
        }

        @Override
        public String complete(String systemPrompt, String userPrompt) {
            this.calls.incrementAndGet();
            return this.reply.get();
        }
    }

    private static ResilientLanguageModelClient client(long timeoutMs, LanguageModelProvider... providers) {
        return new ResilientLanguageModelClient(List.of(providers), new ObjectMapper(), timeoutMs, 2, Duration.ofMinutes(5), 1);
    }

    private static Supplier<String> failing() {
        return () -> {
            throw new IllegalStateException("connection refused");
        };
    }

    @Nested
    @DisplayName("Provider fallback")
    class FallbackTest {
        @Test
        @DisplayName("The first healthy provider answers")
        void primaryAnswers() {
            ScriptedProvider primary = new ScriptedProvider("ollama", () -> "{\"answer\":\"yes\",\"score\":0.8}");
            ScriptedProvider backup = new ScriptedProvider("backup", () -> "{\"answer\":\"no\",\"score\":0.1}");

            Verdict verdict = client(1000, primary, backup).generateStructured("sys", "user", Verdict.class);

            assertThat(verdict).isEqualTo(new Verdict("yes", 0.8));
            assertThat(backup.calls.get()).isZero();
        }

        @Test
        @DisplayName("A failing provider falls through to the next")
        void fallsBack() {
            ScriptedProvider primary = new ScriptedProvider("ollama", failing());
            ScriptedProvider backup = new ScriptedProvider("backup", () -> "{\"answer\":\"no\",\"score\":0.1}");

            assertThat(client(1000, primary, backup).generateStructured("sys", "user", Verdict.class).answer()).isEqualTo("no");
        }

        @Test
        @DisplayName("Unparseable output counts as a failure of that provider")
        void malformedOutput() {
            ScriptedProvider primary = new ScriptedProvider("ollama", () -> "I would rather not answer in JSON");
            ScriptedProvider backup = new ScriptedProvider("backup", () -> "{\"answer\":\"ok\",\"score\":1}");

            assertThat(client(1000, primary, backup).generateStructured("sys", "user", Verdict.class).answer()).isEqualTo("ok");
        }

        @Test
        @DisplayName("A slow provider is abandoned after the call timeout")
        void timeout() {
            ScriptedProvider slow = new ScriptedProvider("slow", () -> {
                try {
                    Thread.sleep(2000);
                }
                catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return "{\"answer\":\"late\",\"score\":0}";
            });
            ScriptedProvider backup = new ScriptedProvider("backup", () -> "{\"answer\":\"fast\",\"score\":0}");

            long start = System.currentTimeMillis();
            Verdict verdict = client(100, slow, backup).generateStructured("sys", "user", Verdict.class);

            assertThat(verdict.answer()).isEqualTo("fast");
            assertThat(System.currentTimeMillis() - start).isLessThan(1500L);
        }

        @Test
        @DisplayName("When every provider fails the failures are reported together")
        void allFail() {
            ScriptedProvider primary = new ScriptedProvider("ollama", failing());
            ScriptedProvider backup = new ScriptedProvider("backup", () -> "not json");

            assertThatThrownBy(() -> client(1000, primary, backup).generateStructured("sys", "user", Verdict.class))
                    .isInstanceOf(LanguageModelUnavailableException.class)
                    .satisfies(e -> assertThat(((LanguageModelUnavailableException) e).getFailures())
                            .containsExactly("ollama: IllegalStateException", "backup: malformed output"));
        }

        @Test
        @DisplayName("Repeated failures open the provider's breaker so it is skipped")
        void breakerOpens() {
            ScriptedProvider primary = new ScriptedProvider("ollama", failing());
            ScriptedProvider backup = new ScriptedProvider("backup", () -> "{\"answer\":\"ok\",\"score\":1}");
            ResilientLanguageModelClient client = client(1000, primary, backup);

            for (int i = 0; i < 4; i++) {
                client.generateStructured("sys", "user", Verdict.class);
            }

            assertThat(primary.calls.get()).isEqualTo(2);
            assertThat(client.breakers().get(0).state()).isEqualTo(ProviderCircuitBreaker.State.OPEN);
            assertThat(backup.calls.get()).isEqualTo(4);
        }
    }

    @Test
    @DisplayName("A provider that keeps returning malformed output trips its breaker")
    void malformedOutputOpensBreaker() {
        ScriptedProvider chatty = new ScriptedProvider("ollama", () -> "Sure! Here is my plan without JSON.");
        ScriptedProvider backup = new ScriptedProvider("backup", () -> "{\"answer\":\"ok\",\"score\":1}");
        ResilientLanguageModelClient client = client(1000, chatty, backup);

        for (int i = 0; i < 3; i++) {
            client.generateStructured("sys", "user", Verdict.class);
        }

        assertThat(chatty.calls.get()).isEqualTo(2);
        assertThat(client.breakers().get(0).state()).isEqualTo(ProviderCircuitBreaker.State.OPEN);
        assertThat(client.breakers().get(0).lastFailure()).isEqualTo("IllegalArgumentException");
    }

    @Nested
    @DisplayName("JSON extraction")
    class ExtractionTest {
        @Test
        @DisplayName("Strips a markdown code fence")
        void codeFence() {
            assertThat(ResilientLanguageModelClient.extractJson("```json\n{\"a\":1}\n```")).isEqualTo("{\"a\":1}");
        }

        @Test
        @DisplayName("Ignores prose around the object")
        void prose() {
            assertThat(ResilientLanguageModelClient.extractJson("Here is the plan: {\"a\":{\"b\":2}} hope it helps"))
                    .isEqualTo("{\"a\":{\"b\":2}}");
        }

        @Test
        @DisplayName("No object gives null")
        void noObject() {
            assertThat(ResilientLanguageModelClient.extractJson("nothing here")).isNull();
            assertThat(ResilientLanguageModelClient.extractJson(null)).isNull();
        }
    }

    @Test
    @DisplayName("At least one provider is required")
    void requiresProvider() {
        assertThatThrownBy(() -> new ResilientLanguageModelClient(List.of(), new ObjectMapper(), 100, 1, Duration.ofSeconds(1), 1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
