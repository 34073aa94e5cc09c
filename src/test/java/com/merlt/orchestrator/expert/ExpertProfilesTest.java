package com.merlt.orchestrator.expert;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

import com.merlt.orchestrator.llm.LanguageModelClient;
import com.merlt.orchestrator.model.ExpertType;
import com.merlt.orchestrator.retrieval.KnowledgeRetrievalClient;
import com.merlt.orchestrator.weights.TraversalWeightStore;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ExpertProfilesTest {

    @Test
    @DisplayName("Each expert is built from its own profile with semantic search and a traversal tool")
    void expertsCarryTheirProfiles() {
        LanguageModelClient llm = mock(LanguageModelClient.class);
        KnowledgeRetrievalClient retrieval = mock(KnowledgeRetrievalClient.class);
        TraversalWeightStore weights = new TraversalWeightStore();
        ExpertSettings settings = new ExpertSettings(5, 5, 5);

        List<ReasoningExpert> experts = List.of(
                new LiteralExpert(llm, retrieval, weights, settings),
                new SystemicExpert(llm, retrieval, weights, settings),
                new PrinciplesExpert(llm, retrieval, weights, settings),
                new PrecedentExpert(llm, retrieval, weights, settings));

        assertThat(experts).extracting(e -> e.profile().type())
                .containsExactly(ExpertType.LITERAL, ExpertType.SYSTEMIC, ExpertType.PRINCIPLES, ExpertType.PRECEDENT);
        for (ReasoningExpert expert : experts) {
            assertThat(expert.profile().tools()).extracting(ToolSpec::name).contains(ToolSpec.SEMANTIC_SEARCH);
            assertThat(expert.profile().primaryTraversal()).isPresent();
            assertThat(expert.profile().instructions()).isNotBlank();
        }
    }

    @Test
    @DisplayName("Default profiles match the instance profile")
    void defaultProfilesAreStable() {
        assertThat(LiteralExpert.defaultProfile().type()).isEqualTo(ExpertType.LITERAL);
        assertThat(PrecedentExpert.defaultProfile().type()).isEqualTo(ExpertType.PRECEDENT);
        SystemicExpert systemic = new SystemicExpert(mock(LanguageModelClient.class), mock(KnowledgeRetrievalClient.class),
                new TraversalWeightStore(), new ExpertSettings(5, 5, 5));
        assertThat(systemic.profile()).isEqualTo(SystemicExpert.defaultProfile());
    }
}
