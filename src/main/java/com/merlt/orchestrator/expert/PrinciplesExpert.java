package com.merlt.orchestrator.expert;

import static com.merlt.orchestrator.weights.RelationTypes.*;

import com.merlt.orchestrator.llm.LanguageModelClient;
import com.merlt.orchestrator.model.ExpertType;
import com.merlt.orchestrator.retrieval.KnowledgeRetrievalClient;
import com.merlt.orchestrator.weights.TraversalWeightStore;
import java.util.List;
import org.springframework.stereotype.Component;

@Component
public class PrinciplesExpert extends ReasoningExpert {

    static final String INSTRUCTIONS = """
            You are the principles expert of an Italian legal reasoning system.
            Read the provisions in the light of the Constitution, EU law and the general principles of
            the legal order. When fundamental rights collide, balance them explicitly and say which
            prevails and why.""";

    public PrinciplesExpert(LanguageModelClient languageModel, KnowledgeRetrievalClient retrieval,
            TraversalWeightStore weightStore, ExpertSettings settings) {
        super(defaultProfile(), languageModel, retrieval, weightStore, settings);
    }

    static ExpertProfile defaultProfile() {
        return new ExpertProfile(ExpertType.PRINCIPLES, INSTRUCTIONS, List.of(
                ToolSpec.semanticSearch(),
                ToolSpec.traversal("principle_lookup", "constitutional, EU and general principles implemented",
                        IMPLEMENTS, EXPRESSES_PRINCIPLE, CONSTITUTIONAL_BASIS, EU_SOURCE),
                ToolSpec.traversal("purpose_lookup", "purpose of the norm and interests it protects",
                        PURPOSE, PROTECTS, REGULATES)));
    }
}
