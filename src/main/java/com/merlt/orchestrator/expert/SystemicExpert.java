package com.merlt.orchestrator.expert;

import static com.merlt.orchestrator.weights.RelationTypes.*;

import com.merlt.orchestrator.llm.LanguageModelClient;
import com.merlt.orchestrator.model.ExpertType;
import com.merlt.orchestrator.retrieval.KnowledgeRetrievalClient;
import com.merlt.orchestrator.weights.TraversalWeightStore;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Places the norm in its legal system: neighbouring provisions, amendments and derogations.
 */
@Component
public class SystemicExpert extends ReasoningExpert {

    static final String INSTRUCTIONS = """
            You are the systemic interpretation expert of an Italian legal reasoning system.
            Interpret the provisions through their position in the code, the connected provisions and
            the intention of the legislator (art. 12 preleggi). Account for amendments, repeals and
            special rules that derogate from the general ones.""";

    public SystemicExpert(LanguageModelClient languageModel, KnowledgeRetrievalClient retrieval,
            TraversalWeightStore weightStore, ExpertSettings settings) {
        super(defaultProfile(), languageModel, retrieval, weightStore, settings);
    }

    static ExpertProfile defaultProfile() {
        return new ExpertProfile(ExpertType.SYSTEMIC, INSTRUCTIONS, List.of(
                ToolSpec.semanticSearch(),
                ToolSpec.traversal("norm_hierarchy", "connected and containing provisions",
                        CONNECTED_TO, CONTAINS, REGULATES, REFERS_TO),
                ToolSpec.traversal("amendment_history", "amendments, repeals and derogations",
                        MODIFIES, REPEALS, DEROGATES)));
    }
}
