package com.merlt.orchestrator.expert;

import static com.merlt.orchestrator.weights.RelationTypes.*;

import com.merlt.orchestrator.llm.LanguageModelClient;
import com.merlt.orchestrator.model.ExpertType;
import com.merlt.orchestrator.retrieval.KnowledgeRetrievalClient;
import com.merlt.orchestrator.weights.TraversalWeightStore;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Reads the norm for its plain textual meaning: definitions, the wording of the provision and the
 * provisions it refers to.
 */
@Component
public class LiteralExpert extends ReasoningExpert {

    static final String INSTRUCTIONS = """
            You are the literal interpretation expert of an Italian legal reasoning system.
            Establish the meaning of the provisions from their wording and the connection of the words
            (art. 12 preleggi, first clause). Rely on statutory definitions and on the provisions the
            text refers to. Do not speculate about purpose or case law.""";

    public LiteralExpert(LanguageModelClient languageModel, KnowledgeRetrievalClient retrieval,
            TraversalWeightStore weightStore, ExpertSettings settings) {
        super(defaultProfile(), languageModel, retrieval, weightStore, settings);
    }

    static ExpertProfile defaultProfile() {
        return new ExpertProfile(ExpertType.LITERAL, INSTRUCTIONS, List.of(
                ToolSpec.semanticSearch(),
                ToolSpec.traversal("lookup_definitions", "statutory definitions and contained provisions",
                        DEFINES, CONTAINS, REGULATES),
                ToolSpec.traversal("follow_references", "provisions referred to, amended or repealed",
                        REFERS_TO, MODIFIES, REPEALS, CITES)));
    }
}
