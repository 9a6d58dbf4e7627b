package org.calista.arasaka.reasoning.retrieve;

import org.calista.arasaka.reasoning.knowledge.KnowledgeItem;

import java.util.List;

/**
 * External research collaborator (web search and the like). Consulted only when the knowledge store
 * has too little for a topic. Implementations may block and may fail; the retriever isolates both.
 */
@FunctionalInterface
public interface ResearchSource {

    List<KnowledgeItem> searchAndLearn(String query);
}
