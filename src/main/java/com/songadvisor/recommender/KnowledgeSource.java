package com.songadvisor.recommender;

/**
 * An independent unit of reasoning that reads and writes the {@link Blackboard}.
 */
public interface KnowledgeSource extends Notifiable {
    /**
     * Name shown as the provenance of hypotheses this source makes.
     */
    default String name() {
        return getClass().getSimpleName();
    }
}
