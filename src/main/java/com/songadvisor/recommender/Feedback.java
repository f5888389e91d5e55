package com.songadvisor.recommender;

/**
 * User response to a presented candidate.
 */
public enum Feedback {
    ACCEPTED,
    REJECTED;

    /**
     * Maps a typed answer to feedback. Only "yes" (any case) counts as acceptance.
     * @param answer raw console input, may be null
     * @return ACCEPTED for "yes", REJECTED otherwise
     */
    public static Feedback fromAnswer(String answer) {
        return answer != null && answer.trim().equalsIgnoreCase("yes") ? ACCEPTED : REJECTED;
    }
}
