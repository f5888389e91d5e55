package com.songadvisor.recommender;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Runs the recommendation dialogue from seed track to the end of the session.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Loads the seed track as the reference and gathers the initial pool.</li>
 *   <li>Repeatedly shows the blackboard, asks the {@link Arbiter} for a pick and presents it.</li>
 *   <li>A liked pick ends the session unless the user wants another one, in which case it becomes
 *       the new reference. A disliked pick is dropped from the pool.</li>
 *   <li>The session ends when no recommendation is left.</li>
 * </ul>
 * A {@link ProviderException} from any lookup ends the session and reaches the caller.
 *
 * @author Song Advisor Team
 * @since 1.0
 */
public class RecommendationSession {
    private static final Logger logger = LoggerFactory.getLogger(RecommendationSession.class);

    private final Blackboard blackboard;
    private final InfoSource infoSource;
    private final SimilarTrackSource similarTrackSource;
    private final Arbiter arbiter;
    private final PresenterInterface presenter;
    private final int initialPoolSize;

    public RecommendationSession(Blackboard blackboard, InfoSource infoSource, SimilarTrackSource similarTrackSource,
                                 Arbiter arbiter, PresenterInterface presenter, int initialPoolSize) {
        this.blackboard = blackboard;
        this.infoSource = infoSource;
        this.similarTrackSource = similarTrackSource;
        this.arbiter = arbiter;
        this.presenter = presenter;
        this.initialPoolSize = initialPoolSize;
    }

    /**
     * Wires a full session against one provider.
     */
    public static RecommendationSession create(MusicDataProviderInterface provider, PresenterInterface presenter, LastFmConfig config) {
        Blackboard blackboard = new Blackboard();
        InfoSource infoSource = new InfoSource(blackboard, provider);
        SimilarTrackSource similarTrackSource = new SimilarTrackSource(blackboard, provider, config.similarArtistLimit());
        PlaycountSource playcountSource = new PlaycountSource(blackboard);
        TagSource tagSource = new TagSource(blackboard, provider);
        Arbiter arbiter = new Arbiter(blackboard, playcountSource, tagSource, similarTrackSource, config.refillCount());
        return new RecommendationSession(blackboard, infoSource, similarTrackSource, arbiter, presenter, config.initialPoolSize());
    }

    /**
     * Prompts for the seed track, then runs the dialogue.
     */
    public void run() {
        run(presenter.promptSeed());
    }

    /**
     * Runs the dialogue for a known seed track.
     * @return number of recommendations presented
     */
    public int run(SeedTrack seed) {
        presenter.announceWorking("looking up " + seed.artist() + " - " + seed.track());
        infoSource.load(seed.artist(), seed.track());
        presenter.announceWorking("getting similar artists and songs");
        similarTrackSource.gather(seed.artist(), seed.track(), initialPoolSize);
        presenter.announceWorking("evaluating");
        int presented = 0;
        while (true) {
            Optional<Candidate> bestIdea = arbiter.recommend();
            presenter.showCycleState(blackboard.pool(), blackboard.hypotheses(), blackboard.solving());
            if (bestIdea.isEmpty()) {
                presenter.announceExhausted();
                break;
            }
            Candidate recommendation = bestIdea.get();
            presented++;
            logger.debug("Presenting recommendation #{}: {}", presented, recommendation.id());
            if (presenter.presentCandidate(recommendation) == Feedback.ACCEPTED) {
                if (!presenter.askForAnother()) {
                    presenter.announceSessionEnd();
                    break;
                }
                presenter.announceWorking("getting similar artists and songs");
                arbiter.accept(recommendation);
                presenter.announceWorking("evaluating");
            } else {
                arbiter.reject(recommendation);
            }
        }
        logger.info("Session finished after {} recommendation(s)", presented);
        return presented;
    }

    Blackboard blackboard() {
        return blackboard;
    }
}
