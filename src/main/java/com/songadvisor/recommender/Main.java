package com.songadvisor.recommender;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main entry point for the song advisor.
 * <p>
 * Usage: {@code Main [artist track]}. Without arguments the seed track is asked for interactively.
 * The Last.fm API key and tuning knobs come from the environment (see {@link LastFmConfig}).
 *
 * @author Song Advisor Team
 * @since 1.0
 */
public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    /**
     * Main application entry point.
     * @param args optional artist and track
     */
    public static void main(String[] args) {
        int status = 0;
        try {
            LastFmConfig config = LastFmConfig.fromEnvironment();
            logger.info("Starting with {}", config);
            PresenterInterface presenter = new ConsolePresenter();
            RecommendationSession session = RecommendationSession.create(new LastFmClient(config), presenter, config);
            if (args != null && args.length >= 2) {
                session.run(new SeedTrack(args[0], args[1]));
            } else {
                session.run();
            }
        } catch (ProviderException e) {
            logger.error("Lookup failed: {}", e.getMessage());
            status = 1;
        } catch (IllegalArgumentException e) {
            logger.error("Cannot start: {}", e.getMessage());
            status = 2;
        }
        if (status != 0) {
            System.exit(status);
        }
    }
}
