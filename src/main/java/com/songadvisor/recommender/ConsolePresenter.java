package com.songadvisor.recommender;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Text dialogue on standard input and output.
 * <p>
 * Before each recommendation the whole blackboard is printed: the reference track, the pool and
 * every hypothesis, labelled "Assumption" when retractable and "Assertion" when permanent.
 *
 * @author Song Advisor Team
 * @since 1.0
 */
public class ConsolePresenter implements PresenterInterface {
    private final BufferedReader in;
    private final PrintStream out;

    public ConsolePresenter() {
        this(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), System.out);
    }

    public ConsolePresenter(BufferedReader in, PrintStream out) {
        this.in = in;
        this.out = out;
    }

    @Override
    public SeedTrack promptSeed() {
        out.println("Ask me for a recommendation based on a track of your choosing:");
        String artist = ask("artist: ");
        String track = ask("track: ");
        return new SeedTrack(artist, track);
    }

    @Override
    public void showCycleState(List<Candidate> pool, List<Hypothesis> hypotheses, Hypothesis solving) {
        out.println();
        out.println("- - - - - THE BLACKBOARD - - - - -");
        out.println("- Find a recommendation based on:");
        out.println("- " + (solving == null ? "(nothing yet)" : describe(solving.candidate())));
        out.println("-");
        out.println("- Recommendation Pool:");
        for (Candidate rec : pool) {
            out.println("- " + describe(rec));
        }
        out.println("-");
        out.println("- Assumptions and Assertions:");
        for (Hypothesis aff : hypotheses) {
            StringBuilder line = new StringBuilder("- **** ");
            line.append(aff.isRetractable() ? "Assumption: " : "Assertion: ");
            line.append(aff.candidate().id()).append(", ");
            if (aff.score() != null) {
                line.append(String.format(Locale.ROOT, "%s with score of %.2f", aff.reason(), aff.score()));
            } else {
                line.append(aff.reason());
            }
            line.append(" : made by ").append(aff.source() == null ? "unknown" : aff.source().name());
            out.println(line);
        }
        out.println("- - - - - ************** - - - - -");
        out.println();
    }

    @Override
    public Feedback presentCandidate(Candidate candidate) {
        out.printf("Do you like \"%s\" by %s?%n", candidate.name(), candidate.artist());
        if (candidate.url() != null) {
            out.println("Check it out: " + candidate.url());
        }
        Feedback feedback = Feedback.fromAnswer(ask("response (yes/No): "));
        if (feedback == Feedback.ACCEPTED) {
            out.println("Great! Would you like me to make another recommendation?");
        } else {
            out.println("Okay, I'll find another recommendation.");
        }
        return feedback;
    }

    @Override
    public boolean askForAnother() {
        return Feedback.fromAnswer(ask("response (yes/No): ")) == Feedback.ACCEPTED;
    }

    @Override
    public void announceWorking(String step) {
        out.println("    ~ " + step + "...");
    }

    @Override
    public void announceExhausted() {
        out.println("Sorry, but there are no more recommendations to be had.");
    }

    @Override
    public void announceSessionEnd() {
        out.println("Okay. Goodbye!");
    }

    /**
     * One-line summary of a candidate: at most three tags are listed, followed by how many were left out.
     */
    static String describe(Candidate rec) {
        String tags = "None";
        if (rec.tags() != null) {
            List<String> shown = new ArrayList<>(rec.tags().subList(0, Math.min(3, rec.tags().size())));
            shown.add("(" + Math.max(0, rec.tags().size() - 3) + " more)...");
            tags = shown.toString();
        }
        return String.format(Locale.ROOT, "**** %s, listeners: %d, duration: %d, playcount: %d, tags: %s",
            rec.id(), rec.listeners(), rec.duration(), rec.playcount(), tags);
    }

    private String ask(String prompt) {
        out.print(prompt);
        out.flush();
        try {
            String line = in.readLine();
            return line == null ? "" : line.trim();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read console input", e);
        }
    }
}
