package ai.bridge;

import ai.bridge.auction.Auction;
import ai.bridge.auction.Contract;
import ai.bridge.bidding.BidDecision;
import ai.bridge.config.PlayProperties;
import ai.bridge.game.Deck;
import ai.bridge.game.Hand;
import ai.bridge.game.Seat;
import ai.bridge.game.Vulnerability;
import ai.bridge.play.CardDecision;
import ai.bridge.play.Difficulty;
import ai.bridge.play.PlayState;
import ai.bridge.play.Trick;
import ai.bridge.scoring.HandScore;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class Game implements CommandLineRunner {
    private static final Logger log = LoggerFactory.getLogger(Game.class);

    private final BridgeEngine engine;
    private final PlayProperties playProperties;

    public Game(BridgeEngine engine, PlayProperties playProperties) {
        this.engine = engine;
        this.playProperties = playProperties;
    }

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Game.class);
        app.setWebApplicationType(WebApplicationType.NONE);
        app.run(args);
    }

    @Override
    public void run(String... args) {
        // CLI entrypoint ignores the result; tests call play() directly.
        Long seed = Long.getLong("game.seed");
        int board = Integer.getInteger("game.board", 1);
        Deck deck = seed == null ? new Deck() : new Deck(seed);
        play(deck, dealerFor(board), Vulnerability.forBoard(board));
    }

    /**
     * Plays one deal with a fresh shuffled deck, North dealing, nobody vulnerable.
     *
     * @return the summary of the deal
     */
    public GameResult play() {
        return play(new Deck(), Seat.NORTH, Vulnerability.NONE);
    }

    /**
     * Deals, bids, plays and scores one board with four AI seats.
     *
     * <p>The phases are:
     * <ol>
     *     <li>Deal 13 cards to each seat starting left of the dealer.</li>
     *     <li>Ask the bidding engine for each call until the auction ends.</li>
     *     <li>Resolve the contract; a passed-out board stops here.</li>
     *     <li>Play 13 tricks at the configured difficulty.</li>
     *     <li>Score the result.</li>
     * </ol>
     *
     * @param deck          a full deck
     * @param dealer        the dealer
     * @param vulnerability the board's vulnerability
     * @return the summary of the deal
     */
    public GameResult play(Deck deck, Seat dealer, Vulnerability vulnerability) {
        long startNanos = System.nanoTime();
        Map<Seat, Hand> hands = deck.deal(dealer);
        for (Seat seat : Seat.values()) {
            log.info("{}: {} ({} HCP)", seat, hands.get(seat), hands.get(seat).hcp());
        }

        Auction auction = Auction.start(dealer);
        while (!auction.isComplete()) {
            Seat seat = auction.nextSeat();
            BidDecision decision = engine.nextBid(hands.get(seat), auction);
            log.info("{} bids {} ({}: {})", seat, decision.bid(), decision.convention(), decision.rationale());
            auction = auction.with(decision.bid());
        }
        log.info("Auction: {}", auction);

        Optional<Contract> resolved = engine.resolveContract(auction);
        if (resolved.isEmpty()) {
            log.info("Passed out");
            DealLogger.logDeal(hands, auction, null);
            return new GameResult(auction, null, 0, null, System.nanoTime() - startNanos);
        }
        Contract contract = resolved.get();
        log.info("Contract: {}", contract);

        Difficulty difficulty = playProperties.getDifficulty();
        PlayState state = PlayState.start(contract, hands);
        while (!state.isComplete()) {
            CardDecision decision = engine.decideCard(state, difficulty);
            if (decision.source() == CardDecision.Source.SEARCH_FALLBACK && log.isDebugEnabled()) {
                log.debug("{} used fallback: {}", state.getNextToPlay(), decision.reason());
            }
            int tricksBefore = state.getTrickHistory().size();
            state = state.play(decision.card());
            if (state.getTrickHistory().size() > tricksBefore) {
                Trick trick = state.getTrickHistory().get(state.getTrickHistory().size() - 1);
                log.info("Trick {}: {}", state.getTrickHistory().size(), trick);
            }
        }

        HandScore score = engine.scoreHand(contract, state.getDeclarerTricks(), vulnerability, hands);
        log.info("Result: {}", score);
        DealLogger.logDeal(hands, auction, score);
        return new GameResult(auction, contract, state.getDeclarerTricks(), score, System.nanoTime() - startNanos);
    }

    static Seat dealerFor(int board) {
        return Seat.values()[(board - 1) % 4];
    }

    /**
     * Summary of a single deal.
     */
    public static final class GameResult {
        private final Auction auction;
        private final Contract contract;
        private final int declarerTricks;
        private final HandScore score;
        private final long durationNanos;

        public GameResult(Auction auction, Contract contract, int declarerTricks, HandScore score, long durationNanos) {
            this.auction = auction;
            this.contract = contract;
            this.declarerTricks = declarerTricks;
            this.score = score;
            this.durationNanos = durationNanos;
        }

        public Auction getAuction() {
            return auction;
        }

        public Optional<Contract> getContract() {
            return Optional.ofNullable(contract);
        }

        public boolean isPassedOut() {
            return contract == null;
        }

        public int getDeclarerTricks() {
            return declarerTricks;
        }

        public Optional<HandScore> getScore() {
            return Optional.ofNullable(score);
        }

        public long getDurationNanos() {
            return durationNanos;
        }
    }
}
