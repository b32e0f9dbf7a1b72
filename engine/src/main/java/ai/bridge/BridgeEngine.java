package ai.bridge;

import ai.bridge.auction.Auction;
import ai.bridge.auction.Contract;
import ai.bridge.auction.ContractResolver;
import ai.bridge.bidding.BidDecision;
import ai.bridge.bidding.DecisionEngine;
import ai.bridge.config.PlayProperties;
import ai.bridge.game.Card;
import ai.bridge.game.Hand;
import ai.bridge.game.Seat;
import ai.bridge.game.Vulnerability;
import ai.bridge.play.CardDecision;
import ai.bridge.play.CardPlayer;
import ai.bridge.play.Difficulty;
import ai.bridge.play.NoLegalCardException;
import ai.bridge.play.PlayState;
import ai.bridge.play.ai.MinimaxPlayer;
import ai.bridge.play.ai.dds.DoubleDummyClient;
import ai.bridge.play.ai.dds.DoubleDummyPlayer;
import ai.bridge.scoring.HandScore;
import ai.bridge.scoring.Scorer;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Entry point for collaborators: bids, cards, contracts and scores.
 *
 * Every call is independent. The engine holds only configuration, so one instance can serve any
 * number of tables.
 */
@Component
public class BridgeEngine {

    private static final Logger log = LoggerFactory.getLogger(BridgeEngine.class);

    private final DecisionEngine decisionEngine;
    private final PlayProperties playProperties;
    private final DoubleDummyClient solverClient;

    /**
     * Creates an engine with default configuration, for use outside a Spring context.
     */
    public BridgeEngine() {
        this(new DecisionEngine(), new PlayProperties(), new DoubleDummyClient());
    }

    @Autowired
    public BridgeEngine(DecisionEngine decisionEngine, PlayProperties playProperties, DoubleDummyClient solverClient) {
        this.decisionEngine = decisionEngine;
        this.playProperties = playProperties;
        this.solverClient = solverClient;
    }

    /**
     * Chooses the next call for the seat whose turn it is.
     *
     * @param hand    that seat's hand
     * @param auction the auction so far
     * @return the legal call, its rationale and the convention that produced it
     */
    public BidDecision nextBid(Hand hand, Auction auction) {
        return decisionEngine.decide(hand, auction);
    }

    public Card nextCard(PlayState state, Difficulty difficulty) {
        return decideCard(state, difficulty).card();
    }

    /**
     * Chooses the next card and reports how it was chosen.
     *
     * @param state      the position; the next seat is the one to act
     * @param difficulty the strength tier
     * @return the card with its source and reason
     * @throws NoLegalCardException if the next seat has no card to play
     */
    public CardDecision decideCard(PlayState state, Difficulty difficulty) {
        if (state.legalCards().isEmpty()) {
            throw new NoLegalCardException("No legal card for " + state.getNextToPlay() + " in " + state);
        }
        CardDecision decision = playerFor(difficulty).choose(state);
        if (!state.isLegal(decision.card())) {
            throw new IllegalStateException(difficulty + " player chose illegal card " + decision.card()
                    + "; legal: " + state.legalCards());
        }
        if (log.isDebugEnabled()) {
            log.debug("{} plays {} [{}] {}", state.getNextToPlay(), decision.card(), decision.source(), decision.reason());
        }
        return decision;
    }

    CardPlayer playerFor(Difficulty difficulty) {
        if (!difficulty.usesSolver()) {
            return new MinimaxPlayer(playProperties.depthFor(difficulty));
        }
        PlayProperties.Solver solver = playProperties.getSolver();
        boolean unsupported = DoubleDummyClient.isUnsupportedPlatform(solver.getUnsupportedPlatforms(),
                System.getProperty("os.name"), System.getProperty("os.arch"));
        return new DoubleDummyPlayer(solverClient, new MinimaxPlayer(playProperties.depthFor(difficulty)),
                solver.isEnabled(), unsupported);
    }

    /**
     * Works out the final contract.
     *
     * @param auction a finished auction
     * @return the contract, or empty when the auction is unfinished or was passed out
     */
    public Optional<Contract> resolveContract(Auction auction) {
        return ContractResolver.resolve(auction);
    }

    public HandScore scoreHand(Contract contract, int tricksTaken, Vulnerability vulnerability) {
        return Scorer.score(contract, tricksTaken, vulnerability);
    }

    /**
     * Scores a hand including honours held in the original deal.
     *
     * @param contract      the contract
     * @param tricksTaken   tricks won by declarer's side
     * @param vulnerability the board's vulnerability
     * @param hands         the four hands as dealt
     * @return the score, signed from declarer's view
     */
    public HandScore scoreHand(Contract contract, int tricksTaken, Vulnerability vulnerability, Map<Seat, Hand> hands) {
        return Scorer.score(contract, tricksTaken, vulnerability, hands);
    }
}
