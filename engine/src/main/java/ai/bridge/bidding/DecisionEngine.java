package ai.bridge.bidding;

import ai.bridge.auction.Auction;
import ai.bridge.auction.Bid;
import ai.bridge.auction.BidLegality;
import ai.bridge.bidding.conventions.AdvancerBids;
import ai.bridge.bidding.conventions.Blackwood;
import ai.bridge.bidding.conventions.FourthSuitForcing;
import ai.bridge.bidding.conventions.Gerber;
import ai.bridge.bidding.conventions.GrandSlamForce;
import ai.bridge.bidding.conventions.JacobyTransfers;
import ai.bridge.bidding.conventions.MichaelsCuebid;
import ai.bridge.bidding.conventions.MinorSuitBust;
import ai.bridge.bidding.conventions.NegativeDoubles;
import ai.bridge.bidding.conventions.OpenerRebids;
import ai.bridge.bidding.conventions.OpeningBids;
import ai.bridge.bidding.conventions.Overcalls;
import ai.bridge.bidding.conventions.PreemptiveBids;
import ai.bridge.bidding.conventions.ResponderRebids;
import ai.bridge.bidding.conventions.Responses;
import ai.bridge.bidding.conventions.SplinterBids;
import ai.bridge.bidding.conventions.Stayman;
import ai.bridge.bidding.conventions.TakeoutDoubles;
import ai.bridge.bidding.conventions.UnusualNotrump;
import ai.bridge.config.BiddingProperties;
import ai.bridge.game.Hand;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Chooses the next call for a hand by consulting convention modules in a fixed priority order.
 *
 * The auction state selects an ordered chain of modules. The first module that returns a
 * suggestion wins; its bid is then made legal with {@link BidLegality#repair}. A repair that lands
 * on a slam or a major-suit game the hand cannot support is turned into Pass by
 * {@link BidSafety}. When no module applies the engine passes.
 *
 * Routing:
 * - OPENING: preempts, then opening bids
 * - COMPETITIVE, first call: Michaels, Unusual 2NT, takeout doubles, overcalls
 * - COMPETITIVE, later calls: Blackwood, Michaels, Unusual 2NT, negative doubles, advancer bids
 * - PARTNERSHIP_RESPONSE: Gerber, grand slam force, Blackwood, splinters, fourth suit, negative
 *   doubles, minor suit bust, Stayman, transfers, responses
 * - PARTNERSHIP_REBID: Gerber, grand slam force, Blackwood, splinters, fourth suit, minor suit bust,
 *   Stayman, transfers, responder rebids
 * - OPENER_REBID: Gerber, grand slam force, Blackwood, splinters, fourth suit, minor suit bust,
 *   Stayman, transfers, preempts, opener rebids
 *
 * The engine is stateless; the same hand and auction always produce the same decision.
 */
@Component
public class DecisionEngine {

    private static final Logger log = LoggerFactory.getLogger(DecisionEngine.class);

    private final int maxRepairLevels;
    private final BiddingProperties.Slam thresholds;
    private final Map<Convention, ConventionModule> modules = new EnumMap<>(Convention.class);

    /**
     * Creates an engine with default thresholds, for use outside a Spring context.
     */
    public DecisionEngine() {
        this(new BiddingProperties());
    }

    @Autowired
    public DecisionEngine(BiddingProperties properties) {
        this.maxRepairLevels = properties.getMaxRepairLevels();
        this.thresholds = properties.getSlam();
        register(new OpeningBids());
        register(new PreemptiveBids());
        register(new Responses());
        register(new OpenerRebids());
        register(new ResponderRebids());
        register(new Overcalls());
        register(new AdvancerBids());
        register(new Stayman());
        register(new JacobyTransfers());
        register(new Blackwood(properties.getSlam()));
        register(new TakeoutDoubles());
        register(new NegativeDoubles());
        register(new MichaelsCuebid());
        register(new UnusualNotrump());
        register(new SplinterBids());
        register(new FourthSuitForcing());
        register(new Gerber(properties.getSlam()));
        register(new GrandSlamForce(properties.getSlam()));
        register(new MinorSuitBust());
    }

    private void register(ConventionModule module) {
        modules.put(module.convention(), module);
    }

    /**
     * Decides the next call for the seat whose turn it is.
     *
     * @param hand    that seat's 13 cards
     * @param auction the auction so far; must not be complete
     * @return a legal call with its rationale
     * @throws IllegalArgumentException if the hand is not a full hand or the auction is over
     */
    public BidDecision decide(Hand hand, Auction auction) {
        if (auction.isComplete()) {
            throw new IllegalArgumentException("Auction is already complete: " + auction);
        }
        HandFeatures features = FeatureExtractor.extract(hand, auction);
        List<Convention> chain = chainFor(features);
        if (log.isDebugEnabled()) {
            log.debug("{} to call in state {} after [{}]; chain {}", features.getSeat(), features.getState(), auction, chain);
        }
        for (Convention convention : chain) {
            Optional<Suggestion> suggestion = modules.get(convention).evaluate(hand, features);
            if (suggestion.isEmpty()) {
                continue;
            }
            Bid proposed = suggestion.get().bid();
            Bid legal = BidLegality.repair(proposed, auction, maxRepairLevels);
            boolean repaired = !legal.equals(proposed);
            if (repaired) {
                log.info("{} suggested illegal {} after [{}]; repaired to {}", convention, proposed, auction, legal);
                Optional<String> unsafe = BidSafety.check(legal, features, thresholds);
                if (unsafe.isPresent()) {
                    log.info("{} {}; passing instead", convention, unsafe.get());
                    return new BidDecision(Bid.PASS, "Cannot bid safely: " + unsafe.get(), convention, true);
                }
            }
            return new BidDecision(legal, suggestion.get().rationale(), convention, repaired);
        }
        return new BidDecision(Bid.PASS, "No convention applies; passing", Convention.DEFAULT_PASS, false);
    }

    /**
     * Returns the ordered modules consulted for a caller.
     *
     * @param features the caller's features
     * @return the chain, highest priority first
     */
    static List<Convention> chainFor(HandFeatures features) {
        return switch (features.getState()) {
            case OPENING -> List.of(Convention.PREEMPTS, Convention.OPENING_BIDS);
            case COMPETITIVE -> features.getMyBids().isEmpty() && features.getPartnerCalls().isEmpty()
                    ? List.of(Convention.MICHAELS, Convention.UNUSUAL_NOTRUMP, Convention.TAKEOUT_DOUBLES,
                            Convention.OVERCALLS)
                    : List.of(Convention.BLACKWOOD, Convention.MICHAELS, Convention.UNUSUAL_NOTRUMP,
                            Convention.NEGATIVE_DOUBLES, Convention.ADVANCER_BIDS);
            case PARTNERSHIP_RESPONSE -> List.of(Convention.GERBER, Convention.GRAND_SLAM_FORCE,
                    Convention.BLACKWOOD, Convention.SPLINTERS, Convention.FOURTH_SUIT_FORCING,
                    Convention.NEGATIVE_DOUBLES, Convention.MINOR_SUIT_BUST, Convention.STAYMAN,
                    Convention.JACOBY_TRANSFERS, Convention.RESPONSES);
            case PARTNERSHIP_REBID -> List.of(Convention.GERBER, Convention.GRAND_SLAM_FORCE,
                    Convention.BLACKWOOD, Convention.SPLINTERS, Convention.FOURTH_SUIT_FORCING,
                    Convention.MINOR_SUIT_BUST, Convention.STAYMAN, Convention.JACOBY_TRANSFERS,
                    Convention.RESPONDER_REBIDS);
            case OPENER_REBID -> List.of(Convention.GERBER, Convention.GRAND_SLAM_FORCE,
                    Convention.BLACKWOOD, Convention.SPLINTERS, Convention.FOURTH_SUIT_FORCING,
                    Convention.MINOR_SUIT_BUST, Convention.STAYMAN, Convention.JACOBY_TRANSFERS,
                    Convention.PREEMPTS, Convention.OPENER_REBIDS);
        };
    }
}
