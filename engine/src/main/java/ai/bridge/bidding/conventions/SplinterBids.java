package ai.bridge.bidding.conventions;

import ai.bridge.auction.Bid;
import ai.bridge.bidding.AuctionState;
import ai.bridge.bidding.Convention;
import ai.bridge.bidding.ConventionModule;
import ai.bridge.bidding.HandFeatures;
import ai.bridge.bidding.Suggestion;
import ai.bridge.game.Hand;
import ai.bridge.game.Suit;
import java.util.Optional;

/**
 * Splinter raises of a one-level major opening: a double jump in a new suit showing four-card
 * support, game values and a singleton or void in the bid suit.
 * <p>
 * Over 1♠ the splinters are 4♣, 4♦ and 4♥; over 1♥ they are 3♠, 4♣ and 4♦. Opener signs off in game
 * unless Blackwood takes over.
 */
public class SplinterBids implements ConventionModule {

    static final int MIN_SUPPORT_POINTS = 12;
    static final int MAX_HCP = 15;

    @Override
    public Convention convention() {
        return Convention.SPLINTERS;
    }

    @Override
    public Optional<Suggestion> evaluate(Hand hand, HandFeatures features) {
        Optional<Bid> opening = features.getOpeningBid();
        if (opening.isEmpty() || opening.get().level() != 1 || !opening.get().strain().isMajor()) {
            return Optional.empty();
        }
        Suit major = opening.get().strain().suit().orElseThrow();
        if (features.getState() == AuctionState.PARTNERSHIP_RESPONSE) {
            return splinter(features, major);
        }
        if (features.getState() == AuctionState.OPENER_REBID && features.getMyBids().size() == 1
                && features.getPartnerLastBid().filter(bid -> isSplinter(bid, opening.get())).isPresent()) {
            return Suggestion.of(Bid.of(4, major), "Signing off in game after partner's splinter");
        }
        return Optional.empty();
    }

    private Optional<Suggestion> splinter(HandFeatures features, Suit major) {
        if (features.getInterference().isPresent() || features.length(major) < 4
                || features.getHcp() > MAX_HCP || features.getSupportPoints() < MIN_SUPPORT_POINTS) {
            return Optional.empty();
        }
        Suit shortest = null;
        for (Suit suit : Suit.values()) {
            if (suit == major || features.length(suit) > 1) {
                continue;
            }
            if (shortest == null || features.length(suit) < features.length(shortest)) {
                shortest = suit;
            }
        }
        if (shortest == null) {
            return Optional.empty();
        }
        Bid bid = splinterBid(major, shortest);
        String shape = features.length(shortest) == 0 ? "void" : "singleton";
        return Suggestion.of(bid, "Splinter: 4+ " + major + " support, " + shape + " in " + shortest);
    }

    static Bid splinterBid(Suit major, Suit shortSuit) {
        int level = shortSuit.ordinal() > major.ordinal() ? 3 : 4;
        return Bid.of(level, shortSuit);
    }

    /**
     * Checks whether a response is a splinter of a one-level major opening.
     *
     * @param response the response
     * @param opening  the opening bid it answered
     * @return {@code true} for a double-jump new suit over 1♥ or 1♠
     */
    static boolean isSplinter(Bid response, Bid opening) {
        if (!response.isContract() || !opening.isContract() || opening.level() != 1 || !opening.strain().isMajor()
                || response.strain() == opening.strain() || response.strain().isNotrump()) {
            return false;
        }
        Suit major = opening.strain().suit().orElseThrow();
        Suit shortSuit = response.strain().suit().orElseThrow();
        return response.equals(splinterBid(major, shortSuit));
    }
}
