package ai.bridge.bidding;

import ai.bridge.auction.Bid;
import ai.bridge.auction.BidLegality;
import ai.bridge.auction.Strain;
import ai.bridge.game.Card;
import ai.bridge.game.Hand;
import ai.bridge.game.Rank;
import ai.bridge.game.Suit;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Hand-evaluation and bid-construction helpers shared by the convention modules.
 */
public final class BiddingHelper {

    private BiddingHelper() {
        // Utility class.
    }

    /**
     * Checks whether a bid skips at least one level compared with the cheapest bid in its strain.
     *
     * @param bid  the bid
     * @param over the contract bid it was made over, or {@code null} if it opened the auction
     * @return {@code true} for a jump bid
     */
    public static boolean isJump(Bid bid, Bid over) {
        if (!bid.isContract()) {
            return false;
        }
        if (over == null) {
            return bid.level() > 1;
        }
        int cheapest = bid.strain().ordinal() > over.strain().ordinal() ? over.level() : over.level() + 1;
        return bid.level() > cheapest;
    }

    /**
     * Checks for a notrump stopper: A, Kx, Qxx or Jxxx.
     *
     * @param hand the hand
     * @param suit the suit to stop
     * @return {@code true} if the suit is stopped
     */
    public static boolean hasStopper(Hand hand, Suit suit) {
        int length = hand.length(suit);
        return hand.holds(Rank.ACE, suit)
                || (hand.holds(Rank.KING, suit) && length >= 2)
                || (hand.holds(Rank.QUEEN, suit) && length >= 3)
                || (hand.holds(Rank.JACK, suit) && length >= 4);
    }

    public static int aces(Hand hand) {
        return hand.count(Rank.ACE);
    }

    public static int kings(Hand hand) {
        return hand.count(Rank.KING);
    }

    /**
     * Counts the top honours (A, K, Q) held in a suit.
     *
     * @param hand the hand
     * @param suit the suit
     * @return 0 to 3
     */
    public static int topHonours(Hand hand, Suit suit) {
        int count = 0;
        for (Card card : hand.cardsIn(suit)) {
            if (card.getRank().getValue() >= Rank.QUEEN.getValue()) {
                count++;
            }
        }
        return count;
    }

    /**
     * A suit worth showing at a high level: two of the top three honours, or three of the top five.
     *
     * @param hand the hand
     * @param suit the suit
     * @return {@code true} for a good suit
     */
    public static boolean isGoodSuit(Hand hand, Suit suit) {
        if (topHonours(hand, suit) >= 2) {
            return true;
        }
        int honours = 0;
        for (Card card : hand.cardsIn(suit)) {
            if (card.getRank().isHonour()) {
                honours++;
            }
        }
        return honours >= 3;
    }

    /**
     * Returns the longest suit; ties go to the higher-ranking suit.
     *
     * @param lengths suit lengths
     * @return the longest suit
     */
    public static Suit longestSuit(Map<Suit, Integer> lengths) {
        Suit best = Suit.CLUBS;
        for (Suit suit : Suit.values()) {
            if (lengths.get(suit) >= lengths.get(best)) {
                best = suit;
            }
        }
        return best;
    }

    /**
     * Returns the longest suit among the candidates, ties to the higher-ranking one.
     *
     * @param lengths    suit lengths
     * @param candidates suits to choose from
     * @return the best candidate, or empty if the list is empty
     */
    public static Optional<Suit> longestOf(Map<Suit, Integer> lengths, List<Suit> candidates) {
        Suit best = null;
        for (Suit suit : candidates) {
            if (best == null || lengths.get(suit) > lengths.get(best)
                    || (lengths.get(suit).equals(lengths.get(best)) && suit.ordinal() > best.ordinal())) {
                best = suit;
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * Returns the cheapest legal bid in a strain for the seat due to call.
     *
     * @param strain   the strain
     * @param features the caller's features
     * @return the cheapest legal bid, if any
     */
    public static Optional<Bid> cheapest(Strain strain, HandFeatures features) {
        return BidLegality.lowestLegal(strain, features.getAuction());
    }

    public static Optional<Bid> cheapest(Suit suit, HandFeatures features) {
        return cheapest(Strain.of(suit), features);
    }

    /**
     * Returns the suit of a contract bid, empty for notrump or non-contract calls.
     *
     * @param bid the bid
     * @return its suit, if any
     */
    public static Optional<Suit> suitOf(Bid bid) {
        return bid != null && bid.isContract() ? bid.strain().suit() : Optional.empty();
    }

    public static boolean isLegal(Bid bid, HandFeatures features) {
        return BidLegality.isLegal(bid, features.getAuction());
    }
}
