package ai.bridge.bidding;

import ai.bridge.auction.Auction;
import ai.bridge.auction.Bid;
import ai.bridge.auction.Call;
import ai.bridge.auction.Strain;
import ai.bridge.game.Hand;
import ai.bridge.game.Seat;
import ai.bridge.game.Suit;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes {@link HandFeatures} from a 13-card hand and the auction so far.
 * <p>
 * Extraction is pure: the same hand and auction always give equal features, and neither input
 * is modified. The features describe the seat whose turn it is ({@link Auction#nextSeat()}).
 */
public final class FeatureExtractor {

    private static final Logger log = LoggerFactory.getLogger(FeatureExtractor.class);

    private FeatureExtractor() {
        // Utility class.
    }

    /**
     * Extracts features for the seat due to call.
     *
     * @param hand    the caller's 13 cards
     * @param auction the auction so far
     * @return the features
     * @throws IllegalArgumentException if the hand does not hold 13 cards
     */
    public static HandFeatures extract(Hand hand, Auction auction) {
        if (hand.size() != Hand.FULL_SIZE) {
            throw new IllegalArgumentException("Bidding needs a 13-card hand, got " + hand.size());
        }
        Seat seat = auction.nextSeat();
        Seat partner = seat.partner();
        List<Call> calls = auction.getCalls();

        Map<Suit, Integer> lengths = hand.suitLengths();
        int hcp = hand.hcp();
        int distribution = 0;
        for (int length : lengths.values()) {
            if (length >= 5) {
                distribution += Math.min(length - 4, 3);
            }
        }

        HandFeatures.Builder builder = HandFeatures.builder()
                .seat(seat)
                .auction(auction)
                .state(AuctionState.classify(auction))
                .hcp(hcp)
                .distributionPoints(distribution)
                .balanced(isBalanced(lengths))
                .lengths(lengths);

        Optional<Call> opening = openingCall(auction);
        if (opening.isPresent()) {
            Seat opener = opening.get().seat();
            Relationship relationship = opener == seat ? Relationship.SELF
                    : opener == partner ? Relationship.PARTNER : Relationship.OPPONENT;
            builder.opener(opener, opening.get().bid(), relationship);
            builder.openerLastBid(lastContractBy(calls, opener));
        }

        List<Bid> myCalls = nonPassCalls(calls, seat);
        List<Bid> partnerCalls = nonPassCalls(calls, partner);
        builder.myBids(myCalls)
                .partnerCalls(partnerCalls)
                .partnerLastCall(partnerCalls.isEmpty() ? null : partnerCalls.get(partnerCalls.size() - 1))
                .partnerLastBid(lastContractBy(calls, partner))
                .lhoLastBid(lastContractBy(calls, seat.next()))
                .rhoLastBid(lastContractBy(calls, seat.previous()));

        auction.lastContractCall().ifPresent(call -> builder.lastContract(call.bid(), call.seat()));

        Set<Suit> ourSuits = EnumSet.noneOf(Suit.class);
        Set<Suit> theirSuits = EnumSet.noneOf(Suit.class);
        boolean weBid = false;
        boolean theyBid = false;
        for (Call call : calls) {
            if (!call.bid().isContract()) {
                continue;
            }
            boolean ours = call.seat().side() == seat.side();
            weBid |= ours;
            theyBid |= !ours;
            Optional<Suit> suit = call.bid().strain().suit();
            if (suit.isPresent()) {
                (ours ? ourSuits : theirSuits).add(suit.get());
            }
        }
        builder.ourSuits(ourSuits)
                .theirSuits(theirSuits)
                .contested(weBid && theyBid)
                .balancingSeat(auction.lastNonPass().isPresent() && auction.trailingPasses() == 2)
                .interference(interference(calls, seat));

        Suit fit = findFit(calls, partner, lengths, opening.orElse(null));
        builder.fitSuit(fit);
        builder.supportPoints(fit == null ? hcp + distribution : hcp + shortnessPoints(lengths, fit));
        builder.partnerMinimumPoints(estimatePartnerMinimum(calls, seat, opening.orElse(null)));

        HandFeatures features = builder.build();
        if (log.isDebugEnabled()) {
            log.debug("Extracted {}", features);
        }
        return features;
    }

    /**
     * Returns the opening call: the first contract bid of the auction.
     *
     * @param auction the auction
     * @return the opening call, or empty if only passes have been made
     */
    public static Optional<Call> openingCall(Auction auction) {
        for (Call call : auction.getCalls()) {
            if (call.bid().isContract()) {
                return Optional.of(call);
            }
        }
        return Optional.empty();
    }

    static boolean isBalanced(Map<Suit, Integer> lengths) {
        int[] shape = lengths.values().stream().mapToInt(Integer::intValue).sorted().toArray();
        return Arrays.equals(shape, new int[] {3, 3, 3, 4})
                || Arrays.equals(shape, new int[] {2, 3, 4, 4})
                || Arrays.equals(shape, new int[] {2, 3, 3, 5});
    }

    private static int shortnessPoints(Map<Suit, Integer> lengths, Suit trump) {
        int points = 0;
        for (Map.Entry<Suit, Integer> entry : lengths.entrySet()) {
            if (entry.getKey() == trump) {
                continue;
            }
            points += switch (entry.getValue()) {
                case 0 -> 5;
                case 1 -> 3;
                case 2 -> 1;
                default -> 0;
            };
        }
        return points;
    }

    private static List<Bid> nonPassCalls(List<Call> calls, Seat seat) {
        List<Bid> result = new ArrayList<>();
        for (Call call : calls) {
            if (call.seat() == seat && !call.bid().isPass()) {
                result.add(call.bid());
            }
        }
        return result;
    }

    private static Bid lastContractBy(List<Call> calls, Seat seat) {
        Bid last = null;
        for (Call call : calls) {
            if (call.seat() == seat && call.bid().isContract()) {
                last = call.bid();
            }
        }
        return last;
    }

    private static Interference interference(List<Call> calls, Seat seat) {
        int partnerIndex = -1;
        for (int i = 0; i < calls.size(); i++) {
            if (calls.get(i).seat() == seat.partner() && !calls.get(i).bid().isPass()) {
                partnerIndex = i;
            }
        }
        if (partnerIndex < 0) {
            return Interference.NONE;
        }
        Interference found = Interference.NONE;
        for (int i = partnerIndex + 1; i < calls.size(); i++) {
            Call call = calls.get(i);
            if (call.seat().isOpponentOf(seat) && !call.bid().isPass()) {
                found = Interference.of(call.seat(), call.bid());
            }
        }
        return found;
    }

    /**
     * Finds the first natural suit partner has bid in which we hold 3+ (major) or 4+ (minor) cards.
     */
    private static Suit findFit(List<Call> calls, Seat partner, Map<Suit, Integer> lengths, Call opening) {
        for (int i = 0; i < calls.size(); i++) {
            Call call = calls.get(i);
            if (call.seat() != partner || !call.bid().isContract() || !isNatural(calls, i, opening)) {
                continue;
            }
            Optional<Suit> suit = call.bid().strain().suit();
            if (suit.isEmpty()) {
                continue;
            }
            int held = lengths.get(suit.get());
            if ((suit.get().isMajor() && held >= 3) || held >= 4) {
                return suit.get();
            }
        }
        return null;
    }

    /**
     * Rough test for whether a suit bid promises length in that suit. Excludes the strong 2♣
     * opening, two-level suit responses to 1NT (Stayman, transfers, the minor suit relay), cue bids
     * of the opponents' suit, and answers to ace and king asks.
     */
    static boolean isNatural(List<Call> calls, int index, Call opening) {
        Bid bid = calls.get(index).bid();
        Seat bidder = calls.get(index).seat();
        if (opening != null && calls.get(index).equals(opening) && bid.equals(Bid.of(2, Strain.CLUBS))) {
            return false;
        }
        Bid previousOwnSide = null;
        Call previousOwnCall = null;
        Bid previousTheirs = null;
        for (int i = 0; i < index; i++) {
            Call call = calls.get(i);
            if (!call.bid().isContract()) {
                continue;
            }
            if (call.seat().side() == bidder.side()) {
                previousOwnSide = call.bid();
                previousOwnCall = call;
            } else {
                previousTheirs = call.bid();
            }
        }
        if (previousOwnSide != null && previousOwnSide.strain().isNotrump() && previousOwnSide.level() >= 4) {
            return false;
        }
        if (previousOwnCall != null && previousOwnCall.equals(opening)
                && previousOwnSide.equals(Bid.of(1, Strain.NOTRUMP)) && bid.level() == 2
                && !bid.strain().isNotrump()) {
            return false;
        }
        return previousTheirs == null || previousTheirs.strain() != bid.strain();
    }

    /**
     * Estimates the least strength partner's calls have shown, taking the strongest single message.
     */
    static int estimatePartnerMinimum(List<Call> calls, Seat seat, Call opening) {
        Seat partner = seat.partner();
        int estimate = 0;
        boolean partnerFirstCall = true;
        Bid lastOwnSide = null;
        Bid lastContract = null;
        for (Call call : calls) {
            Bid bid = call.bid();
            if (call.seat() == partner && !bid.isPass()) {
                int shown = 0;
                if (bid.isDouble()) {
                    shown = opening != null && opening.seat().isOpponentOf(partner) ? 12 : 6;
                } else if (bid.isContract()) {
                    if (opening != null && call.equals(opening)) {
                        shown = openingStrength(bid);
                    } else if (opening != null && opening.seat() == partner) {
                        shown = openerRebidStrength(bid, lastOwnSide);
                    } else if (opening != null && opening.seat() == seat && partnerFirstCall) {
                        shown = responseStrength(bid, opening.bid());
                    } else if (opening != null && opening.seat().isOpponentOf(partner) && partnerFirstCall) {
                        shown = overcallStrength(bid, lastContract, opening.bid());
                    }
                }
                estimate = Math.max(estimate, shown);
                partnerFirstCall = false;
            }
            if (bid.isContract()) {
                if (call.seat().side() == seat.side()) {
                    lastOwnSide = bid;
                }
                lastContract = bid;
            }
        }
        return estimate;
    }

    private static int openingStrength(Bid bid) {
        if (bid.equals(Bid.of(2, Strain.CLUBS))) {
            return 22;
        }
        if (bid.strain().isNotrump()) {
            return switch (bid.level()) {
                case 1 -> 15;
                case 2 -> 20;
                default -> 10;
            };
        }
        return bid.level() == 1 ? 12 : 6;
    }

    private static int openerRebidStrength(Bid bid, Bid previousOwnSide) {
        if (bid.strain().isNotrump() && bid.level() == 2 && previousOwnSide != null && previousOwnSide.level() == 1) {
            return 18;
        }
        if (bid.strain().isNotrump() && bid.level() == 3) {
            return 18;
        }
        return 12;
    }

    private static int responseStrength(Bid bid, Bid openingBid) {
        if (bid.strain().isNotrump()) {
            return switch (bid.level()) {
                case 1 -> 6;
                case 2 -> 13;
                case 3 -> 15;
                default -> 0;
            };
        }
        if (bid.strain() == openingBid.strain()) {
            return bid.level() == 3 ? 10 : 6;
        }
        if (openingBid.strain().isMajor() && bid.level() - openingBid.level() >= 2) {
            return 12;
        }
        if (bid.level() == 1) {
            return 6;
        }
        return bid.level() == 2 ? 10 : 6;
    }

    private static int overcallStrength(Bid bid, Bid lastContract, Bid openingBid) {
        if (bid.strain().isNotrump()) {
            return bid.level() == 1 ? 15 : 6;
        }
        if (bid.strain() == openingBid.strain()) {
            return 8;
        }
        if (BiddingHelper.isJump(bid, lastContract)) {
            return 6;
        }
        return bid.level() == 1 ? 8 : 10;
    }
}
