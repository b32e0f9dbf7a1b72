package ai.bridge.bidding.conventions;

import ai.bridge.auction.Bid;
import ai.bridge.auction.Strain;
import ai.bridge.bidding.Convention;
import ai.bridge.bidding.ConventionModule;
import ai.bridge.bidding.HandFeatures;
import ai.bridge.bidding.Suggestion;
import ai.bridge.game.Hand;
import ai.bridge.game.Suit;
import java.util.List;
import java.util.Optional;

/**
 * Jacoby transfers over partner's 1NT: 2♦ shows five or more hearts, 2♥ shows five or more spades.
 * Opener completes the transfer, or super-accepts at the three level with 17 HCP and four trumps.
 * Responder then passes, invites or bids game according to strength and suit length.
 */
public class JacobyTransfers implements ConventionModule {

    static final int SUPER_ACCEPT_HCP = 17;

    @Override
    public Convention convention() {
        return Convention.JACOBY_TRANSFERS;
    }

    @Override
    public Optional<Suggestion> evaluate(Hand hand, HandFeatures features) {
        if (!features.getOpeningBid().equals(Optional.of(Stayman.ONE_NOTRUMP))) {
            return Optional.empty();
        }
        return switch (features.getState()) {
            case PARTNERSHIP_RESPONSE -> transfer(features);
            case OPENER_REBID -> openerContinues(features);
            case PARTNERSHIP_REBID -> responderContinues(features);
            default -> Optional.empty();
        };
    }

    static Optional<Suit> targetOf(Bid transfer) {
        if (transfer.equals(Bid.of(2, Strain.DIAMONDS))) {
            return Optional.of(Suit.HEARTS);
        }
        if (transfer.equals(Bid.of(2, Strain.HEARTS))) {
            return Optional.of(Suit.SPADES);
        }
        return Optional.empty();
    }

    private Optional<Suggestion> transfer(HandFeatures features) {
        if (features.getInterference().isPresent()) {
            return Optional.empty();
        }
        int hearts = features.length(Suit.HEARTS);
        int spades = features.length(Suit.SPADES);
        if (spades >= 5 && spades >= hearts) {
            return Suggestion.of(Bid.of(2, Strain.HEARTS), "Jacoby transfer: " + spades + " spades");
        }
        if (hearts >= 5) {
            return Suggestion.of(Bid.of(2, Strain.DIAMONDS), "Jacoby transfer: " + hearts + " hearts");
        }
        return Optional.empty();
    }

    private Optional<Suggestion> openerContinues(HandFeatures features) {
        List<Bid> mine = features.getMyBids();
        List<Bid> partner = features.getPartnerCalls();
        if (partner.isEmpty()) {
            return Optional.empty();
        }
        Optional<Suit> target = targetOf(partner.get(0));
        if (target.isEmpty()) {
            return Optional.empty();
        }
        Suit major = target.get();
        int support = features.length(major);
        int hcp = features.getHcp();
        if (mine.size() == 1 && partner.size() == 1) {
            if (hcp >= SUPER_ACCEPT_HCP && support >= 4) {
                return Suggestion.of(Bid.of(3, major), "Super-accept: maximum with 4 " + major);
            }
            return Suggestion.of(Bid.of(2, major), "Completing the transfer to " + major);
        }
        if (mine.size() != 2 || partner.size() != 2) {
            return Optional.empty();
        }
        Bid followUp = partner.get(1);
        boolean maximum = hcp >= 16;
        if (followUp.equals(Bid.of(2, Strain.NOTRUMP))) {
            if (maximum) {
                return support >= 3
                        ? Suggestion.of(Bid.of(4, major), "Maximum with a fit: game in " + major)
                        : Suggestion.of(Bid.of(3, Strain.NOTRUMP), "Maximum without a fit: 3NT");
            }
            return support >= 3
                    ? Suggestion.of(Bid.of(3, major), "Minimum with a fit: declining in " + major)
                    : Suggestion.of(Bid.PASS, "Minimum without a fit: passing 2NT");
        }
        if (followUp.equals(Bid.of(3, Strain.NOTRUMP))) {
            return support >= 3
                    ? Suggestion.of(Bid.of(4, major), "Choosing the 5-3 major fit")
                    : Suggestion.of(Bid.PASS, "Choosing notrump without a fit");
        }
        if (followUp.equals(Bid.of(3, major))) {
            return maximum
                    ? Suggestion.of(Bid.of(4, major), "Accepting the invitation in " + major)
                    : Suggestion.of(Bid.PASS, "Declining the invitation in " + major);
        }
        return Suggestion.of(Bid.PASS, "Partner has placed the contract after the transfer");
    }

    private Optional<Suggestion> responderContinues(HandFeatures features) {
        List<Bid> mine = features.getMyBids();
        if (mine.size() != 1 || features.getPartnerCalls().size() != 2) {
            return Optional.empty();
        }
        Optional<Suit> target = targetOf(mine.get(0));
        if (target.isEmpty()) {
            return Optional.empty();
        }
        Suit major = target.get();
        Bid completion = features.getPartnerCalls().get(1);
        int hcp = features.getHcp();
        int length = features.length(major);
        if (completion.equals(Bid.of(3, major))) {
            return hcp >= 6
                    ? Suggestion.of(Bid.of(4, major), "Game after partner's super-accept")
                    : Suggestion.of(Bid.PASS, "Too weak even after a super-accept");
        }
        if (hcp <= 7) {
            return Suggestion.of(Bid.PASS, "Weak hand: playing in " + major);
        }
        if (hcp <= 9) {
            return length >= 6
                    ? Suggestion.of(Bid.of(3, major), "Invitational with 6 " + major)
                    : Suggestion.of(Bid.of(2, Strain.NOTRUMP), "Invitational with 5 " + major);
        }
        return length >= 6
                ? Suggestion.of(Bid.of(4, major), "Game with 6 " + major)
                : Suggestion.of(Bid.of(3, Strain.NOTRUMP), "Game: partner chooses between 3NT and 4" + major);
    }
}
