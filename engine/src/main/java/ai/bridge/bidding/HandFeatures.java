package ai.bridge.bidding;

import ai.bridge.auction.Auction;
import ai.bridge.auction.Bid;
import ai.bridge.game.Seat;
import ai.bridge.game.Suit;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable summary of a hand and of the auction as seen by the seat about to call.
 * <p>
 * Every convention module reads the same features, so auction-context questions (who opened,
 * what partner last bid, whether we are in the balancing seat) are answered once here and never
 * re-derived from the raw call list. Instances are produced by {@link FeatureExtractor}.
 */
public final class HandFeatures {

    private final Seat seat;
    private final Auction auction;
    private final AuctionState state;

    private final int hcp;
    private final int distributionPoints;
    private final int supportPoints;
    private final boolean balanced;
    private final Map<Suit, Integer> lengths;
    private final Suit fitSuit;

    private final Seat opener;
    private final Bid openingBid;
    private final Relationship openerRelationship;
    private final List<Bid> myBids;
    private final List<Bid> partnerCalls;
    private final Bid partnerLastCall;
    private final Bid partnerLastBid;
    private final Bid openerLastBid;
    private final Bid lhoLastBid;
    private final Bid rhoLastBid;
    private final Bid lastContractBid;
    private final Seat lastContractBidder;
    private final boolean contested;
    private final boolean balancingSeat;
    private final Interference interference;
    private final Set<Suit> ourSuits;
    private final Set<Suit> theirSuits;
    private final int partnerMinimumPoints;

    private HandFeatures(Builder b) {
        this.seat = b.seat;
        this.auction = b.auction;
        this.state = b.state;
        this.hcp = b.hcp;
        this.distributionPoints = b.distributionPoints;
        this.supportPoints = b.supportPoints;
        this.balanced = b.balanced;
        this.lengths = Collections.unmodifiableMap(new EnumMap<>(b.lengths));
        this.fitSuit = b.fitSuit;
        this.opener = b.opener;
        this.openingBid = b.openingBid;
        this.openerRelationship = b.openerRelationship;
        this.myBids = List.copyOf(b.myBids);
        this.partnerCalls = List.copyOf(b.partnerCalls);
        this.partnerLastCall = b.partnerLastCall;
        this.partnerLastBid = b.partnerLastBid;
        this.openerLastBid = b.openerLastBid;
        this.lhoLastBid = b.lhoLastBid;
        this.rhoLastBid = b.rhoLastBid;
        this.lastContractBid = b.lastContractBid;
        this.lastContractBidder = b.lastContractBidder;
        this.contested = b.contested;
        this.balancingSeat = b.balancingSeat;
        this.interference = b.interference;
        this.ourSuits = Collections.unmodifiableSet(copy(b.ourSuits));
        this.theirSuits = Collections.unmodifiableSet(copy(b.theirSuits));
        this.partnerMinimumPoints = b.partnerMinimumPoints;
    }

    private static Set<Suit> copy(Set<Suit> suits) {
        return suits.isEmpty() ? EnumSet.noneOf(Suit.class) : EnumSet.copyOf(suits);
    }

    public Seat getSeat() {
        return seat;
    }

    public Auction getAuction() {
        return auction;
    }

    public AuctionState getState() {
        return state;
    }

    public int getHcp() {
        return hcp;
    }

    /**
     * Length points: +1, +2 or +3 for each 5-, 6- or 7+-card suit.
     *
     * @return distribution points
     */
    public int getDistributionPoints() {
        return distributionPoints;
    }

    public int getTotalPoints() {
        return hcp + distributionPoints;
    }

    /**
     * HCP plus shortness points (void 5, singleton 3, doubleton 1) when a fit with partner exists,
     * otherwise the same as {@link #getTotalPoints()}.
     *
     * @return support points
     */
    public int getSupportPoints() {
        return supportPoints;
    }

    public boolean isBalanced() {
        return balanced;
    }

    public Map<Suit, Integer> getLengths() {
        return lengths;
    }

    public int length(Suit suit) {
        return lengths.get(suit);
    }

    /**
     * Returns the suit partner has bid in which we hold a fit (3+ in a major, 4+ in a minor).
     *
     * @return the fit suit, if one exists
     */
    public Optional<Suit> getFitSuit() {
        return Optional.ofNullable(fitSuit);
    }

    public Optional<Seat> getOpener() {
        return Optional.ofNullable(opener);
    }

    public Optional<Bid> getOpeningBid() {
        return Optional.ofNullable(openingBid);
    }

    public Relationship getOpenerRelationship() {
        return openerRelationship;
    }

    /**
     * Returns this seat's previous non-pass calls, oldest first.
     *
     * @return my calls
     */
    public List<Bid> getMyBids() {
        return myBids;
    }

    public Optional<Bid> getMyLastBid() {
        return myBids.isEmpty() ? Optional.empty() : Optional.of(myBids.get(myBids.size() - 1));
    }

    public Optional<Bid> getMyFirstBid() {
        return myBids.isEmpty() ? Optional.empty() : Optional.of(myBids.get(0));
    }

    /**
     * Returns partner's non-pass calls (contract bids and doubles), oldest first.
     *
     * @return partner's calls
     */
    public List<Bid> getPartnerCalls() {
        return partnerCalls;
    }

    /**
     * Returns partner's most recent non-pass call, which may be a Double.
     *
     * @return partner's last call
     */
    public Optional<Bid> getPartnerLastCall() {
        return Optional.ofNullable(partnerLastCall);
    }

    /**
     * Returns partner's most recent contract bid.
     *
     * @return partner's last contract bid
     */
    public Optional<Bid> getPartnerLastBid() {
        return Optional.ofNullable(partnerLastBid);
    }

    public Optional<Bid> getOpenerLastBid() {
        return Optional.ofNullable(openerLastBid);
    }

    public Optional<Bid> getLhoLastBid() {
        return Optional.ofNullable(lhoLastBid);
    }

    public Optional<Bid> getRhoLastBid() {
        return Optional.ofNullable(rhoLastBid);
    }

    public Optional<Bid> getLastContractBid() {
        return Optional.ofNullable(lastContractBid);
    }

    public Optional<Seat> getLastContractBidder() {
        return Optional.ofNullable(lastContractBidder);
    }

    public boolean isOpeningSide() {
        return openerRelationship == Relationship.SELF || openerRelationship == Relationship.PARTNER;
    }

    /**
     * Whether both partnerships have made contract bids.
     *
     * @return {@code true} in a contested auction
     */
    public boolean isContested() {
        return contested;
    }

    /**
     * Whether a pass by this seat would end the auction.
     *
     * @return {@code true} in the balancing (pass-out) seat
     */
    public boolean isBalancingSeat() {
        return balancingSeat;
    }

    public Interference getInterference() {
        return interference;
    }

    /**
     * Suits named in contract bids by this partnership.
     *
     * @return our suits
     */
    public Set<Suit> getOurSuits() {
        return ourSuits;
    }

    /**
     * Suits named in contract bids by the opponents.
     *
     * @return their suits
     */
    public Set<Suit> getTheirSuits() {
        return theirSuits;
    }

    /**
     * The least strength partner's natural calls have promised.
     *
     * @return partner's minimum points, 0 if partner has not bid
     */
    public int getPartnerMinimumPoints() {
        return partnerMinimumPoints;
    }

    /**
     * Combined partnership strength: our support points plus partner's shown minimum.
     *
     * @return estimated combined points
     */
    public int getCombinedPoints() {
        return supportPoints + partnerMinimumPoints;
    }

    @Override
    public String toString() {
        return "HandFeatures{seat=" + seat + ", state=" + state + ", hcp=" + hcp
                + ", total=" + getTotalPoints() + ", support=" + supportPoints
                + ", balanced=" + balanced + ", lengths=" + lengths
                + ", opener=" + opener + " (" + openerRelationship + ")"
                + ", partnerLast=" + partnerLastCall + ", interference=" + interference.type()
                + ", balancing=" + balancingSeat + "}";
    }

    static Builder builder() {
        return new Builder();
    }

    /**
     * Mutable collector used by {@link FeatureExtractor}.
     */
    static final class Builder {
        private Seat seat;
        private Auction auction;
        private AuctionState state;
        private int hcp;
        private int distributionPoints;
        private int supportPoints;
        private boolean balanced;
        private Map<Suit, Integer> lengths = new EnumMap<>(Suit.class);
        private Suit fitSuit;
        private Seat opener;
        private Bid openingBid;
        private Relationship openerRelationship = Relationship.NONE;
        private List<Bid> myBids = List.of();
        private List<Bid> partnerCalls = List.of();
        private Bid partnerLastCall;
        private Bid partnerLastBid;
        private Bid openerLastBid;
        private Bid lhoLastBid;
        private Bid rhoLastBid;
        private Bid lastContractBid;
        private Seat lastContractBidder;
        private boolean contested;
        private boolean balancingSeat;
        private Interference interference = Interference.NONE;
        private Set<Suit> ourSuits = EnumSet.noneOf(Suit.class);
        private Set<Suit> theirSuits = EnumSet.noneOf(Suit.class);
        private int partnerMinimumPoints;

        Builder seat(Seat seat) {
            this.seat = seat;
            return this;
        }

        Builder auction(Auction auction) {
            this.auction = auction;
            return this;
        }

        Builder state(AuctionState state) {
            this.state = state;
            return this;
        }

        Builder hcp(int hcp) {
            this.hcp = hcp;
            return this;
        }

        Builder distributionPoints(int distributionPoints) {
            this.distributionPoints = distributionPoints;
            return this;
        }

        Builder supportPoints(int supportPoints) {
            this.supportPoints = supportPoints;
            return this;
        }

        Builder balanced(boolean balanced) {
            this.balanced = balanced;
            return this;
        }

        Builder lengths(Map<Suit, Integer> lengths) {
            this.lengths = lengths;
            return this;
        }

        Builder fitSuit(Suit fitSuit) {
            this.fitSuit = fitSuit;
            return this;
        }

        Builder opener(Seat opener, Bid openingBid, Relationship relationship) {
            this.opener = opener;
            this.openingBid = openingBid;
            this.openerRelationship = relationship;
            return this;
        }

        Builder myBids(List<Bid> myBids) {
            this.myBids = myBids;
            return this;
        }

        Builder partnerCalls(List<Bid> partnerCalls) {
            this.partnerCalls = partnerCalls;
            return this;
        }

        Builder partnerLastCall(Bid bid) {
            this.partnerLastCall = bid;
            return this;
        }

        Builder partnerLastBid(Bid bid) {
            this.partnerLastBid = bid;
            return this;
        }

        Builder openerLastBid(Bid bid) {
            this.openerLastBid = bid;
            return this;
        }

        Builder lhoLastBid(Bid bid) {
            this.lhoLastBid = bid;
            return this;
        }

        Builder rhoLastBid(Bid bid) {
            this.rhoLastBid = bid;
            return this;
        }

        Builder lastContract(Bid bid, Seat bidder) {
            this.lastContractBid = bid;
            this.lastContractBidder = bidder;
            return this;
        }

        Builder contested(boolean contested) {
            this.contested = contested;
            return this;
        }

        Builder balancingSeat(boolean balancingSeat) {
            this.balancingSeat = balancingSeat;
            return this;
        }

        Builder interference(Interference interference) {
            this.interference = interference;
            return this;
        }

        Builder ourSuits(Set<Suit> ourSuits) {
            this.ourSuits = ourSuits;
            return this;
        }

        Builder theirSuits(Set<Suit> theirSuits) {
            this.theirSuits = theirSuits;
            return this;
        }

        Builder partnerMinimumPoints(int points) {
            this.partnerMinimumPoints = points;
            return this;
        }

        HandFeatures build() {
            return new HandFeatures(this);
        }
    }
}
