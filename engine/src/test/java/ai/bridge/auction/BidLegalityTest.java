package ai.bridge.auction;

import static org.junit.jupiter.api.Assertions.assertEquals;

import ai.bridge.game.Seat;
import org.junit.jupiter.api.Test;

class BidLegalityTest {

    @Test
    void legalSuggestionIsUnchanged() {
        Auction auction = Auction.of(Seat.NORTH, "1♥");

        assertEquals(Bid.parse("2♥"), BidLegality.repair(Bid.parse("2♥"), auction));
    }

    @Test
    void illegalBidIsRaisedToCheapestLegalBidInTheSameStrain() {
        Auction auction = Auction.of(Seat.NORTH, "3♥");

        assertEquals(Bid.parse("3♠"), BidLegality.repair(Bid.parse("2♠"), auction));
        assertEquals(Bid.parse("4♦"), BidLegality.repair(Bid.parse("2♦"), auction));
    }

    @Test
    void repairNeedingMoreThanTwoLevelsBecomesPass() {
        Auction auction = Auction.of(Seat.NORTH, "4♠");

        assertEquals(Bid.parse("5♣"), BidLegality.repair(Bid.parse("3♣"), auction));
        assertEquals(Bid.PASS, BidLegality.repair(Bid.parse("2♣"), auction));
        assertEquals(Bid.PASS, BidLegality.repair(Bid.parse("1♣"), auction));
    }

    @Test
    void escalationCapIsConfigurable() {
        Auction auction = Auction.of(Seat.NORTH, "4♠");

        assertEquals(Bid.parse("5♣"), BidLegality.repair(Bid.parse("1♣"), auction, 4));
        assertEquals(Bid.PASS, BidLegality.repair(Bid.parse("4♣"), auction, 0));
    }

    @Test
    void illegalDoubleOrRedoubleBecomesPass() {
        Auction auction = Auction.of(Seat.NORTH, "1♥", "P");

        assertEquals(Bid.PASS, BidLegality.repair(Bid.DOUBLE, auction));
        assertEquals(Bid.PASS, BidLegality.repair(Bid.REDOUBLE, auction));
    }

    @Test
    void nothingAboveSevenNotrump() {
        Auction auction = Auction.of(Seat.NORTH, "7NT");

        assertEquals(Bid.PASS, BidLegality.repair(Bid.parse("7♠"), auction));
    }
}
