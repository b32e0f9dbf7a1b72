package ai.bridge.auction;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.bridge.game.Seat;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class AuctionTest {

    @Nested
    @DisplayName("Legality")
    class Legality {

        @Test
        void contractBidMustBeHigherThanLastContract() {
            Auction auction = Auction.of(Seat.NORTH, "1♥");

            assertFalse(BidLegality.isLegal(Bid.parse("1♦"), auction));
            assertFalse(BidLegality.isLegal(Bid.parse("1♥"), auction));
            assertTrue(BidLegality.isLegal(Bid.parse("1♠"), auction));
            assertTrue(BidLegality.isLegal(Bid.parse("2♣"), auction));
            assertTrue(BidLegality.isLegal(Bid.PASS, auction));
        }

        @Test
        void doubleOnlyOfAnOpponentsContractBid() {
            assertTrue(BidLegality.isLegal(Bid.DOUBLE, Auction.of(Seat.NORTH, "1♥")));
            // Partner's bid cannot be doubled.
            assertFalse(BidLegality.isLegal(Bid.DOUBLE, Auction.of(Seat.NORTH, "1♥", "P")));
            // Passes in between do not matter as long as the last non-pass call is an opponent's bid.
            assertTrue(BidLegality.isLegal(Bid.DOUBLE, Auction.of(Seat.NORTH, "1♥", "P", "P")));
            assertFalse(BidLegality.isLegal(Bid.DOUBLE, Auction.start(Seat.NORTH)));
            assertFalse(BidLegality.isLegal(Bid.DOUBLE, Auction.of(Seat.NORTH, "1♥", "X")));
        }

        @Test
        void redoubleOnlyOfAnOpponentsDouble() {
            assertTrue(BidLegality.isLegal(Bid.REDOUBLE, Auction.of(Seat.NORTH, "1♥", "X")));
            assertFalse(BidLegality.isLegal(Bid.REDOUBLE, Auction.of(Seat.NORTH, "1♥")));
            assertFalse(BidLegality.isLegal(Bid.REDOUBLE, Auction.of(Seat.NORTH, "1♥", "X", "P")));
        }

        @Test
        void withRejectsIllegalCalls() {
            Auction auction = Auction.of(Seat.NORTH, "2♠");

            assertThrows(IllegalArgumentException.class, () -> auction.with(Bid.parse("2♥")));
            assertThrows(IllegalArgumentException.class, () -> auction.with(Bid.REDOUBLE));
            assertEquals(1, auction.size());
        }
    }

    @Nested
    @DisplayName("Completion")
    class Completion {

        @Test
        void fourPassesIsPassedOut() {
            Auction auction = Auction.of(Seat.EAST, "P", "P", "P");
            assertFalse(auction.isComplete());

            Auction passedOut = auction.with(Bid.PASS);
            assertTrue(passedOut.isComplete());
            assertTrue(passedOut.isPassedOut());
        }

        @Test
        void threePassesAfterABidEndTheAuction() {
            Auction auction = Auction.of(Seat.NORTH, "P", "1♣", "P", "P");
            assertFalse(auction.isComplete());
            assertTrue(auction.with(Bid.PASS).isComplete());
            assertFalse(auction.with(Bid.PASS).isPassedOut());
        }

        @Test
        void completeAuctionAcceptsNoMoreCalls() {
            Auction auction = Auction.of(Seat.NORTH, "1♣", "P", "P", "P");

            assertThrows(IllegalArgumentException.class, () -> auction.with(Bid.PASS));
        }

        @Test
        void callsRotateFromTheDealer() {
            Auction auction = Auction.of(Seat.WEST, "1♣", "P");

            assertEquals(Seat.EAST, auction.nextSeat());
            assertEquals(Seat.WEST, auction.getCalls().get(0).seat());
        }
    }

    @Nested
    @DisplayName("Ordering")
    class Ordering {

        @Test
        void mixedCallsSortBelowContractBids() {
            List<Bid> calls = new ArrayList<>(List.of(
                    Bid.parse("2♣"), Bid.REDOUBLE, Bid.parse("1NT"), Bid.PASS, Bid.DOUBLE, Bid.parse("1♠")));

            Collections.sort(calls);

            assertEquals(List.of(Bid.PASS, Bid.DOUBLE, Bid.REDOUBLE,
                    Bid.parse("1♠"), Bid.parse("1NT"), Bid.parse("2♣")), calls);
        }

        @Test
        void ladderIndexStillRejectsNonContractCalls() {
            assertThrows(IllegalStateException.class, Bid.PASS::ladderIndex);
            assertEquals(34, Bid.parse("7NT").ladderIndex());
        }
    }
}
