package ai.bridge.scoring;

import ai.bridge.auction.Contract;
import ai.bridge.auction.DoubledState;
import ai.bridge.auction.Strain;
import ai.bridge.game.Card;
import ai.bridge.game.Hand;
import ai.bridge.game.Rank;
import ai.bridge.game.Seat;
import ai.bridge.game.Suit;
import ai.bridge.game.Vulnerability;
import java.util.Map;
import java.util.Optional;

/**
 * Duplicate bridge scoring.
 */
public final class Scorer {

    private Scorer() {
        // Utility class.
    }

    /**
     * Scores a played hand.
     *
     * @param contract      the contract
     * @param tricksTaken   tricks won by declarer's side (0-13)
     * @param vulnerability the board's vulnerability
     * @return the score, signed from declarer's view
     * @throws IllegalArgumentException if the trick count is out of range
     */
    public static HandScore score(Contract contract, int tricksTaken, Vulnerability vulnerability) {
        if (tricksTaken < 0 || tricksTaken > 13) {
            throw new IllegalArgumentException("Tricks taken must be 0-13: " + tricksTaken);
        }
        boolean vulnerable = vulnerability.isVulnerable(contract.declaringSide());
        if (tricksTaken < contract.tricksRequired()) {
            int penalty = undertrickPenalty(contract.tricksRequired() - tricksTaken, contract.doubled(), vulnerable);
            return new HandScore(contract, tricksTaken, vulnerable, 0, 0, 0, 0, 0, penalty, 0, -penalty);
        }
        DoubledState doubled = contract.doubled();
        int perTrick = contract.strain().isMinor() ? 20 : 30;
        int trickScore = contract.level() * perTrick + (contract.strain().isNotrump() ? 10 : 0);
        trickScore *= doubled.getMultiplier();

        int gameBonus = trickScore >= 100 ? (vulnerable ? 500 : 300) : 50;
        int slamBonus = switch (contract.level()) {
            case 6 -> vulnerable ? 750 : 500;
            case 7 -> vulnerable ? 1500 : 1000;
            default -> 0;
        };
        int overtricks = tricksTaken - contract.tricksRequired();
        int overtrickScore = switch (doubled) {
            case NONE -> overtricks * perTrick;
            case DOUBLED -> overtricks * (vulnerable ? 200 : 100);
            case REDOUBLED -> overtricks * (vulnerable ? 400 : 200);
        };
        int insultBonus = switch (doubled) {
            case NONE -> 0;
            case DOUBLED -> 50;
            case REDOUBLED -> 100;
        };
        int total = trickScore + gameBonus + slamBonus + overtrickScore + insultBonus;
        return new HandScore(contract, tricksTaken, vulnerable, trickScore, gameBonus, slamBonus, overtrickScore,
                insultBonus, 0, 0, total);
    }

    /**
     * Scores a played hand including the honours bonus, which goes to whichever side holds the
     * honours.
     *
     * @param contract      the contract
     * @param tricksTaken   tricks won by declarer's side
     * @param vulnerability the board's vulnerability
     * @param hands         the four original hands
     * @return the score, signed from declarer's view
     */
    public static HandScore score(Contract contract, int tricksTaken, Vulnerability vulnerability,
                                  Map<Seat, Hand> hands) {
        HandScore base = score(contract, tricksTaken, vulnerability);
        int honours = 0;
        for (Map.Entry<Seat, Hand> entry : hands.entrySet()) {
            int bonus = honoursIn(contract.strain(), entry.getValue());
            if (bonus > 0) {
                honours = entry.getKey().side() == contract.declaringSide() ? bonus : -bonus;
                break;
            }
        }
        if (honours == 0) {
            return base;
        }
        return new HandScore(contract, tricksTaken, base.vulnerable(), base.trickScore(), base.gameBonus(),
                base.slamBonus(), base.overtrickScore(), base.insultBonus(), base.penalty(), honours,
                base.score() + honours);
    }

    /**
     * Honours held in one hand: 150 for all four aces at notrump, otherwise 150 for all five trump
     * honours and 100 for four of them.
     */
    static int honoursIn(Strain strain, Hand hand) {
        Optional<Suit> trump = strain.suit();
        if (trump.isEmpty()) {
            return hand.count(Rank.ACE) == 4 ? 150 : 0;
        }
        int held = 0;
        for (Card card : hand.cardsIn(trump.get())) {
            if (card.getRank().getValue() >= Rank.TEN.getValue()) {
                held++;
            }
        }
        if (held == 5) {
            return 150;
        }
        return held == 4 ? 100 : 0;
    }

    /**
     * Undertrick points. Undoubled: 50 a trick, 100 vulnerable. Doubled not vulnerable: 100, then
     * 200 for the second and third, then 300 each. Doubled vulnerable: 200, then 300 each.
     * Redoubled is twice doubled.
     */
    static int undertrickPenalty(int undertricks, DoubledState doubled, boolean vulnerable) {
        if (doubled == DoubledState.NONE) {
            return undertricks * (vulnerable ? 100 : 50);
        }
        int penalty = 0;
        for (int i = 1; i <= undertricks; i++) {
            if (vulnerable) {
                penalty += i == 1 ? 200 : 300;
            } else {
                penalty += i == 1 ? 100 : (i <= 3 ? 200 : 300);
            }
        }
        return doubled == DoubledState.REDOUBLED ? penalty * 2 : penalty;
    }
}
