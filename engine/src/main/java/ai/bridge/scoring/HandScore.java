package ai.bridge.scoring;

import ai.bridge.auction.Contract;
import ai.bridge.game.Side;

/**
 * The duplicate score of one played hand, with its breakdown.
 *
 * {@link #score()} is signed from the declaring side's view: positive when the contract made,
 * negative when it went down. {@link #pointsFor(Side)} turns that into the points a side actually
 * receives, so the side that benefited always gets a positive number and the other side 0.
 *
 * @param contract       the contract played
 * @param tricksTaken    tricks won by declarer's side
 * @param vulnerable     whether declarer's side was vulnerable
 * @param trickScore     contract trick points, after doubling
 * @param gameBonus      game (300/500) or part-score (50) bonus
 * @param slamBonus      small or grand slam bonus
 * @param overtrickScore points for tricks beyond the contract
 * @param insultBonus    50 for making a doubled contract, 100 redoubled
 * @param penalty        undertrick points due to the defenders
 * @param honours        honours bonus, positive for declarer's side and negative for the defenders
 * @param score          the signed total from declarer's view
 */
public record HandScore(Contract contract, int tricksTaken, boolean vulnerable, int trickScore, int gameBonus,
                        int slamBonus, int overtrickScore, int insultBonus, int penalty, int honours, int score) {

    public boolean made() {
        return tricksTaken >= contract.tricksRequired();
    }

    /**
     * Returns the number of tricks above the contract.
     *
     * @return overtricks, 0 when the contract failed
     */
    public int overtricks() {
        return Math.max(0, tricksTaken - contract.tricksRequired());
    }

    public int undertricks() {
        return Math.max(0, contract.tricksRequired() - tricksTaken);
    }

    /**
     * Credits the score to a partnership.
     *
     * @param side the partnership
     * @return the positive points this side receives, or 0 if the other side scores
     */
    public int pointsFor(Side side) {
        int forSide = side == contract.declaringSide() ? score : -score;
        return Math.max(0, forSide);
    }

    @Override
    public String toString() {
        String result = made()
                ? (overtricks() > 0 ? "made +" + overtricks() : "made")
                : "down " + undertricks();
        return contract + " " + result + ": " + (score > 0 ? "+" : "") + score;
    }
}
