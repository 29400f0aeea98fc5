package org.uctbot.base.player.mcts.model;

public class CumulativeStatistics {

    private int numVisits;
    private int numWins;

    public CumulativeStatistics() {
        numVisits = 0;
        numWins = 0;
    }

    public int getNumVisits() {
        return numVisits;
    }

    public int getNumWins() {
        return numWins;
    }

    public double getWinRate() {
        return (double) numWins / numVisits;
    }

    public void update(boolean won) {
        numVisits++;
        if (won) {
            numWins++;
        }
    }
}
