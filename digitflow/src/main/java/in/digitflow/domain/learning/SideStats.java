package in.digitflow.domain.learning;

public record SideStats(int trades, int wins, int losses) {

    public static SideStats empty() {
        return new SideStats(0, 0, 0);
    }

    public SideStats record(boolean won) {
        return new SideStats(trades + 1, won ? wins + 1 : wins, won ? losses : losses + 1);
    }
}
