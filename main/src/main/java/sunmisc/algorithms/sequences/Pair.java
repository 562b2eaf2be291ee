package sunmisc.algorithms.sequences;

public record Pair<T>(T first, T second) {

    @Override
    public String toString() {
        return "(" + this.first + ", " + this.second + ")";
    }
}
