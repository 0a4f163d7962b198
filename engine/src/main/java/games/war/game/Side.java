package games.war.game;

/**
 * The two seats at the table.
 */
public enum Side {
    A("Player A"),
    B("Player B");

    private final String displayName;

    Side(String displayName) {
        this.displayName = displayName;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
