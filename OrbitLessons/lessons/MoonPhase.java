package lessons;

//Names for the eight 45 degree steps of the moon lesson, starting from new moon
public enum MoonPhase {
    NEW_MOON("New Moon"),
    WAXING_CRESCENT("Waxing Crescent"),
    FIRST_QUARTER("First Quarter"),
    WAXING_GIBBOUS("Waxing Gibbous"),
    FULL_MOON("Full Moon"),
    WANING_GIBBOUS("Waning Gibbous"),
    LAST_QUARTER("Last Quarter"),
    WANING_CRESCENT("Waning Crescent");

    private final String label;

    MoonPhase(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    //Unit 8 (a full cycle) wraps back to new moon
    public static MoonPhase forUnit(int unit) {
        MoonPhase[] all = values();
        return all[Math.floorMod(unit, all.length)];
    }
}
