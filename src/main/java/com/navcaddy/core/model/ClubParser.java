package com.navcaddy.core.model;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves free-text club references ("7i", "7-iron", "PW", "big stick") to a canonical {@link Club}.
 * <p>
 * Unrecognised text resolves to {@code null} so that a bad club never fails a classification.
 */
public final class ClubParser {

    private static final Pattern IRON = Pattern.compile("(\\d)i(?:ron)?");
    private static final Pattern HYBRID = Pattern.compile("(\\d)(?:h|hy|hybrid)|hybrid(\\d)");
    private static final Pattern WOOD = Pattern.compile("(\\d)(?:w|wood)");

    private static final Map<Integer, Club> IRONS = Map.of(
            3, new Club("3-Iron", ClubType.IRON, 20.0, 180),
            4, new Club("4-Iron", ClubType.IRON, 23.0, 170),
            5, new Club("5-Iron", ClubType.IRON, 26.0, 160),
            6, new Club("6-Iron", ClubType.IRON, 29.0, 150),
            7, new Club("7-Iron", ClubType.IRON, 33.0, 140),
            8, new Club("8-Iron", ClubType.IRON, 37.0, 130),
            9, new Club("9-Iron", ClubType.IRON, 41.0, 120)
    );

    private static final Map<Integer, Club> HYBRIDS = Map.of(
            2, new Club("2-Hybrid", ClubType.HYBRID, 17.0, 195),
            3, new Club("3-Hybrid", ClubType.HYBRID, 19.0, 185),
            4, new Club("4-Hybrid", ClubType.HYBRID, 22.0, 175),
            5, new Club("5-Hybrid", ClubType.HYBRID, 25.0, 165)
    );

    private static final Map<Integer, Club> WOODS = Map.of(
            3, new Club("3-Wood", ClubType.WOOD, 15.0, 210),
            5, new Club("5-Wood", ClubType.WOOD, 18.0, 195),
            7, new Club("7-Wood", ClubType.WOOD, 21.0, 180)
    );

    private static final Club DRIVER = new Club("Driver", ClubType.DRIVER, 10.5, 230);
    private static final Club PITCHING_WEDGE = new Club("Pitching Wedge", ClubType.WEDGE, 46.0, 110);
    private static final Club GAP_WEDGE = new Club("Gap Wedge", ClubType.WEDGE, 50.0, 100);
    private static final Club SAND_WEDGE = new Club("Sand Wedge", ClubType.WEDGE, 56.0, 80);
    private static final Club LOB_WEDGE = new Club("Lob Wedge", ClubType.WEDGE, 60.0, 60);
    private static final Club PUTTER = new Club("Putter", ClubType.PUTTER, 3.0, 0);

    private ClubParser() {} // utility class

    /**
     * @param text club reference as typed, spoken or returned by the model
     * @return the canonical club, or {@code null} when the text names no known club
     */
    public static Club parse(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        String key = text.toLowerCase(Locale.ROOT).replace("-", "").replace(" ", "");

        if (key.equals("d") || key.equals("1w") || key.contains("driver") || key.contains("bigstick")
                || key.contains("bigdog")) {
            return DRIVER;
        }
        if (key.contains("putter") || key.contains("flatstick")) {
            return PUTTER;
        }
        if (key.equals("pw") || key.contains("pitching")) {
            return PITCHING_WEDGE;
        }
        if (key.equals("gw") || key.equals("aw") || key.contains("gap") || key.contains("approach")) {
            return GAP_WEDGE;
        }
        if (key.equals("sw") || key.contains("sandwedge")) {
            return SAND_WEDGE;
        }
        if (key.equals("lw") || key.contains("lob")) {
            return LOB_WEDGE;
        }

        Matcher iron = IRON.matcher(key);
        if (iron.matches()) {
            return IRONS.get(Integer.parseInt(iron.group(1)));
        }
        Matcher hybrid = HYBRID.matcher(key);
        if (hybrid.matches()) {
            String digit = hybrid.group(1) != null ? hybrid.group(1) : hybrid.group(2);
            return HYBRIDS.get(Integer.parseInt(digit));
        }
        Matcher wood = WOOD.matcher(key);
        if (wood.matches()) {
            return WOODS.get(Integer.parseInt(wood.group(1)));
        }
        return null;
    }
}
