package com.sentient.worker;

import java.util.Locale;
import java.util.Map;

/**
 * Fixed canvas templates, one per canonical emotion.
 *
 * {@link #resolve(String)} is total: canonical names and known synonyms map to
 * their template, anything else (including null) maps to {@link #NEUTRAL}.
 */
public enum EmotionCanvas {

    HAPPY("""
               \\   |   /
             --   .-.   --
               .-(   )-.
              (  \\_/  )    Today feels bright.
               '-----'      Let it carry you.
            """),

    EXCITED("""
              *    .  *   .   *
                .  \\o/  .       Energy to spare!
              *     |      *    Point it at what matters.
                .  / \\  .
              *    .  *   .   *
            """),

    HOPEFUL("""
                        .
                       /|\\
                      / | \\     A small light ahead.
              ___    /  |  \\    Keep walking toward it.
             (___)~~~~~~~~~~~~
            """),

    ANXIOUS("""
              ~ ~ ~ ~ ~ ~ ~ ~
               ( o   o )         Breathe in for four,
                 \\ ~ /           hold for four,
                  ---            out for four.
              ~ ~ ~ ~ ~ ~ ~ ~
            """),

    STRESSED("""
              [=====]   [=====]
              |  #  |   |  #  |   One thing at a time.
              [=====]   [=====]   The stack gets smaller
                  \\       /       with every step.
                   '-----'
            """),

    SAD("""
                 .-~~~-.
                (  . .  )
                 \\  ^  /        It is fine to feel this.
                  '---'          Rain does not last forever.
               ,  '  ,  '  ,
            """),

    ANGRY("""
              /\\/\\/\\/\\/\\/\\
             <   >    <   >      Heat is information.
              \\   ____   /       Let it pass before you act.
               \\________/
              /\\/\\/\\/\\/\\/\\
            """),

    NEUTRAL("""
              +-------------+
              |             |
              |    -   -    |     Steady and even.
              |      _      |     A good place to plan from.
              |             |
              +-------------+
            """),

    TIRED("""
                 ______
                /      \\
               |  -  -  |  z     Rest is part of the plan.
               |   __   |   z    Be gentle with yourself.
                \\______/     z
            """),

    GRATEFUL("""
               .-.   .-.
              (   \\_/   )
               \\       /         Thank you for this moment.
                \\     /          Gratitude changes the view.
                 \\   /
                  \\_/
            """);

    private static final Map<String, EmotionCanvas> ALIASES = Map.ofEntries(
            Map.entry("joyful", HAPPY),
            Map.entry("elated", EXCITED),
            Map.entry("enthusiastic", EXCITED),
            Map.entry("optimistic", HOPEFUL),
            Map.entry("worried", ANXIOUS),
            Map.entry("nervous", ANXIOUS),
            Map.entry("overwhelmed", STRESSED),
            Map.entry("depressed", SAD),
            Map.entry("melancholic", SAD),
            Map.entry("furious", ANGRY),
            Map.entry("irritated", ANGRY),
            Map.entry("exhausted", TIRED),
            Map.entry("fatigued", TIRED),
            Map.entry("thankful", GRATEFUL),
            Map.entry("appreciative", GRATEFUL)
    );

    private final String art;

    EmotionCanvas(String art) {
        this.art = art;
    }

    public String art() {
        return art;
    }

    /**
     * Map an emotion label to a canvas.
     *
     * @param emotion label as produced by analysis, case and surrounding space ignored
     * @return matching canvas, {@link #NEUTRAL} when unknown
     */
    public static EmotionCanvas resolve(String emotion) {
        if (emotion == null || emotion.isBlank()) {
            return NEUTRAL;
        }
        String normalized = emotion.strip().toLowerCase(Locale.ROOT);

        EmotionCanvas alias = ALIASES.get(normalized);
        if (alias != null) {
            return alias;
        }
        for (EmotionCanvas canvas : values()) {
            if (canvas.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return canvas;
            }
        }
        return NEUTRAL;
    }
}
