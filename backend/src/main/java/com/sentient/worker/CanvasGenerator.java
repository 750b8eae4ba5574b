package com.sentient.worker;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Renders a canvas template with its identifying footer.
 *
 * Output depends only on the template, the record id and the clock, so the
 * same inputs at the same instant always render the same text.
 */
@Component
@RequiredArgsConstructor
public class CanvasGenerator {

    static final String TITLE = "Sentient Planner - Emotion Canvas";
    static final int SHORT_ID_LENGTH = 8;

    private static final DateTimeFormatter FOOTER_TIME =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'").withZone(ZoneOffset.UTC);

    private final Clock clock;

    public String render(EmotionCanvas canvas, String recordId) {
        String shortId = recordId.length() > SHORT_ID_LENGTH ? recordId.substring(0, SHORT_ID_LENGTH) : recordId;
        String generated = FOOTER_TIME.format(clock.instant());

        return canvas.art()
                + "\n"
                + "  +--------------------------------------+\n"
                + "  | " + pad(TITLE) + " |\n"
                + "  | " + pad("ID: " + shortId) + " |\n"
                + "  | " + pad("Generated: " + generated) + " |\n"
                + "  +--------------------------------------+\n";
    }

    private static String pad(String value) {
        return String.format("%-36s", value);
    }
}
