package com.dcruver.lifepatterns.domain.temporal;

import com.dcruver.lifepatterns.domain.DayRecord;
import com.dcruver.lifepatterns.domain.EntryTextSource;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Word-list sentiment over the day's text: (positive - negative) / (positive + negative),
 * 0 when neither list matches. Each listed word counts once per day.
 */
public class LexiconMoodSignal implements MoodSignal {

    public static final Set<String> POSITIVE_WORDS = Set.of(
        "good", "great", "happy", "wonderful", "amazing", "love",
        "better", "accomplished", "grateful", "fun", "excited",
        "relieved", "positive", "motivated", "confident", "inspired",
        "recharged", "energetic", "optimistic", "fulfilling", "rewarding");

    public static final Set<String> NEGATIVE_WORDS = Set.of(
        "stress", "pressure", "anxious", "nervous", "worry", "tough",
        "exhausted", "tired", "drained", "difficult", "hard", "sick",
        "worried", "unprepared", "uncertain", "struggling", "frustrated");

    private static final Pattern WORD = Pattern.compile("[a-z']+");

    private final EntryTextSource texts;

    public LexiconMoodSignal(EntryTextSource texts) {
        this.texts = texts;
    }

    @Override
    public double score(DayRecord day) {
        return scoreText(texts.textOf(day.getId()));
    }

    public static double scoreText(String text) {
        if (text == null || text.isBlank()) {
            return 0.0;
        }
        Set<String> words = new HashSet<>();
        Matcher matcher = WORD.matcher(text.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            words.add(matcher.group());
        }

        long positive = POSITIVE_WORDS.stream().filter(words::contains).count();
        long negative = NEGATIVE_WORDS.stream().filter(words::contains).count();
        long total = positive + negative;
        return total == 0 ? 0.0 : (double) (positive - negative) / total;
    }
}
