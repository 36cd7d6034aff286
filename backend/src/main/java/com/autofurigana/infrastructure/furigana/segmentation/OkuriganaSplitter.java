package com.autofurigana.infrastructure.furigana.segmentation;

import com.autofurigana.infrastructure.furigana.script.ReadingNormalizer;
import com.autofurigana.infrastructure.furigana.script.ScriptClassifier;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Splits one token's surface into [leading kana][kanji core][trailing kana] and aligns the reading.
 *
 * <p>Leading kana are consumed while the remaining reading starts with their hiragana form;
 * trailing kana are consumed, without crossing the leading cursor, while the remaining reading
 * ends with theirs. Whatever is left of the reading belongs to the core.</p>
 *
 * <pre>
 *   お願い / おねがい → お | 願(ねが) | い
 *   食べる / たべる   →    | 食(た)   | べる
 * </pre>
 *
 * A kanji whose true reading happens to share kana with the adjacent okurigana can be mis-split;
 * that approximation is kept as is.
 */
@Component
@RequiredArgsConstructor
public class OkuriganaSplitter {

    private final ScriptClassifier scriptClassifier;
    private final ReadingNormalizer readingNormalizer;

    /**
     * @param surface     token surface containing at least one kanji
     * @param readingHira the token reading, already normalized to hiragana
     */
    public OkuriganaSplit split(String surface, String readingHira) {
        String remaining = readingHira;

        int i = 0;
        StringBuilder prefixBase = new StringBuilder();
        StringBuilder prefixReading = new StringBuilder();
        while (i < surface.length()) {
            char ch = surface.charAt(i);
            if (!scriptClassifier.isKana(ch)) {
                break;
            }
            String hira = String.valueOf((char) readingNormalizer.toHiragana(ch));
            if (!remaining.startsWith(hira)) {
                break;
            }
            prefixBase.append(ch);
            prefixReading.append(hira);
            remaining = remaining.substring(hira.length());
            i++;
        }

        int j = surface.length() - 1;
        StringBuilder suffixBase = new StringBuilder();
        StringBuilder suffixReading = new StringBuilder();
        while (j >= i) {
            char ch = surface.charAt(j);
            if (!scriptClassifier.isKana(ch)) {
                break;
            }
            String hira = String.valueOf((char) readingNormalizer.toHiragana(ch));
            if (!remaining.endsWith(hira)) {
                break;
            }
            suffixBase.insert(0, ch);
            suffixReading.insert(0, hira);
            remaining = remaining.substring(0, remaining.length() - hira.length());
            j--;
        }

        return new OkuriganaSplit(
                surface.substring(i, j + 1),
                remaining,
                new KanaAffix(prefixBase.toString(), prefixReading.toString()),
                new KanaAffix(suffixBase.toString(), suffixReading.toString()));
    }

    /**
     * Result of {@link #split}. {@code prefix.base + base + suffix.base} always equals the surface.
     *
     * @param base        the kanji core (may contain inner kana)
     * @param baseReading reading left for the core, possibly empty
     * @param prefix      leading kana and their reading
     * @param suffix      trailing kana and their reading
     */
    public record OkuriganaSplit(String base, String baseReading, KanaAffix prefix, KanaAffix suffix) {}

    public record KanaAffix(String base, String reading) {

        public boolean isEmpty() {
            return base.isEmpty();
        }
    }
}
