package com.autofurigana.infrastructure.furigana.segmentation;

import com.autofurigana.domain.furigana.model.AlignedSegment;
import com.autofurigana.domain.furigana.model.Token;
import com.autofurigana.infrastructure.furigana.script.ReadingNormalizer;
import com.autofurigana.infrastructure.furigana.script.ScriptClassifier;
import com.autofurigana.support.StubReadingTokenizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SegmentBuilderTest {

    private SegmentBuilder builder;
    private StubReadingTokenizer tokenizer;

    @BeforeEach
    void setUp() {
        ScriptClassifier classifier = new ScriptClassifier();
        ReadingNormalizer normalizer = new ReadingNormalizer();
        builder = new SegmentBuilder(classifier, normalizer, new OkuriganaSplitter(classifier, normalizer));
        tokenizer = StubReadingTokenizer.common();
    }

    @Nested
    @DisplayName("With tokenizer")
    class WithTokenizer {

        @Test
        @DisplayName("お願いします → お/願/い/し/ます")
        void okurigana_split() {
            AlignedSegment segment = builder.build("お願いします", tokenizer);

            assertThat(segment.baseChunks()).containsExactly("お", "願", "い", "し", "ます");
            assertThat(segment.readingChunks()).containsExactly("お", "ねが", "い", "し", "ます");
        }

        @Test
        @DisplayName("Whole-kanji token keeps a single chunk")
        void whole_kanji() {
            AlignedSegment segment = builder.build("日本語", tokenizer);

            assertThat(segment.baseChunks()).containsExactly("日本語");
            assertThat(segment.readingChunks()).containsExactly("にほんご");
        }

        @Test
        @DisplayName("Kana-only token passes through as one pair")
        void kana_token() {
            AlignedSegment segment = builder.build("カタカナ", text -> List.of(new Token("カタカナ", "カタカナ")));

            assertThat(segment.baseChunks()).containsExactly("カタカナ");
            assertThat(segment.readingChunks()).containsExactly("かたかな");
        }

        @Test
        @DisplayName("Reading fully consumed by kana walks → core gets the whole reading")
        void empty_core_reading() {
            AlignedSegment segment = builder.build("お茶", text -> List.of(new Token("お茶", "オ")));

            assertThat(segment.baseChunks()).containsExactly("お", "茶");
            assertThat(segment.readingChunks()).containsExactly("お", "お");
        }

        @Test
        @DisplayName("Unread kanji token uses its surface as reading")
        void unread_token() {
            AlignedSegment segment = builder.build("鬱", text -> List.of(Token.unread("鬱")));

            assertThat(segment.baseChunks()).containsExactly("鬱");
            assertThat(segment.readingChunks()).containsExactly("鬱");
        }

        @Test
        @DisplayName("Tokenizer returning nothing → whole-string fallback")
        void no_tokens() {
            AlignedSegment segment = builder.build("漢字", text -> List.of());

            assertThat(segment.baseChunks()).containsExactly("漢字");
            assertThat(segment.readingChunks()).containsExactly("漢字");
        }

        @Test
        @DisplayName("Base chunks concatenate back to the input")
        void reconstructs_input() {
            String text = "これは漢字です";
            AlignedSegment segment = builder.build(text, tokenizer);

            assertThat(segment.baseText()).isEqualTo(text);
            assertThat(segment.readingChunks()).hasSameSizeAs(segment.baseChunks());
        }
    }

    @Nested
    @DisplayName("Without tokenizer")
    class WithoutTokenizer {

        @Test
        @DisplayName("Whole input becomes one unread chunk")
        void degraded() {
            AlignedSegment segment = builder.build("漢字");

            assertThat(segment.baseChunks()).containsExactly("漢字");
            assertThat(segment.readingChunks()).containsExactly("漢字");
        }

        @Test
        @DisplayName("Katakana input is still normalized")
        void degraded_katakana() {
            AlignedSegment segment = builder.build("カナ", null);

            assertThat(segment.readingChunks()).containsExactly("かな");
        }

        @Test
        @DisplayName("Empty input → empty segment")
        void empty() {
            assertThat(builder.build("").isEmpty()).isTrue();
            assertThat(builder.build(null, tokenizer).isEmpty()).isTrue();
        }
    }
}
