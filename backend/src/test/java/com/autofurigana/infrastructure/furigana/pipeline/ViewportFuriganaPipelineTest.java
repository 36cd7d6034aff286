package com.autofurigana.infrastructure.furigana.pipeline;

import com.autofurigana.domain.furigana.model.FuriganaResult;
import com.autofurigana.domain.furigana.model.Interval;
import com.autofurigana.domain.furigana.model.NotationStyle;
import com.autofurigana.domain.furigana.model.ResolvedSpan;
import com.autofurigana.domain.furigana.model.SelectionRange;
import com.autofurigana.infrastructure.furigana.pipeline.ViewportFuriganaPipeline.VisibleRange;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ViewportFuriganaPipelineTest {

    // lines: [0,3) [4,7) [8,11)
    private static final String DOC = "一行目\n二行目\n三行目";

    private ViewportFuriganaPipeline pipeline;

    @BeforeEach
    void setUp() {
        pipeline = new ViewportFuriganaPipeline(
                PipelineFixtures.collector(),
                PipelineFixtures.CODE_REGION_SCANNER,
                PipelineFixtures.INTERVAL_RESOLVER,
                PipelineFixtures.readyProvider());
    }

    private FuriganaResult compute(String text, List<VisibleRange> ranges, List<SelectionRange> selections) {
        return pipeline.compute(text, ranges, selections, NotationStyle.CURLY);
    }

    @Nested
    @DisplayName("Line selection")
    class LineSelection {

        @Test
        @DisplayName("Only visible lines are scanned")
        void visible_only() {
            FuriganaResult result = compute(DOC, List.of(new VisibleRange(4, 7)), List.of());

            assertThat(result.spans()).extracting(ResolvedSpan::interval).containsExactly(new Interval(4, 7));
            assertThat(result.stats().scannedLineCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("Ranges sharing a line scan it once")
        void shared_line() {
            FuriganaResult result = compute(DOC, List.of(new VisibleRange(4, 5), new VisibleRange(5, 6)), List.of());

            assertThat(result.spans()).hasSize(1);
            assertThat(result.stats().scannedLineCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("Ranges in any order give sorted spans")
        void unordered_ranges() {
            FuriganaResult result = compute(DOC, List.of(new VisibleRange(8, 11), new VisibleRange(0, 3)), List.of());

            assertThat(result.spans()).extracting(ResolvedSpan::interval)
                    .containsExactly(new Interval(0, 3), new Interval(8, 11));
            assertThat(result.stats().scannedLineCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("Out-of-bounds range is clamped")
        void clamped() {
            FuriganaResult result = compute(DOC, List.of(new VisibleRange(0, 1000)), List.of());

            assertThat(result.spans()).hasSize(3);
        }

        @Test
        @DisplayName("Empty range still touches its line")
        void empty_range() {
            FuriganaResult result = compute(DOC, List.of(new VisibleRange(5, 5)), List.of());

            assertThat(result.spans()).extracting(ResolvedSpan::interval).containsExactly(new Interval(4, 7));
        }

        @Test
        @DisplayName("No visible range → nothing scanned")
        void nothing_visible() {
            FuriganaResult result = compute(DOC, List.of(), List.of());

            assertThat(result.spans()).isEmpty();
            assertThat(result.stats().scannedLineCount()).isZero();
        }
    }

    @Nested
    @DisplayName("Fences")
    class Fences {

        private static final String FENCED = "```\n漢字\n```\n漢字";

        @Test
        @DisplayName("Whole document visible: fenced body skipped")
        void whole_document() {
            FuriganaResult result = compute(FENCED, List.of(new VisibleRange(0, FENCED.length())), List.of());

            assertThat(result.spans()).extracting(ResolvedSpan::interval).containsExactly(new Interval(11, 13));
        }

        @Test
        @DisplayName("Viewport starting inside a fence sees the body as text until the next fence line")
        void starts_inside_fence() {
            FuriganaResult result = compute(FENCED, List.of(new VisibleRange(4, FENCED.length())), List.of());

            assertThat(result.spans()).extracting(ResolvedSpan::interval).containsExactly(new Interval(4, 6));
        }

        @Test
        @DisplayName("Fence state carries across separate ranges")
        void across_ranges() {
            String doc = "```\nx\n漢字\n```";
            FuriganaResult result = compute(doc, List.of(new VisibleRange(0, 1), new VisibleRange(6, 8)), List.of());

            assertThat(result.spans()).isEmpty();
        }
    }

    @Test
    @DisplayName("Caret inside a span suppresses it; state is not carried between calls")
    void caret() {
        List<VisibleRange> all = List.of(new VisibleRange(0, DOC.length()));

        FuriganaResult editing = compute(DOC, all, List.of(SelectionRange.caret(5)));
        FuriganaResult moved = compute(DOC, all, List.of(SelectionRange.caret(0)));

        assertThat(editing.spans()).extracting(ResolvedSpan::interval)
                .containsExactly(new Interval(0, 3), new Interval(8, 11));
        assertThat(moved.spans()).hasSize(3);
    }

    @Test
    @DisplayName("Inverted range is rejected")
    void inverted_range() {
        assertThatThrownBy(() -> new VisibleRange(5, 4)).isInstanceOf(IllegalArgumentException.class);
    }
}
