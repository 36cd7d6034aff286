package com.autofurigana.application.furigana;

import com.autofurigana.application.furigana.exception.TextTooLongException;
import com.autofurigana.domain.furigana.model.AlignedSegment;
import com.autofurigana.domain.furigana.model.AnnotationStats;
import com.autofurigana.domain.furigana.model.FuriganaResult;
import com.autofurigana.domain.furigana.model.NotationStyle;
import com.autofurigana.infrastructure.furigana.pipeline.FuriganaPipeline;
import com.autofurigana.infrastructure.furigana.pipeline.ViewportFuriganaPipeline;
import com.autofurigana.infrastructure.furigana.pipeline.ViewportFuriganaPipeline.VisibleRange;
import com.autofurigana.infrastructure.furigana.rendering.RubyMarkupRenderer;
import com.autofurigana.infrastructure.furigana.script.ReadingNormalizer;
import com.autofurigana.infrastructure.furigana.script.ScriptClassifier;
import com.autofurigana.infrastructure.furigana.segmentation.OkuriganaSplitter;
import com.autofurigana.infrastructure.furigana.segmentation.SegmentBuilder;
import com.autofurigana.infrastructure.tokenizer.TokenizerInitializationException;
import com.autofurigana.infrastructure.tokenizer.TokenizerProvider;
import com.autofurigana.support.StubReadingTokenizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.lang.reflect.Field;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FuriganaAppServiceTest {

    private static final FuriganaResult EMPTY_RESULT = new FuriganaResult(
            "", List.of(), true, new AnnotationStats(0, 0, 0, 0, 0, 0, 0, 0));

    @Mock
    private FuriganaPipeline furiganaPipeline;
    @Mock
    private ViewportFuriganaPipeline viewportPipeline;
    @Mock
    private SegmentBuilder segmentBuilder;
    @Mock
    private RubyMarkupRenderer rubyMarkupRenderer;
    @Mock
    private TokenizerProvider tokenizerProvider;

    private FuriganaSettings settings;
    private FuriganaAppService service;

    @BeforeEach
    void setUp() throws Exception {
        settings = new FuriganaSettings(true, true, "curly");
        service = new FuriganaAppService(
                furiganaPipeline, viewportPipeline, segmentBuilder, rubyMarkupRenderer, tokenizerProvider, settings);
        setMaxTextLength(service, 10);
    }

    private static void setMaxTextLength(FuriganaAppService target, int value) throws Exception {
        Field field = FuriganaAppService.class.getDeclaredField("maxTextLength");
        field.setAccessible(true);
        field.set(target, value);
    }

    @Nested
    @DisplayName("annotate")
    class Annotate {

        @Test
        @DisplayName("Configured notation style is used when the request has none")
        void default_style() {
            when(furiganaPipeline.annotate(anyString(), any(), anyList(), anyBoolean())).thenReturn(EMPTY_RESULT);

            service.annotate("漢字", null, List.of(), true, false);

            verify(furiganaPipeline).annotate("漢字", NotationStyle.CURLY, List.of(), true);
            verify(tokenizerProvider, never()).awaitReady();
        }

        @Test
        @DisplayName("Request style overrides the configured one")
        void request_style() {
            when(furiganaPipeline.annotate(anyString(), any(), anyList(), anyBoolean())).thenReturn(EMPTY_RESULT);

            service.annotate("漢字", "square", List.of(), false, false);

            verify(furiganaPipeline).annotate("漢字", NotationStyle.SQUARE, List.of(), false);
        }

        @Test
        @DisplayName("waitForTokenizer blocks on the provider first")
        void wait_for_tokenizer() {
            when(tokenizerProvider.awaitReady()).thenReturn(new StubReadingTokenizer());
            when(furiganaPipeline.annotate(anyString(), any(), anyList(), anyBoolean())).thenReturn(EMPTY_RESULT);

            service.annotate("漢字", null, List.of(), true, true);

            verify(tokenizerProvider).awaitReady();
        }

        @Test
        @DisplayName("Tokenizer timeout propagates")
        void tokenizer_timeout() {
            when(tokenizerProvider.awaitReady()).thenThrow(new TokenizerInitializationException("Tokenizer init timeout"));

            assertThatThrownBy(() -> service.annotate("漢字", null, List.of(), true, true))
                    .isInstanceOf(TokenizerInitializationException.class);
            verify(furiganaPipeline, never()).annotate(anyString(), any(), anyList(), anyBoolean());
        }

        @Test
        @DisplayName("Reading mode off → text unchanged, no spans")
        void reading_mode_off() {
            settings.update(null, false, null);

            FuriganaResult result = service.annotate("漢字", null, List.of(), true, false);

            assertThat(result.text()).isEqualTo("漢字");
            assertThat(result.spans()).isEmpty();
            verify(furiganaPipeline, never()).annotate(anyString(), any(), anyList(), anyBoolean());
        }

        @Test
        @DisplayName("Text over the limit is rejected")
        void too_long() {
            assertThatThrownBy(() -> service.annotate("12345678901", null, List.of(), true, false))
                    .isInstanceOf(TextTooLongException.class)
                    .hasMessageContaining("10");
        }

        @Test
        @DisplayName("Raised limit admits text beyond the default")
        void raised_limit() throws Exception {
            setMaxTextLength(service, 200_000);
            String text = "あ".repeat(150_000);
            when(furiganaPipeline.annotate(anyString(), any(), anyList(), anyBoolean())).thenReturn(EMPTY_RESULT);

            service.annotate(text, null, List.of(), true, false);

            verify(furiganaPipeline).annotate(text, NotationStyle.CURLY, List.of(), true);
        }
    }

    @Nested
    @DisplayName("viewport")
    class Viewport {

        @Test
        @DisplayName("Delegates with the current notation style")
        void delegates() {
            List<VisibleRange> ranges = List.of(new VisibleRange(0, 2));
            when(viewportPipeline.compute(eq("漢字"), eq(ranges), anyList(), eq(NotationStyle.CURLY)))
                    .thenReturn(EMPTY_RESULT);

            assertThat(service.viewport("漢字", ranges, List.of(), null)).isSameAs(EMPTY_RESULT);
        }

        @Test
        @DisplayName("Editing mode off → no spans")
        void editing_mode_off() {
            settings.update(false, null, null);

            FuriganaResult result = service.viewport("漢字", List.of(new VisibleRange(0, 2)), List.of(), null);

            assertThat(result.spans()).isEmpty();
            verify(viewportPipeline, never()).compute(anyString(), anyList(), anyList(), any());
        }
    }

    @Nested
    @DisplayName("segments")
    class Segments {

        @Test
        @DisplayName("Uses the built tokenizer when present")
        void built_tokenizer() {
            StubReadingTokenizer tokenizer = new StubReadingTokenizer();
            when(tokenizerProvider.currentOrStart()).thenReturn(Optional.of(tokenizer));

            service.segments("漢字", false);

            verify(segmentBuilder).build("漢字", tokenizer);
        }

        @Test
        @DisplayName("First call starts the build and degrades, a later call gets real readings")
        void starts_build() throws Exception {
            QueuedExecutor executor = new QueuedExecutor();
            TokenizerProvider provider = new TokenizerProvider(StubReadingTokenizer::common, executor, Duration.ofSeconds(1));
            ScriptClassifier classifier = new ScriptClassifier();
            ReadingNormalizer normalizer = new ReadingNormalizer();
            SegmentBuilder realBuilder =
                    new SegmentBuilder(classifier, normalizer, new OkuriganaSplitter(classifier, normalizer));
            FuriganaAppService realService = new FuriganaAppService(
                    furiganaPipeline, viewportPipeline, realBuilder, rubyMarkupRenderer, provider, settings);
            setMaxTextLength(realService, 100);

            AlignedSegment degraded = realService.segments("お願い", false);

            assertThat(degraded.readingChunks()).containsExactly("お", "願", "い");
            assertThat(executor.pending()).isEqualTo(1);

            executor.runAll();
            AlignedSegment read = realService.segments("お願い", false);

            assertThat(provider.isReady()).isTrue();
            assertThat(read.baseChunks()).containsExactly("お", "願", "い");
            assertThat(read.readingChunks()).containsExactly("お", "ねが", "い");
        }
    }

    /** Executor that holds tasks until {@link #runAll()}. */
    private static class QueuedExecutor implements Executor {
        private final List<Runnable> tasks = new ArrayList<>();

        @Override
        public void execute(Runnable command) {
            tasks.add(command);
        }

        int pending() {
            return tasks.size();
        }

        void runAll() {
            List<Runnable> queued = new ArrayList<>(tasks);
            tasks.clear();
            queued.forEach(Runnable::run);
        }
    }
}
