package com.autofurigana.infrastructure.furigana.rendering;

import com.autofurigana.domain.furigana.model.AlignedSegment.RubyPair;
import com.autofurigana.domain.furigana.model.CandidateOrigin;
import com.autofurigana.domain.furigana.model.ResolvedSpan;
import com.autofurigana.infrastructure.furigana.script.ScriptClassifier;
import lombok.RequiredArgsConstructor;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Entities;
import org.jsoup.nodes.TextNode;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Assembles an HTML fragment from a text and its resolved spans.
 *
 * <pre>
 *   &lt;ruby class="furi"&gt;&lt;rb&gt;漢&lt;/rb&gt;&lt;rt&gt;かん&lt;/rt&gt;&lt;rb&gt;は&lt;/rb&gt;&lt;rt&gt;&lt;/rt&gt;&lt;/ruby&gt;
 * </pre>
 *
 * Explicit rb/rt pairs keep browsers from regrouping chunks. Readings are shown only above chunks
 * containing kanji; automatic spans without any kanji stay plain text.
 */
@Component
@RequiredArgsConstructor
public class RubyMarkupRenderer {

    public static final String RUBY_CLASS = "furi";

    private final ScriptClassifier scriptClassifier;

    /**
     * @param text  source text the span offsets refer to
     * @param spans ordered, non-overlapping spans
     * @return HTML fragment, text escaped
     */
    public String render(String text, List<ResolvedSpan> spans) {
        Document document = Document.createShell("");
        document.outputSettings()
                .prettyPrint(false)
                .escapeMode(Entities.EscapeMode.base);
        Element body = document.body();

        int cursor = 0;
        for (ResolvedSpan span : spans) {
            if (span.from() > cursor) {
                body.appendChild(new TextNode(text.substring(cursor, span.from())));
            }
            if (span.origin() == CandidateOrigin.AUTOMATIC
                    && !scriptClassifier.containsKanji(span.segment().baseText())) {
                body.appendChild(new TextNode(text.substring(span.from(), span.to())));
            } else {
                body.appendChild(ruby(span.segment().pairs()));
            }
            cursor = span.to();
        }
        if (cursor < text.length()) {
            body.appendChild(new TextNode(text.substring(cursor)));
        }
        return body.html();
    }

    Element ruby(List<RubyPair> pairs) {
        Element ruby = new Element("ruby").addClass(RUBY_CLASS);
        for (RubyPair pair : pairs) {
            ruby.appendElement("rb").text(pair.base());
            ruby.appendElement("rt").text(scriptClassifier.containsKanji(pair.base()) ? pair.reading() : "");
        }
        return ruby;
    }
}
