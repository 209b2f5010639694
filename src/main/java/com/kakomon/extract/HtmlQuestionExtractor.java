package com.kakomon.extract;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the randomized single-question page (AP-siken layout) with Jsoup.
 * Each {@code .qBlock} is one question; without such blocks the whole page is one question.
 */
public final class HtmlQuestionExtractor implements Extractor {
    private static final String[] CHOICE_IDS = {"select_a", "select_i", "select_u", "select_e"};
    private static final Pattern TOTAL_HINT = Pattern.compile("選択中の問題\\s*(\\d+)\\s*問");
    private static final Pattern TRAILING_NUMBER = Pattern.compile("(\\d+)\\s*$");
    private static final Pattern BLOCK_NUMBER = Pattern.compile("問\\s*([0-9０-９]+)");
    private static final Pattern YEAR_LABEL = Pattern.compile("(\\p{IsHan}{2}\\s*(?:元|[0-9０-９]+)\\s*年|(?:19|20)[0-9]{2})");
    private static final Pattern CATEGORY_SPLIT = Pattern.compile("\\s*(?:»|＞|&raquo;|>)\\s*");

    @Override
    public ExtractionResult extract(String rawBody) throws ExtractionException {
        if (rawBody == null || rawBody.isBlank()) {
            throw new ExtractionException("empty html body");
        }
        Document doc = Jsoup.parse(rawBody);
        List<Element> scopes = new ArrayList<>(doc.select(".qBlock"));
        if (scopes.isEmpty()) {
            scopes.add(doc);
        }

        List<RawQuestion> candidates = new ArrayList<>();
        int skipped = 0;
        for (Element scope : scopes) {
            if (scope.selectFirst(".selectList") == null) {
                skipped++;
                continue;
            }
            candidates.add(readBlock(doc, scope));
        }
        if (candidates.isEmpty()) {
            throw new ExtractionException("no question block on page (title=" + doc.title() + ")");
        }
        return new ExtractionResult(
                candidates,
                Continuation.requestAgain(),
                parseTotalHint(doc.text()),
                hiddenFields(doc),
                skipped
        );
    }

    private RawQuestion readBlock(Document doc, Element scope) {
        return RawQuestion.builder()
                .origin(ExtractionMode.HTML)
                .sequence(questionNumber(doc, scope))
                .yearLabel(yearLabel(doc, scope))
                .categorySegments(categoryPath(scope))
                .text(text(scope.selectFirst("h3.qno + div")))
                .choices(choices(scope))
                .answerMarker(text(scope.selectFirst("#answerChar")))
                .explanation(text(scope.selectFirst("#kaisetsu")))
                .sourceUrl(sourceUrl(doc))
                .build();
    }

    private List<String> choices(Element scope) {
        List<String> out = new ArrayList<>(CHOICE_IDS.length);
        boolean anyById = false;
        for (String id : CHOICE_IDS) {
            Element el = scope.selectFirst("#" + id);
            anyById |= el != null;
            out.add(text(el));
        }
        if (anyById) {
            return out;
        }
        List<String> listed = new ArrayList<>();
        for (Element li : scope.select(".selectList li")) {
            listed.add(li.text());
        }
        return listed;
    }

    private List<String> categoryPath(Element scope) {
        Element heading = null;
        for (Element h3 : scope.select("h3")) {
            if (h3.text().contains("分類")) {
                heading = h3;
                break;
            }
        }
        if (heading == null) {
            return List.of();
        }
        Element div = heading.nextElementSibling();
        while (div != null && !div.tagName().equals("div")) {
            div = div.nextElementSibling();
        }
        if (div == null) {
            return List.of();
        }
        List<String> parts = new ArrayList<>();
        for (String part : CATEGORY_SPLIT.split(div.text())) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                parts.add(trimmed);
            }
        }
        return parts;
    }

    /**
     * A block's own {@code _q} input, else its {@code 問N} heading. The page-level {@code _q} numbers only
     * a single-question page; on a multi-block page it belongs to none of the blocks.
     */
    private Integer questionNumber(Document doc, Element scope) {
        Element hidden = scope.selectFirst("input[name=_q]");
        if (hidden != null) {
            return number(TRAILING_NUMBER, hidden.attr("value").replace('_', ' '));
        }
        if (scope == doc) {
            return null;
        }
        Element heading = scope.selectFirst("h3.qno");
        return heading == null ? null : number(BLOCK_NUMBER, heading.text());
    }

    private static Integer number(Pattern pattern, String text) {
        Matcher m = pattern.matcher(text);
        if (!m.find()) {
            return null;
        }
        try {
            return Integer.parseInt(m.group(1));
        } catch (NumberFormatException ignored) {
            return null;
        }
    }

    private String yearLabel(Document doc, Element scope) {
        Element heading = scope.selectFirst("h3.qno");
        String found = heading == null ? "" : firstYearLabel(heading.text());
        if (found.isEmpty()) {
            found = firstYearLabel(doc.title());
        }
        return found;
    }

    private String firstYearLabel(String text) {
        if (text == null) {
            return "";
        }
        Matcher m = YEAR_LABEL.matcher(text);
        return m.find() ? m.group(1) : "";
    }

    private String sourceUrl(Document doc) {
        Element meta = doc.selectFirst("meta[property=og:url]");
        return meta == null ? "" : meta.attr("content").trim();
    }

    public static OptionalInt parseTotalHint(String text) {
        if (text == null) {
            return OptionalInt.empty();
        }
        Matcher m = TOTAL_HINT.matcher(text);
        if (!m.find()) {
            return OptionalInt.empty();
        }
        try {
            return OptionalInt.of(Integer.parseInt(m.group(1)));
        } catch (NumberFormatException ignored) {
            return OptionalInt.empty();
        }
    }

    /**
     * Reads the first form of {@code html}. A page without a form submits hidden fields by GET to {@code pageUrl}.
     */
    public static FormState readForm(String html, String pageUrl) {
        Document doc = Jsoup.parse(html == null ? "" : html, pageUrl == null ? "" : pageUrl);
        Element form = doc.selectFirst("form");
        if (form == null) {
            return new FormState(pageUrl, false, Map.of());
        }
        String action = form.absUrl("action");
        boolean post = "post".equalsIgnoreCase(form.attr("method").trim());
        return new FormState(action.isEmpty() ? pageUrl : action, post, hiddenFields(doc));
    }

    private static Map<String, String> hiddenFields(Document doc) {
        Map<String, String> out = new LinkedHashMap<>();
        Elements hidden = doc.select("form input[type=hidden][name]");
        for (Element input : hidden) {
            out.put(input.attr("name"), input.attr("value"));
        }
        return out;
    }

    private static String text(Element el) {
        return el == null ? "" : el.text();
    }
}
