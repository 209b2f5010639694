package com.kakomon.extract;

import com.kakomon.config.SessionMeta;
import com.kakomon.normalize.EraConverter;
import com.kakomon.normalize.NormalizationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 模块说明：SessionDiscovery（class）。
 * 主要职责：从过去问索引页的 {@code times[]} 复选框中发现可抓取的场次，并生成随机抽题模式的 SessionMeta。
 * 使用建议：无法识别年号的条目直接跳过；表单参数与站点出题页的提交内容保持一致。
 */
public final class SessionDiscovery {
    private static final Logger LOG = LogManager.getLogger(SessionDiscovery.class);

    /**
     * Parses the index page. The returned sessions draw from {@code indexUrl} in randomized mode.
     */
    public List<SessionMeta> discover(String indexHtml, String indexUrl) {
        Document doc = Jsoup.parse(indexHtml == null ? "" : indexHtml);
        Map<String, SessionMeta> out = new LinkedHashMap<>();
        for (Element input : doc.select("input[name=\"times[]\"]")) {
            String code = input.attr("value").trim();
            if (code.isEmpty()) {
                continue;
            }
            String label = labelFor(input);
            int year;
            try {
                year = EraConverter.toGregorian(label);
            } catch (NormalizationException e) {
                LOG.debug("skip session code={} label='{}': {}", code, label, e.getMessage());
                continue;
            }
            out.putIfAbsent(label, SessionMeta.builder()
                    .label(label)
                    .year(year)
                    .startUrl(indexUrl)
                    .form(drawForm(code))
                    .build());
        }
        return new ArrayList<>(out.values());
    }

    private String labelFor(Element input) {
        Element parent = input.parent();
        if (parent != null && parent.tagName().equals("label")) {
            return parent.text().trim();
        }
        Node next = input.nextSibling();
        if (next instanceof TextNode text) {
            return text.text().trim();
        }
        if (next instanceof Element el) {
            return el.text().trim();
        }
        return "";
    }

    /**
     * Form fields the site expects on every draw: the session code, all fields and categories,
     * and the "mixed" drawing mode.
     */
    static Map<String, List<String>> drawForm(String timesCode) {
        Map<String, List<String>> form = new LinkedHashMap<>();
        form.put("times[]", List.of(timesCode));
        form.put("fields[]", List.of("te_all", "ma_all", "st_all"));
        List<String> categories = new ArrayList<>();
        for (int cat = 1; cat <= 23; cat++) {
            categories.add(String.valueOf(cat));
        }
        form.put("categories[]", List.copyOf(categories));
        form.put("options[]", List.of("timesFilter"));
        form.put("moshi", List.of("mix_all"));
        form.put("moshi_cnt", List.of("40"));
        form.put("addition", List.of("0"));
        form.put("mode", List.of("1"));
        return form;
    }
}
