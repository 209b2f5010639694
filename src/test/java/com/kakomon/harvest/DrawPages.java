package com.kakomon.harvest;

import com.kakomon.dataset.Question;
import com.kakomon.normalize.IdAllocator;

import java.util.List;

/**
 * Minimal AP-siken style pages for harvester tests.
 */
final class DrawPages {
    static final String START_URL = "https://www.ap-siken.test/apkakomon.php";
    static final String DRAW_URL = "https://www.ap-siken.test/draw.php";

    private DrawPages() {
    }

    static String prime(int totalHint) {
        return "<html><head><title>過去問道場</title></head><body>"
                + (totalHint > 0 ? "<p>選択中の問題 " + totalHint + " 問</p>" : "")
                + "<form method=\"post\" action=\"/draw.php\">"
                + "<input type=\"hidden\" name=\"sid\" value=\"s-001\">"
                + "<input type=\"hidden\" name=\"result\" value=\"\">"
                + "</form></body></html>";
    }

    static String question(int n) {
        return "<html><head><title>令和7年春期 問" + n + "</title></head><body>"
                + "<h3 class=\"qno\">令和7年春期 午前 問" + n + "</h3>"
                + "<div>" + text(n) + "</div>"
                + "<ul class=\"selectList\">"
                + "<li><span id=\"select_a\">" + choices(n).get(0) + "</span></li>"
                + "<li><span id=\"select_i\">" + choices(n).get(1) + "</span></li>"
                + "<li><span id=\"select_u\">" + choices(n).get(2) + "</span></li>"
                + "<li><span id=\"select_e\">" + choices(n).get(3) + "</span></li>"
                + "</ul>"
                + "<span id=\"answerChar\">イ</span>"
                + "<div id=\"kaisetsu\">問" + n + "の解説。</div>"
                + "<form method=\"post\" action=\"/draw.php\">"
                + "<input type=\"hidden\" name=\"_q\" value=\"07_haru_" + n + "\">"
                + "<input type=\"hidden\" name=\"sid\" value=\"s-00" + n + "\">"
                + "</form></body></html>";
    }

    /**
     * Draw {@code n} served without its {@code _q} input, so the page carries no sequence number.
     */
    static String unnumbered(int n) {
        return question(n).replace("<input type=\"hidden\" name=\"_q\" value=\"07_haru_" + n + "\">", "");
    }

    static String notAQuestion() {
        return "<html><head><title>過去問道場</title></head><body><p>条件を選択してください</p></body></html>";
    }

    static String text(int n) {
        return "問題文その" + n;
    }

    static List<String> choices(int n) {
        return List.of("選択肢" + n + "A", "選択肢" + n + "B", "選択肢" + n + "C", "選択肢" + n + "D");
    }

    /**
     * The record a previous run would have stored for draw {@code n}.
     */
    static Question stored(String prefix, int n) {
        return Question.builder()
                .id(IdAllocator.format(prefix, n))
                .category("unknown")
                .year(2025)
                .text(text(n))
                .choices(choices(n))
                .answerIndex(1)
                .explanation("問" + n + "の解説。")
                .sourceUrl(DRAW_URL)
                .build();
    }
}
