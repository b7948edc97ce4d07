package com.rapidlayout.constraint;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

// Keywords are matched as whole words, longest first, so swidth never expands as s + width
public final class ConstraintKeywords {

    // centers of keyword-centered cells may differ by one unit on each axis
    public static final int CENTER_TOLERANCE = 1;

    private static final Map<String, String> keyword2Expansion = new LinkedHashMap<>();

    static {
        // centering
        keyword2Expansion.put("xcenter", centerRelations('x', CENTER_TOLERANCE));
        keyword2Expansion.put("ycenter", centerRelations('y', CENTER_TOLERANCE));
        keyword2Expansion.put("center",
            centerRelations('x', CENTER_TOLERANCE) + ", " + centerRelations('y', CENTER_TOLERANCE));

        // edge alignment
        keyword2Expansion.put("left", "sx1=ox1");
        keyword2Expansion.put("right", "sx2=ox2");
        keyword2Expansion.put("top", "sy2=oy2");
        keyword2Expansion.put("bottom", "sy1=oy1");

        // inner edge distances, object edge minus subject edge
        keyword2Expansion.put("l_edge", "ox1-sx1");
        keyword2Expansion.put("r_edge", "ox2-sx2");
        keyword2Expansion.put("t_edge", "oy2-sy2");
        keyword2Expansion.put("b_edge", "oy1-sy1");

        // edge-to-edge distances, subject edge minus object edge
        keyword2Expansion.put("ll_edge", "sx1-ox1");
        keyword2Expansion.put("lr_edge", "sx1-ox2");
        keyword2Expansion.put("rl_edge", "sx2-ox1");
        keyword2Expansion.put("rr_edge", "sx2-ox2");
        keyword2Expansion.put("bb_edge", "sy1-oy1");
        keyword2Expansion.put("bt_edge", "sy1-oy2");
        keyword2Expansion.put("tb_edge", "sy2-oy1");
        keyword2Expansion.put("tt_edge", "sy2-oy2");

        // sizes
        keyword2Expansion.put("swidth", "sx2-sx1");
        keyword2Expansion.put("sheight", "sy2-sy1");
        keyword2Expansion.put("owidth", "ox2-ox1");
        keyword2Expansion.put("oheight", "oy2-oy1");
        keyword2Expansion.put("width", "x2-x1");
        keyword2Expansion.put("height", "y2-y1");

        // lower-left corner shorthands
        keyword2Expansion.put("sx", "sx1");
        keyword2Expansion.put("sy", "sy1");
        keyword2Expansion.put("ox", "ox1");
        keyword2Expansion.put("oy", "oy1");
    }

    private static final List<Map.Entry<Pattern, String>> replacements = buildReplacements();

    private ConstraintKeywords() {
    }

    private static List<Map.Entry<Pattern, String>> buildReplacements() {
        List<String> keywords = new ArrayList<>(keyword2Expansion.keySet());
        keywords.sort(Comparator.comparingInt(String::length).reversed());

        List<Map.Entry<Pattern, String>> result = new ArrayList<>();
        for (String keyword : keywords) {
            Pattern pattern = Pattern.compile("\\b" + Pattern.quote(keyword) + "\\b");
            result.add(Map.entry(pattern, keyword2Expansion.get(keyword)));
        }
        return Collections.unmodifiableList(result);
    }

    // rewrites every keyword in the relation string
    public static String expand(String relations) {
        String expanded = relations;
        for (Map.Entry<Pattern, String> entry : replacements) {
            String expansion = entry.getValue();
            boolean isTerm = expansion.indexOf('=') < 0 && expansion.indexOf('-') >= 0;
            String replacement = isTerm ? "(" + expansion + ")" : expansion;
            expanded = entry.getKey().matcher(expanded).replaceAll(Matcher.quoteReplacement(replacement));
        }
        return expanded;
    }

    public static boolean isKeyword(String word) {
        return keyword2Expansion.containsKey(word);
    }

    // center sums of subject and object along one axis, within twice the tolerance
    public static String centerRelations(char axis, int tolerance) {
        if (tolerance < 0) {
            throw new IllegalArgumentException("Centering tolerance should not be negative: " + tolerance);
        }
        String subjectSum = String.format("s%c1+s%c2", axis, axis);
        String objectSum = String.format("o%c1+o%c2", axis, axis);
        if (tolerance == 0) {
            return subjectSum + "=" + objectSum;
        }
        int toleranceSum = tolerance * 2;
        return String.format("%s>=%s-%d, %s<=%s+%d", subjectSum, objectSum, toleranceSum, subjectSum, objectSum, toleranceSum);
    }
}
