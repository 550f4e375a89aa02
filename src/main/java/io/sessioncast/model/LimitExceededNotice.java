package io.sessioncast.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Terminal relay error: the account hit a resource limit. Fields are relay-provided strings and
 * are passed through untouched.
 */
public record LimitExceededNotice(
        String resource,
        String current,
        String max,
        String messageEn,
        String messageKo,
        String upgradeUrl
) {
    private static final String RULE = "============================================================";

    public static LimitExceededNotice fromMeta(Map<String, String> meta) {
        Map<String, String> m = meta == null ? Map.of() : meta;
        return new LimitExceededNotice(
                m.get("resource"),
                m.get("current"),
                m.get("max"),
                m.get("messageEn"),
                m.get("messageKo"),
                m.get("upgradeUrl")
        );
    }

    public List<String> renderLines() {
        List<String> out = new ArrayList<>();
        out.add(RULE);
        out.add("SESSION LIMIT EXCEEDED");
        out.add(RULE);
        out.add("Resource: " + resource);
        out.add("Current: " + current + ", Max: " + max);
        out.add("Message: " + messageEn);
        out.add("한국어: " + messageKo);
        out.add("Upgrade at: " + upgradeUrl);
        out.add(RULE);
        return out;
    }
}
