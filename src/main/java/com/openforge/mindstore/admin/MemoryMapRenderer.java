package com.openforge.mindstore.admin;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Renders the boxed text memory map.
 *
 * Collections are grouped by name: the first group whose keywords match
 * wins, anything unmatched lands in OTHER. Only the first
 * {@link #MAX_LINKS} links are listed.
 */
final class MemoryMapRenderer {

    static final int MAX_LINKS = 10;

    private static final int    WIDTH  = 66;
    private static final String TOP    = "╔" + "═".repeat(WIDTH) + "╗";
    private static final String MIDDLE = "╠" + "═".repeat(WIDTH) + "╣";
    private static final String BOTTOM = "╚" + "═".repeat(WIDTH) + "╝";

    private static final Map<String, Predicate<String>> GROUPS = new LinkedHashMap<>();

    static {
        GROUPS.put("THOUGHT SYSTEM",       n -> n.contains("thought"));
        GROUPS.put("SKILLS & TOOLS",       n -> n.contains("skill") || n.contains("tool"));
        GROUPS.put("KNOWLEDGE BASE",       n -> n.contains("core") || n.contains("code"));
        GROUPS.put("PERSONALITY & SELF",   n -> n.contains("person") || n.contains("self"));
    }

    private MemoryMapRenderer() {}

    static String render(Collection<CollectionInfo> collections, List<CollectionLink> links) {
        Map<String, List<CollectionInfo>> sections = new LinkedHashMap<>();
        GROUPS.keySet().forEach(title -> sections.put(title, new ArrayList<>()));
        sections.put("OTHER", new ArrayList<>());

        for (CollectionInfo info : collections) {
            String section = GROUPS.entrySet().stream()
                    .filter(g -> g.getValue().test(info.name()))
                    .map(Map.Entry::getKey)
                    .findFirst()
                    .orElse("OTHER");
            sections.get(section).add(info);
        }

        StringBuilder sb = new StringBuilder();
        sb.append(TOP).append('\n');
        line(sb, center("MINDSTORE MEMORY ARCHITECTURE"));
        sb.append(MIDDLE).append('\n');

        sections.forEach((title, infos) -> {
            if (infos.isEmpty()) return;
            line(sb, " " + title);
            for (CollectionInfo info : infos) {
                line(sb, String.format("   %s %-36s [%4dd] %8d pts",
                        info.isGreen() ? "✓" : "⚠", info.name(), info.vectorSize(), info.pointsCount()));
            }
        });

        sb.append(MIDDLE).append('\n');
        line(sb, " COLLECTION LINKS");
        links.stream().limit(MAX_LINKS).forEach(link -> line(sb, String.format("   %-25s ─%12s→ %s",
                link.sourceCollection(), link.relationType().wire(), link.targetCollection())));
        if (links.size() > MAX_LINKS) {
            line(sb, "   ... and " + (links.size() - MAX_LINKS) + " more links");
        }
        sb.append(BOTTOM).append('\n');
        return sb.toString();
    }

    private static void line(StringBuilder sb, String text) {
        String body = text.length() > WIDTH ? text.substring(0, WIDTH) : text;
        sb.append('║').append(body).append(" ".repeat(WIDTH - body.length())).append("║\n");
    }

    private static String center(String text) {
        int pad = Math.max(0, (WIDTH - text.length()) / 2);
        return " ".repeat(pad) + text;
    }
}
