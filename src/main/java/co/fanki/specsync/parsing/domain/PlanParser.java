package co.fanki.specsync.parsing.domain;

import co.fanki.specsync.document.domain.Block;
import co.fanki.specsync.document.domain.BlockParser;
import co.fanki.specsync.document.domain.ListEntry;
import co.fanki.specsync.feature.domain.PlanPhase;
import co.fanki.specsync.feature.domain.Risk;
import co.fanki.specsync.shared.Preconditions;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses {@code plan.md} implementation plans.
 *
 * <p>Depth-2 headings select the section: summary, technical context,
 * a phase (every phase heading opens a new phase), dependencies or risks.
 * Risk items are split on their first delimiter into risk and mitigation;
 * a spaced dash or a colon wins over a dash inside a word. Items without a
 * delimiter are dropped.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
public class PlanParser extends DocumentParser<ParsedPlan> {

    private static final Pattern TECH_ENTRY = Pattern.compile(
            "\\*\\*([^*]+)\\*\\*:\\s*((?:(?!\\*\\*)[^\\n])+)");

    private static final Pattern RISK_DELIMITER = Pattern.compile(
            "\\s+[-\u2013]\\s+|:");

    private static final Pattern BARE_DASH = Pattern.compile("[-\u2013]");

    private static final Pattern INLINE_MARKUP = Pattern.compile(
            "\\*\\*|`");

    /** The section the scan is currently in. */
    private enum Section {
        NONE,
        SUMMARY,
        TECH_STACK,
        PHASE,
        DEPENDENCIES,
        RISKS;

        static Section classify(final String heading) {
            final String lower = heading.toLowerCase(Locale.ROOT);
            if (lower.contains("summary")) {
                return SUMMARY;
            }
            if (lower.contains("technical context") || lower.contains("tech")) {
                return TECH_STACK;
            }
            if (lower.contains("phase")) {
                return PHASE;
            }
            if (lower.contains("dependencies")) {
                return DEPENDENCIES;
            }
            if (lower.contains("risk")) {
                return RISKS;
            }
            return NONE;
        }
    }

    private final BlockParser blockParser;

    /**
     * Creates a new PlanParser.
     *
     * @param theBlockParser the block parser, never null
     */
    public PlanParser(final BlockParser theBlockParser) {
        this.blockParser = Preconditions.requireNonNull(theBlockParser,
                "Block parser is required");
    }

    @Override
    public String fileName() {
        return "plan.md";
    }

    @Override
    public ParsedPlan parseContent(final String content) {
        final Scan scan = new Scan();
        for (final Block block : blockParser.parse(content)) {
            switch (block.kind()) {
                case HEADING -> scan.onHeading(block);
                case PARAGRAPH -> scan.onParagraph(block);
                case LIST -> scan.onList(block);
                default -> { }
            }
        }
        return new ParsedPlan(scan.summary, scan.techStack,
                scan.phases.stream().map(PhaseDraft::build).toList(),
                scan.dependencies, scan.risks);
    }

    /**
     * Splits a risk item on its first delimiter.
     *
     * <p>A dash with spaces around it or a colon is looked for first, so
     * "Third-party outage - cache responses" keeps its hyphenated word.
     * Otherwise the first bare dash or en dash splits the item.</p>
     *
     * @param item the flattened item text
     * @return the risk, or null when the item has no delimiter
     */
    static Risk risk(final String item) {
        Matcher matcher = RISK_DELIMITER.matcher(item);
        if (!matcher.find()) {
            matcher = BARE_DASH.matcher(item);
            if (!matcher.find()) {
                return null;
            }
        }
        final String risk = item.substring(0, matcher.start()).trim();
        if (risk.isEmpty()) {
            return null;
        }
        return new Risk(risk, item.substring(matcher.end()).trim());
    }

    /** Mutable state of one linear scan. */
    private static final class Scan {

        private Section section = Section.NONE;
        private PhaseDraft phase;

        private String summary;
        private final Map<String, String> techStack = new LinkedHashMap<>();
        private final List<PhaseDraft> phases = new ArrayList<>();
        private final List<String> dependencies = new ArrayList<>();
        private final List<Risk> risks = new ArrayList<>();

        void onHeading(final Block block) {
            if (!block.isHeading(2)) {
                return;
            }
            section = Section.classify(block.text());
            phase = null;
            if (section == Section.PHASE) {
                phase = new PhaseDraft(block.text(), phases.size() + 1);
                phases.add(phase);
            }
        }

        void onParagraph(final Block block) {
            switch (section) {
                case SUMMARY -> {
                    if (summary == null) {
                        summary = block.text();
                    }
                }
                case PHASE -> {
                    if (phase.goal == null) {
                        phase.goal = block.text();
                    }
                }
                case TECH_STACK -> readTechStack(block.source());
                default -> { }
            }
        }

        void onList(final Block block) {
            for (final ListEntry item : block.items()) {
                switch (section) {
                    case PHASE -> phase.tasks.add(item.text());
                    case DEPENDENCIES -> dependencies.add(item.text());
                    case RISKS -> {
                        final Risk risk = risk(item.text());
                        if (risk != null) {
                            risks.add(risk);
                        }
                    }
                    case TECH_STACK -> readTechStack(item.source());
                    default -> { }
                }
            }
        }

        private void readTechStack(final String source) {
            final Matcher matcher = TECH_ENTRY.matcher(source);
            while (matcher.find()) {
                final String key = matcher.group(1).trim();
                final String value = INLINE_MARKUP.matcher(matcher.group(2))
                        .replaceAll("").trim();
                if (!key.isEmpty() && !value.isEmpty()) {
                    techStack.put(key, value);
                }
            }
        }
    }

    /** A phase being assembled. */
    private static final class PhaseDraft {

        private final String name;
        private final int order;
        private String goal;
        private final List<String> tasks = new ArrayList<>();

        PhaseDraft(final String theName, final int theOrder) {
            this.name = theName;
            this.order = theOrder;
        }

        PlanPhase build() {
            return new PlanPhase(name, goal, order, tasks);
        }
    }

}
