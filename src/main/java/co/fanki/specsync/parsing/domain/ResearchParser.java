package co.fanki.specsync.parsing.domain;

import co.fanki.specsync.document.domain.Block;
import co.fanki.specsync.document.domain.BlockParser;
import co.fanki.specsync.document.domain.ListEntry;
import co.fanki.specsync.parsing.domain.ParsedResearch.ParsedDecision;
import co.fanki.specsync.shared.Preconditions;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses {@code research.md} documents into decisions.
 *
 * <p>Decisions live under depth-2 headings mentioning "phase" or
 * "research"; each depth-3 heading there opens one. Deeper headings switch
 * the sub-section (decision, rationale, alternatives, context) and
 * paragraphs are buffered until the next switch, when they are assigned to
 * the sub-section they were written under. The decision text keeps its
 * first assignment, rationale and context keep the latest.</p>
 *
 * <p>Bold-label paragraphs ({@code **Decision**:}, {@code **Rationale**:},
 * {@code **Alternatives**:}) assign their field immediately.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
public class ResearchParser extends DocumentParser<ParsedResearch> {

    private static final Pattern ORDINAL = Pattern.compile("^\\d+\\.\\s*");

    private static final Pattern LABEL = Pattern.compile(
            "^\\*\\*(Decision|Rationale|Alternatives(?: Considered)?)"
                    + "\\*\\*:\\s*", Pattern.CASE_INSENSITIVE);

    private static final Pattern NAMED_ALTERNATIVE = Pattern.compile(
            "^\\*\\*([^*]+)\\*\\*:\\s*(.*)", Pattern.DOTALL);

    private static final Pattern INLINE_MARKUP = Pattern.compile(
            "\\*\\*|`");

    /** The part of a decision the scan is in. */
    private enum SubSection {
        NONE,
        DECISION,
        RATIONALE,
        ALTERNATIVES,
        CONTEXT;

        static SubSection classify(final String heading) {
            final String lower = heading.toLowerCase(Locale.ROOT);
            if (lower.contains("decision")) {
                return DECISION;
            }
            if (lower.contains("rationale") || lower.contains("why")) {
                return RATIONALE;
            }
            if (lower.contains("alternative")) {
                return ALTERNATIVES;
            }
            if (lower.contains("implementation") || lower.contains("approach")
                    || lower.contains("context")
                    || lower.contains("background")) {
                return CONTEXT;
            }
            return NONE;
        }
    }

    private final BlockParser blockParser;

    /**
     * Creates a new ResearchParser.
     *
     * @param theBlockParser the block parser, never null
     */
    public ResearchParser(final BlockParser theBlockParser) {
        this.blockParser = Preconditions.requireNonNull(theBlockParser,
                "Block parser is required");
    }

    @Override
    public String fileName() {
        return "research.md";
    }

    @Override
    public ParsedResearch parseContent(final String content) {
        final Scan scan = new Scan();
        for (final Block block : blockParser.parse(content)) {
            switch (block.kind()) {
                case HEADING -> scan.onHeading(block);
                case PARAGRAPH -> scan.onParagraph(block);
                case LIST -> scan.onList(block);
                case CODE -> scan.onCode(block);
                default -> { }
            }
        }
        scan.closeDecision();
        return new ParsedResearch(scan.decisions);
    }

    /** Mutable state of one linear scan. */
    private static final class Scan {

        private boolean inRegion;
        private DecisionDraft decision;
        private SubSection subSection = SubSection.NONE;
        private final List<String> buffer = new ArrayList<>();

        private final List<ParsedDecision> decisions = new ArrayList<>();

        void onHeading(final Block block) {
            if (block.isHeading(2)) {
                final String lower = block.text().toLowerCase(Locale.ROOT);
                inRegion = lower.contains("phase") || lower.contains("research");
            } else if (block.isHeading(3)) {
                if (inRegion) {
                    closeDecision();
                    decision = new DecisionDraft(ORDINAL.matcher(block.text())
                            .replaceFirst("").trim());
                    subSection = SubSection.NONE;
                }
            } else if (block.depth() >= 4 && decision != null) {
                switchTo(SubSection.classify(block.text()));
            }
        }

        void onParagraph(final Block block) {
            if (decision == null) {
                return;
            }
            final List<String> labeled = labeledLines(block.source());
            if (!labeled.isEmpty()) {
                for (final String line : labeled) {
                    final Matcher label = LABEL.matcher(line);
                    label.find();
                    assignLabel(label.group(1).toLowerCase(Locale.ROOT),
                            plain(line.substring(label.end())));
                }
                return;
            }
            if (subSection != SubSection.NONE) {
                buffer.add(block.text());
            }
        }

        void onList(final Block block) {
            if (decision == null || subSection == SubSection.NONE) {
                return;
            }
            if (subSection == SubSection.ALTERNATIVES) {
                for (final ListEntry item : block.items()) {
                    decision.alternatives.add(alternative(item));
                }
                return;
            }
            buffer.add(String.join("\n", block.items().stream()
                    .map(item -> "- " + item.text())
                    .toList()));
        }

        void onCode(final Block block) {
            if (decision != null && subSection == SubSection.CONTEXT) {
                final String language = block.language() == null
                        ? "" : block.language();
                buffer.add("```" + language + "\n" + block.text() + "\n```");
            }
        }

        void closeDecision() {
            if (decision == null) {
                return;
            }
            flush();
            decisions.add(decision.build());
            decision = null;
            subSection = SubSection.NONE;
        }

        private void switchTo(final SubSection next) {
            flush();
            subSection = next;
        }

        private void flush() {
            if (!buffer.isEmpty()) {
                final String content = String.join("\n\n", buffer);
                switch (subSection) {
                    case DECISION -> {
                        if (decision.decision.isEmpty()) {
                            decision.decision = content;
                        }
                    }
                    case RATIONALE -> decision.rationale = content;
                    case CONTEXT -> decision.context = content;
                    default -> { }
                }
            }
            buffer.clear();
        }

        private void assignLabel(final String label, final String value) {
            if (label.startsWith("decision")) {
                switchTo(SubSection.NONE);
                decision.decision = value;
            } else if (label.startsWith("rationale")) {
                switchTo(SubSection.NONE);
                decision.rationale = value;
            } else {
                switchTo(SubSection.ALTERNATIVES);
                if (!value.isEmpty()) {
                    decision.alternatives.add(value);
                }
            }
        }

        /**
         * Splits a paragraph whose first line is a bold label into one
         * entry per labeled line; unlabeled lines continue the previous
         * entry.
         *
         * @return the labeled entries, empty when the paragraph does not
         *         start with a label
         */
        private static List<String> labeledLines(final String source) {
            final List<String> entries = new ArrayList<>();
            if (!LABEL.matcher(source).find()) {
                return entries;
            }
            for (final String line : source.split("\n")) {
                final String trimmed = line.trim();
                if (LABEL.matcher(trimmed).find() || entries.isEmpty()) {
                    entries.add(trimmed);
                } else {
                    final int last = entries.size() - 1;
                    entries.set(last, entries.get(last) + "\n" + trimmed);
                }
            }
            return entries;
        }

        private static String alternative(final ListEntry item) {
            final Matcher named = NAMED_ALTERNATIVE.matcher(item.source());
            if (named.find()) {
                return named.group(1).trim() + ": " + plain(named.group(2));
            }
            return item.text();
        }

        private static String plain(final String markup) {
            return INLINE_MARKUP.matcher(markup).replaceAll("").trim();
        }
    }

    /** A decision being assembled. */
    private static final class DecisionDraft {

        private final String title;
        private String decision = "";
        private String rationale;
        private String context;
        private final List<String> alternatives = new ArrayList<>();

        DecisionDraft(final String theTitle) {
            this.title = theTitle;
        }

        ParsedDecision build() {
            return new ParsedDecision(title, decision, rationale,
                    alternatives, context);
        }
    }

}
