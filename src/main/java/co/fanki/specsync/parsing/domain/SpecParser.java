package co.fanki.specsync.parsing.domain;

import co.fanki.specsync.document.domain.Block;
import co.fanki.specsync.document.domain.BlockParser;
import co.fanki.specsync.document.domain.ListEntry;
import co.fanki.specsync.parsing.domain.ParsedSpec.UserStory;
import co.fanki.specsync.shared.Preconditions;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses {@code spec.md} feature specifications.
 *
 * <p>The document is scanned once, block by block. A depth-2 heading sets
 * the current section: one mentioning both "user" and "scenario" opens the
 * user stories, one mentioning "requirement" opens the requirements, any
 * other clears it. Within the user stories each depth-3 heading opens a
 * story. Metadata paragraphs ({@code **Status**:}, {@code **Created**:},
 * {@code **Feature Branch**:}) are honored anywhere and the last
 * occurrence wins.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
public class SpecParser extends DocumentParser<ParsedSpec> {

    private static final Pattern TITLE_PREFIX = Pattern.compile(
            "^Feature Specification:\\s*", Pattern.CASE_INSENSITIVE);

    private static final Pattern STATUS = Pattern.compile(
            "\\*\\*Status\\*\\*:[ \\t]*([A-Za-z][A-Za-z _-]*)",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern CREATED = Pattern.compile(
            "\\*\\*Created\\*\\*:\\s*([\\d-]+)");

    private static final Pattern BRANCH = Pattern.compile(
            "\\*\\*Feature Branch\\*\\*:\\s*`?([^`\\n]+)`?");

    private static final Pattern PRIORITY = Pattern.compile(
            "\\(Priority:\\s*(P[123])\\)", Pattern.CASE_INSENSITIVE);

    private static final Pattern PRIORITY_SUFFIX = Pattern.compile(
            "\\s*\\(Priority:.*\\)", Pattern.CASE_INSENSITIVE);

    private static final Pattern REQUIREMENT_ID = Pattern.compile(
            "^(FR-\\d+|NFR-\\d+)", Pattern.CASE_INSENSITIVE);

    private static final Pattern DESCRIPTION_LEAD = Pattern.compile(
            "^[:\\s-]+");

    /** The section the scan is currently in. */
    private enum Section {
        NONE,
        USER_STORIES,
        REQUIREMENTS
    }

    private final BlockParser blockParser;

    /**
     * Creates a new SpecParser.
     *
     * @param theBlockParser the block parser, never null
     */
    public SpecParser(final BlockParser theBlockParser) {
        this.blockParser = Preconditions.requireNonNull(theBlockParser,
                "Block parser is required");
    }

    @Override
    public String fileName() {
        return "spec.md";
    }

    @Override
    public ParsedSpec parseContent(final String content) {
        final Scan scan = new Scan();
        for (final Block block : blockParser.parse(content)) {
            switch (block.kind()) {
                case HEADING -> scan.onHeading(block);
                case PARAGRAPH -> scan.onParagraph(block);
                case LIST -> scan.onList(block);
                default -> { }
            }
        }
        return scan.result();
    }

    /** Mutable state of one linear scan. */
    private static final class Scan {

        private Section section = Section.NONE;
        private StoryDraft story;

        private String title;
        private String status = ParsedSpec.DEFAULT_STATUS;
        private String createdDate;
        private String featureBranch;
        private final List<StoryDraft> stories = new ArrayList<>();
        private final List<ParsedRequirement> requirements = new ArrayList<>();

        void onHeading(final Block block) {
            if (block.isHeading(1)) {
                title = TITLE_PREFIX.matcher(block.text()).replaceFirst("")
                        .trim();
            } else if (block.isHeading(2)) {
                section = classify(block.text());
                story = null;
            } else if (block.isHeading(3) && section == Section.USER_STORIES) {
                story = new StoryDraft(block.text());
                stories.add(story);
            }
        }

        void onParagraph(final Block block) {
            readMetadata(block.source());

            if (section == Section.USER_STORIES && story != null
                    && story.description.isEmpty()
                    && !block.source().startsWith("**")) {
                story.description = block.text();
            }
        }

        void onList(final Block block) {
            if (section == Section.USER_STORIES && story != null) {
                for (final ListEntry item : block.items()) {
                    story.scenarios.add(item.text());
                }
            } else if (section == Section.REQUIREMENTS) {
                for (final ListEntry item : block.items()) {
                    final ParsedRequirement requirement = requirement(item);
                    if (requirement != null) {
                        requirements.add(requirement);
                    }
                }
            }
        }

        ParsedSpec result() {
            return new ParsedSpec(title, status, createdDate, featureBranch,
                    stories.stream().map(StoryDraft::build).toList(),
                    requirements);
        }

        private void readMetadata(final String source) {
            final Matcher statusMatcher = STATUS.matcher(source);
            if (statusMatcher.find()) {
                status = statusMatcher.group(1).trim()
                        .toLowerCase(Locale.ROOT);
            }
            final Matcher createdMatcher = CREATED.matcher(source);
            if (createdMatcher.find()) {
                createdDate = createdMatcher.group(1);
            }
            final Matcher branchMatcher = BRANCH.matcher(source);
            if (branchMatcher.find()) {
                featureBranch = branchMatcher.group(1).trim();
            }
        }

        private static Section classify(final String heading) {
            final String lower = heading.toLowerCase(Locale.ROOT);
            if (lower.contains("user") && lower.contains("scenario")) {
                return Section.USER_STORIES;
            }
            if (lower.contains("requirement")) {
                return Section.REQUIREMENTS;
            }
            return Section.NONE;
        }

        private static ParsedRequirement requirement(final ListEntry item) {
            final Matcher idMatcher = REQUIREMENT_ID.matcher(item.text());
            if (!idMatcher.find()) {
                return null;
            }
            String rest = item.text().substring(idMatcher.end());

            String priority = null;
            final Matcher priorityMatcher = PRIORITY.matcher(rest);
            if (priorityMatcher.find()) {
                priority = priorityMatcher.group(1).toUpperCase(Locale.ROOT);
                rest = rest.substring(0, priorityMatcher.start())
                        + rest.substring(priorityMatcher.end());
            }

            final String description = DESCRIPTION_LEAD.matcher(rest)
                    .replaceFirst("").trim();
            return new ParsedRequirement(
                    idMatcher.group(1).toUpperCase(Locale.ROOT),
                    description,
                    priority,
                    item.children().stream().map(ListEntry::text).toList());
        }
    }

    /** A user story being assembled. */
    private static final class StoryDraft {

        private final String title;
        private final String priority;
        private String description = "";
        private final List<String> scenarios = new ArrayList<>();

        StoryDraft(final String heading) {
            final Matcher matcher = PRIORITY.matcher(heading);
            this.priority = matcher.find()
                    ? matcher.group(1).toUpperCase(Locale.ROOT)
                    : UserStory.DEFAULT_PRIORITY;
            this.title = PRIORITY_SUFFIX.matcher(heading).replaceFirst("")
                    .trim();
        }

        UserStory build() {
            return new UserStory(title, priority, description, scenarios);
        }
    }

}
